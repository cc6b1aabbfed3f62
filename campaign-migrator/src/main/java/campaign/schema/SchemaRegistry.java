package campaign.schema;

import campaign.config.MigratorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Resolves a platform identifier to its {@link PlatformSchema}.
 *
 * <p>Definitions are looked up as {@code <platform>.yml}, {@code <platform>.yaml} and
 * {@code <platform>.json}, in that order, either under a classpath prefix or in a
 * filesystem directory. JSON definitions are read by the same YAML parser.
 *
 * <p>Loading is lazy and cached per platform: the first {@link #get(String)} for a
 * platform reads and parses its definition, later calls return the same instance.
 * A failed load is not cached.
 *
 * <h2>Usage:</h2>
 * <pre>
 * SchemaRegistry registry = SchemaRegistry.classpath("schemas");
 * PlatformSchema facebook = registry.get("facebook");
 * </pre>
 *
 * @see SchemaDefinitionParser
 */
public final class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);
    private static final List<String> EXTENSIONS = List.of(".yml", ".yaml", ".json");

    private final String classpathLocation;
    private final Path directory;
    private final ClassLoader classLoader;
    private final ConcurrentMap<String, PlatformSchema> cache = new ConcurrentHashMap<>();

    private SchemaRegistry(String classpathLocation, Path directory, ClassLoader classLoader) {
        this.classpathLocation = classpathLocation;
        this.directory = directory;
        this.classLoader = classLoader;
    }

    /**
     * Creates a registry reading definitions from the classpath.
     *
     * @param location classpath prefix, e.g. {@code schemas}
     */
    public static SchemaRegistry classpath(String location) {
        Objects.requireNonNull(location, "location");
        String prefix = location.endsWith("/") ? location.substring(0, location.length() - 1) : location;
        return new SchemaRegistry(prefix, null, SchemaRegistry.class.getClassLoader());
    }

    /**
     * Creates a registry reading definitions from a directory.
     *
     * @param directory directory containing {@code <platform>.yml} files
     */
    public static SchemaRegistry directory(Path directory) {
        return new SchemaRegistry(null, Objects.requireNonNull(directory, "directory"), null);
    }

    /**
     * Creates a registry for the configured schema source; a configured directory
     * takes precedence over the classpath location.
     */
    public static SchemaRegistry fromConfig(MigratorConfig config) {
        return config.schemaDirectory() != null
                ? directory(config.schemaDirectory())
                : classpath(config.schemaLocation());
    }

    /**
     * Returns the schema for a platform, loading it on first use.
     *
     * @param platform platform identifier, case-insensitive
     * @return the platform's schema
     * @throws SchemaNotFoundException if no definition exists for the platform
     * @throws SchemaLoadException if the definition is malformed
     */
    public PlatformSchema get(String platform) {
        String key = normalize(platform);
        if (key.isEmpty()) {
            throw new SchemaNotFoundException(String.valueOf(platform), describeSource());
        }
        return cache.computeIfAbsent(key, this::load);
    }

    /**
     * Registers an already-built schema, replacing any cached one for the same platform.
     */
    public void register(PlatformSchema schema) {
        cache.put(normalize(schema.platform()), schema);
    }

    /** Returns true if the platform's schema has been loaded or registered. */
    public boolean isLoaded(String platform) {
        return cache.containsKey(normalize(platform));
    }

    private PlatformSchema load(String platform) {
        for (String ext : EXTENSIONS) {
            String name = platform + ext;
            try (InputStream is = open(name)) {
                if (is == null) {
                    continue;
                }
                Object root = new Yaml().load(is);
                PlatformSchema schema = SchemaDefinitionParser.parse(platform, root);
                log.info("Loaded schema for {} (version {}) from {}", platform, schema.version(), describe(name));
                return schema;
            } catch (YAMLException e) {
                throw new SchemaLoadException("Failed to parse " + describe(name) + ": " + e.getMessage(), e);
            } catch (IOException e) {
                throw new SchemaLoadException("Failed to read " + describe(name), e);
            }
        }
        throw new SchemaNotFoundException(platform, describeSource());
    }

    private InputStream open(String name) throws IOException {
        if (directory != null) {
            Path file = directory.resolve(name);
            return Files.isRegularFile(file) ? Files.newInputStream(file) : null;
        }
        return classLoader.getResourceAsStream(classpathLocation.isEmpty() ? name : classpathLocation + "/" + name);
    }

    private String describe(String name) {
        return directory != null ? directory.resolve(name).toString() : "classpath:" + classpathLocation + "/" + name;
    }

    private String describeSource() {
        return directory != null ? directory.toString() : "classpath:" + classpathLocation;
    }

    private static String normalize(String platform) {
        return platform == null ? "" : platform.trim().toLowerCase(Locale.ROOT);
    }
}
