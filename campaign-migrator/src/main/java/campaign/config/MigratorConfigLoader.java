package campaign.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads migrator configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code campaign-migrator.properties} on the classpath</li>
 *   <li>{@code campaign-migrator.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration, using the same keys
 * (e.g., {@code -Dmigrator.alert.level=DEBUG}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migrator.schema.location} - classpath prefix of schema definitions</li>
 *   <li>{@code migrator.schema.directory} - filesystem directory of schema definitions</li>
 *   <li>{@code migrator.validate.records} - true or false</li>
 *   <li>{@code migrator.warn.unfilled} - true or false</li>
 *   <li>{@code migrator.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see MigratorConfig
 */
public final class MigratorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigratorConfigLoader.class);

    static final String PROPERTIES_FILE = "campaign-migrator.properties";
    static final String YAML_FILE = "campaign-migrator.yml";

    private MigratorConfigLoader() {}

    /**
     * Load from classpath (campaign-migrator.properties or campaign-migrator.yml).
     * @throws MigratorConfigException if no config file found
     */
    public static MigratorConfig load() {
        InputStream is = getResource(PROPERTIES_FILE);
        if (is != null) {
            return loadProperties(is, PROPERTIES_FILE);
        }

        is = getResource(YAML_FILE);
        if (is != null) {
            return loadYaml(is, YAML_FILE);
        }

        throw new MigratorConfigException(
                "Config file required: " + PROPERTIES_FILE + " or " + YAML_FILE);
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigratorConfigException if the file cannot be parsed
     */
    public static MigratorConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return MigratorConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    static MigratorConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new MigratorConfigException("Failed to load " + source, e);
        }
    }

    static MigratorConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try (is) {
            root = new Yaml().load(is);
        } catch (YAMLException | ClassCastException e) {
            throw new MigratorConfigException("Failed to parse " + source, e);
        } catch (IOException e) {
            throw new MigratorConfigException("Failed to load " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static MigratorConfig parse(Properties props) {
        MigratorConfig.Builder b = MigratorConfig.builder();

        getString(props, "migrator.schema.location").filter(v -> !v.isEmpty()).ifPresent(b::schemaLocation);
        getString(props, "migrator.schema.directory").filter(v -> !v.isEmpty())
                .ifPresent(v -> b.schemaDirectory(Path.of(v)));

        getBoolean(props, "migrator.validate.records").ifPresent(b::validateRecords);
        getBoolean(props, "migrator.warn.unfilled").ifPresent(b::warnOnUnfilledFields);

        getString(props, "migrator.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if (v.equalsIgnoreCase("true")) return Optional.of(Boolean.TRUE);
            if (v.equalsIgnoreCase("false")) return Optional.of(Boolean.FALSE);
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }
}
