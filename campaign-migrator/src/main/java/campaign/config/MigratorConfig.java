package campaign.config;

import java.nio.file.Path;

/**
 * Central configuration for the migration engine.
 *
 * <p>Covers:
 * <ul>
 *   <li>Where platform schema definitions are read from</li>
 *   <li>Whether records are structurally validated before mapping</li>
 *   <li>Whether unfilled target fields produce an advisory warning</li>
 *   <li>The alert level for event logging</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code campaign-migrator.properties} or
 * {@code campaign-migrator.yml} using {@link MigratorConfigLoader}.
 *
 * @see MigratorConfigLoader
 * @see campaign.engine.MigrationEngine.Builder#config(MigratorConfig)
 */
public final class MigratorConfig {

    public static final MigratorConfig DEFAULTS = builder().build();

    private final String schemaLocation;
    private final Path schemaDirectory;
    private final boolean validateRecords;
    private final boolean warnOnUnfilledFields;
    private final AlertLevel alertLevel;

    private MigratorConfig(Builder b) {
        this.schemaLocation = b.schemaLocation;
        this.schemaDirectory = b.schemaDirectory;
        this.validateRecords = b.validateRecords;
        this.warnOnUnfilledFields = b.warnOnUnfilledFields;
        this.alertLevel = b.alertLevel;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the classpath prefix schema definitions are read from. */
    public String schemaLocation() { return schemaLocation; }

    /** Returns the schema directory, or null to use the classpath location. */
    public Path schemaDirectory() { return schemaDirectory; }

    /** Returns true if records are validated against their platform schema before mapping. */
    public boolean validateRecords() { return validateRecords; }

    /** Returns true if a target field with neither value nor default produces a warning. */
    public boolean warnOnUnfilledFields() { return warnOnUnfilledFields; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigratorConfig{" +
                "schemaLocation=" + schemaLocation +
                ", schemaDirectory=" + schemaDirectory +
                ", validateRecords=" + validateRecords +
                ", warnOnUnfilledFields=" + warnOnUnfilledFields +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigratorConfig} instances.
     */
    public static final class Builder {
        private String schemaLocation = "schemas";
        private Path schemaDirectory;
        private boolean validateRecords = true;
        private boolean warnOnUnfilledFields = true;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder schemaLocation(String location) {
            if (location == null || location.isBlank()) {
                throw new IllegalArgumentException("schemaLocation must not be blank");
            }
            this.schemaLocation = location.trim();
            return this;
        }

        public Builder schemaDirectory(Path directory) {
            this.schemaDirectory = directory;
            return this;
        }

        public Builder validateRecords(boolean validate) {
            this.validateRecords = validate;
            return this;
        }

        public Builder warnOnUnfilledFields(boolean warn) {
            this.warnOnUnfilledFields = warn;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigratorConfig build() {
            return new MigratorConfig(this);
        }
    }
}
