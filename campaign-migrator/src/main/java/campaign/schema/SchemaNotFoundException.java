package campaign.schema;

/**
 * Thrown when no schema definition exists for a requested platform.
 *
 * <p>Unchecked: a missing definition is a setup problem that aborts the whole
 * operation before any record is processed.
 *
 * @see SchemaRegistry#get(String)
 */
public class SchemaNotFoundException extends RuntimeException {

    private final String platform;

    /**
     * @param platform the platform that has no definition
     * @param location where the definition was looked for
     */
    public SchemaNotFoundException(String platform, String location) {
        super("No schema definition for platform '" + platform + "' in " + location);
        this.platform = platform;
    }

    /** Returns the platform that has no definition. */
    public String getPlatform() {
        return platform;
    }
}
