package campaign.exceptions;

/**
 * Thrown when no source adapter is registered for a platform.
 *
 * <p>Unchecked: without an adapter no record of the batch can be attempted, so the
 * whole operation is aborted rather than failing each record.
 */
public class AdapterNotFoundException extends RuntimeException {

    private final String platform;

    public AdapterNotFoundException(String platform) {
        super("Migration from '" + platform + "' is not supported");
        this.platform = platform;
    }

    /** Returns the unsupported platform. */
    public String getPlatform() {
        return platform;
    }
}
