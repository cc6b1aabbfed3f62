package campaign.exceptions;

import campaign.engine.MigrationStage;

/**
 * Exception thrown when migrating a single record fails.
 *
 * <p>This exception carries diagnostic context:
 * <ul>
 *   <li>A human-readable error message</li>
 *   <li>The stage where the failure occurred</li>
 *   <li>The source platform</li>
 *   <li>A reference to the record (campaign id or name)</li>
 * </ul>
 *
 * <p>Record-level failures are caught at the engine boundary and turned into
 * report entries; they never abort a batch.
 *
 * @see campaign.engine.MigrationEngine
 */
public class MigrationException extends Exception {

    private final MigrationStage stage;
    private final String platform;
    private final String recordRef;

    // ---------------- constructors ----------------

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrationException(String message) {
        this(message, null, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrationException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    /**
     * Creates a new migration exception with full diagnostic context.
     *
     * @param message the error message
     * @param stage the stage where the failure occurred
     * @param platform the source platform
     * @param recordRef campaign id or name of the record
     * @param cause the underlying cause, may be null
     */
    public MigrationException(String message,
                              MigrationStage stage,
                              String platform,
                              String recordRef,
                              Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.platform = platform;
        this.recordRef = recordRef;
    }

    // ---------------- getters ----------------

    /**
     * Returns the stage where the failure occurred.
     *
     * @return the stage, or null if not set
     */
    public MigrationStage getStage() {
        return stage;
    }

    /**
     * Returns the source platform.
     *
     * @return the platform, or null if not set
     */
    public String getPlatform() {
        return platform;
    }

    /**
     * Returns the campaign id or name of the failing record.
     *
     * @return the record reference, or null if not set
     */
    public String getRecordRef() {
        return recordRef;
    }

    /**
     * Returns the message without the diagnostic suffixes.
     */
    public String getBareMessage() {
        return super.getMessage();
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (platform != null) sb.append(" [platform=").append(platform).append("]");
        if (recordRef != null) sb.append(" [record=").append(recordRef).append("]");

        return sb.toString();
    }
}
