package campaign.report;

/**
 * Category of a failure entry in a {@link MigrationReport}.
 */
public enum ErrorKind {
    /** No source adapter for the requested platform; aborts the whole operation. */
    ADAPTER_NOT_FOUND,
    /** No schema definition for the platform; aborts the whole operation. */
    SCHEMA_NOT_FOUND,
    /** Malformed schema definition; aborts the whole operation. */
    SCHEMA_LOAD_ERROR,
    /** The source platform could not deliver the record. */
    FETCH_FAILED,
    /** The record failed structural validation. */
    VALIDATION_FAILED,
    /** The target platform refused the mapped record. */
    UPLOAD_REJECTED,
    /** Anything uncategorised; the cause is kept on the failure entry. */
    UNEXPECTED_ERROR
}
