package campaign.engine;

/**
 * Stages a record moves through during migration.
 *
 * <pre>
 * FETCHING -&gt; VALIDATING -&gt; MAPPING -&gt; OVERRIDING -&gt; UPLOADING -&gt; DONE
 * </pre>
 * Any stage may move to {@link #FAILED}. {@link #VALIDATING} is skipped when record
 * validation is disabled, {@link #OVERRIDING} when no overrides are supplied.
 */
public enum MigrationStage {
    /** Obtaining the source record from its platform or an uploaded row */
    FETCHING,
    /** Checking the source record against the platform's validation schema */
    VALIDATING,
    /** Building the canonical record from the mapping schema */
    MAPPING,
    /** Applying caller-supplied manual overrides */
    OVERRIDING,
    /** Handing the canonical record to the target platform */
    UPLOADING,
    /** Terminal: the target accepted the record */
    DONE,
    /** Terminal: the record did not reach the target */
    FAILED
}
