package campaign.exceptions;

import campaign.engine.MigrationStage;

import java.util.List;

/**
 * Thrown by an upload sink when the target platform refuses a canonical record.
 *
 * <p>The rejected field names are kept so the report can say exactly what the target
 * objected to.
 */
public class UploadRejectedException extends MigrationException {

    private final List<String> rejectedFields;

    /**
     * @param message the target's rejection message
     * @param rejectedFields fields the target reported as missing or invalid
     */
    public UploadRejectedException(String message, List<String> rejectedFields) {
        super(message, MigrationStage.UPLOADING, null, null, null);
        this.rejectedFields = rejectedFields == null ? List.of() : List.copyOf(rejectedFields);
    }

    /** Returns the fields the target reported as missing or invalid. */
    public List<String> getRejectedFields() {
        return rejectedFields;
    }
}
