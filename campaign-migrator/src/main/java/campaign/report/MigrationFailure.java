package campaign.report;

import campaign.engine.MigrationStage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A failure entry in a {@link MigrationReport}.
 *
 * @param message human-readable description
 * @param errorKind failure category
 * @param stage stage the record was in when it failed, or null for whole-operation failures
 * @param recordRef campaign id or name, or null for whole-operation failures
 * @param cause the exception behind the failure, may be null
 */
public record MigrationFailure(
        String message,
        ErrorKind errorKind,
        MigrationStage stage,
        String recordRef,
        Throwable cause
) {
    public MigrationFailure {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(errorKind, "errorKind");
    }

    public static MigrationFailure of(String message, ErrorKind errorKind) {
        return new MigrationFailure(message, errorKind, null, null, null);
    }

    /**
     * Converts the failure to a Map for reporting.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("message", message);
        map.put("error", errorKind.name());
        if (stage != null) map.put("stage", stage.name());
        if (recordRef != null) map.put("record", recordRef);
        if (cause != null) map.put("cause", cause.getClass().getName() + ": " + cause.getMessage());
        return map;
    }
}
