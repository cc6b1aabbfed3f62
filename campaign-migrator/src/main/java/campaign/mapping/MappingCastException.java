package campaign.mapping;

import campaign.schema.TargetType;

/**
 * Raised when a mapped value cannot be coerced to its rule's target type.
 *
 * <p>Never escapes {@link FieldMapper}: the mapper converts it into a warning and
 * omits the field from the canonical record.
 */
public class MappingCastException extends Exception {

    private final String field;
    private final TargetType targetType;

    public MappingCastException(String field, TargetType targetType, String message) {
        super(message);
        this.field = field;
        this.targetType = targetType;
    }

    public MappingCastException(String field, TargetType targetType, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.targetType = targetType;
    }

    /** Returns the canonical target field whose value failed to cast. */
    public String getField() {
        return field;
    }

    /** Returns the type the cast attempted. */
    public TargetType getTargetType() {
        return targetType;
    }
}
