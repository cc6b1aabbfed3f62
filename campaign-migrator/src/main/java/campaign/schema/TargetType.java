package campaign.schema;

import java.util.Locale;

/**
 * Type a mapped value is coerced to before it is written into a canonical record.
 *
 * @see MappingRule#fieldType()
 * @see campaign.mapping.FieldMapper
 */
public enum TargetType {
    /** Value is written as produced by the source or transform, without coercion. */
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean");

    private final String literal;

    TargetType(String literal) {
        this.literal = literal;
    }

    public String literal() {
        return literal;
    }

    /**
     * Resolves a schema literal, case-insensitively. A null literal means {@link #STRING}.
     *
     * @throws IllegalArgumentException if the literal names no type
     */
    public static TargetType fromLiteral(String literal) {
        if (literal == null) {
            return STRING;
        }
        String normalized = literal.trim().toLowerCase(Locale.ROOT);
        for (TargetType type : values()) {
            if (type.literal.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field_type: " + literal);
    }
}
