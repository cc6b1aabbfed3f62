package campaign.schema;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of value types a validation rule can declare for a source field.
 *
 * <p>Each constant knows its literal as written in a schema definition and how to
 * recognise a matching Java value in an untyped campaign record:
 * <ul>
 *   <li>{@link #STRING} - any {@link CharSequence}</li>
 *   <li>{@link #NUMBER} - any {@link Number}</li>
 *   <li>{@link #INTEGER} - integral numbers only ({@code Integer}, {@code Long}, ...)</li>
 *   <li>{@link #BOOLEAN} - {@link Boolean}</li>
 *   <li>{@link #OBJECT} - {@link Map}</li>
 *   <li>{@link #ARRAY} - {@link Collection}</li>
 * </ul>
 *
 * @see FieldDefinition
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array");

    private final String literal;

    FieldType(String literal) {
        this.literal = literal;
    }

    /** Returns the literal used in schema definitions and issue reports. */
    public String literal() {
        return literal;
    }

    /** Returns true for the types that accept {@code min_value}/{@code max_value} bounds. */
    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER;
    }

    /**
     * Checks whether a record value is of this type. {@code null} matches nothing.
     *
     * @param value the value taken from a record
     * @return true if the value matches
     */
    public boolean matches(Object value) {
        switch (this) {
            case STRING:
                return value instanceof CharSequence;
            case NUMBER:
                return value instanceof Number;
            case INTEGER:
                return value instanceof Integer || value instanceof Long
                        || value instanceof Short || value instanceof Byte
                        || value instanceof BigInteger;
            case BOOLEAN:
                return value instanceof Boolean;
            case OBJECT:
                return value instanceof Map;
            case ARRAY:
                return value instanceof Collection;
            default:
                return false;
        }
    }

    /**
     * Resolves a schema literal, case-insensitively.
     *
     * @param literal the literal from a schema definition
     * @return the matching type
     * @throws IllegalArgumentException if the literal names no type
     */
    public static FieldType fromLiteral(String literal) {
        if (literal != null) {
            String normalized = literal.trim().toLowerCase(Locale.ROOT);
            for (FieldType type : values()) {
                if (type.literal.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + literal);
    }

    /**
     * Describes the type of an arbitrary record value using the schema vocabulary.
     * Integral numbers are reported as {@code integer}, other numbers as {@code number}.
     *
     * @param value any value, may be null
     * @return the describing literal, or {@code null} / the class name for foreign values
     */
    public static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        if (INTEGER.matches(value)) {
            return INTEGER.literal;
        }
        for (FieldType type : values()) {
            if (type.matches(value)) {
                return type.literal;
            }
        }
        return value.getClass().getSimpleName();
    }
}
