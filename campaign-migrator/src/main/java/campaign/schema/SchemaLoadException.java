package campaign.schema;

/**
 * Thrown when a schema definition exists but is malformed: unreadable, not a map,
 * an unknown type literal or transform name, or an attribute that does not fit its
 * field type.
 *
 * <p>Loading fails fast, so this surfaces the first time a platform's schema is
 * requested rather than during validation or mapping.
 *
 * @see SchemaDefinitionParser
 */
public class SchemaLoadException extends RuntimeException {

    /**
     * @param message description of the problem, including the offending path
     */
    public SchemaLoadException(String message) {
        super(message);
    }

    /**
     * @param message description of the problem
     * @param cause the underlying cause (I/O or YAML parse error)
     */
    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
