package campaign.config;

/**
 * Exception thrown when migrator configuration cannot be loaded.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>No configuration file is found on the classpath</li>
 *   <li>A configuration file cannot be read or parsed</li>
 * </ul>
 *
 * <p>Unchecked, so configuration loading can sit in initialization code without
 * forced exception handling.
 *
 * @see MigratorConfigLoader
 */
public class MigratorConfigException extends RuntimeException {

    /**
     * @param message a description of the configuration problem
     */
    public MigratorConfigException(String message) {
        super(message);
    }

    /**
     * @param message a description of the configuration problem
     * @param cause the underlying cause (e.g., IOException, YAML parse error)
     */
    public MigratorConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
