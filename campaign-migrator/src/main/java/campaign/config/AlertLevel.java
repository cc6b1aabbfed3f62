package campaign.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link campaign.alert.MigrationAlertLogger}. Configured via the
 * {@code migrator.alert.level} property.
 *
 * <p>Log output at each level:
 * <ul>
 *   <li>{@link #DEBUG} - All events: batch started, stage transitions, record outcomes, batch completed</li>
 *   <li>{@link #WARNING} - Record warnings and failures only</li>
 *   <li>{@link #ERROR} - Failures only</li>
 * </ul>
 *
 * @see MigratorConfig#alertLevel()
 */
public enum AlertLevel {
    /** Log all events. Use for development and troubleshooting. */
    DEBUG,

    /** Log warnings and failures. This is the default level. */
    WARNING,

    /** Log failures only. */
    ERROR
}
