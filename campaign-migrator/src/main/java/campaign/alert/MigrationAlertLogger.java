package campaign.alert;

import campaign.config.AlertLevel;
import campaign.engine.MigrationStage;
import campaign.report.ErrorKind;
import campaign.report.MigrationFailure;
import campaign.report.MigrationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structured logging for migration events.
 *
 * <p>Log entries start with a marker such as MIGRATION_STARTED, RECORD_FAILED or
 * MIGRATION_COMPLETED followed by key=value pairs, so log aggregators can parse and
 * alert on them.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs record warnings and failures only</li>
 *   <li>ERROR: logs failures only</li>
 * </ul>
 * Failures are logged at every level.
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - MIGRATION_STARTED id=7 platform=facebook records=3
 * 12:00:00.001 INFO  migration - RECORD_STAGE id=7 record="Spring Sale" stage=MAPPING
 * 12:00:00.002 WARN  migration - RECORD_WARNING id=7 record="Spring Sale" warning="CPC bid defaulted"
 * 12:00:00.003 ERROR migration - RECORD_FAILED id=7 record="Promo" stage=UPLOADING kind=UPLOAD_REJECTED error="..."
 * 12:00:00.004 INFO  migration - MIGRATION_COMPLETED id=7 successes=2 warnings=1 failures=1
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    /**
     * Get the current alert level.
     */
    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    /**
     * Log when a single-record or batch migration starts.
     */
    public static void migrationStarted(long migrationId, String platform, int records) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_STARTED id={} platform={} records={}", migrationId, platform, records);
        }
    }

    public static void stageEntered(long migrationId, String recordRef, MigrationStage stage) {
        if (shouldLogInfo()) {
            log.info("RECORD_STAGE id={} record=\"{}\" stage={}", migrationId, recordRef, stage.name());
        }
    }

    public static void recordSucceeded(long migrationId, String recordRef, String message) {
        if (shouldLogInfo()) {
            log.info("RECORD_SUCCEEDED id={} record=\"{}\" message=\"{}\"", migrationId, recordRef, message);
        }
    }

    public static void recordWarning(long migrationId, String recordRef, String warning) {
        if (shouldLogWarn()) {
            log.warn("RECORD_WARNING id={} record=\"{}\" warning=\"{}\"", migrationId, recordRef, warning);
        }
    }

    /**
     * Log a per-record failure. Always logged; the cause's stack trace is attached for
     * uncategorised failures.
     */
    public static void recordFailed(long migrationId, MigrationFailure failure) {
        String stage = failure.stage() != null ? failure.stage().name() : "UNKNOWN";
        if (failure.cause() != null && failure.errorKind() == ErrorKind.UNEXPECTED_ERROR) {
            log.error("RECORD_FAILED id={} record=\"{}\" stage={} kind={} error=\"{}\"",
                    migrationId, failure.recordRef(), stage, failure.errorKind(), failure.message(), failure.cause());
        } else {
            log.error("RECORD_FAILED id={} record=\"{}\" stage={} kind={} error=\"{}\"",
                    migrationId, failure.recordRef(), stage, failure.errorKind(), failure.message());
        }
    }

    /**
     * Log a failure that aborted the whole operation before any record was attempted.
     */
    public static void migrationAborted(long migrationId, String platform, Throwable error) {
        log.error("MIGRATION_ABORTED id={} platform={} error=\"{}\"", migrationId, platform,
                error != null ? error.getMessage() : "Unknown error");
    }

    public static void migrationCompleted(long migrationId, MigrationReport report) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_COMPLETED id={} successes={} warnings={} failures={}",
                    migrationId,
                    report.successes().size(),
                    report.warnings().size(),
                    report.failures().size());
        }
    }
}
