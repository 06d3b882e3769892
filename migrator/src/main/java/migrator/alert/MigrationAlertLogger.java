package migrator.alert;

import migrator.config.AlertLevel;
import migrator.metrics.MigrationMetrics;
import migrator.plan.MigrationDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Structured logging for migrator runs.
 *
 * <p>Log entries use markers like RUN_STARTED, MIGRATION_APPLIED, RUN_FAILED
 * with key=value pairs so they can be grepped and alerted on.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: logs warnings and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - RUN_STARTED id=3 direction=up target=ALL steps=2
 * 12:00:00.040 INFO  migration - MIGRATION_APPLIED id=3 migration=bc960dc8-... duration_ms=40
 * 12:00:00.090 INFO  migration - MIGRATION_APPLIED id=3 migration=4885e8ab-... duration_ms=50
 * 12:00:00.091 INFO  migration - RUN_COMPLETED id=3 direction=up duration_ms=91 completed=2
 * </pre>
 */
public final class MigrationAlertLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationAlertLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level, or null to restore the default (WARNING)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    /** Get the current alert level. */
    public static AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private static boolean shouldLogInfo() {
        return alertLevel.includes(AlertLevel.DEBUG);
    }

    private static boolean shouldLogWarn() {
        return alertLevel.includes(AlertLevel.WARNING);
    }

    /**
     * Log when a run starts.
     *
     * @param runId the run identifier
     * @param direction the run direction
     * @param target the requested target, or null for all migrations
     * @param steps number of migrations the run will apply or revert
     */
    public static void runStarted(long runId, MigrationDirection direction, UUID target, int steps) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED id={} direction={} target={} steps={}",
                    runId, direction.label(), target != null ? target : "ALL", steps);
        }
    }

    /**
     * Log when a single migration changed state.
     *
     * @param runId the run identifier
     * @param direction whether it was applied or reverted
     * @param migrationId the migration id
     * @param durationMs time spent in the adapter
     */
    public static void migrationCompleted(long runId, MigrationDirection direction, UUID migrationId, long durationMs) {
        if (shouldLogInfo()) {
            String marker = direction == MigrationDirection.UP ? "MIGRATION_APPLIED" : "MIGRATION_REVERTED";
            log.info("{} id={} migration={} duration_ms={}", marker, runId, migrationId, durationMs);
        }
    }

    /**
     * Log when a run completes successfully.
     *
     * @param runId the run identifier
     * @param metrics the final run metrics
     */
    public static void runCompleted(long runId, MigrationMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED id={} direction={} duration_ms={} completed={}",
                    runId,
                    metrics.direction().label(),
                    metrics.totalDurationMs(),
                    metrics.completed());
        }
    }

    /**
     * Log when a single migration fails. Always logged.
     *
     * @param runId the run identifier
     * @param direction whether it was being applied or reverted
     * @param migrationId the migration id
     * @param description the migration description
     * @param error the adapter error
     */
    public static void migrationFailed(long runId, MigrationDirection direction, UUID migrationId,
                                       String description, Throwable error) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        log.error("MIGRATION_FAILED id={} direction={} migration={} description=\"{}\" error=\"{}\"",
                runId, direction.label(), migrationId, description, errorMsg);
    }

    /**
     * Log when a run fails. Always logged.
     *
     * @param runId the run identifier
     * @param error the error that ended the run
     * @param partialMetrics metrics collected before the failure (may be null)
     */
    public static void runFailed(long runId, Throwable error, MigrationMetrics partialMetrics) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";

        if (partialMetrics != null) {
            log.error("RUN_FAILED id={} direction={} error=\"{}\" duration_ms={} completed={} planned={}",
                    runId, partialMetrics.direction().label(), errorMsg,
                    partialMetrics.totalDurationMs(),
                    partialMetrics.completed(),
                    partialMetrics.planned());
        } else {
            log.error("RUN_FAILED id={} error=\"{}\"", runId, errorMsg);
        }
    }

    /**
     * Log when a listener callback threw and was skipped.
     *
     * @param runId the run identifier
     * @param callback name of the callback
     * @param error what the listener threw
     */
    public static void listenerFailed(long runId, String callback, Throwable error) {
        if (shouldLogWarn()) {
            log.warn("LISTENER_FAILED id={} callback={} error=\"{}\"", runId, callback, error.getMessage());
        }
    }
}
