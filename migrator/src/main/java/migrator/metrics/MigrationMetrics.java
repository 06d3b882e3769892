package migrator.metrics;

import migrator.plan.MigrationDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable metrics collected during one run.
 *
 * <p>Captures timing for the whole run and for each migration the adapter
 * applied or reverted, plus how far the run got.
 *
 * <p>Use {@link #summary()} for a human-readable summary, or {@link #toMap()}
 * for JSON serialization.
 *
 * @param runId identifier of the run
 * @param direction the run direction
 * @param startTime when the run started
 * @param endTime when the run finished or failed
 * @param totalDurationMs wall-clock duration of the run
 * @param planned number of migrations the run intended to change
 * @param completed number of migrations that changed state
 * @param migrationDurations time spent in the adapter per migration, in execution order
 * @param failedMigration id of the migration that failed, or null
 * @see MigrationMetricsCollector
 */
public record MigrationMetrics(
        long runId,
        MigrationDirection direction,
        Instant startTime,
        Instant endTime,
        long totalDurationMs,
        int planned,
        int completed,
        Map<UUID, Long> migrationDurations,
        UUID failedMigration
) {

    /** Returns true if every planned migration changed state. */
    public boolean isComplete() {
        return failedMigration == null && completed == planned;
    }

    /** Returns the total run duration as a Duration object. */
    public Duration totalDuration() {
        return Duration.ofMillis(totalDurationMs);
    }

    /**
     * Returns the time spent applying or reverting one migration.
     *
     * @param id the migration id
     * @return duration in milliseconds, or 0 if the migration was not run
     */
    public long migrationDuration(UUID id) {
        return migrationDurations.getOrDefault(id, 0L);
    }

    /**
     * Returns a human-readable summary of the run.
     */
    public String summary() {
        return String.format(Locale.ROOT,
                "Run #%d (%s) in %dms | %d of %d migrations%s",
                runId, direction.label(), totalDurationMs, completed, planned,
                failedMigration != null ? " | failed at " + failedMigration : "");
    }

    /**
     * Converts the metrics to a Map for JSON serialization.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("direction", direction.label());
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("planned", planned);
        map.put("completed", completed);
        map.put("failedMigration", failedMigration != null ? failedMigration.toString() : null);
        Map<String, Long> durations = new LinkedHashMap<>();
        migrationDurations.forEach((id, ms) -> durations.put(id.toString(), ms));
        map.put("migrationDurationsMs", durations);
        return map;
    }
}
