package migrator.metrics;

import migrator.plan.MigrationDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Collects timing for one run.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationMetricsCollector collector = new MigrationMetricsCollector();
 * collector.start(runId, MigrationDirection.UP, plan.size());
 *
 * collector.timed(migration.id(), () -&gt; adapter.applyMigration(migration));
 *
 * MigrationMetrics metrics = collector.finish();
 * </pre>
 *
 * <p>A migration whose action throws is recorded as the failed migration
 * and does not count as completed.
 *
 * @see MigrationMetrics
 */
public final class MigrationMetricsCollector {

    private final Map<UUID, Long> migrationDurations = new LinkedHashMap<>();

    private long runId;
    private MigrationDirection direction;
    private Instant startTime;
    private int planned;
    private int completed;
    private UUID failedMigration;

    /**
     * Starts metrics collection for a new run.
     *
     * @param runId the run identifier
     * @param direction the run direction
     * @param planned number of migrations the run intends to change
     * @return this collector for method chaining
     */
    public MigrationMetricsCollector start(long runId, MigrationDirection direction, int planned) {
        this.runId = runId;
        this.direction = direction;
        this.startTime = Instant.now();
        this.planned = planned;
        this.completed = 0;
        this.failedMigration = null;
        this.migrationDurations.clear();
        return this;
    }

    @FunctionalInterface
    public interface ThrowingRunnable<E extends Exception> {
        void run() throws E;
    }

    /**
     * Time one migration's action (can throw checked exceptions).
     *
     * @param migrationId the migration being applied or reverted
     * @param action the adapter call
     * @return the duration of the action in milliseconds
     * @throws E whatever the action throws
     */
    public <E extends Exception> long timed(UUID migrationId, ThrowingRunnable<E> action) throws E {
        long start = System.nanoTime();
        boolean ok = false;
        try {
            action.run();
            ok = true;
        } finally {
            long ms = Duration.ofNanos(System.nanoTime() - start).toMillis();
            migrationDurations.put(migrationId, ms);
            if (ok) {
                completed++;
            } else {
                failedMigration = migrationId;
            }
        }
        return migrationDurations.get(migrationId);
    }

    /**
     * Finishes metrics collection and returns the final metrics.
     *
     * @return the collected run metrics
     */
    public MigrationMetrics finish() {
        Instant endTime = Instant.now();
        return new MigrationMetrics(
                runId,
                direction,
                startTime,
                endTime,
                Duration.between(startTime, endTime).toMillis(),
                planned,
                completed,
                Collections.unmodifiableMap(new LinkedHashMap<>(migrationDurations)),
                failedMigration
        );
    }
}
