package migrator.state;

import migrator.metrics.MigrationMetrics;
import migrator.plan.MigrationDirection;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a single finished run.
 *
 * <p>History entries are stored in {@link MigrationState} and can be queried
 * via {@link MigrationState#getHistory()}. The number of entries retained
 * is controlled by the {@code migrator.history.size} configuration property.
 *
 * @param runId identifier of the run
 * @param timestamp when the run completed (or failed)
 * @param direction the run direction
 * @param target the requested target, or null for all migrations
 * @param status final status of the run (SUCCESS or FAILED)
 * @param metrics metrics from the run (null if it failed before planning finished)
 * @param errorMessage error message if the run failed (null on success)
 * @see MigrationState
 */
public record MigrationHistoryEntry(
        long runId,
        Instant timestamp,
        MigrationDirection direction,
        UUID target,
        MigrationState.Status status,
        MigrationMetrics metrics,
        String errorMessage
) {
    /**
     * Creates a successful run entry.
     */
    public static MigrationHistoryEntry success(long runId, MigrationDirection direction, UUID target,
                                                MigrationMetrics metrics) {
        return new MigrationHistoryEntry(runId, Instant.now(), direction, target,
                MigrationState.Status.SUCCESS, metrics, null);
    }

    /**
     * Creates a failed run entry.
     */
    public static MigrationHistoryEntry failure(long runId, MigrationDirection direction, UUID target,
                                                String errorMessage, MigrationMetrics partialMetrics) {
        return new MigrationHistoryEntry(runId, Instant.now(), direction, target,
                MigrationState.Status.FAILED, partialMetrics, errorMessage);
    }
}
