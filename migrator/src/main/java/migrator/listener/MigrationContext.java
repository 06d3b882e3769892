package migrator.listener;

import migrator.plan.MigrationDirection;
import migrator.plan.MigrationPlan;

/**
 * Context information delivered to {@link MigrationListener} callbacks.
 */
public final class MigrationContext {

    private final MigrationPlan<?> plan;
    private final long runId;
    private final long startedAtNanos;

    public MigrationContext(MigrationPlan<?> plan, long runId) {
        this.plan = plan;
        this.runId = runId;
        this.startedAtNanos = System.nanoTime();
    }

    /** The plan being executed. */
    public MigrationPlan<?> plan() {
        return plan;
    }

    /** Direction of the run. */
    public MigrationDirection direction() {
        return plan.direction();
    }

    /** Unique identifier for this run. */
    public long runId() {
        return runId;
    }

    /** Timestamp (in nanos) when this run started. */
    public long startedAtNanos() {
        return startedAtNanos;
    }
}
