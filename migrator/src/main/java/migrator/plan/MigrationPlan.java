package migrator.plan;

import java.util.*;

import migrator.Migration;

/**
 * Immutable result of planning an {@code up} or {@code down} run.
 *
 * <p>A MigrationPlan records:
 * <ul>
 *   <li>the direction of the run</li>
 *   <li>the requested target, or none for "everything"</li>
 *   <li>the target set: every migration the run is allowed to touch</li>
 *   <li>the migrations that will actually change state, in execution order</li>
 * </ul>
 *
 * <p>The steps are the target set filtered by the applied state read at
 * planning time, in global topological order for {@link MigrationDirection#UP}
 * and reverse topological order for {@link MigrationDirection#DOWN}.
 *
 * @param <M> the migration type
 * @see migrator.engine.Migrator#planUp(UUID)
 * @see migrator.engine.Migrator#planDown(UUID)
 */
public final class MigrationPlan<M extends Migration> {

    private final MigrationDirection direction;
    private final UUID target;
    private final Set<UUID> targetIds;
    private final List<M> steps;

    private MigrationPlan(MigrationDirection direction, UUID target, Set<UUID> targetIds, List<M> steps) {
        this.direction = direction;
        this.target = target;
        this.targetIds = targetIds;
        this.steps = steps;
    }

    /**
     * Creates a plan.
     *
     * @param direction the run direction
     * @param target the requested target, or null for all migrations
     * @param targetIds ids the run may touch
     * @param steps migrations to apply or revert, in execution order
     * @param <M> the migration type
     * @return an immutable plan
     */
    public static <M extends Migration> MigrationPlan<M> of(
            MigrationDirection direction,
            UUID target,
            Collection<UUID> targetIds,
            List<? extends M> steps
    ) {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(targetIds, "targetIds");
        Objects.requireNonNull(steps, "steps");
        return new MigrationPlan<>(
                direction,
                target,
                Collections.unmodifiableSet(new LinkedHashSet<>(targetIds)),
                List.copyOf(steps)
        );
    }

    /** Returns the run direction. */
    public MigrationDirection direction() {
        return direction;
    }

    /**
     * Returns the requested target.
     *
     * @return the target id, or empty when the run covers all migrations
     */
    public Optional<UUID> target() {
        return Optional.ofNullable(target);
    }

    /** Returns the ids the run may touch, whether or not they change state. */
    public Set<UUID> targetIds() {
        return targetIds;
    }

    /** Returns the migrations that will change state, in execution order. */
    public List<M> steps() {
        return steps;
    }

    /** Returns the ids of {@link #steps()}, in execution order. */
    public List<UUID> stepIds() {
        List<UUID> ids = new ArrayList<>(steps.size());
        for (M m : steps) {
            ids.add(m.id());
        }
        return Collections.unmodifiableList(ids);
    }

    /** Returns true if running this plan would not touch the adapter. */
    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /** Returns the number of migrations that will change state. */
    public int size() {
        return steps.size();
    }

    @Override
    public String toString() {
        return "MigrationPlan{" +
                "direction=" + direction +
                ", target=" + target +
                ", targets=" + targetIds.size() +
                ", steps=" + stepIds() +
                '}';
    }
}
