package migrator.testing;

import migrator.Adapter;
import migrator.Migration;
import migrator.plan.MigrationDirection;

import java.util.*;

/**
 * Adapter keeping the applied set in memory.
 *
 * <p>Every successful apply or revert is appended to an operation log, so
 * tests can assert on the exact order the migrator used. Failures can be
 * injected per migration id or for reads of the applied set; a failed
 * operation leaves the applied set untouched.
 *
 * @param <M> the migration type
 */
public class InMemoryAdapter<M extends Migration> implements Adapter<M, InMemoryAdapter.InMemoryAdapterException> {

    /** One successful apply or revert. */
    public record Operation(MigrationDirection direction, UUID migrationId) {
        @Override
        public String toString() {
            return direction.label() + ":" + migrationId;
        }
    }

    /** Error raised by injected failures. */
    public static class InMemoryAdapterException extends Exception {
        public InMemoryAdapterException(String message) {
            super(message);
        }
    }

    private final Set<UUID> applied = new LinkedHashSet<>();
    private final List<Operation> operations = new ArrayList<>();
    private final Set<UUID> failing = new HashSet<>();
    private boolean failReads;
    private int reads;

    public InMemoryAdapter() {
    }

    /**
     * Creates an adapter whose store already records {@code preApplied} as applied.
     */
    public InMemoryAdapter(Collection<UUID> preApplied) {
        applied.addAll(preApplied);
    }

    @Override
    public Set<UUID> appliedMigrations() throws InMemoryAdapterException {
        reads++;
        if (failReads) {
            throw new InMemoryAdapterException("Injected read failure");
        }
        return new LinkedHashSet<>(applied);
    }

    @Override
    public void applyMigration(M migration) throws InMemoryAdapterException {
        UUID id = migration.id();
        if (failing.contains(id)) {
            throw new InMemoryAdapterException("Injected failure applying " + id);
        }
        applied.add(id);
        operations.add(new Operation(MigrationDirection.UP, id));
    }

    @Override
    public void revertMigration(M migration) throws InMemoryAdapterException {
        UUID id = migration.id();
        if (failing.contains(id)) {
            throw new InMemoryAdapterException("Injected failure reverting " + id);
        }
        applied.remove(id);
        operations.add(new Operation(MigrationDirection.DOWN, id));
    }

    /**
     * Make every apply or revert of {@code id} fail until {@link #clearFailures()}.
     *
     * @return this adapter
     */
    public InMemoryAdapter<M> failOn(UUID id) {
        failing.add(Objects.requireNonNull(id, "id"));
        return this;
    }

    /**
     * Make reads of the applied set fail or succeed.
     *
     * @return this adapter
     */
    public InMemoryAdapter<M> failReads(boolean fail) {
        this.failReads = fail;
        return this;
    }

    public void clearFailures() {
        failing.clear();
        failReads = false;
    }

    /** Returns the applied ids without counting as a read. */
    public Set<UUID> applied() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(applied));
    }

    /** Returns all successful operations in execution order. */
    public List<Operation> operations() {
        return List.copyOf(operations);
    }

    /** Returns the ids of the successful operations in {@code direction}, in execution order. */
    public List<UUID> operationIds(MigrationDirection direction) {
        List<UUID> ids = new ArrayList<>();
        for (Operation op : operations) {
            if (op.direction() == direction) ids.add(op.migrationId());
        }
        return ids;
    }

    public void clearOperations() {
        operations.clear();
    }

    /** Returns how many times the applied set was read. */
    public int reads() {
        return reads;
    }
}
