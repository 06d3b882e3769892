package migrator;

import java.util.Set;
import java.util.UUID;

/**
 * Storage collaborator that records which migrations are applied and runs
 * their forward and backward actions.
 *
 * <p>The {@link migrator.engine.Migrator} never touches storage itself. It asks
 * the adapter for the applied set once per operation and then calls
 * {@link #applyMigration(Migration)} or {@link #revertMigration(Migration)} once
 * for every migration whose state has to change.
 *
 * <p>Contract:
 * <ul>
 *   <li>{@link #appliedMigrations()} reflects every earlier successful apply or
 *   revert made through any adapter sharing the same store, and may be called
 *   any number of times</li>
 *   <li>applying runs the forward action <em>and</em> records the id as one
 *   atomic unit; reverting runs the backward action and removes the id
 *   atomically</li>
 *   <li>initialising the adapter's own bookkeeping (tables, files) is done by
 *   the caller before any migrator operation</li>
 * </ul>
 *
 * @param <M> migration type this adapter knows how to execute
 * @param <E> error type reported by this adapter
 * @see Migration
 */
public interface Adapter<M extends Migration, E extends Exception> {

    /**
     * Returns the ids of all migrations currently recorded as applied.
     *
     * @return the applied ids (never null)
     * @throws E if the applied state cannot be read
     */
    Set<UUID> appliedMigrations() throws E;

    /**
     * Runs the forward action of a migration and records it as applied.
     *
     * @param migration the migration to apply
     * @throws E if the action or the bookkeeping fails; nothing is persisted then
     */
    void applyMigration(M migration) throws E;

    /**
     * Runs the backward action of a migration and records it as not applied.
     *
     * @param migration the migration to revert
     * @throws E if the action or the bookkeeping fails; nothing is persisted then
     */
    void revertMigration(M migration) throws E;
}
