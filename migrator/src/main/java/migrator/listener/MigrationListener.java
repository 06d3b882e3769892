package migrator.listener;

import migrator.Migration;

/**
 * Receives a callback around every migration a run applies or reverts, for
 * progress reporting and auditing.
 *
 * <p>Callbacks run synchronously on the migrator's thread. An exception thrown
 * by a callback is logged and ignored; it never changes the outcome of the run.
 *
 * <h2>Usage:</h2>
 * <pre>
 * migrator.setListener(new MigrationListener() {
 *     public void beforeMigration(MigrationContext ctx, Migration m) {
 *         System.out.println(ctx.direction().label() + " " + m.description());
 *     }
 *     public void afterMigration(MigrationContext ctx, Migration m) { }
 * });
 * </pre>
 *
 * @see MigrationContext
 */
public interface MigrationListener {

    /**
     * Called before the adapter applies or reverts {@code migration}.
     *
     * @param ctx run context
     * @param migration the migration about to change state
     */
    void beforeMigration(MigrationContext ctx, Migration migration);

    /**
     * Called after the adapter successfully applied or reverted {@code migration}.
     * Not called for a migration that failed.
     *
     * @param ctx run context
     * @param migration the migration that changed state
     */
    void afterMigration(MigrationContext ctx, Migration migration);
}
