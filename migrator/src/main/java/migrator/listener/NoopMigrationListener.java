package migrator.listener;

import migrator.Migration;

/**
 * Default no-op implementation used when the user doesn't supply a listener.
 */
public enum NoopMigrationListener implements MigrationListener {
    INSTANCE;

    @Override
    public void beforeMigration(MigrationContext ctx, Migration migration) { /* no-op */ }

    @Override
    public void afterMigration(MigrationContext ctx, Migration migration) { /* no-op */ }
}
