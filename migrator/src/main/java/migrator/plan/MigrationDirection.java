package migrator.plan;

/**
 * Direction in which a run moves migrations.
 */
public enum MigrationDirection {
    /** Unapplied to applied, dependencies first. */
    UP("up"),
    /** Applied to unapplied, dependents first. */
    DOWN("down");

    private final String label;

    MigrationDirection(String label) {
        this.label = label;
    }

    /** Lower-case label used in log and error messages. */
    public String label() {
        return label;
    }
}
