package migrator.config;

/**
 * Minimum severity of run events written by {@link migrator.alert.MigrationAlertLogger},
 * set with {@code migrator.alert.level}.
 *
 * <ul>
 *   <li>{@link #DEBUG} - run started, every applied or reverted migration, run completed, errors</li>
 *   <li>{@link #WARNING} - ignored listener failures and errors</li>
 *   <li>{@link #ERROR} - failed migrations and failed runs</li>
 * </ul>
 *
 * Failures are logged at every level.
 *
 * @see MigratorConfig#alertLevel()
 */
public enum AlertLevel {
    DEBUG,
    /** Default. */
    WARNING,
    ERROR;

    /**
     * Whether an event of the given severity passes this threshold.
     *
     * @param severity the event's severity
     * @return true if the event should be logged
     */
    public boolean includes(AlertLevel severity) {
        return severity.ordinal() >= ordinal();
    }
}
