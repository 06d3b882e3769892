package migrator.config;

/**
 * Exception thrown when migrator configuration cannot be loaded or is invalid.
 *
 * <p>Raised for unparseable configuration files and for metadata table names
 * that are not plain SQL identifiers. Invalid individual values in an
 * otherwise readable file are logged and replaced by defaults instead.
 *
 * @see MigratorConfigLoader
 * @see MigratorConfig
 */
public class MigrationConfigException extends RuntimeException {

    /**
     * Creates a new configuration exception with the specified message.
     *
     * @param message a description of the configuration problem
     */
    public MigrationConfigException(String message) {
        super(message);
    }

    /**
     * Creates a new configuration exception with the specified message and cause.
     *
     * @param message a description of the configuration problem
     * @param cause the underlying cause (I/O or YAML parse error)
     */
    public MigrationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
