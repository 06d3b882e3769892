package migrator.config;

import java.util.regex.Pattern;

/**
 * Central configuration for migrator runs and adapters.
 *
 * <p>This class encapsulates:
 * <ul>
 *   <li>Name of the metadata table adapters record applied ids in</li>
 *   <li>Number of run history entries kept in memory</li>
 *   <li>Alert level for structured run logging</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code migrator.properties} or
 * {@code migrator.yml} using {@link MigratorConfigLoader}.
 *
 * @see MigratorConfigLoader
 * @see migrator.engine.Migrator#applyConfig(MigratorConfig)
 */
public final class MigratorConfig {

    /** Metadata table name used when none is configured. */
    public static final String DEFAULT_METADATA_TABLE = "_schemer";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static final MigratorConfig DEFAULTS = builder().build();

    private final String metadataTable;
    private final int historySize;
    private final AlertLevel alertLevel;

    private MigratorConfig(Builder b) {
        this.metadataTable = b.metadataTable;
        this.historySize = b.historySize;
        this.alertLevel = b.alertLevel;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Checks that a table name is a plain SQL identifier.
     *
     * @param name the table name
     * @return the name
     * @throws MigrationConfigException if the name is null or not a plain identifier
     */
    public static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new MigrationConfigException("Invalid metadata table name: " + name);
        }
        return name;
    }

    /** Returns the metadata table name. */
    public String metadataTable() { return metadataTable; }

    /** Returns the maximum number of run history entries to keep. */
    public int historySize() { return historySize; }

    /** Returns the alert level for logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    @Override
    public String toString() {
        return "MigratorConfig{" +
                "metadataTable=" + metadataTable +
                ", historySize=" + historySize +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigratorConfig} instances.
     */
    public static final class Builder {
        private String metadataTable = DEFAULT_METADATA_TABLE;
        private int historySize = 10;
        private AlertLevel alertLevel = AlertLevel.WARNING;

        public Builder metadataTable(String table) {
            this.metadataTable = requireIdentifier(table);
            return this;
        }

        public Builder historySize(int size) {
            if (size <= 0) throw new IllegalArgumentException("historySize must be positive");
            this.historySize = size;
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public MigratorConfig build() {
            return new MigratorConfig(this);
        }
    }
}
