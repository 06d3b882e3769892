package migrator.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import migrator.Adapter;
import migrator.config.MigratorConfig;

import java.sql.*;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * {@link Adapter} recording applied migrations in a metadata table.
 *
 * <p>The table holds one row per applied migration id:
 * <pre>
 * CREATE TABLE IF NOT EXISTS _schemer (id VARCHAR(36) PRIMARY KEY)
 * </pre>
 * Call {@link #init()} once before handing the adapter to a
 * {@link migrator.engine.Migrator}; it is safe to call it again.
 *
 * <p>Each apply or revert runs in its own transaction: the migration action
 * and the metadata change are committed together or rolled back together.
 * The connection's auto-commit mode is restored afterwards.
 *
 * <p>The adapter does not own the connection and never closes it.
 */
public class JdbcAdapter implements Adapter<JdbcMigration, SQLException> {

    private static final Logger log = LoggerFactory.getLogger(JdbcAdapter.class);

    private final Connection connection;
    private final String table;

    /**
     * Creates an adapter using the default metadata table.
     *
     * @param connection the connection to migrate
     */
    public JdbcAdapter(Connection connection) {
        this(connection, MigratorConfig.DEFAULT_METADATA_TABLE);
    }

    /**
     * Creates an adapter using the metadata table from {@code config}.
     *
     * @param connection the connection to migrate
     * @param config configuration providing the table name
     */
    public JdbcAdapter(Connection connection, MigratorConfig config) {
        this(connection, config.metadataTable());
    }

    /**
     * Creates an adapter using a custom metadata table.
     *
     * @param connection the connection to migrate
     * @param table the metadata table name, a plain SQL identifier
     * @throws migrator.config.MigrationConfigException if the name is not a plain identifier
     */
    public JdbcAdapter(Connection connection, String table) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.table = MigratorConfig.requireIdentifier(table);
    }

    /**
     * Creates the metadata table if it does not exist yet.
     *
     * @throws SQLException if the table cannot be created
     */
    public void init() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS " + table + " (id VARCHAR(36) PRIMARY KEY)");
        }
        if (!connection.getAutoCommit()) {
            connection.commit();
        }
        log.debug("Metadata table {} ready", table);
    }

    /** Returns the metadata table name. */
    public String table() {
        return table;
    }

    @Override
    public Set<UUID> appliedMigrations() throws SQLException {
        Set<UUID> ids = new LinkedHashSet<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT id FROM " + table)) {
            while (rs.next()) {
                String raw = rs.getString(1);
                try {
                    ids.add(UUID.fromString(raw));
                } catch (IllegalArgumentException e) {
                    throw new SQLException("Malformed migration id in " + table + ": " + raw, e);
                }
            }
        }
        return ids;
    }

    @Override
    public void applyMigration(JdbcMigration migration) throws SQLException {
        inTransaction(() -> {
            migration.up(connection);
            try (PreparedStatement ps = connection.prepareStatement("INSERT INTO " + table + " (id) VALUES (?)")) {
                ps.setString(1, migration.id().toString());
                ps.executeUpdate();
            }
        });
        log.debug("Recorded {} as applied in {}", migration.id(), table);
    }

    @Override
    public void revertMigration(JdbcMigration migration) throws SQLException {
        inTransaction(() -> {
            migration.down(connection);
            try (PreparedStatement ps = connection.prepareStatement("DELETE FROM " + table + " WHERE id = ?")) {
                ps.setString(1, migration.id().toString());
                ps.executeUpdate();
            }
        });
        log.debug("Removed {} from {}", migration.id(), table);
    }

    @FunctionalInterface
    private interface SqlWork {
        void run() throws SQLException;
    }

    private void inTransaction(SqlWork work) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        Exception failure = null;
        try {
            work.run();
            connection.commit();
        } catch (SQLException | RuntimeException e) {
            failure = e;
            try {
                connection.rollback();
            } catch (SQLException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        } finally {
            restoreAutoCommit(autoCommit, failure);
        }
    }

    private void restoreAutoCommit(boolean autoCommit, Exception failure) throws SQLException {
        try {
            connection.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            if (failure == null) {
                throw e;
            }
            failure.addSuppressed(e);
        }
    }
}
