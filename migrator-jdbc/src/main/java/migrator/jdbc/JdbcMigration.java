package migrator.jdbc;

import migrator.Migration;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Migration executed through JDBC.
 *
 * <p>Both actions run inside the transaction the {@link JdbcAdapter} opens
 * for the migration: they must not commit, roll back or change the
 * auto-commit mode of {@code connection}.
 */
public interface JdbcMigration extends Migration {

    /**
     * Forward action.
     *
     * @param connection connection with an open transaction
     * @throws SQLException to abort and roll back the migration
     */
    default void up(Connection connection) throws SQLException {
    }

    /**
     * Backward action.
     *
     * @param connection connection with an open transaction
     * @throws SQLException to abort and roll back the revert
     */
    default void down(Connection connection) throws SQLException {
    }
}
