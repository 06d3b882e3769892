package catalog.schema;

import migrator.AbstractMigration;
import migrator.annotations.SchemaMigration;
import migrator.jdbc.JdbcMigration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

@SchemaMigration
public class IndexProductNames extends AbstractMigration implements JdbcMigration {

    public static final String ID = "9433a432-386f-467e-a59f-a9fb7e249767";

    public IndexProductNames() {
        super(ID, "Index products by name", CreateProducts.ID);
    }

    @Override
    public void up(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("CREATE INDEX products_name ON products (name)");
        }
    }

    @Override
    public void down(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("DROP INDEX products_name");
        }
    }
}
