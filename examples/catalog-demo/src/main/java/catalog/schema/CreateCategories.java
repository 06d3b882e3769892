package catalog.schema;

import migrator.AbstractMigration;
import migrator.annotations.SchemaMigration;
import migrator.jdbc.JdbcMigration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

@SchemaMigration
public class CreateCategories extends AbstractMigration implements JdbcMigration {

    public static final String ID = "4885e8ab-dafa-4d76-a565-2dee8b04ef60";

    public CreateCategories() {
        super(ID, "Create categories table");
    }

    @Override
    public void up(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("CREATE TABLE categories (id INTEGER PRIMARY KEY, name TEXT NOT NULL UNIQUE)");
        }
    }

    @Override
    public void down(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("DROP TABLE categories");
        }
    }
}
