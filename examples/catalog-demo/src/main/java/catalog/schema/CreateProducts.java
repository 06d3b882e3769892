package catalog.schema;

import migrator.AbstractMigration;
import migrator.annotations.SchemaMigration;
import migrator.jdbc.JdbcMigration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

@SchemaMigration
public class CreateProducts extends AbstractMigration implements JdbcMigration {

    public static final String ID = "bc960dc8-0e4a-4182-a62a-8e776d1e2b30";

    public CreateProducts() {
        super(ID, "Create products table");
    }

    @Override
    public void up(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("CREATE TABLE products (id INTEGER PRIMARY KEY, sku TEXT NOT NULL UNIQUE, name TEXT NOT NULL)");
        }
    }

    @Override
    public void down(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("DROP TABLE products");
        }
    }
}
