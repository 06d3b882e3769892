package catalog.schema;

import migrator.AbstractMigration;
import migrator.annotations.SchemaMigration;
import migrator.jdbc.JdbcMigration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Many-to-many link between products and categories.
 */
@SchemaMigration
public class LinkProductCategories extends AbstractMigration implements JdbcMigration {

    public static final String ID = "c5d07448-851f-45e8-8fa7-4823d5250609";

    public LinkProductCategories() {
        super(ID, "Link products to categories", CreateProducts.ID, CreateCategories.ID);
    }

    @Override
    public void up(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("CREATE TABLE product_categories ("
                    + "product_id INTEGER NOT NULL REFERENCES products (id), "
                    + "category_id INTEGER NOT NULL REFERENCES categories (id), "
                    + "PRIMARY KEY (product_id, category_id))");
        }
    }

    @Override
    public void down(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("DROP TABLE product_categories");
        }
    }
}
