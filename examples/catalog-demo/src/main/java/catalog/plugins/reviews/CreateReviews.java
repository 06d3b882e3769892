package catalog.plugins.reviews;

import catalog.schema.CreateProducts;
import migrator.AbstractMigration;
import migrator.annotations.SchemaMigration;
import migrator.jdbc.JdbcMigration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Contributed by the reviews plugin; depends on the core products table only.
 */
@SchemaMigration
public class CreateReviews extends AbstractMigration implements JdbcMigration {

    public static final String ID = "0940acb1-0e2e-4b99-9d69-2302a9c74524";

    public CreateReviews() {
        super(ID, "Create product reviews table", CreateProducts.ID);
    }

    @Override
    public void up(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("CREATE TABLE reviews ("
                    + "id INTEGER PRIMARY KEY, "
                    + "product_id INTEGER NOT NULL REFERENCES products (id), "
                    + "rating INTEGER NOT NULL CHECK (rating BETWEEN 1 AND 5), "
                    + "body TEXT)");
        }
    }

    @Override
    public void down(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("DROP TABLE reviews");
        }
    }
}
