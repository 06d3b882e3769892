package catalog.plugins.reviews;

import migrator.AbstractMigration;
import migrator.annotations.SchemaMigration;
import migrator.jdbc.JdbcMigration;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

@SchemaMigration
public class IndexReviewsByProduct extends AbstractMigration implements JdbcMigration {

    public static final String ID = "5c3a1f0e-7b2d-4c8e-9f61-2a4d8b7e3c10";

    public IndexReviewsByProduct() {
        super(ID, "Index reviews by product", CreateReviews.ID);
    }

    @Override
    public void up(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("CREATE INDEX reviews_product ON reviews (product_id)");
        }
    }

    @Override
    public void down(Connection c) throws SQLException {
        try (Statement s = c.createStatement()) {
            s.execute("DROP INDEX reviews_product");
        }
    }
}
