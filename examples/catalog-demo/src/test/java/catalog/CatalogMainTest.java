package catalog;

import catalog.plugins.reviews.CreateReviews;
import catalog.plugins.reviews.IndexReviewsByProduct;
import catalog.schema.CreateCategories;
import catalog.schema.CreateProducts;
import catalog.schema.IndexProductNames;
import catalog.schema.LinkProductCategories;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Catalog demo CLI")
class CatalogMainTest {

    @TempDir
    Path tempDir;

    private Path db;
    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() {
        db = tempDir.resolve("catalog.db");
        buffer = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        buffer.reset();
        String[] full = new String[args.length + 1];
        full[0] = db.toString();
        System.arraycopy(args, 0, full, 1, args.length);
        return CatalogMain.run(full, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private List<String> tables() throws SQLException {
        List<String> names = new ArrayList<>();
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + db);
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT name FROM sqlite_master WHERE type IN ('table', 'index') "
                     + "AND name NOT LIKE 'sqlite_%'")) {
            while (rs.next()) names.add(rs.getString(1));
        }
        return names;
    }

    @Test
    @DisplayName("up with no target builds the whole schema, plugins included")
    void upAll() throws Exception {
        assertThat(run("up")).isZero();

        assertThat(tables()).contains("catalog_migrations", "products", "categories",
                "product_categories", "products_name", "reviews", "reviews_product");
        assertThat(output()).contains("6 of 6 migrations");
    }

    @Test
    @DisplayName("status marks applied migrations")
    void status() {
        run("up", CreateCategories.ID);
        assertThat(run("status")).isZero();

        assertThat(output())
                .contains("[x] " + CreateCategories.ID)
                .contains("[ ] " + CreateProducts.ID)
                .contains("[ ] " + CreateReviews.ID);
    }

    @Test
    @DisplayName("down to products reverts every dependent, core and plugin")
    void downToProducts() throws Exception {
        run("up");
        assertThat(run("down", CreateProducts.ID)).isZero();

        assertThat(tables())
                .contains("products", "categories")
                .doesNotContain("product_categories", "products_name", "reviews", "reviews_product");
    }

    @Test
    @DisplayName("plan-up lists dependencies before dependents without touching the database")
    void planUp() throws Exception {
        assertThat(run("plan-up", LinkProductCategories.ID)).isZero();

        String out = output();
        assertThat(out).contains(CreateProducts.ID, CreateCategories.ID, LinkProductCategories.ID)
                .doesNotContain(IndexProductNames.ID, IndexReviewsByProduct.ID);
        assertThat(out.indexOf(LinkProductCategories.ID))
                .isGreaterThan(out.indexOf(CreateProducts.ID))
                .isGreaterThan(out.indexOf(CreateCategories.ID));
        assertThat(tables()).doesNotContain("products");
    }

    @Test
    @DisplayName("plan-down on an empty database has nothing to do")
    void planDownEmpty() {
        assertThat(run("plan-down")).isZero();
        assertThat(output()).contains("Nothing to down");
    }

    @Test
    @DisplayName("unknown target fails with exit code 1")
    void unknownTarget() {
        assertThat(run("up", "00000000-0000-0000-0000-000000000001")).isEqualTo(1);
        assertThat(output()).contains("Unknown migration ID 00000000-0000-0000-0000-000000000001");
    }

    @Test
    @DisplayName("bad usage exits with 2")
    void badUsage() {
        assertThat(run("sideways")).isEqualTo(2);
        assertThat(run("up", "not-a-uuid")).isEqualTo(2);
        assertThat(CatalogMain.run(new String[0], new PrintStream(buffer, true, StandardCharsets.UTF_8))).isEqualTo(2);
    }

    @Test
    @DisplayName("an unknown command is rejected before the database is opened")
    void unknownCommandLeavesNoDatabase() {
        assertThat(run("sideways")).isEqualTo(2);
        assertThat(db).doesNotExist();
    }

    @Test
    @DisplayName("a plugin migration that cannot be instantiated exits with 1")
    void brokenPlugin() {
        String[] args = {db.toString(), "status"};
        int code = CatalogMain.run(args, new PrintStream(buffer, true, StandardCharsets.UTF_8), "catalog.broken");

        assertThat(code).isEqualTo(1);
        assertThat(output()).startsWith("FAILED:").contains("no-argument constructor");
    }
}
