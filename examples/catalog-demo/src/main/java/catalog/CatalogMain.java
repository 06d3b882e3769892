package catalog;

import migrator.config.MigrationConfigException;
import migrator.config.MigratorConfig;
import migrator.config.MigratorConfigLoader;
import migrator.engine.Migrator;
import migrator.exceptions.DependencyException;
import migrator.exceptions.MigrateException;
import migrator.exceptions.MigrationDiscoveryException;
import migrator.jdbc.JdbcAdapter;
import migrator.jdbc.JdbcMigration;
import migrator.metrics.MigrationMetrics;
import migrator.plan.MigrationPlan;
import migrator.scanner.MigrationScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Command-line driver migrating a product catalog stored in a SQLite file.
 *
 * <p>The core schema lives in {@code catalog.schema}; plugins contribute their
 * own migrations under {@code catalog.plugins}. Both are discovered on the
 * classpath and ordered purely by their declared dependencies.
 *
 * <h2>Usage:</h2>
 * <pre>
 * catalog-demo &lt;db-file&gt; status
 * catalog-demo &lt;db-file&gt; up [migration-id]
 * catalog-demo &lt;db-file&gt; down [migration-id]
 * catalog-demo &lt;db-file&gt; plan-up [migration-id]
 * catalog-demo &lt;db-file&gt; plan-down [migration-id]
 * </pre>
 *
 * <p>Exit codes: 0 on success, 1 if the migration failed, 2 on bad usage.
 */
public final class CatalogMain {

    private static final Logger log = LoggerFactory.getLogger(CatalogMain.class);

    static final String[] MIGRATION_PACKAGES = {"catalog.schema", "catalog.plugins"};

    private static final Set<String> COMMANDS = Set.of("status", "up", "down", "plan-up", "plan-down");

    private CatalogMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, PrintStream out) {
        return run(args, out, MIGRATION_PACKAGES);
    }

    static int run(String[] args, PrintStream out, String... packages) {
        if (args.length < 2 || args.length > 3) {
            usage(out);
            return 2;
        }

        String dbFile = args[0];
        String command = args[1];
        if (!COMMANDS.contains(command)) {
            usage(out);
            return 2;
        }
        UUID target;
        try {
            target = args.length == 3 ? UUID.fromString(args[2]) : null;
        } catch (IllegalArgumentException e) {
            out.println("Not a migration id: " + args[2]);
            return 2;
        }

        MigratorConfig config;
        try {
            config = MigratorConfigLoader.load();
        } catch (MigrationConfigException e) {
            log.error("Invalid migrator configuration: {}", e.getMessage());
            out.println("FAILED: " + e.getMessage());
            return 1;
        }

        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile)) {
            JdbcAdapter adapter = new JdbcAdapter(connection, config);
            adapter.init();

            Migrator<JdbcMigration, SQLException> migrator = new Migrator<>(adapter).applyConfig(config);
            List<JdbcMigration> discovered = MigrationScanner.discover(JdbcMigration.class, packages);
            migrator.registerMultiple(discovered);
            log.info("Registered {} migration(s) from {}", discovered.size(), List.of(packages));

            switch (command) {
                case "status":
                    printStatus(migrator, out);
                    return 0;
                case "up":
                    migrator.up(target);
                    printMetrics(migrator.lastMetrics(), out);
                    return 0;
                case "down":
                    migrator.down(target);
                    printMetrics(migrator.lastMetrics(), out);
                    return 0;
                case "plan-up":
                    printPlan(migrator.planUp(target), out);
                    return 0;
                case "plan-down":
                    printPlan(migrator.planDown(target), out);
                    return 0;
                default:
                    usage(out);
                    return 2;
            }
        } catch (MigrateException e) {
            log.error("Migration failed [{}]: {}", e.getKind(), e.getMessage());
            out.println("FAILED: " + e.getMessage());
            return 1;
        } catch (DependencyException e) {
            log.error("Invalid migration set [{}]: {}", e.getKind(), e.getMessage());
            out.println("FAILED: " + e.getMessage());
            return 1;
        } catch (MigrationDiscoveryException e) {
            log.error("Cannot load catalog migrations: {}", e.getMessage());
            out.println("FAILED: " + e.getMessage());
            return 1;
        } catch (SQLException e) {
            log.error("Cannot open catalog database {}", dbFile, e);
            out.println("FAILED: " + e.getMessage());
            return 1;
        }
    }

    private static void printStatus(Migrator<JdbcMigration, SQLException> migrator, PrintStream out)
            throws MigrateException {
        for (Map.Entry<JdbcMigration, Boolean> e : migrator.status().entrySet()) {
            JdbcMigration m = e.getKey();
            out.printf("[%s] %s %s%n", e.getValue() ? "x" : " ", m.id(), m.description());
        }
    }

    private static void printPlan(MigrationPlan<JdbcMigration> plan, PrintStream out) {
        if (plan.isEmpty()) {
            out.println("Nothing to " + plan.direction().label());
            return;
        }
        for (JdbcMigration m : plan.steps()) {
            out.printf("%s %s %s%n", plan.direction().label(), m.id(), m.description());
        }
    }

    private static void printMetrics(MigrationMetrics metrics, PrintStream out) {
        if (metrics != null) {
            out.println(metrics.summary());
        }
    }

    private static void usage(PrintStream out) {
        out.println("usage: catalog-demo <db-file> <status|up|down|plan-up|plan-down> [migration-id]");
    }
}
