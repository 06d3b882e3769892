package migrator.annotations;

import java.lang.annotation.*;

/**
 * Marks a class as a migration to be picked up by classpath discovery.
 *
 * <p>The annotated class must implement the migration type being discovered
 * and have a public no-argument constructor. Any number of classes may carry
 * the annotation; their order on the classpath does not matter since the
 * {@link migrator.engine.Migrator} orders them by dependency.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}SchemaMigration
 * public class CreateUsers extends AbstractMigration implements JdbcMigration {
 *     public CreateUsers() {
 *         super("bc960dc8-0e4a-4182-a62a-8e776d1e2b30", "Create users table");
 *     }
 *     ...
 * }
 * </pre>
 *
 * @see migrator.scanner.MigrationScanner
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface SchemaMigration {
}
