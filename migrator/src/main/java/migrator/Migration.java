package migrator;

import java.util.Set;
import java.util.UUID;

/**
 * Identity and dependency metadata of a single migration.
 *
 * <p>A migration is a unit of schema change with a forward and a backward
 * action. This interface only describes <em>which</em> migration it is and what
 * it must run after; the actions themselves are defined by adapter-specific
 * sub-interfaces (for example {@code migrator.jdbc.JdbcMigration}) and are
 * opaque to the {@link migrator.engine.Migrator}.
 *
 * <h2>Example:</h2>
 * <pre>
 * public class CreateUsers extends AbstractMigration implements JdbcMigration {
 *     public CreateUsers() {
 *         super("bc960dc8-0e4a-4182-a62a-8e776d1e2b30", "Create users table");
 *     }
 *
 *     {@literal @}Override
 *     public void up(Connection c) throws SQLException { ... }
 * }
 * </pre>
 *
 * <p>Implementations must be immutable: the id and dependency set are read
 * once at registration and are expected to stay the same for the lifetime of
 * the process.
 *
 * @see AbstractMigration
 * @see Adapter
 */
public interface Migration {

    /**
     * Unique identifier of this migration.
     *
     * <p>The id is the join key between the dependency graph and the state
     * persisted by an {@link Adapter}, so it must be stable across runs.
     *
     * @return the migration id (never null)
     */
    UUID id();

    /**
     * Ids of all direct dependencies of this migration.
     *
     * @return the dependency ids, possibly empty (never null)
     */
    Set<UUID> dependencies();

    /**
     * Human-readable description used in diagnostics only.
     *
     * @return the description (never null)
     */
    String description();
}
