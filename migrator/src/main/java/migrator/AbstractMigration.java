package migrator;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Convenience base class declaring a migration's id, dependencies and
 * description in one constructor call.
 *
 * <h2>Example:</h2>
 * <pre>
 * public class AddEmailIndex extends AbstractMigration implements JdbcMigration {
 *     public AddEmailIndex() {
 *         super("4885e8ab-dafa-4d76-a565-2dee8b04ef60",
 *               "Index users by email",
 *               "bc960dc8-0e4a-4182-a62a-8e776d1e2b30");
 *     }
 * }
 * </pre>
 *
 * @see Migration
 */
public abstract class AbstractMigration implements Migration {

    private final UUID id;
    private final Set<UUID> dependencies;
    private final String description;

    /**
     * Creates a migration from UUID strings.
     *
     * @param id the migration id
     * @param description human-readable description
     * @param dependencies ids of the migrations this one depends on
     * @throws IllegalArgumentException if any id is not a valid UUID
     */
    protected AbstractMigration(String id, String description, String... dependencies) {
        this(UUID.fromString(id), description, parse(dependencies));
    }

    /**
     * Creates a migration from already parsed ids.
     *
     * @param id the migration id
     * @param description human-readable description
     * @param dependencies ids of the migrations this one depends on
     */
    protected AbstractMigration(UUID id, String description, Collection<UUID> dependencies) {
        this.id = Objects.requireNonNull(id, "id");
        this.description = Objects.requireNonNull(description, "description");
        this.dependencies = Set.copyOf(new LinkedHashSet<>(Objects.requireNonNull(dependencies, "dependencies")));
    }

    private static Set<UUID> parse(String... ids) {
        Set<UUID> result = new LinkedHashSet<>();
        for (String s : ids) {
            result.add(UUID.fromString(s));
        }
        return result;
    }

    @Override
    public final UUID id() { return id; }

    @Override
    public final Set<UUID> dependencies() { return dependencies; }

    @Override
    public final String description() { return description; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + id + ", \"" + description + "\"}";
    }
}
