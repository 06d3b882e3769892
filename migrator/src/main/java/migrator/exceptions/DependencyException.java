package migrator.exceptions;

import java.util.Objects;
import java.util.UUID;

/**
 * Exception thrown when migration identities or dependencies are defined
 * inconsistently.
 *
 * <p>These are definition bugs in the registered migrations and are reported
 * synchronously from registration, before any storage is touched:
 * <ul>
 *   <li>{@link Kind#DUPLICATE_ID} - two migrations share an id</li>
 *   <li>{@link Kind#UNKNOWN_ID} - a dependency or target id is not registered</li>
 *   <li>{@link Kind#CYCLE} - a dependency edge would close a cycle</li>
 * </ul>
 *
 * <p>They are never retried; the caller has to fix the migration set.
 *
 * @see migrator.engine.Migrator#register(migrator.Migration)
 * @see migrator.plan.DependencyGraph#addEdge(int, int)
 */
public class DependencyException extends Exception {

    /**
     * The kind of definition error.
     */
    public enum Kind {
        DUPLICATE_ID,
        UNKNOWN_ID,
        CYCLE
    }

    private final Kind kind;
    private final UUID migrationId;
    private final UUID from;
    private final UUID to;

    private DependencyException(String message, Kind kind, UUID migrationId, UUID from, UUID to) {
        super(message);
        this.kind = kind;
        this.migrationId = migrationId;
        this.from = from;
        this.to = to;
    }

    /**
     * A migration with the same id is already registered.
     *
     * @param id the duplicated id
     * @return the exception
     */
    public static DependencyException duplicateId(UUID id) {
        Objects.requireNonNull(id, "id");
        return new DependencyException("Duplicate migration ID " + id, Kind.DUPLICATE_ID, id, null, null);
    }

    /**
     * No migration with the given id is registered.
     *
     * @param id the unknown id
     * @return the exception
     */
    public static DependencyException unknownId(UUID id) {
        Objects.requireNonNull(id, "id");
        return new DependencyException("Unknown migration ID " + id, Kind.UNKNOWN_ID, id, null, null);
    }

    /**
     * The edge from {@code from} (dependency) to {@code to} (dependent) would
     * create a cycle.
     *
     * @param from id of the dependency
     * @param to id of the dependent migration
     * @return the exception
     */
    public static DependencyException cycle(UUID from, UUID to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return new DependencyException(
                "Cyclic dependency caused by edge from migration IDs " + from + " to " + to,
                Kind.CYCLE, null, from, to);
    }

    /** Returns the kind of definition error. */
    public Kind getKind() { return kind; }

    /**
     * Returns the duplicated or unknown id.
     *
     * @return the id, or null for {@link Kind#CYCLE}
     */
    public UUID getMigrationId() { return migrationId; }

    /**
     * Returns the dependency end of the rejected edge.
     *
     * @return the id, or null unless {@link Kind#CYCLE}
     */
    public UUID getFrom() { return from; }

    /**
     * Returns the dependent end of the rejected edge.
     *
     * @return the id, or null unless {@link Kind#CYCLE}
     */
    public UUID getTo() { return to; }
}
