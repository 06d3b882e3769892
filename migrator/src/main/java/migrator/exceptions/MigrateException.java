package migrator.exceptions;

import migrator.Migration;
import migrator.plan.MigrationDirection;

import java.util.Objects;
import java.util.UUID;

/**
 * Exception thrown when an {@code up} or {@code down} run fails.
 *
 * <p>Every instance carries a {@link Kind} and the underlying cause:
 * <ul>
 *   <li>{@link Kind#DEPENDENCY} - the requested target is not a registered
 *   migration; the cause is a {@link DependencyException}</li>
 *   <li>{@link Kind#ADAPTER} - the applied state could not be read; the cause
 *   is the adapter's error</li>
 *   <li>{@link Kind#MIGRATION} - applying or reverting one specific migration
 *   failed; {@link #getMigrationId()}, {@link #getDescription()} and
 *   {@link #getDirection()} identify it and the cause is the adapter's error</li>
 * </ul>
 *
 * <p>For {@link Kind#MIGRATION} every migration before the failing one in the
 * run's order completed, and none after it was attempted. Repeating the whole
 * call is safe because completed migrations are skipped.
 *
 * @see migrator.engine.Migrator
 */
public class MigrateException extends Exception {

    /**
     * The family of run failure.
     */
    public enum Kind {
        DEPENDENCY,
        ADAPTER,
        MIGRATION
    }

    private final Kind kind;
    private final UUID migrationId;
    private final String description;
    private final MigrationDirection direction;

    private MigrateException(String message,
                             Kind kind,
                             UUID migrationId,
                             String description,
                             MigrationDirection direction,
                             Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.migrationId = migrationId;
        this.description = description;
        this.direction = direction;
    }

    /**
     * Wraps a definition error detected while resolving a run target.
     *
     * @param cause the dependency error
     * @return the exception
     */
    public static MigrateException dependency(DependencyException cause) {
        Objects.requireNonNull(cause, "cause");
        return new MigrateException("An error occurred due to migration dependencies: " + cause.getMessage(),
                Kind.DEPENDENCY, cause.getMigrationId(), null, null, cause);
    }

    /**
     * Wraps an adapter error not attributable to a single migration.
     *
     * @param cause the adapter error
     * @return the exception
     */
    public static MigrateException adapter(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        return new MigrateException("An error occurred while interacting with the adapter: " + cause.getMessage(),
                Kind.ADAPTER, null, null, null, cause);
    }

    /**
     * Attributes an adapter error to the migration being applied or reverted.
     *
     * @param migration the failing migration
     * @param direction whether it was being applied or reverted
     * @param cause the adapter error
     * @return the exception
     */
    public static MigrateException migration(Migration migration, MigrationDirection direction, Throwable cause) {
        Objects.requireNonNull(migration, "migration");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(cause, "cause");
        return new MigrateException(
                "An error occurred while applying migration " + migration.id()
                        + " (" + migration.description() + ") " + direction.label()
                        + ": " + cause.getMessage() + ".",
                Kind.MIGRATION, migration.id(), migration.description(), direction, cause);
    }

    /** Returns the failure family. */
    public Kind getKind() { return kind; }

    /**
     * Returns the id of the failing migration, or of the unknown target.
     *
     * @return the id, or null for {@link Kind#ADAPTER}
     */
    public UUID getMigrationId() { return migrationId; }

    /**
     * Returns the description of the failing migration.
     *
     * @return the description, or null unless {@link Kind#MIGRATION}
     */
    public String getDescription() { return description; }

    /**
     * Returns whether the failing migration was being applied or reverted.
     *
     * @return the direction, or null unless {@link Kind#MIGRATION}
     */
    public MigrationDirection getDirection() { return direction; }
}
