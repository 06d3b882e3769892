package migrator.exceptions;

/**
 * Exception thrown when a class annotated with
 * {@link migrator.annotations.SchemaMigration} cannot be turned into a
 * migration instance.
 *
 * <p>This happens when the annotated class:
 * <ul>
 *   <li>does not implement the requested migration type</li>
 *   <li>is abstract or an interface</li>
 *   <li>has no accessible no-arg constructor, or the constructor throws</li>
 * </ul>
 *
 * <p>This is an unchecked exception because a broken migration class is a
 * packaging problem that cannot be recovered at runtime.
 *
 * @see migrator.scanner.MigrationScanner
 */
public class MigrationDiscoveryException extends RuntimeException {

    /**
     * Creates a new exception with the specified message.
     *
     * @param message description of the offending class
     */
    public MigrationDiscoveryException(String message) {
        super(message);
    }

    /**
     * Creates a new exception with the specified message and cause.
     *
     * @param message description of the offending class
     * @param cause the reflective failure
     */
    public MigrationDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
