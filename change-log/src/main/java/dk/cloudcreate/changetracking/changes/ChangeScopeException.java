package dk.cloudcreate.changetracking.changes;

/**
 * Wraps a checked exception thrown inside {@link Undoable#usingChangeScope(dk.cloudcreate.essentials.shared.functional.CheckedConsumer)}
 * or {@link Undoable#withChangeScope(dk.cloudcreate.essentials.shared.functional.CheckedFunction)}
 */
public class ChangeScopeException extends RuntimeException {
    public ChangeScopeException(String message) {
        super(message);
    }

    public ChangeScopeException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChangeScopeException(Throwable cause) {
        super(cause);
    }
}
