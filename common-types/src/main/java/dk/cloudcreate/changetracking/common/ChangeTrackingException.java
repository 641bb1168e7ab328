package dk.cloudcreate.changetracking.common;

/**
 * Base exception for recoverable failures raised while mutating a change tracked object,
 * e.g. a business rule violated by a validator
 */
public class ChangeTrackingException extends RuntimeException {
    public ChangeTrackingException() {
    }

    public ChangeTrackingException(String message) {
        super(message);
    }

    public ChangeTrackingException(String message, Throwable cause) {
        super(message, cause);
    }

    public ChangeTrackingException(Throwable cause) {
        super(cause);
    }

    public ChangeTrackingException(String message, Throwable cause, boolean enableSuppression, boolean writableStackTrace) {
        super(message, cause, enableSuppression, writableStackTrace);
    }
}
