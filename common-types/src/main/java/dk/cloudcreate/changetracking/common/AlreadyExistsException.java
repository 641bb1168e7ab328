package dk.cloudcreate.changetracking.common;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when creating an entity whose identity is already present
 */
public class AlreadyExistsException extends ChangeTrackingException {
    /**
     * The item that was rejected
     */
    public final Object item;

    public AlreadyExistsException(Object item) {
        super(msg("Already exists: {}", requireNonNull(item, "You must supply the item that already exists")));
        this.item = item;
    }
}
