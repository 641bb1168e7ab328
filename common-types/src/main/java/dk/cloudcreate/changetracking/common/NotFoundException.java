package dk.cloudcreate.changetracking.common;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when updating or removing an entity whose identity isn't present
 */
public class NotFoundException extends ChangeTrackingException {
    /**
     * The item or identity that couldn't be found
     */
    public final Object subject;

    public NotFoundException(Object subject) {
        super(msg("Not found: {}", requireNonNull(subject, "You must supply the subject that wasn't found")));
        this.subject = subject;
    }
}
