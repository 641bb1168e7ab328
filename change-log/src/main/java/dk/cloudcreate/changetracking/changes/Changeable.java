package dk.cloudcreate.changetracking.changes;

/**
 * An object whose state is only ever changed by applying events, where every applied event yields the
 * event that reverts it.
 *
 * @param <EVENT> the event type
 */
public interface Changeable<EVENT> {
    /**
     * Apply the event to this object
     *
     * @param event the event to apply
     * @return the inverse event, i.e. the event that restores the state this object had before <code>event</code> was applied
     * @throws IllegalStateException if the event can't be applied to the current state (e.g. it references an entity that doesn't exist)
     */
    EVENT apply(EVENT event);

    /**
     * Apply the event and pair it with its inverse
     *
     * @param event the event to apply
     * @return the single {@link Change} produced
     */
    default Changes<EVENT> applied(EVENT event) {
        var inverse = apply(event);
        return Changes.only(event, inverse);
    }
}
