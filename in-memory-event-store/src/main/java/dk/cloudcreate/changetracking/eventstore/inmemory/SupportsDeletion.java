package dk.cloudcreate.changetracking.eventstore.inmemory;

/**
 * Recognizes the event that marks an aggregate as deleted, so {@link InMemoryEventStore#loadAll()} can skip deleted aggregates
 *
 * @param <EVENT> the event type
 */
@FunctionalInterface
public interface SupportsDeletion<EVENT> {
    /**
     * Deletion isn't supported, i.e. no event marks an aggregate as deleted
     */
    static <EVENT> SupportsDeletion<EVENT> never() {
        return event -> false;
    }

    /**
     * @param event the last event stored for an aggregate
     * @return true if the aggregate is deleted after <code>event</code>
     */
    boolean isDeletion(EVENT event);
}
