package dk.cloudcreate.changetracking.eventstore.inmemory;

import dk.cloudcreate.essentials.types.LongType;

/**
 * The position of an event within the events stored for a single aggregate instance.<br>
 * The first event stored for an aggregate has {@link #FIRST_EVENT_ORDER} and every following event has the order
 * of its predecessor plus one.
 */
public class EventOrder extends LongType<EventOrder> {
    /**
     * Special value that signifies that no events have been stored in relation to a given aggregate
     */
    public static final EventOrder NO_EVENTS_PERSISTED = EventOrder.of(-1);
    /**
     * The {@link EventOrder} of the FIRST event stored in relation to a given aggregate
     */
    public static final EventOrder FIRST_EVENT_ORDER   = EventOrder.of(0);

    public EventOrder(Long value) {
        super(value);
    }

    public static EventOrder of(long value) {
        return new EventOrder(value);
    }

    public EventOrder increaseAndGet() {
        return new EventOrder(value() + 1);
    }
}
