package dk.cloudcreate.changetracking.eventstore.inmemory;

import dk.cloudcreate.changetracking.common.identity.Id;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event stored by the {@link InMemoryEventStore}, keyed by the id of the aggregate it belongs to
 *
 * @param <ID_ENTITY> the entity type identified by the aggregate id
 * @param <EVENT>     the event type
 */
public final class EventEnvelope<ID_ENTITY, EVENT> {
    public final Id<ID_ENTITY> aggregateId;
    public final EventOrder    eventOrder;
    public final EVENT         event;

    public EventEnvelope(Id<ID_ENTITY> aggregateId, EventOrder eventOrder, EVENT event) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.event = requireNonNull(event, "No event provided");
    }

    public Id<ID_ENTITY> aggregateId() {
        return aggregateId;
    }

    public EventOrder eventOrder() {
        return eventOrder;
    }

    public EVENT event() {
        return event;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventEnvelope)) return false;
        var that = (EventEnvelope<?, ?>) o;
        return aggregateId.equals(that.aggregateId) && eventOrder.equals(that.eventOrder) && event.equals(that.event);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, eventOrder, event);
    }

    @Override
    public String toString() {
        return "EventEnvelope{" +
                "aggregateId=" + aggregateId +
                ", eventOrder=" + eventOrder +
                ", event=" + event +
                '}';
    }
}
