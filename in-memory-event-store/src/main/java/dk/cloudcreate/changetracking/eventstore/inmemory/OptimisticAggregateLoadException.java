package dk.cloudcreate.changetracking.eventstore.inmemory;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when the latest stored {@link EventOrder} of an aggregate differs from the one the caller expected
 */
public class OptimisticAggregateLoadException extends EventStoreException {
    public final Object     aggregateId;
    public final Class<?>   aggregateRootImplementationType;
    public final EventOrder expectedLatestEventOrder;
    public final EventOrder actualLatestEventOrder;

    public OptimisticAggregateLoadException(Object aggregateId, Class<?> aggregateRootImplementationType, EventOrder expectedLatestEventOrder, EventOrder actualLatestEventOrder) {
        super(msg("Expected expectedLatestEventOrder '{}' for '{}' with id '{}' but found '{}' (actualLatestEventOrder) in the EventStore",
                  expectedLatestEventOrder,
                  aggregateRootImplementationType.getName(),
                  aggregateId,
                  actualLatestEventOrder));
        this.aggregateId = aggregateId;
        this.aggregateRootImplementationType = aggregateRootImplementationType;
        this.expectedLatestEventOrder = expectedLatestEventOrder;
        this.actualLatestEventOrder = actualLatestEventOrder;
    }
}
