package dk.cloudcreate.changetracking.eventstore.inmemory;

import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Configuration of an {@link InMemoryEventStore}
 *
 * @param <EVENT>     the event type
 * @param <AGGREGATE> the aggregate implementation type
 */
public class InMemoryEventStoreConfiguration<EVENT, AGGREGATE> {
    /**
     * Name of the stored aggregate type, used in log and exception messages
     */
    public final String                     aggregateName;
    public final Class<AGGREGATE>           aggregateRootImplementationType;
    /**
     * Creates an aggregate instance without any state, to which the stored events are applied when loading
     */
    public final Supplier<AGGREGATE>        emptyAggregateFactory;
    public final SupportsDeletion<EVENT>    supportsDeletion;
    /**
     * Applied to the streamed events of an aggregate before they are stored, e.g. {@code EventOptimizer::optimize}
     */
    public final UnaryOperator<List<EVENT>> eventsTransformer;

    public InMemoryEventStoreConfiguration(String aggregateName,
                                           Class<AGGREGATE> aggregateRootImplementationType,
                                           Supplier<AGGREGATE> emptyAggregateFactory,
                                           SupportsDeletion<EVENT> supportsDeletion,
                                           UnaryOperator<List<EVENT>> eventsTransformer) {
        this.aggregateName = requireNonNull(aggregateName, "No aggregateName provided");
        requireTrue(!aggregateName.isBlank(), "aggregateName must not be blank");
        this.aggregateRootImplementationType = requireNonNull(aggregateRootImplementationType, "No aggregateRootImplementationType provided");
        this.emptyAggregateFactory = requireNonNull(emptyAggregateFactory, "No emptyAggregateFactory provided");
        this.supportsDeletion = requireNonNull(supportsDeletion, "No supportsDeletion provided");
        this.eventsTransformer = requireNonNull(eventsTransformer, "No eventsTransformer provided");
    }

    /**
     * Configuration without deletion support that stores the streamed events as is
     */
    public InMemoryEventStoreConfiguration(String aggregateName,
                                           Class<AGGREGATE> aggregateRootImplementationType,
                                           Supplier<AGGREGATE> emptyAggregateFactory) {
        this(aggregateName,
             aggregateRootImplementationType,
             emptyAggregateFactory,
             SupportsDeletion.never(),
             UnaryOperator.identity());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InMemoryEventStoreConfiguration)) return false;
        var that = (InMemoryEventStoreConfiguration<?, ?>) o;
        return aggregateName.equals(that.aggregateName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateName);
    }

    @Override
    public String toString() {
        return "InMemoryEventStoreConfiguration{" +
                "aggregateName='" + aggregateName + '\'' +
                ", aggregateRootImplementationType=" + aggregateRootImplementationType.getName() +
                '}';
    }
}
