package dk.cloudcreate.changetracking.eventstore.inmemory;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class AggregateNotFoundException extends EventStoreException {
    public final Object   aggregateId;
    public final Class<?> aggregateRootImplementationType;
    public final String   aggregateName;

    public AggregateNotFoundException(Object aggregateId, Class<?> aggregateRootImplementationType, String aggregateName) {
        super(generateMessage(aggregateId, aggregateRootImplementationType, aggregateName));
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.aggregateRootImplementationType = requireNonNull(aggregateRootImplementationType, "You must supply an aggregateRootImplementationType");
        this.aggregateName = requireNonNull(aggregateName, "You must supply an aggregateName");
    }

    private static String generateMessage(Object aggregateId, Class<?> aggregateRootImplementationType, String aggregateName) {
        return msg("Couldn't find a '{}' aggregate root with Id '{}' in the '{}' event store",
                   aggregateRootImplementationType.getName(),
                   aggregateId,
                   aggregateName);
    }
}
