package dk.cloudcreate.changetracking.eventstore.inmemory;

import dk.cloudcreate.changetracking.aggregates.AggregateRoot;
import dk.cloudcreate.changetracking.changes.streaming.EventSink;
import dk.cloudcreate.changetracking.common.identity.Id;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Append-only event store that keeps the events of one aggregate type in memory.<br>
 * {@link #save(AggregateRoot)} streams the aggregate's recorded changes into the store and marks them as committed,
 * {@link #load(Id)} recreates an aggregate by applying its stored events to an empty aggregate.<p>
 * Not thread safe.
 *
 * @param <ID_ENTITY> the entity type identified by the aggregate id
 * @param <EVENT>     the event type
 * @param <AGGREGATE> the aggregate implementation type
 */
public class InMemoryEventStore<ID_ENTITY, EVENT, AGGREGATE extends AggregateRoot<ID_ENTITY, EVENT, AGGREGATE>> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final InMemoryEventStoreConfiguration<EVENT, AGGREGATE> configuration;
    private final List<EventEnvelope<ID_ENTITY, EVENT>>             events = new ArrayList<>();

    public InMemoryEventStore(InMemoryEventStoreConfiguration<EVENT, AGGREGATE> configuration) {
        this.configuration = requireNonNull(configuration, "No configuration provided");
    }

    /**
     * Store the recorded changes of the aggregate and mark them as committed
     *
     * @param aggregate the aggregate
     * @return the envelopes appended to the store
     */
    public List<EventEnvelope<ID_ENTITY, EVENT>> save(AGGREGATE aggregate) {
        requireNonNull(aggregate, "No aggregate provided");
        var aggregateId = aggregate.aggregateId();
        var streamed    = new ArrayList<EVENT>();
        aggregate.streamTo(EventSink.into(streamed));
        var toBeStored = requireNonNull(configuration.eventsTransformer.apply(streamed), "The eventsTransformer returned null");

        var appended   = new ArrayList<EventEnvelope<ID_ENTITY, EVENT>>(toBeStored.size());
        var eventOrder = new EventOrder[]{latestEventOrder(aggregateId)};
        EventSink<EVENT> sink = EventSink.mapping(event -> {
            eventOrder[0] = eventOrder[0].increaseAndGet();
            return new EventEnvelope<>(aggregateId, eventOrder[0], event);
        }, EventSink.into(appended));
        sink.append(toBeStored);
        events.addAll(appended);

        aggregate.markChangesAsCommitted();
        log.debug("[{}] Saved {} event(s) for aggregate with id '{}' ({} streamed)",
                  configuration.aggregateName,
                  appended.size(),
                  aggregateId,
                  streamed.size());
        return appended;
    }

    /**
     * Try to load the aggregate with the given id
     *
     * @param aggregateId the id of the aggregate
     * @return the aggregate, or {@link Optional#empty()} if no events are stored for <code>aggregateId</code>
     */
    public Optional<AGGREGATE> tryLoad(Id<ID_ENTITY> aggregateId) {
        return tryLoad(aggregateId, Optional.empty());
    }

    /**
     * Try to load the aggregate with the given id
     *
     * @param aggregateId              the id of the aggregate
     * @param expectedLatestEventOrder the expected {@link EventOrder} of the last event stored for the aggregate (if any)
     * @return the aggregate, or {@link Optional#empty()} if no events are stored for <code>aggregateId</code>
     * @throws OptimisticAggregateLoadException if the {@link EventOrder} of the last stored event differs from <code>expectedLatestEventOrder</code>
     */
    public Optional<AGGREGATE> tryLoad(Id<ID_ENTITY> aggregateId, Optional<EventOrder> expectedLatestEventOrder) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedLatestEventOrder, "No expectedLatestEventOrder option provided");
        var aggregateEvents = events(aggregateId);
        if (aggregateEvents.isEmpty()) {
            log.trace("[{}] Didn't find any events for aggregate with id '{}'", configuration.aggregateName, aggregateId);
            return Optional.empty();
        }
        var actualLatestEventOrder = aggregateEvents.get(aggregateEvents.size() - 1).eventOrder;
        expectedLatestEventOrder.ifPresent(expected -> {
            if (!expected.equals(actualLatestEventOrder)) {
                throw new OptimisticAggregateLoadException(aggregateId,
                                                           configuration.aggregateRootImplementationType,
                                                           expected,
                                                           actualLatestEventOrder);
            }
        });
        log.trace("[{}] Loading aggregate with id '{}' from {} event(s)", configuration.aggregateName, aggregateId, aggregateEvents.size());
        return Optional.of(rehydrate(aggregateEvents));
    }

    /**
     * Load the aggregate with the given id
     *
     * @param aggregateId the id of the aggregate
     * @return the aggregate
     * @throws AggregateNotFoundException if no events are stored for <code>aggregateId</code>
     */
    public AGGREGATE load(Id<ID_ENTITY> aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId,
                                                                                     configuration.aggregateRootImplementationType,
                                                                                     configuration.aggregateName));
    }

    /**
     * Load every stored aggregate that hasn't been deleted, i.e. whose last stored event isn't a deletion according to
     * {@link InMemoryEventStoreConfiguration#supportsDeletion}
     *
     * @return the aggregates, in the order they were first stored
     */
    public List<AGGREGATE> loadAll() {
        var eventsPerAggregate = events.stream()
                                       .collect(Collectors.groupingBy(EventEnvelope::aggregateId,
                                                                      LinkedHashMap::new,
                                                                      Collectors.toList()));
        var aggregates = eventsPerAggregate.values()
                                           .stream()
                                           .filter(aggregateEvents -> !configuration.supportsDeletion.isDeletion(aggregateEvents.get(aggregateEvents.size() - 1).event))
                                           .map(this::rehydrate)
                                           .collect(Collectors.toList());
        log.debug("[{}] Loaded {} of {} aggregate(s)", configuration.aggregateName, aggregates.size(), eventsPerAggregate.size());
        return aggregates;
    }

    /**
     * @return the {@link EventOrder} of the last event stored for <code>aggregateId</code> or {@link EventOrder#NO_EVENTS_PERSISTED}
     */
    public EventOrder latestEventOrder(Id<ID_ENTITY> aggregateId) {
        var aggregateEvents = events(aggregateId);
        return aggregateEvents.isEmpty() ? EventOrder.NO_EVENTS_PERSISTED : aggregateEvents.get(aggregateEvents.size() - 1).eventOrder;
    }

    /**
     * @return the events stored for <code>aggregateId</code>, oldest first
     */
    public List<EventEnvelope<ID_ENTITY, EVENT>> events(Id<ID_ENTITY> aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return events.stream()
                     .filter(envelope -> envelope.aggregateId.equals(aggregateId))
                     .collect(Collectors.toList());
    }

    /**
     * @return every stored event, in the order they were stored
     */
    public List<EventEnvelope<ID_ENTITY, EVENT>> allEvents() {
        return List.copyOf(events);
    }

    public int size() {
        return events.size();
    }

    public InMemoryEventStoreConfiguration<EVENT, AGGREGATE> configuration() {
        return configuration;
    }

    private AGGREGATE rehydrate(List<EventEnvelope<ID_ENTITY, EVENT>> aggregateEvents) {
        var aggregate = requireNonNull(configuration.emptyAggregateFactory.get(), "The emptyAggregateFactory returned null");
        return aggregate.rehydrate(aggregateEvents.stream().map(EventEnvelope::event));
    }
}
