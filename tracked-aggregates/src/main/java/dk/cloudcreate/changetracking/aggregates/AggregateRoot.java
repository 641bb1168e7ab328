package dk.cloudcreate.changetracking.aggregates;

import dk.cloudcreate.changetracking.changes.*;
import dk.cloudcreate.changetracking.changes.streaming.*;
import dk.cloudcreate.changetracking.common.identity.Id;
import org.slf4j.*;

import java.util.function.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for mutable aggregates composed of change tracked constituents ({@link dk.cloudcreate.changetracking.aggregates.primary.Primary},
 * {@link dk.cloudcreate.changetracking.aggregates.details.DetailSet}, {@link dk.cloudcreate.changetracking.aggregates.nested.NestedDetailSet}, ...).<br>
 * The {@link AggregateRoot} owns the aggregate's {@link ChangeRecord}, so every business method can group its steps in a
 * {@link ChangeScope} that is rolled back automatically if a step fails:
 * <pre>{@code
 * public Changes<OrderEvent> addItem(OrderItem item) {
 *     try (var scope = begin()) {
 *         scope.mutateInner(() -> primary.update(OrderPrimary::incrementItemCount), OrderEvent::primary);
 *         scope.mutateInner(() -> items.addNew(item), OrderEvent::items);
 *         scope.invoke(this::validateItemCount);
 *         return scope.commit();
 *     }
 * }
 * }</pre>
 * Subclasses route each event to the constituent it concerns in {@link #applyEventToTheAggregate(Object)}.<p>
 * The recorded changes are streamed as forward events using the configured {@link StreamingMode} (see {@link #uncommittedChanges()})
 * and forgotten using {@link #markChangesAsCommitted()} once persisted.
 *
 * @param <ID_ENTITY>      the entity type identified by the aggregate id
 * @param <EVENT>          the aggregate's event type
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 */
public abstract class AggregateRoot<ID_ENTITY, EVENT, AGGREGATE_TYPE extends AggregateRoot<ID_ENTITY, EVENT, AGGREGATE_TYPE>> implements Streamable<EVENT> {
    private static final Logger log = LoggerFactory.getLogger(AggregateRoot.class);

    private final StreamingMode       streamingMode;
    private       ChangeRecord<EVENT> changeRecord;
    private       boolean             hasBeenRehydrated;

    protected AggregateRoot() {
        this(StreamingMode.UndoRedo);
    }

    protected AggregateRoot(StreamingMode streamingMode) {
        this.streamingMode = requireNonNull(streamingMode, "You must supply a streamingMode");
    }

    /**
     * @return the id of the aggregate
     * @throws IllegalStateException if the aggregate hasn't been created yet
     */
    public abstract Id<ID_ENTITY> aggregateId();

    /**
     * Effectively performs a leftFold over all the previous events related to this aggregate instance.<br>
     * The events are applied without being recorded as changes
     *
     * @param previousEvents the previous events related to this aggregate instance, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    @SuppressWarnings("unchecked")
    public AGGREGATE_TYPE rehydrate(Stream<EVENT> previousEvents) {
        requireNonNull(previousEvents, "You must provide a previousEvents stream");
        previousEvents.forEach(this::apply);
        hasBeenRehydrated = true;
        log.trace("Rehydrated '{}'", getClass().getSimpleName());
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Has {@link #rehydrate(Stream)} been used
     */
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    @Override
    public final EVENT apply(EVENT event) {
        requireNonNull(event, "You must supply an event");
        var inverse = applyEventToTheAggregate(event);
        if (inverse == null) {
            throw new IllegalStateException(msg("'{}' didn't return the inverse of '{}'", getClass().getName(), event));
        }
        return inverse;
    }

    /**
     * Apply the event to the constituent of the aggregate it concerns
     *
     * @param event the event to apply
     * @return the inverse event
     * @throws IllegalStateException if the event isn't supported or can't be applied to the current state
     */
    protected abstract EVENT applyEventToTheAggregate(EVENT event);

    /**
     * Run a single mutation of one of the aggregate's constituents and record its changes
     *
     * @param mutation the mutation of the constituent
     * @param bubbleUp wraps a constituent event into the aggregate's event type
     * @return the wrapped changes
     */
    protected <INNER> Changes<EVENT> mutateInner(Supplier<Changes<INNER>> mutation, Function<? super INNER, ? extends EVENT> bubbleUp) {
        try (var scope = begin()) {
            scope.mutateInner(mutation, bubbleUp);
            return scope.commit();
        }
    }

    @Override
    public final ChangeRecord<EVENT> changeRecord() {
        if (changeRecord == null) {
            changeRecord = new ChangeRecord<>();
        }
        return changeRecord;
    }

    @Override
    public StreamingStrategy streamingStrategy() {
        return streamingMode.strategy;
    }

    public StreamingMode streamingMode() {
        return streamingMode;
    }
}
