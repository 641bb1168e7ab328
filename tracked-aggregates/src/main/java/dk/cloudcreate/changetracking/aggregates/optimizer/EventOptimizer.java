package dk.cloudcreate.changetracking.aggregates.optimizer;

import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Shrinks a batch of events before it's persisted by merging the events that concern the same entity:
 * <ul>
 *     <li>Created followed by Updated becomes Created with the latest state</li>
 *     <li>Updated followed by Updated becomes the latest Updated</li>
 *     <li>Created followed by Deleted disappears entirely</li>
 *     <li>Updated followed by Deleted becomes Deleted</li>
 * </ul>
 * The merged events are returned in the order in which their entity first appeared in the batch.<br>
 * If any event of the batch lacks a {@link MergeableEvent#mergeKey()} the batch is returned unchanged.
 */
public final class EventOptimizer {
    private static final Logger log = LoggerFactory.getLogger(EventOptimizer.class);

    private EventOptimizer() {
    }

    /**
     * @param events the events, oldest first
     * @param <EVENT> the event type
     * @return the optimized events
     * @throws IllegalStateException if two events concerning the same entity can't follow each other
     */
    public static <EVENT extends MergeableEvent<EVENT>> List<EVENT> optimize(List<EVENT> events) {
        requireNonNull(events, "You must supply events");
        var merged = new LinkedHashMap<Object, EVENT>();
        for (var event : events) {
            var key = event.mergeKey();
            if (key.isEmpty()) {
                log.debug("Not optimizing {} event(s) since '{}' doesn't concern a single entity", events.size(), event);
                return new ArrayList<>(events);
            }
            var previous = merged.get(key.get());
            if (previous == null) {
                merged.put(key.get(), event);
                continue;
            }
            var result = previous.mergeWith(event);
            if (result.isAnnihilated()) {
                log.trace("'{}' and '{}' annihilated each other", previous, event);
                merged.remove(key.get());
            } else {
                merged.put(key.get(), result.event().get());
            }
        }
        log.debug("Optimized {} event(s) into {} event(s)", events.size(), merged.size());
        return new ArrayList<>(merged.values());
    }
}
