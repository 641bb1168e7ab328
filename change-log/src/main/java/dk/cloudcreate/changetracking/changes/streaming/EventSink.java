package dk.cloudcreate.changetracking.changes.streaming;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Receives the events streamed out of a {@link Streamable}.<br>
 * A sink is write-only from the point of view of the streaming object, it's never read from.
 *
 * @param <EVENT> the event type
 */
@FunctionalInterface
public interface EventSink<EVENT> {
    /**
     * Append the events, in order, to the sink
     *
     * @param events the events to append
     */
    void append(List<EVENT> events);

    /**
     * @param target the list the events are appended to
     * @return a sink that appends to <code>target</code>
     */
    static <EVENT> EventSink<EVENT> into(List<? super EVENT> target) {
        requireNonNull(target, "You must supply a target list");
        return target::addAll;
    }

    /**
     * Adapt a sink of another event type, e.g. wrapping each event in an envelope keyed by the aggregate id
     *
     * @param mapper maps a streamed event to an event of the target sink
     * @param target the target sink
     * @return a sink that maps every event before appending it to <code>target</code>
     */
    static <EVENT, TARGET_EVENT> EventSink<EVENT> mapping(Function<? super EVENT, ? extends TARGET_EVENT> mapper, EventSink<TARGET_EVENT> target) {
        requireNonNull(mapper, "You must supply a mapper");
        requireNonNull(target, "You must supply a target sink");
        return events -> target.append(events.stream()
                                             .<TARGET_EVENT>map(mapper)
                                             .collect(Collectors.toList()));
    }
}
