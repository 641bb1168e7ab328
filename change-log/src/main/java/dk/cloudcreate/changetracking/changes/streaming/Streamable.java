package dk.cloudcreate.changetracking.changes.streaming;

import dk.cloudcreate.changetracking.changes.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An {@link Undoable} whose recorded changes can be streamed as forward events, e.g. to persist them
 * in an event store.<br>
 * Streaming doesn't change the object's observable state.
 *
 * @param <EVENT> the event type
 */
public interface Streamable<EVENT> extends Undoable<EVENT> {
    /**
     * @return the strategy used by {@link #streamTo(EventSink)}
     */
    default StreamingStrategy streamingStrategy() {
        return UndoRedoStreamingStrategy.INSTANCE;
    }

    /**
     * Send the forward events of all recorded changes, oldest first, to the sink. The recorded changes are kept
     *
     * @param sink the sink
     */
    default void streamTo(EventSink<EVENT> sink) {
        requireNonNull(sink, "You must supply a sink");
        streamingStrategy().streamTo(this, sink);
    }

    /**
     * @return the forward events of all recorded changes, oldest first. The recorded changes are kept
     */
    default List<EVENT> uncommittedChanges() {
        var events = new ArrayList<EVENT>();
        streamTo(EventSink.into(events));
        return events;
    }

    /**
     * Stream all recorded changes to the sink and forget them afterwards
     *
     * @param sink the sink
     */
    default void takeChanges(EventSink<EVENT> sink) {
        streamTo(sink);
        forgetChanges();
    }

    /**
     * @return the forward events of all recorded changes, oldest first. The recorded changes are forgotten afterwards
     */
    default List<EVENT> takeChanges() {
        var events = uncommittedChanges();
        forgetChanges();
        return events;
    }

    /**
     * Forget all recorded changes, marking them as having been persisted
     */
    default void markChangesAsCommitted() {
        forgetChanges();
    }
}
