package dk.cloudcreate.changetracking.changes.streaming;

import dk.cloudcreate.changetracking.changes.*;

/**
 * Determines how the recorded changes of an {@link Undoable} are turned into the forward events sent to an {@link EventSink}.<br>
 * A strategy never changes the observable state of the object it streams.
 *
 * @see UndoRedoStreamingStrategy
 * @see CloneRedoStreamingStrategy
 */
public interface StreamingStrategy {
    /**
     * Stream the forward events of every change in <code>source</code>'s undo history, oldest first, to <code>sink</code>
     *
     * @param source  the object whose changes are streamed
     * @param sink    the sink receiving the events
     * @param <EVENT> the event type
     */
    <EVENT> void streamTo(Undoable<EVENT> source, EventSink<EVENT> sink);
}
