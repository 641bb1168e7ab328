package dk.cloudcreate.changetracking.changes.streaming;

import dk.cloudcreate.changetracking.changes.*;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Streams by rewinding: every recorded change is undone, the forward events of the undone changes are sent
 * to the sink oldest first, and finally the same number of changes are redone.<br>
 * The forward events are the ones produced by actually replaying the history against the object, so they reflect
 * the object's real state transitions.<br>
 * The changes are redone even if the sink throws.
 */
public final class UndoRedoStreamingStrategy implements StreamingStrategy {
    private static final Logger log = LoggerFactory.getLogger(UndoRedoStreamingStrategy.class);

    public static final UndoRedoStreamingStrategy INSTANCE = new UndoRedoStreamingStrategy();

    @Override
    public <EVENT> void streamTo(Undoable<EVENT> source, EventSink<EVENT> sink) {
        requireNonNull(source, "You must supply a source");
        requireNonNull(sink, "You must supply a sink");
        var undoManager = source.undoManager();
        var count       = source.changeRecord().historyLength();
        log.debug("Streaming {} change(s) of '{}' by undoing and redoing them", count, source.getClass().getSimpleName());
        undoManager.undoAll();
        try {
            sink.append(undoManager.futureHistory(count));
        } finally {
            undoManager.redoN(count);
        }
    }

    @Override
    public String toString() {
        return "UndoRedoStreamingStrategy";
    }
}
