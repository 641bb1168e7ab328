package dk.cloudcreate.changetracking.changes.streaming;

import dk.cloudcreate.changetracking.changes.*;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Streams the recorded forward events of the undo history as is, without touching the object
 */
public final class CloneRedoStreamingStrategy implements StreamingStrategy {
    private static final Logger log = LoggerFactory.getLogger(CloneRedoStreamingStrategy.class);

    public static final CloneRedoStreamingStrategy INSTANCE = new CloneRedoStreamingStrategy();

    @Override
    public <EVENT> void streamTo(Undoable<EVENT> source, EventSink<EVENT> sink) {
        requireNonNull(source, "You must supply a source");
        requireNonNull(sink, "You must supply a sink");
        var events = source.undoManager().history();
        log.debug("Streaming {} recorded change(s) of '{}'", events.size(), source.getClass().getSimpleName());
        sink.append(events);
    }

    @Override
    public String toString() {
        return "CloneRedoStreamingStrategy";
    }
}
