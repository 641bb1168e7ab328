package dk.cloudcreate.changetracking.aggregates;

import dk.cloudcreate.changetracking.changes.streaming.*;

/**
 * Selects the {@link StreamingStrategy} an {@link AggregateRoot} uses
 */
public enum StreamingMode {
    /**
     * Undo every recorded change, stream the forward events and redo the changes again
     */
    UndoRedo(UndoRedoStreamingStrategy.INSTANCE),
    /**
     * Stream the recorded forward events without touching the aggregate
     */
    CloneRedo(CloneRedoStreamingStrategy.INSTANCE);

    public final StreamingStrategy strategy;

    StreamingMode(StreamingStrategy strategy) {
        this.strategy = strategy;
    }
}
