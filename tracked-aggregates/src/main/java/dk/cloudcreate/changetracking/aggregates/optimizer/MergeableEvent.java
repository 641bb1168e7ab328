package dk.cloudcreate.changetracking.aggregates.optimizer;

import java.util.Optional;

/**
 * An event that the {@link EventOptimizer} can merge with later events concerning the same entity
 *
 * @param <SELF> the event type
 */
public interface MergeableEvent<SELF extends MergeableEvent<SELF>> {
    /**
     * @return the key identifying the entity this event concerns, or {@link Optional#empty()} if the event
     * doesn't concern a single entity (e.g. a bulk event)
     */
    Optional<?> mergeKey();

    /**
     * Merge this event with a later event having the same {@link #mergeKey()}
     *
     * @param next the later event
     * @return the merged event, or {@link MergeResult#annihilated()} if the two events cancel each other out
     * @throws IllegalStateException if the two events can't follow each other
     */
    MergeResult<SELF> mergeWith(SELF next);
}
