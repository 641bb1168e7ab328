package dk.cloudcreate.changetracking.aggregates.optimizer;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Result of {@link MergeableEvent#mergeWith(MergeableEvent)}
 *
 * @param <EVENT> the event type
 */
public final class MergeResult<EVENT> {
    private static final MergeResult<?> ANNIHILATED = new MergeResult<>(null);

    private final EVENT combined;

    private MergeResult(EVENT combined) {
        this.combined = combined;
    }

    /**
     * The two events are replaced by <code>event</code>
     */
    public static <EVENT> MergeResult<EVENT> combined(EVENT event) {
        return new MergeResult<>(requireNonNull(event, "You must supply the combined event"));
    }

    /**
     * The two events cancel each other out
     */
    @SuppressWarnings("unchecked")
    public static <EVENT> MergeResult<EVENT> annihilated() {
        return (MergeResult<EVENT>) ANNIHILATED;
    }

    public boolean isAnnihilated() {
        return combined == null;
    }

    public Optional<EVENT> event() {
        return Optional.ofNullable(combined);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MergeResult)) return false;
        return Objects.equals(combined, ((MergeResult<?>) o).combined);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(combined);
    }

    @Override
    public String toString() {
        return isAnnihilated() ? "Annihilated" : "Combined(" + combined + ")";
    }
}
