package dk.cloudcreate.changetracking.aggregates.nested;

import dk.cloudcreate.changetracking.common.identity.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Events applied to a {@link NestedDetailSet}. Each event wraps an event of the nested item it concerns.
 *
 * @param <T>     the nested item type
 * @param <INNER> the nested item's event type
 */
public abstract class NestedEvent<T extends Identifiable<T>, INNER> {
    public final Id<T> id;
    public final INNER inner;

    private NestedEvent(Id<T> id, INNER inner) {
        this.id = requireNonNull(id, "You must supply an id");
        this.inner = requireNonNull(inner, "You must supply an inner event");
    }

    public static <T extends Identifiable<T>, INNER> Created<T, INNER> created(Id<T> id, INNER inner) {
        return new Created<>(id, inner, Optional.empty());
    }

    /**
     * Recreates a removed item at the position it had before the removal
     */
    public static <T extends Identifiable<T>, INNER> Created<T, INNER> createdAt(Id<T> id, INNER inner, int position) {
        return new Created<>(id, inner, Optional.of(position));
    }

    public static <T extends Identifiable<T>, INNER> Updated<T, INNER> updated(Id<T> id, INNER inner) {
        return new Updated<>(id, inner);
    }

    public static <T extends Identifiable<T>, INNER> Deleted<T, INNER> deleted(Id<T> id, INNER inner) {
        return new Deleted<>(id, inner);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        var that = (NestedEvent<?, ?>) o;
        return id.equals(that.id) && inner.equals(that.inner);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), id, inner);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + id + ", " + inner + ")";
    }

    /**
     * A new nested item was created by applying <code>inner</code> to an empty item. The item is added at the end,
     * or at <code>position</code> when present
     */
    public static final class Created<T extends Identifiable<T>, INNER> extends NestedEvent<T, INNER> {
        public final Optional<Integer> position;

        private Created(Id<T> id, INNER inner, Optional<Integer> position) {
            super(id, inner);
            this.position = requireNonNull(position, "You must supply a position option");
        }

        @Override
        public boolean equals(Object o) {
            return super.equals(o) && position.equals(((Created<?, ?>) o).position);
        }

        @Override
        public int hashCode() {
            return Objects.hash(super.hashCode(), position);
        }

        @Override
        public String toString() {
            return position.map(index -> "Created(" + id + ", " + inner + " at " + index + ")")
                           .orElseGet(super::toString);
        }
    }

    public static final class Updated<T extends Identifiable<T>, INNER> extends NestedEvent<T, INNER> {
        private Updated(Id<T> id, INNER inner) {
            super(id, inner);
        }
    }

    /**
     * The nested item was removed after applying <code>inner</code> to it
     */
    public static final class Deleted<T extends Identifiable<T>, INNER> extends NestedEvent<T, INNER> {
        private Deleted(Id<T> id, INNER inner) {
            super(id, inner);
        }
    }
}
