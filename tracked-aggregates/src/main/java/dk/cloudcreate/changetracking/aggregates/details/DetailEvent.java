package dk.cloudcreate.changetracking.aggregates.details;

import dk.cloudcreate.changetracking.aggregates.optimizer.*;
import dk.cloudcreate.changetracking.common.identity.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Events applied to a {@link DetailSet}
 *
 * @param <T> the detail type
 */
public abstract class DetailEvent<T extends Identifiable<T>> implements MergeableEvent<DetailEvent<T>> {
    private DetailEvent() {
    }

    public static <T extends Identifiable<T>> Created<T> created(T item) {
        return new Created<>(item, Optional.empty());
    }

    /**
     * Restores an item at the position it had before it was removed
     *
     * @param position zero based position of the item
     */
    public static <T extends Identifiable<T>> Created<T> createdAt(T item, int position) {
        return new Created<>(item, Optional.of(position));
    }

    public static <T extends Identifiable<T>> Updated<T> updated(T item) {
        return new Updated<>(item);
    }

    public static <T extends Identifiable<T>> Deleted<T> deleted(Id<T> id) {
        return new Deleted<>(id);
    }

    public static <T extends Identifiable<T>> AllDeleted<T> allDeleted() {
        return new AllDeleted<>();
    }

    public static <T extends Identifiable<T>> AllRestored<T> allRestored(List<T> items) {
        return new AllRestored<>(items);
    }

    @Override
    public MergeResult<DetailEvent<T>> mergeWith(DetailEvent<T> next) {
        requireNonNull(next, "You must supply the next event");
        if (this instanceof Created && next instanceof Updated) {
            return MergeResult.combined(new Created<>(((Updated<T>) next).item, ((Created<T>) this).position));
        }
        if (this instanceof Updated && next instanceof Updated) {
            return MergeResult.combined(next);
        }
        if (this instanceof Created && next instanceof Deleted) {
            return MergeResult.annihilated();
        }
        if (this instanceof Updated && next instanceof Deleted) {
            return MergeResult.combined(next);
        }
        throw new IllegalStateException(msg("Cannot merge '{}' with '{}'", this, next));
    }

    /**
     * The item was added at the end of the set, or at <code>position</code> when present
     */
    public static final class Created<T extends Identifiable<T>> extends DetailEvent<T> {
        public final T                 item;
        public final Optional<Integer> position;

        private Created(T item, Optional<Integer> position) {
            this.item = requireNonNull(item, "You must supply an item");
            this.position = requireNonNull(position, "You must supply a position option");
        }

        @Override
        public Optional<?> mergeKey() {
            return Optional.of(item.id());
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Created)) return false;
            var that = (Created<?>) o;
            return item.equals(that.item) && position.equals(that.position);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Created.class, item, position);
        }

        @Override
        public String toString() {
            return position.map(index -> "Created(" + item + " at " + index + ")")
                           .orElseGet(() -> "Created(" + item + ")");
        }
    }

    public static final class Updated<T extends Identifiable<T>> extends DetailEvent<T> {
        public final T item;

        private Updated(T item) {
            this.item = requireNonNull(item, "You must supply an item");
        }

        @Override
        public Optional<?> mergeKey() {
            return Optional.of(item.id());
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Updated && item.equals(((Updated<?>) o).item);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Updated.class, item);
        }

        @Override
        public String toString() {
            return "Updated(" + item + ")";
        }
    }

    public static final class Deleted<T extends Identifiable<T>> extends DetailEvent<T> {
        public final Id<T> id;

        private Deleted(Id<T> id) {
            this.id = requireNonNull(id, "You must supply an id");
        }

        @Override
        public Optional<?> mergeKey() {
            return Optional.of(id);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Deleted && id.equals(((Deleted<?>) o).id);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Deleted.class, id);
        }

        @Override
        public String toString() {
            return "Deleted(" + id + ")";
        }
    }

    /**
     * Every item was removed at once
     */
    public static final class AllDeleted<T extends Identifiable<T>> extends DetailEvent<T> {
        private AllDeleted() {
        }

        @Override
        public Optional<?> mergeKey() {
            return Optional.empty();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AllDeleted;
        }

        @Override
        public int hashCode() {
            return AllDeleted.class.hashCode();
        }

        @Override
        public String toString() {
            return "AllDeleted";
        }
    }

    /**
     * Restores the items removed by {@link AllDeleted}
     */
    public static final class AllRestored<T extends Identifiable<T>> extends DetailEvent<T> {
        public final List<T> items;

        private AllRestored(List<T> items) {
            this.items = List.copyOf(requireNonNull(items, "You must supply items"));
        }

        @Override
        public Optional<?> mergeKey() {
            return Optional.empty();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AllRestored && items.equals(((AllRestored<?>) o).items);
        }

        @Override
        public int hashCode() {
            return Objects.hash(AllRestored.class, items);
        }

        @Override
        public String toString() {
            return "AllRestored(" + items + ")";
        }
    }
}
