package dk.cloudcreate.changetracking.aggregates.primary;

import dk.cloudcreate.changetracking.aggregates.optimizer.*;
import dk.cloudcreate.changetracking.common.identity.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Events applied to a {@link Primary}
 *
 * @param <T> the primary value type
 */
public abstract class PrimaryEvent<T extends Identifiable<T>> implements MergeableEvent<PrimaryEvent<T>> {
    private PrimaryEvent() {
    }

    public static <T extends Identifiable<T>> Created<T> created(T value) {
        return new Created<>(value);
    }

    public static <T extends Identifiable<T>> Updated<T> updated(T value) {
        return new Updated<>(value);
    }

    public static <T extends Identifiable<T>> Deleted<T> deleted(Id<T> id) {
        return new Deleted<>(id);
    }

    /**
     * @return the identity of the primary value the event concerns
     */
    public abstract Id<T> id();

    @Override
    public Optional<?> mergeKey() {
        return Optional.of(id());
    }

    @Override
    public MergeResult<PrimaryEvent<T>> mergeWith(PrimaryEvent<T> next) {
        requireNonNull(next, "You must supply the next event");
        if (this instanceof Created && next instanceof Updated) {
            return MergeResult.combined(created(((Updated<T>) next).value));
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

    public static final class Created<T extends Identifiable<T>> extends PrimaryEvent<T> {
        public final T value;

        private Created(T value) {
            this.value = requireNonNull(value, "You must supply a value");
        }

        @Override
        public Id<T> id() {
            return value.id();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Created && value.equals(((Created<?>) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Created.class, value);
        }

        @Override
        public String toString() {
            return "Created(" + value + ")";
        }
    }

    public static final class Updated<T extends Identifiable<T>> extends PrimaryEvent<T> {
        public final T value;

        private Updated(T value) {
            this.value = requireNonNull(value, "You must supply a value");
        }

        @Override
        public Id<T> id() {
            return value.id();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Updated && value.equals(((Updated<?>) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Updated.class, value);
        }

        @Override
        public String toString() {
            return "Updated(" + value + ")";
        }
    }

    public static final class Deleted<T extends Identifiable<T>> extends PrimaryEvent<T> {
        public final Id<T> id;

        private Deleted(Id<T> id) {
            this.id = requireNonNull(id, "You must supply an id");
        }

        @Override
        public Id<T> id() {
            return id;
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
}
