package dk.cloudcreate.changetracking.aggregates.primary;

import dk.cloudcreate.changetracking.aggregates.primary.PrimaryEvent.*;
import dk.cloudcreate.changetracking.changes.*;
import dk.cloudcreate.changetracking.common.*;
import dk.cloudcreate.changetracking.common.identity.*;
import dk.cloudcreate.essentials.shared.functional.tuple.*;

import java.util.*;
import java.util.function.UnaryOperator;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Holds the root value of an aggregate, e.g. the order header of an order, which can be created,
 * replaced and deleted.<br>
 * Every mutator applies a {@link PrimaryEvent} and returns the resulting {@link Changes}, which the owning aggregate
 * bubbles up into its own event type.
 *
 * @param <T> the value type
 */
public final class Primary<T extends Identifiable<T>> implements Changeable<PrimaryEvent<T>> {
    private T value;

    private Primary() {
    }

    /**
     * @return a primary without a value, e.g. used as the starting point when rehydrating an aggregate
     */
    public static <T extends Identifiable<T>> Primary<T> empty() {
        return new Primary<>();
    }

    /**
     * Create a primary holding <code>value</code>
     *
     * @return the primary and the change that created the value
     */
    public static <T extends Identifiable<T>> Pair<Primary<T>, Changes<PrimaryEvent<T>>> of(T value) {
        var primary = new Primary<T>();
        var changes = primary.create(value);
        return Tuple.of(primary, changes);
    }

    /**
     * @throws AlreadyExistsException if the primary already holds a value
     */
    public Changes<PrimaryEvent<T>> create(T newValue) {
        requireNonNull(newValue, "You must supply a value");
        if (value != null) {
            throw new AlreadyExistsException(newValue);
        }
        return applied(PrimaryEvent.created(newValue));
    }

    /**
     * Replace the value with <code>newValue</code>, which must have the same identity
     *
     * @return the change, or no changes if <code>newValue</code> equals the current value
     * @throws NotFoundException if the primary doesn't hold a value
     */
    public Changes<PrimaryEvent<T>> set(T newValue) {
        requireNonNull(newValue, "You must supply a value");
        if (value == null) {
            throw new NotFoundException(newValue.id());
        }
        requireTrue(value.id().equals(newValue.id()), msg("Can't replace '{}' with a value having a different id '{}'", value.id(), newValue.id()));
        if (value.equals(newValue)) {
            return Changes.none();
        }
        return applied(PrimaryEvent.updated(newValue));
    }

    /**
     * Replace the value with the result of <code>modifier</code>
     *
     * @throws NotFoundException if the primary doesn't hold a value
     */
    public Changes<PrimaryEvent<T>> update(UnaryOperator<T> modifier) {
        requireNonNull(modifier, "You must supply a modifier");
        if (value == null) {
            throw new NotFoundException("Primary value");
        }
        return set(modifier.apply(value));
    }

    /**
     * @throws NotFoundException if the primary doesn't hold a value
     */
    public Changes<PrimaryEvent<T>> delete() {
        if (value == null) {
            throw new NotFoundException("Primary value");
        }
        return applied(PrimaryEvent.deleted(value.id()));
    }

    /**
     * @return the value
     * @throws IllegalStateException if the value has been deleted or never created
     */
    public T get() {
        if (value == null) {
            throw new IllegalStateException("The primary value has been deleted or was never created");
        }
        return value;
    }

    public Optional<T> tryGet() {
        return Optional.ofNullable(value);
    }

    public Optional<Id<T>> tryGetId() {
        return tryGet().map(value -> value.id());
    }

    public boolean isPresent() {
        return value != null;
    }

    @Override
    public PrimaryEvent<T> apply(PrimaryEvent<T> event) {
        requireNonNull(event, "You must supply an event");
        if (event instanceof Created) {
            if (value != null) {
                throw new IllegalStateException(msg("Can't apply '{}' since the primary already holds '{}'", event, value));
            }
            value = ((Created<T>) event).value;
            return PrimaryEvent.deleted(value.id());
        }
        if (event instanceof Updated) {
            var previous = get();
            value = ((Updated<T>) event).value;
            return PrimaryEvent.updated(previous);
        }
        if (event instanceof Deleted) {
            var previous = get();
            if (!previous.id().equals(event.id())) {
                throw new IllegalStateException(msg("Can't apply '{}' since the primary holds '{}'", event, previous.id()));
            }
            value = null;
            return PrimaryEvent.created(previous);
        }
        throw new IllegalStateException(msg("Unsupported event '{}'", event));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Primary)) return false;
        return Objects.equals(value, ((Primary<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "Primary(" + value + ")";
    }
}
