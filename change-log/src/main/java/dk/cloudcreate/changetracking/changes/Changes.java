package dk.cloudcreate.changetracking.changes;

import java.util.*;
import java.util.function.Function;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An immutable ordered collection of {@link Change}'s.<br>
 * Every mutating operation on a change tracked object returns the {@link Changes} it produced, which the
 * caller can combine using {@link #append(Changes)} or wrap into the event type of an owning object using
 * {@link #bubbleUp(Function)}.
 *
 * @param <EVENT> the event type
 */
public final class Changes<EVENT> implements Iterable<Change<EVENT>> {
    private static final Changes<?> NONE = new Changes<>(List.of());

    private final List<Change<EVENT>> changes;

    private Changes(List<Change<EVENT>> changes) {
        this.changes = changes;
    }

    /**
     * @return an empty {@link Changes}, e.g. returned by an update where nothing changed
     */
    @SuppressWarnings("unchecked")
    public static <EVENT> Changes<EVENT> none() {
        return (Changes<EVENT>) NONE;
    }

    public static <EVENT> Changes<EVENT> only(Change<EVENT> change) {
        requireNonNull(change, "You must supply a change");
        return new Changes<>(List.of(change));
    }

    public static <EVENT> Changes<EVENT> only(EVENT redo, EVENT undo) {
        return only(Change.of(redo, undo));
    }

    @SafeVarargs
    public static <EVENT> Changes<EVENT> of(Change<EVENT>... changes) {
        requireNonNull(changes, "You must supply changes");
        return of(Arrays.asList(changes));
    }

    public static <EVENT> Changes<EVENT> of(List<Change<EVENT>> changes) {
        requireNonNull(changes, "You must supply changes");
        if (changes.isEmpty()) {
            return none();
        }
        return new Changes<>(List.copyOf(changes));
    }

    /**
     * @param other the changes that happened after this instance's changes
     * @return a new {@link Changes} containing this instance's changes followed by <code>other</code>
     */
    public Changes<EVENT> append(Changes<EVENT> other) {
        requireNonNull(other, "You must supply the changes to append");
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var combined = new ArrayList<Change<EVENT>>(changes.size() + other.changes.size());
        combined.addAll(changes);
        combined.addAll(other.changes);
        return new Changes<>(Collections.unmodifiableList(combined));
    }

    /**
     * Wrap every change into the event type of the owning object
     *
     * @see Change#bubbleUp(Function)
     */
    public <PARENT> Changes<PARENT> bubbleUp(Function<? super EVENT, ? extends PARENT> wrapper) {
        requireNonNull(wrapper, "You must supply a wrapper function");
        if (isEmpty()) {
            return none();
        }
        return new Changes<>(changes.stream()
                                    .map(change -> change.<PARENT>bubbleUp(wrapper))
                                    .collect(Collectors.toUnmodifiableList()));
    }

    public int size() {
        return changes.size();
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public Change<EVENT> get(int index) {
        return changes.get(index);
    }

    public Stream<Change<EVENT>> stream() {
        return changes.stream();
    }

    /**
     * @return the {@link Change#redo()} events in the order they were applied
     */
    public List<EVENT> redoEvents() {
        return changes.stream().map(Change::redo).collect(Collectors.toList());
    }

    /**
     * @return the {@link Change#undo()} events in the order they must be applied to revert all changes
     */
    public List<EVENT> undoEvents() {
        var undos = changes.stream().map(Change::undo).collect(Collectors.toList());
        Collections.reverse(undos);
        return undos;
    }

    public List<Change<EVENT>> toList() {
        return changes;
    }

    @Override
    public Iterator<Change<EVENT>> iterator() {
        return changes.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Changes)) return false;
        return changes.equals(((Changes<?>) o).changes);
    }

    @Override
    public int hashCode() {
        return changes.hashCode();
    }

    @Override
    public String toString() {
        return "Changes" + changes;
    }
}
