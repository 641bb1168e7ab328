package dk.cloudcreate.changetracking.changes;

import java.util.Objects;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A single reversible change unit: the <b>redo</b> event that was applied and the <b>undo</b> event
 * that reverts it.<br>
 * Applying {@link #undo()} to the state produced by applying {@link #redo()} restores the prior state.
 *
 * @param <EVENT> the event type
 */
public final class Change<EVENT> {
    private final EVENT redo;
    private final EVENT undo;

    private Change(EVENT redo, EVENT undo) {
        this.redo = requireNonNull(redo, "You must supply a redo event");
        this.undo = requireNonNull(undo, "You must supply an undo event");
    }

    public static <EVENT> Change<EVENT> of(EVENT redo, EVENT undo) {
        return new Change<>(redo, undo);
    }

    /**
     * @return the forward event
     */
    public EVENT redo() {
        return redo;
    }

    /**
     * @return the event that reverts {@link #redo()}
     */
    public EVENT undo() {
        return undo;
    }

    /**
     * Wrap both sides of this change into an event of the owning object, e.g. turning a change of an
     * aggregate's detail set into a change of the aggregate itself
     *
     * @param wrapper wraps an inner event into the parent event type
     * @param <PARENT> the parent event type
     * @return the wrapped change
     */
    public <PARENT> Change<PARENT> bubbleUp(Function<? super EVENT, ? extends PARENT> wrapper) {
        requireNonNull(wrapper, "You must supply a wrapper function");
        return new Change<>(wrapper.apply(redo), wrapper.apply(undo));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Change)) return false;
        var change = (Change<?>) o;
        return redo.equals(change.redo) && undo.equals(change.undo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(redo, undo);
    }

    @Override
    public String toString() {
        return "Change{" +
                "redo=" + redo +
                ", undo=" + undo +
                '}';
    }
}
