package dk.cloudcreate.changetracking.changes;

import org.slf4j.*;

import java.util.*;
import java.util.function.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Groups a sequence of mutations of an {@link Undoable} so they are either all kept or all reverted.<br>
 * The scope captures the {@link ChangeRecord#historyLength()} when it is created (its checkpoint). Mutations performed
 * through {@link #mutate(Supplier)} and {@link #mutateInner(Supplier, Function)} are recorded in the {@link ChangeRecord}.
 * <ul>
 *     <li>{@link #commit()} keeps every change recorded after the checkpoint</li>
 *     <li>{@link #close()} without a prior {@link #commit()} reverts every change recorded after the checkpoint by applying their
 *     {@link Change#undo()} events newest first, which returns the object to exactly the state it had when the scope was created.
 *     The redo buffer discarded by recording changes inside the scope is restored as well</li>
 * </ul>
 * Intended to be used with try-with-resources so that any exception escaping a multi-step operation triggers the rollback:
 * <pre>{@code
 * public Changes<OrderEvent> addItems(List<OrderItem> newItems) {
 *     try (var scope = begin()) {
 *         newItems.forEach(item -> scope.invoke(() -> addItem(item)));
 *         scope.invoke(this::validateItemCount);
 *         return scope.commit();
 *     }
 * }
 * }</pre>
 * Scopes can be nested. Only the innermost open scope may be used, committed or closed; violating this order throws
 * an {@link IllegalStateException}.
 *
 * @param <EVENT> the event type of the {@link Undoable}
 */
public final class ChangeScope<EVENT> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ChangeScope.class);

    private final Undoable<EVENT>     target;
    private final ChangeRecord<EVENT> changeRecord;
    private final int                 checkpoint;
    private final List<Change<EVENT>> redosAtCheckpoint;
    private       ChangeScopeStatus   status;

    ChangeScope(Undoable<EVENT> target) {
        this.target = requireNonNull(target, "You must supply a target");
        this.changeRecord = requireNonNull(target.changeRecord(), msg("{} didn't return a ChangeRecord", target.getClass().getName()));
        this.checkpoint = changeRecord.historyLength();
        this.redosAtCheckpoint = changeRecord.redos();
        this.status = ChangeScopeStatus.Started;
        changeRecord.scopeOpened(this);
        log.trace("Started {}", this);
    }

    /**
     * Run a mutation of the target and record the changes it produced
     *
     * @param mutation the mutation, which applies its changes to the target and returns them
     * @return the changes produced
     */
    public Changes<EVENT> mutate(Supplier<Changes<EVENT>> mutation) {
        requireNonNull(mutation, "You must supply a mutation");
        requireUsable();
        var changes = requireNonNull(mutation.get(), "The mutation returned null instead of Changes");
        requireUsable();
        changeRecord.record(changes);
        return changes;
    }

    /**
     * Run a mutation of one of the target's constituents (e.g. a detail set owned by an aggregate) and record
     * the changes it produced after wrapping them into the target's event type
     *
     * @param mutation the mutation of the constituent
     * @param bubbleUp wraps a constituent event into the target's event type
     * @param <INNER>  the constituent's event type
     * @return the wrapped changes
     */
    public <INNER> Changes<EVENT> mutateInner(Supplier<Changes<INNER>> mutation, Function<? super INNER, ? extends EVENT> bubbleUp) {
        requireNonNull(mutation, "You must supply a mutation");
        requireNonNull(bubbleUp, "You must supply a bubbleUp function");
        return mutate(() -> requireNonNull(mutation.get(), "The mutation returned null instead of Changes").bubbleUp(bubbleUp));
    }

    /**
     * Run a step that doesn't produce changes of its own, e.g. a validator that throws when a business rule is violated,
     * or a nested operation that records its own changes
     *
     * @param step the step to run
     */
    public void invoke(Runnable step) {
        requireNonNull(step, "You must supply a step");
        requireUsable();
        step.run();
    }

    /**
     * Keep every change recorded since the checkpoint
     *
     * @return the changes recorded through this scope
     */
    public Changes<EVENT> commit() {
        requireUsable();
        var recorded = changesSinceCheckpoint();
        changeRecord.scopeCompleted(this);
        status = ChangeScopeStatus.Committed;
        log.debug("Committed {} with {} change(s)", this, recorded.size());
        return recorded;
    }

    /**
     * Revert every change recorded since the checkpoint and restore the redo buffer as it was when the scope was created
     */
    public void rollback() {
        requireUsable();
        var taken = changeRecord.takeAfter(checkpoint);
        Collections.reverse(taken);
        for (var change : taken) {
            log.trace("Reverting {}", change);
            target.apply(change.undo());
        }
        changeRecord.restoreRedos(redosAtCheckpoint);
        changeRecord.scopeCompleted(this);
        status = ChangeScopeStatus.RolledBack;
        log.debug("Rolled back {} reverting {} change(s)", this, taken.size());
    }

    /**
     * Roll back unless the scope has already been committed or rolled back
     */
    @Override
    public void close() {
        if (!status.isCompleted()) {
            rollback();
        }
    }

    public ChangeScopeStatus status() {
        return status;
    }

    public int checkpoint() {
        return checkpoint;
    }

    private Changes<EVENT> changesSinceCheckpoint() {
        var undos = changeRecord.undos();
        return Changes.of(undos.subList(checkpoint, undos.size()));
    }

    private void requireUsable() {
        if (status.isCompleted()) {
            throw new IllegalStateException(msg("{} has already been completed", this));
        }
        changeRecord.requireInnermost(this);
        if (changeRecord.historyLength() < checkpoint) {
            throw new IllegalStateException(msg("The history of '{}' was truncated below the checkpoint of {}", target.getClass().getName(), this));
        }
    }

    @Override
    public String toString() {
        return "ChangeScope{" +
                "target=" + target.getClass().getSimpleName() +
                ", checkpoint=" + checkpoint +
                ", status=" + status +
                '}';
    }
}
