package dk.cloudcreate.changetracking.changes;

import org.slf4j.*;

import java.util.List;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Moves an {@link Undoable} backwards and forwards through its {@link ChangeRecord}.<br>
 * {@link #undo()} reverts the newest change of the undo history and moves it to the redo buffer, {@link #redo()} does the reverse.
 * Entries in both regions are always kept in forward orientation, i.e. {@link Change#redo()} is the event that moves the
 * object forward, so a change can be moved between the regions any number of times.
 *
 * @param <EVENT> the event type
 */
public final class UndoManager<EVENT> {
    private static final Logger log = LoggerFactory.getLogger(UndoManager.class);

    private final Undoable<EVENT>     target;
    private final ChangeRecord<EVENT> changeRecord;

    public UndoManager(Undoable<EVENT> target) {
        this.target = requireNonNull(target, "You must supply a target");
        this.changeRecord = requireNonNull(target.changeRecord(), "The target didn't return a ChangeRecord");
    }

    /**
     * Revert the newest change in the undo history
     *
     * @return true if a change was reverted, false if the undo history was empty
     */
    public boolean undo() {
        requireNoOpenScopes();
        var change = changeRecord.popUndo();
        if (change.isEmpty()) {
            return false;
        }
        var undo = change.get().undo();
        var redo = target.apply(undo);
        log.trace("Undid {}", change.get());
        changeRecord.pushRedo(Change.of(redo, undo));
        return true;
    }

    /**
     * Reapply the most recently undone change
     *
     * @return true if a change was reapplied, false if the redo buffer was empty
     */
    public boolean redo() {
        requireNoOpenScopes();
        var change = changeRecord.popRedo();
        if (change.isEmpty()) {
            return false;
        }
        var redo = change.get().redo();
        var undo = target.apply(redo);
        log.trace("Redid {}", change.get());
        changeRecord.pushUndo(Change.of(redo, undo));
        return true;
    }

    /**
     * Undo every change in the undo history
     *
     * @return the number of changes undone
     */
    public int undoAll() {
        var count = 0;
        while (undo()) {
            count++;
        }
        log.trace("Undid all {} change(s) of '{}'", count, target.getClass().getSimpleName());
        return count;
    }

    /**
     * Redo exactly <code>count</code> previously undone changes
     *
     * @param count the number of changes to redo
     * @throws IllegalStateException if the redo buffer contains fewer than <code>count</code> changes
     */
    public void redoN(int count) {
        requireTrue(count >= 0, "count must be >= 0");
        if (changeRecord.redoLength() < count) {
            throw new IllegalStateException(msg("Can't redo {} change(s) as only {} change(s) can be redone", count, changeRecord.redoLength()));
        }
        for (var i = 0; i < count; i++) {
            redo();
        }
    }

    /**
     * @param count the number of changes
     * @return the forward events of the <code>count</code> changes that the next <code>count</code> {@link #redo()} calls would apply, in that order
     */
    public List<EVENT> futureHistory(int count) {
        return changeRecord.lastRedos(count)
                           .stream()
                           .map(Change::redo)
                           .collect(Collectors.toList());
    }

    /**
     * @return the forward events of the undo history, oldest first
     */
    public List<EVENT> history() {
        return changeRecord.undos()
                           .stream()
                           .map(Change::redo)
                           .collect(Collectors.toList());
    }

    public boolean canUndo() {
        return changeRecord.historyLength() > 0;
    }

    public boolean canRedo() {
        return changeRecord.redoLength() > 0;
    }

    private void requireNoOpenScopes() {
        if (changeRecord.hasOpenScopes()) {
            throw new IllegalStateException(msg("Can't undo or redo changes of '{}' while a ChangeScope is open", target.getClass().getName()));
        }
    }

    /**
     * Forget the undo history and the redo buffer
     */
    public void forgetChanges() {
        changeRecord.clear();
    }
}
