package dk.cloudcreate.changetracking.changes;

import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The change log of a single change tracked object.<br>
 * It consists of two regions:
 * <ul>
 *     <li>the <b>undo history</b>: the {@link Change}'s applied so far, oldest first</li>
 *     <li>the <b>redo buffer</b>: the {@link Change}'s that have been undone and can be redone, the most recently undone last</li>
 * </ul>
 * Replaying the undo history's {@link Change#undo()} events in reverse order returns the object to the state it had
 * when the record was created or last cleared.<p>
 * A {@link ChangeRecord} is owned by exactly one object and isn't thread safe.
 *
 * @param <EVENT> the event type
 */
public final class ChangeRecord<EVENT> {
    private static final Logger log = LoggerFactory.getLogger(ChangeRecord.class);

    private final List<Change<EVENT>>       undos      = new ArrayList<>();
    private final List<Change<EVENT>>       redos      = new ArrayList<>();
    private final Deque<ChangeScope<EVENT>> openScopes = new ArrayDeque<>();

    /**
     * @return the number of {@link Change}'s in the undo history
     */
    public int historyLength() {
        return undos.size();
    }

    /**
     * Append freshly applied changes to the undo history.<br>
     * Recording a fresh change discards the redo buffer, since the undone changes no longer follow the current state.
     *
     * @param changes the changes that have been applied
     */
    public void record(Changes<EVENT> changes) {
        requireNonNull(changes, "You must supply changes");
        if (changes.isEmpty()) {
            return;
        }
        if (!redos.isEmpty()) {
            log.trace("Discarding {} redo change(s)", redos.size());
            redos.clear();
        }
        changes.forEach(undos::add);
        log.trace("Recorded {} change(s). History length is now {}", changes.size(), undos.size());
    }

    public void record(Change<EVENT> change) {
        record(Changes.only(change));
    }

    /**
     * Remove and return every {@link Change} appended after <code>checkpoint</code>
     *
     * @param checkpoint a previously observed {@link #historyLength()}
     * @return the removed changes, in the order they were applied
     */
    public List<Change<EVENT>> takeAfter(int checkpoint) {
        requireTrue(checkpoint >= 0 && checkpoint <= undos.size(), msg("Checkpoint {} is outside the history length {}", checkpoint, undos.size()));
        var tail  = undos.subList(checkpoint, undos.size());
        var taken = new ArrayList<>(tail);
        tail.clear();
        return taken;
    }

    /**
     * Remove and return the complete undo history
     */
    public List<Change<EVENT>> drain() {
        return takeAfter(0);
    }

    public void pushUndo(Change<EVENT> change) {
        undos.add(requireNonNull(change, "You must supply a change"));
    }

    public void pushRedo(Change<EVENT> change) {
        redos.add(requireNonNull(change, "You must supply a change"));
    }

    public Optional<Change<EVENT>> popUndo() {
        return undos.isEmpty() ? Optional.empty() : Optional.of(undos.remove(undos.size() - 1));
    }

    public Optional<Change<EVENT>> popRedo() {
        return redos.isEmpty() ? Optional.empty() : Optional.of(redos.remove(redos.size() - 1));
    }

    /**
     * The <code>count</code> most recently undone changes in the order they'd be redone, i.e. the
     * change that {@link #popRedo()} would return first comes first
     *
     * @param count the number of changes
     * @return the changes
     */
    public List<Change<EVENT>> lastRedos(int count) {
        requireTrue(count >= 0 && count <= redos.size(), msg("Can't get the last {} redo change(s) since the redo buffer only contains {}", count, redos.size()));
        var result = new ArrayList<>(redos.subList(redos.size() - count, redos.size()));
        Collections.reverse(result);
        return result;
    }

    /**
     * @return a snapshot of the undo history, oldest first
     */
    public List<Change<EVENT>> undos() {
        return List.copyOf(undos);
    }

    /**
     * @return a snapshot of the redo buffer, the most recently undone change last
     */
    public List<Change<EVENT>> redos() {
        return List.copyOf(redos);
    }

    public int redoLength() {
        return redos.size();
    }

    /**
     * Forget both the undo history and the redo buffer
     */
    public void clear() {
        if (!openScopes.isEmpty()) {
            throw new IllegalStateException(msg("Can't clear the change record while {} ChangeScope(s) are open", openScopes.size()));
        }
        undos.clear();
        redos.clear();
    }

    void restoreRedos(List<Change<EVENT>> previousRedos) {
        redos.clear();
        redos.addAll(previousRedos);
    }

    boolean hasOpenScopes() {
        return !openScopes.isEmpty();
    }

    void scopeOpened(ChangeScope<EVENT> scope) {
        openScopes.push(scope);
    }

    void requireInnermost(ChangeScope<EVENT> scope) {
        if (openScopes.peek() != scope) {
            throw new IllegalStateException(msg("{} isn't the innermost open ChangeScope. Nested ChangeScopes must be completed in reverse order of creation",
                                                scope));
        }
    }

    void scopeCompleted(ChangeScope<EVENT> scope) {
        requireInnermost(scope);
        openScopes.pop();
    }

    @Override
    public String toString() {
        return "ChangeRecord{" +
                "undos=" + undos.size() +
                ", redos=" + redos.size() +
                ", openScopes=" + openScopes.size() +
                '}';
    }
}
