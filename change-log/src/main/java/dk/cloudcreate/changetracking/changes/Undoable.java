package dk.cloudcreate.changetracking.changes;

import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link Changeable} that keeps its own {@link ChangeRecord}, which allows it to
 * <ul>
 *     <li>group mutations into a {@link ChangeScope} that's either committed or rolled back as a whole</li>
 *     <li>undo and redo recorded changes using its {@link UndoManager}</li>
 * </ul>
 *
 * @param <EVENT> the event type
 */
public interface Undoable<EVENT> extends Changeable<EVENT> {
    Logger changeScopeLog = LoggerFactory.getLogger(Undoable.class);

    /**
     * @return the change record owned by this object (never null)
     */
    ChangeRecord<EVENT> changeRecord();

    /**
     * Start a new {@link ChangeScope}. If the scope is closed without being committed all changes recorded
     * after this call are reverted.
     *
     * @return the new innermost {@link ChangeScope}
     */
    default ChangeScope<EVENT> begin() {
        return new ChangeScope<>(this);
    }

    default UndoManager<EVENT> undoManager() {
        return new UndoManager<>(this);
    }

    /**
     * Forget both the recorded history and any redoable changes, without changing the object's state
     */
    default void forgetChanges() {
        changeRecord().clear();
    }

    /**
     * Run <code>scopeConsumer</code> in a new {@link ChangeScope}, which is committed if the consumer returns normally
     * and rolled back if it throws.<br>
     * A {@link RuntimeException} thrown by the consumer is rethrown as is, a checked exception is wrapped in a {@link ChangeScopeException}
     *
     * @param scopeConsumer the consumer performing the mutations
     */
    default void usingChangeScope(CheckedConsumer<ChangeScope<EVENT>> scopeConsumer) {
        requireNonNull(scopeConsumer, "No scopeConsumer provided");
        withChangeScope(scope -> {
            scopeConsumer.accept(scope);
            return null;
        });
    }

    /**
     * Run <code>scopeFunction</code> in a new {@link ChangeScope}, which is committed if the function returns normally
     * and rolled back if it throws.<br>
     * A {@link RuntimeException} thrown by the function is rethrown as is, a checked exception is wrapped in a {@link ChangeScopeException}
     *
     * @param scopeFunction the function performing the mutations
     * @param <R>           the result type
     * @return the result of the function
     */
    default <R> R withChangeScope(CheckedFunction<ChangeScope<EVENT>, R> scopeFunction) {
        requireNonNull(scopeFunction, "No scopeFunction provided");
        var scope = begin();
        try {
            var result = scopeFunction.apply(scope);
            if (!scope.status().isCompleted()) {
                changeScopeLog.debug("Committing the ChangeScope created by this withChangeScope(CheckedFunction) method call");
                scope.commit();
            }
            return result;
        } catch (Exception e) {
            if (!scope.status().isCompleted()) {
                changeScopeLog.debug("Rolling back the ChangeScope created by this withChangeScope(CheckedFunction) method call");
                scope.rollback();
            }
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new ChangeScopeException(e);
        }
    }
}
