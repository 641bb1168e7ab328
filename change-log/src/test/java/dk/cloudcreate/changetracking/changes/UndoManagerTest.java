package dk.cloudcreate.changetracking.changes;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class UndoManagerTest {
    @Test
    void undo_followed_by_redo_restores_state_and_history() {
        // Given
        var tally = new Tally(100);
        tally.add(5);
        tally.rename("five");
        var historyBefore = tally.changeRecord().undos();
        var undoManager   = tally.undoManager();

        for (var i = 0; i < 3; i++) {
            // When
            assertThat(undoManager.undo()).isTrue();
            assertThat(tally.name()).isEqualTo("");
            assertThat(undoManager.redo()).isTrue();

            // Then
            assertThat(tally.total()).isEqualTo(5);
            assertThat(tally.name()).isEqualTo("five");
            assertThat(tally.changeRecord().undos()).isEqualTo(historyBefore);
            assertThat(tally.changeRecord().redos()).isEmpty();
        }
    }

    @Test
    void undoAll_and_redoN_walk_the_complete_history() {
        // Given
        var tally = new Tally(100);
        tally.add(1);
        tally.add(2);
        tally.rename("three");
        var undoManager = tally.undoManager();

        // When
        var undone = undoManager.undoAll();

        // Then
        assertThat(undone).isEqualTo(3);
        assertThat(tally.total()).isEqualTo(0);
        assertThat(tally.name()).isEqualTo("");
        assertThat(undoManager.canUndo()).isFalse();
        assertThat(undoManager.futureHistory(3)).containsExactly(TallyEvent.added(1), TallyEvent.added(2), TallyEvent.renamed("three"));

        // When
        undoManager.redoN(2);

        // Then
        assertThat(tally.total()).isEqualTo(3);
        assertThat(tally.name()).isEqualTo("");
        assertThat(undoManager.history()).containsExactly(TallyEvent.added(1), TallyEvent.added(2));
        assertThat(undoManager.canRedo()).isTrue();
    }

    @Test
    void undo_and_redo_on_empty_regions_report_false() {
        var undoManager = new Tally(100).undoManager();

        assertThat(undoManager.undo()).isFalse();
        assertThat(undoManager.redo()).isFalse();
        assertThat(undoManager.undoAll()).isEqualTo(0);
    }

    @Test
    void redoN_fails_when_not_enough_changes_have_been_undone() {
        // Given
        var tally = new Tally(100);
        tally.add(1);
        var undoManager = tally.undoManager();
        undoManager.undo();

        // Then
        assertThatThrownBy(() -> undoManager.redoN(2))
                .isExactlyInstanceOf(IllegalStateException.class);
        assertThat(tally.total()).isEqualTo(0);
    }

    @Test
    void a_fresh_change_after_undo_discards_the_redoable_changes() {
        // Given
        var tally = new Tally(100);
        tally.add(1);
        var undoManager = tally.undoManager();
        undoManager.undo();

        // When
        tally.add(7);

        // Then
        assertThat(undoManager.canRedo()).isFalse();
        assertThat(undoManager.history()).containsExactly(TallyEvent.added(7));
    }

    @Test
    void forgetChanges_keeps_the_state() {
        // Given
        var tally = new Tally(100);
        tally.add(4);

        // When
        tally.undoManager().forgetChanges();

        // Then
        assertThat(tally.total()).isEqualTo(4);
        assertThat(tally.undoManager().canUndo()).isFalse();
    }
}
