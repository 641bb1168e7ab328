package dk.cloudcreate.changetracking.changes.streaming;

import dk.cloudcreate.changetracking.changes.*;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class StreamableTest {
    @Test
    void undo_redo_streaming_emits_the_history_oldest_first_and_keeps_it() {
        // Given
        var tally = new Tally(100);
        tally.add(1);
        tally.rename("one");
        tally.add(2);
        var historyBefore = tally.changeRecord().undos();

        // When
        var events = tally.uncommittedChanges();

        // Then
        assertThat(events).containsExactly(TallyEvent.added(1), TallyEvent.renamed("one"), TallyEvent.added(2));
        assertThat(tally.total()).isEqualTo(3);
        assertThat(tally.name()).isEqualTo("one");
        assertThat(tally.changeRecord().undos()).isEqualTo(historyBefore);
        assertThat(tally.changeRecord().redos()).isEmpty();
    }

    @Test
    void streaming_twice_emits_the_same_events() {
        // Given
        var tally = new Tally(100);
        tally.add(1);
        tally.rename("one");

        // Then
        assertThat(tally.uncommittedChanges()).isEqualTo(tally.uncommittedChanges());
    }

    @Test
    void streaming_keeps_previously_undone_changes_redoable() {
        // Given
        var tally = new Tally(100);
        tally.add(1);
        tally.add(2);
        tally.undoManager().undo();

        // When
        var events = tally.uncommittedChanges();

        // Then
        assertThat(events).containsExactly(TallyEvent.added(1));
        assertThat(tally.undoManager().redo()).isTrue();
        assertThat(tally.total()).isEqualTo(3);
    }

    @Test
    void the_state_is_restored_when_the_sink_fails() {
        // Given
        var tally = new Tally(100);
        tally.add(1);
        tally.rename("one");

        // When
        assertThatThrownBy(() -> tally.streamTo(events -> {
            throw new IllegalArgumentException("Sink unavailable");
        })).isExactlyInstanceOf(IllegalArgumentException.class);

        // Then
        assertThat(tally.total()).isEqualTo(1);
        assertThat(tally.name()).isEqualTo("one");
        assertThat(tally.changeRecord().historyLength()).isEqualTo(2);
    }

    @Test
    void takeChanges_streams_and_forgets() {
        // Given
        var tally = new Tally(100);
        tally.add(1);

        // When
        var events = tally.takeChanges();

        // Then
        assertThat(events).containsExactly(TallyEvent.added(1));
        assertThat(tally.uncommittedChanges()).isEmpty();
        assertThat(tally.total()).isEqualTo(1);
    }

    @Test
    void clone_redo_streaming_emits_the_recorded_events_without_rewinding() {
        // Given
        var tally = new Tally(100, CloneRedoStreamingStrategy.INSTANCE);
        tally.add(1);
        tally.rename("one");

        // When
        var events = tally.uncommittedChanges();

        // Then
        assertThat(events).containsExactly(TallyEvent.added(1), TallyEvent.renamed("one"));
        assertThat(tally.total()).isEqualTo(1);
    }

    @Test
    void a_mapping_sink_adapts_the_event_type() {
        // Given
        var tally = new Tally(100);
        tally.add(1);
        tally.add(2);
        var envelopes = new ArrayList<String>();

        // When
        tally.streamTo(EventSink.mapping(event -> "tally:" + event, EventSink.into(envelopes)));

        // Then
        assertThat(envelopes).containsExactly("tally:Added(1)", "tally:Added(2)");
    }
}
