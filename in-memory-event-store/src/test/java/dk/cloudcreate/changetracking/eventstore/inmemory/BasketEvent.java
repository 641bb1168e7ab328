package dk.cloudcreate.changetracking.eventstore.inmemory;

import dk.cloudcreate.changetracking.aggregates.details.DetailEvent;
import dk.cloudcreate.changetracking.aggregates.optimizer.*;
import dk.cloudcreate.changetracking.aggregates.primary.PrimaryEvent;

import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public abstract class BasketEvent implements MergeableEvent<BasketEvent> {
    private BasketEvent() {
    }

    public static BasketEvent headerChanged(PrimaryEvent<BasketHeader> event) {
        return new HeaderChanged(event);
    }

    public static BasketEvent linesChanged(DetailEvent<BasketLine> event) {
        return new LinesChanged(event);
    }

    public static boolean isBasketDeleted(BasketEvent event) {
        return event instanceof HeaderChanged && ((HeaderChanged) event).event instanceof PrimaryEvent.Deleted;
    }

    public static final class HeaderChanged extends BasketEvent {
        public final PrimaryEvent<BasketHeader> event;

        private HeaderChanged(PrimaryEvent<BasketHeader> event) {
            this.event = event;
        }

        @Override
        public Optional<?> mergeKey() {
            return event.mergeKey().map(key -> List.of(HeaderChanged.class, key));
        }

        @Override
        public MergeResult<BasketEvent> mergeWith(BasketEvent next) {
            if (!(next instanceof HeaderChanged)) {
                throw new IllegalStateException(msg("Cannot merge '{}' with '{}'", this, next));
            }
            var merged = event.mergeWith(((HeaderChanged) next).event);
            return merged.isAnnihilated() ? MergeResult.annihilated() : MergeResult.combined(headerChanged(merged.event().get()));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof HeaderChanged && event.equals(((HeaderChanged) o).event);
        }

        @Override
        public int hashCode() {
            return Objects.hash(HeaderChanged.class, event);
        }

        @Override
        public String toString() {
            return "HeaderChanged(" + event + ")";
        }
    }

    public static final class LinesChanged extends BasketEvent {
        public final DetailEvent<BasketLine> event;

        private LinesChanged(DetailEvent<BasketLine> event) {
            this.event = event;
        }

        @Override
        public Optional<?> mergeKey() {
            return event.mergeKey().map(key -> List.of(LinesChanged.class, key));
        }

        @Override
        public MergeResult<BasketEvent> mergeWith(BasketEvent next) {
            if (!(next instanceof LinesChanged)) {
                throw new IllegalStateException(msg("Cannot merge '{}' with '{}'", this, next));
            }
            var merged = event.mergeWith(((LinesChanged) next).event);
            return merged.isAnnihilated() ? MergeResult.annihilated() : MergeResult.combined(linesChanged(merged.event().get()));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof LinesChanged && event.equals(((LinesChanged) o).event);
        }

        @Override
        public int hashCode() {
            return Objects.hash(LinesChanged.class, event);
        }

        @Override
        public String toString() {
            return "LinesChanged(" + event + ")";
        }
    }
}
