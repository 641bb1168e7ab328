package dk.cloudcreate.changetracking.aggregates.joins;

import dk.cloudcreate.changetracking.common.identity.*;
import dk.cloudcreate.essentials.shared.functional.tuple.*;

import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Merge joins between references and the definitions they refer to, e.g. the items of an order and a catalogue of products.<br>
 * Both sides must be sorted in ascending {@link Id} order, which lets the join run in a single pass. References without a
 * matching definition and definitions that nobody refers to are left out.
 */
public final class Joins {
    private Joins() {
    }

    /**
     * Pair every reference with the definition it refers to.<br>
     * Several references may refer to the same definition.
     *
     * @param references  the references, sorted by {@link SingleReference#reference()}
     * @param definitions the definitions, sorted by {@link Identifiable#id()}
     * @return the (reference, definition) pairs in reference order
     * @throws IllegalArgumentException if either side isn't sorted
     */
    public static <R extends SingleReference<D>, D extends Identifiable<D>> List<Pair<R, D>> join(Iterable<R> references, Iterable<D> definitions) {
        requireNonNull(references, "You must supply references");
        requireNonNull(definitions, "You must supply definitions");
        var joined              = new ArrayList<Pair<R, D>>();
        var referenceIterator   = sorted(references, reference -> reference.reference(), "references");
        var definitionIterator  = sorted(definitions, definition -> definition.id(), "definitions");
        var definition          = next(definitionIterator);
        while (referenceIterator.hasNext()) {
            var reference = referenceIterator.next();
            while (definition != null && definition.id().compareTo(reference.reference()) < 0) {
                definition = next(definitionIterator);
            }
            if (definition != null && definition.id().equals(reference.reference())) {
                joined.add(Tuple.of(reference, definition));
            }
        }
        return joined;
    }

    /**
     * Resolve the definitions referred to by <code>owner</code>
     *
     * @param owner       the entity holding the references
     * @param definitions the definitions, sorted by {@link Identifiable#id()}
     * @return the referenced definitions in reference order
     * @throws IllegalArgumentException if the references or the definitions aren't sorted
     */
    public static <D extends Identifiable<D>> List<D> referencedBy(ManyReferences<D> owner, Iterable<D> definitions) {
        requireNonNull(owner, "You must supply an owner");
        var references = requireNonNull(owner.references(), "The owner returned null instead of references");
        var resolved   = new ArrayList<D>();
        join(wrap(references), definitions).forEach(pair -> resolved.add(pair._2));
        return resolved;
    }

    private static <D extends Identifiable<D>> List<IdReference<D>> wrap(List<Id<D>> references) {
        var wrapped = new ArrayList<IdReference<D>>(references.size());
        references.forEach(reference -> wrapped.add(new IdReference<>(reference)));
        return wrapped;
    }

    private static <T, D> Iterator<T> sorted(Iterable<T> elements, Function<T, Id<D>> idOf, String side) {
        Id<D> previous = null;
        for (var element : elements) {
            var id = requireNonNull(idOf.apply(element), msg("The {} contain an element without id", side));
            if (previous != null && previous.compareTo(id) > 0) {
                throw new IllegalArgumentException(msg("The {} aren't sorted: '{}' follows '{}'", side, id, previous));
            }
            previous = id;
        }
        return elements.iterator();
    }

    private static <D> D next(Iterator<D> iterator) {
        return iterator.hasNext() ? iterator.next() : null;
    }

    private static final class IdReference<D extends Identifiable<D>> implements SingleReference<D> {
        private final Id<D> reference;

        private IdReference(Id<D> reference) {
            this.reference = requireNonNull(reference, "References must not be null");
        }

        @Override
        public Id<D> reference() {
            return reference;
        }
    }
}
