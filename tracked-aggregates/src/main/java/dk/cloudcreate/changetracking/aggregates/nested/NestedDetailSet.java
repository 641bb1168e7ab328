package dk.cloudcreate.changetracking.aggregates.nested;

import dk.cloudcreate.changetracking.aggregates.nested.NestedEvent.*;
import dk.cloudcreate.changetracking.changes.*;
import dk.cloudcreate.changetracking.common.*;
import dk.cloudcreate.changetracking.common.identity.*;
import dk.cloudcreate.essentials.shared.functional.tuple.Pair;

import java.util.*;
import java.util.function.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A collection of nested aggregates, i.e. sub-entities that have their own events, such as the shipments of an order.<br>
 * Changes of a nested item are wrapped in {@link NestedEvent}'s carrying the item's identity.<br>
 * Recreating an item, when rehydrating or when reverting its removal, starts from an empty item supplied by the
 * <code>emptyItemFactory</code>, to which the item's creation event is applied. A recreated item gets back the position it had.
 *
 * @param <T>     the nested item type
 * @param <INNER> the nested item's event type
 */
public final class NestedDetailSet<T extends Identifiable<T> & Changeable<INNER>, INNER> implements Changeable<NestedEvent<T, INNER>>, Iterable<T> {
    private final Supplier<T>             emptyItemFactory;
    private final LinkedHashMap<Id<T>, T> items = new LinkedHashMap<>();

    /**
     * @param emptyItemFactory creates an empty item, to which a creation event can be applied
     */
    public NestedDetailSet(Supplier<T> emptyItemFactory) {
        this.emptyItemFactory = requireNonNull(emptyItemFactory, "You must supply an emptyItemFactory");
    }

    /**
     * Add the item created by <code>factory</code>
     *
     * @param factory creates the item together with the changes that created it (at least one)
     * @return the item's creation changes wrapped in a {@link Created} event, followed by any further changes wrapped in {@link Updated} events
     * @throws AlreadyExistsException if an item with the same identity is present
     */
    public Changes<NestedEvent<T, INNER>> addNew(Supplier<Pair<T, Changes<INNER>>> factory) {
        requireNonNull(factory, "You must supply a factory");
        var created = requireNonNull(factory.get(), "The factory returned null");
        var item    = requireNonNull(created._1, "The factory didn't create an item");
        var changes = requireNonNull(created._2, "The factory didn't return the creation changes");
        if (changes.isEmpty()) {
            throw new IllegalArgumentException(msg("The factory didn't return any creation changes for '{}'", item));
        }
        var id = item.id();
        if (items.containsKey(id)) {
            throw new AlreadyExistsException(item);
        }
        items.put(id, item);

        var wrapped = new ArrayList<Change<NestedEvent<T, INNER>>>(changes.size());
        var first   = changes.get(0);
        wrapped.add(Change.of(NestedEvent.created(id, first.redo()), NestedEvent.deleted(id, first.undo())));
        changes.stream()
               .skip(1)
               .forEach(change -> wrapped.add(Change.of(NestedEvent.updated(id, change.redo()), NestedEvent.updated(id, change.undo()))));
        return Changes.of(wrapped);
    }

    /**
     * Mutate the item having the identity <code>id</code>
     *
     * @param mutation mutates the item and returns its changes
     * @return the item's changes wrapped in {@link Updated} events
     * @throws NotFoundException if no item with the identity is present
     */
    public Changes<NestedEvent<T, INNER>> update(Id<T> id, Function<? super T, Changes<INNER>> mutation) {
        requireNonNull(mutation, "You must supply a mutation");
        var item = requireItem(id);
        return requireNonNull(mutation.apply(item), "The mutation returned null instead of Changes")
                .bubbleUp(inner -> NestedEvent.updated(id, inner));
    }

    /**
     * Remove the item having the identity <code>id</code>
     *
     * @param deletedEventFactory creates the item's deletion event, whose inverse must recreate the item from an empty item
     * @throws NotFoundException if no item with the identity is present
     */
    public Changes<NestedEvent<T, INNER>> remove(Id<T> id, Function<? super T, ? extends INNER> deletedEventFactory) {
        requireNonNull(deletedEventFactory, "You must supply a deletedEventFactory");
        var item = requireItem(id);
        return applied(NestedEvent.deleted(id, deletedEventFactory.apply(item)));
    }

    public Optional<T> byId(Id<T> id) {
        return Optional.ofNullable(items.get(id));
    }

    public boolean contains(Id<T> id) {
        return items.containsKey(id);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Stream<T> stream() {
        return items.values().stream();
    }

    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableCollection(items.values()).iterator();
    }

    @Override
    public NestedEvent<T, INNER> apply(NestedEvent<T, INNER> event) {
        requireNonNull(event, "You must supply an event");
        var id = event.id;
        if (event instanceof Created) {
            if (items.containsKey(id)) {
                throw new IllegalStateException(msg("Can't apply '{}' since an item with the same id is already present", event));
            }
            var item = emptyItemFactory.get();
            var undo = item.apply(event.inner);
            if (!id.equals(item.id())) {
                throw new IllegalStateException(msg("Applying '{}' created an item with id '{}'", event, item.id()));
            }
            var position = ((Created<T, INNER>) event).position;
            if (position.isPresent()) {
                insertAt(position.get(), item, event);
            } else {
                items.put(id, item);
            }
            return NestedEvent.deleted(id, undo);
        }
        if (event instanceof Updated) {
            var item = requirePresent(event);
            return NestedEvent.updated(id, item.apply(event.inner));
        }
        if (event instanceof Deleted) {
            var item = requirePresent(event);
            var undo     = item.apply(event.inner);
            var position = new ArrayList<>(items.keySet()).indexOf(id);
            items.remove(id);
            return position == items.size() ? NestedEvent.created(id, undo) : NestedEvent.createdAt(id, undo, position);
        }
        throw new IllegalStateException(msg("Unsupported event '{}'", event));
    }

    private void insertAt(int position, T item, NestedEvent<T, INNER> event) {
        if (position < 0 || position > items.size()) {
            throw new IllegalStateException(msg("Can't apply '{}' since the set only contains {} item(s)", event, items.size()));
        }
        var reordered = new ArrayList<>(items.values());
        reordered.add(position, item);
        items.clear();
        reordered.forEach(nested -> items.put(nested.id(), nested));
    }

    private T requireItem(Id<T> id) {
        requireNonNull(id, "You must supply an id");
        var item = items.get(id);
        if (item == null) {
            throw new NotFoundException(id);
        }
        return item;
    }

    private T requirePresent(NestedEvent<T, INNER> event) {
        var item = items.get(event.id);
        if (item == null) {
            throw new IllegalStateException(msg("Can't apply '{}' since no item with id '{}' is present", event, event.id));
        }
        return item;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NestedDetailSet)) return false;
        return List.copyOf(items.values()).equals(List.copyOf(((NestedDetailSet<?, ?>) o).items.values()));
    }

    @Override
    public int hashCode() {
        return List.copyOf(items.values()).hashCode();
    }

    @Override
    public String toString() {
        return "NestedDetailSet" + items.values();
    }
}
