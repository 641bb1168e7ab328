package dk.cloudcreate.changetracking.aggregates.details;

import dk.cloudcreate.changetracking.aggregates.details.DetailEvent.*;
import dk.cloudcreate.changetracking.changes.*;
import dk.cloudcreate.changetracking.common.*;
import dk.cloudcreate.changetracking.common.identity.*;
import org.slf4j.*;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The collection of sub-entities (details) an aggregate owns, e.g. the items of an order.<br>
 * No two details share the same {@link Identifiable#id()}. Iteration follows insertion order and two {@link DetailSet}'s
 * are equal when they contain equal details in the same order. Reverting the removal of a detail puts it back at its
 * previous position.<p>
 * Every mutator applies {@link DetailEvent}'s and returns the resulting {@link Changes}, which the owning aggregate bubbles up into
 * its own event type. {@link #setAll(Collection)} and {@link #setSome(Predicate, Collection)} replace the content wholesale and
 * emit only the minimal set of {@link Created}/{@link Updated}/{@link Deleted} events needed:
 * <pre>{@code
 * var changes = items.setAll(List.of(item1, changedItem2, newItem4));
 * // -> Updated(changedItem2), Created(newItem4), Deleted(item3.id())
 * }</pre>
 *
 * @param <T> the detail type
 */
public final class DetailSet<T extends Identifiable<T>> implements Changeable<DetailEvent<T>>, Iterable<T> {
    private static final Logger log = LoggerFactory.getLogger(DetailSet.class);

    private final LinkedHashMap<Id<T>, T> items = new LinkedHashMap<>();

    /**
     * Add a detail whose identity isn't present yet
     *
     * @throws AlreadyExistsException if a detail with the same identity is present
     */
    public Changes<DetailEvent<T>> addNew(T item) {
        requireNonNull(item, "You must supply an item");
        if (items.containsKey(item.id())) {
            throw new AlreadyExistsException(item);
        }
        return applied(DetailEvent.created(item));
    }

    /**
     * Replace the detail having the same identity as <code>item</code>
     *
     * @return the change, or no changes if the detail is equal to <code>item</code>
     * @throws NotFoundException if no detail with the same identity is present
     */
    public Changes<DetailEvent<T>> update(T item) {
        requireNonNull(item, "You must supply an item");
        var existing = items.get(item.id());
        if (existing == null) {
            throw new NotFoundException(item);
        }
        if (existing.equals(item)) {
            return Changes.none();
        }
        return applied(DetailEvent.updated(item));
    }

    /**
     * {@link #update(Identifiable)} the detail if its identity is present, otherwise {@link #addNew(Identifiable)}
     */
    public Changes<DetailEvent<T>> updateOrAdd(T item) {
        requireNonNull(item, "You must supply an item");
        return items.containsKey(item.id()) ? update(item) : addNew(item);
    }

    /**
     * @throws NotFoundException if no detail with the identity is present
     */
    public Changes<DetailEvent<T>> removeById(Id<T> id) {
        requireNonNull(id, "You must supply an id");
        if (!items.containsKey(id)) {
            throw new NotFoundException(id);
        }
        return applied(DetailEvent.deleted(id));
    }

    /**
     * Remove the detail having the same identity as <code>item</code>
     *
     * @throws NotFoundException if no detail with the same identity is present
     */
    public Changes<DetailEvent<T>> remove(T item) {
        requireNonNull(item, "You must supply an item");
        return removeById(item.id());
    }

    /**
     * Remove every detail as a single change
     *
     * @return the change, or no changes if the set is empty
     */
    public Changes<DetailEvent<T>> removeAll() {
        if (items.isEmpty()) {
            return Changes.none();
        }
        return applied(DetailEvent.allDeleted());
    }

    /**
     * Replace the complete content with <code>newItems</code>
     *
     * @see #setSome(Predicate, Collection)
     */
    public Changes<DetailEvent<T>> setAll(Collection<T> newItems) {
        return setSome(item -> true, newItems);
    }

    /**
     * Replace the details matching <code>criteria</code> with <code>newItems</code>:
     * <ul>
     *     <li>a new item equal to the present detail with the same identity emits nothing</li>
     *     <li>a new item that differs from the present detail with the same identity emits {@link Updated}</li>
     *     <li>a new item whose identity isn't present emits {@link Created}</li>
     *     <li>a present detail matching <code>criteria</code> without a new item of the same identity emits {@link Deleted}</li>
     * </ul>
     * {@link Updated} and {@link Created} events follow the order of <code>newItems</code>, the {@link Deleted} events come last.
     * Details not matching <code>criteria</code> are only touched if <code>newItems</code> contains an item with their identity.
     *
     * @throws ChangeTrackingException if <code>newItems</code> contains the same identity twice
     */
    public Changes<DetailEvent<T>> setSome(Predicate<? super T> criteria, Collection<T> newItems) {
        requireNonNull(criteria, "You must supply criteria");
        requireNonNull(newItems, "You must supply newItems");
        var newIds = new HashSet<Id<T>>();
        newItems.forEach(item -> {
            requireNonNull(item, "newItems must not contain null");
            if (!newIds.add(item.id())) {
                throw new ChangeTrackingException(msg("newItems contains the id '{}' more than once", item.id()));
            }
        });

        var changes = Changes.<DetailEvent<T>>none();
        for (var item : newItems) {
            changes = changes.append(updateOrAdd(item));
        }
        var toBeDeleted = items.values()
                               .stream()
                               .filter(criteria)
                               .map(item -> item.id())
                               .filter(id -> !newIds.contains(id))
                               .collect(Collectors.toList());
        for (var id : toBeDeleted) {
            changes = changes.append(removeById(id));
        }
        log.trace("Replacing {} item(s) resulted in {} change(s)", newItems.size(), changes.size());
        return changes;
    }

    public Optional<T> byId(Id<T> id) {
        return Optional.ofNullable(items.get(id));
    }

    public boolean contains(Id<T> id) {
        return items.containsKey(id);
    }

    public Optional<T> find(Predicate<? super T> predicate) {
        requireNonNull(predicate, "You must supply a predicate");
        return items.values().stream().filter(predicate).findFirst();
    }

    /**
     * @param index zero based position in insertion order
     */
    public T get(int index) {
        return toList().get(index);
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

    public List<T> toList() {
        return List.copyOf(items.values());
    }

    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableCollection(items.values()).iterator();
    }

    @Override
    public DetailEvent<T> apply(DetailEvent<T> event) {
        requireNonNull(event, "You must supply an event");
        if (event instanceof Created) {
            var created = (Created<T>) event;
            var item    = created.item;
            if (items.containsKey(item.id())) {
                throw new IllegalStateException(msg("Can't apply '{}' since an item with the same id is already present", event));
            }
            if (created.position.isPresent()) {
                insertAt(created.position.get(), item, event);
            } else {
                items.put(item.id(), item);
            }
            return DetailEvent.deleted(item.id());
        }
        if (event instanceof Updated) {
            var item     = ((Updated<T>) event).item;
            var previous = requirePresent(item.id(), event);
            items.put(item.id(), item);
            return DetailEvent.updated(previous);
        }
        if (event instanceof Deleted) {
            var id       = ((Deleted<T>) event).id;
            var previous = requirePresent(id, event);
            var position = new ArrayList<>(items.keySet()).indexOf(id);
            items.remove(id);
            return position == items.size() ? DetailEvent.created(previous) : DetailEvent.createdAt(previous, position);
        }
        if (event instanceof AllDeleted) {
            var previous = toList();
            items.clear();
            return DetailEvent.allRestored(previous);
        }
        if (event instanceof AllRestored) {
            var restored = ((AllRestored<T>) event).items;
            if (!items.isEmpty()) {
                throw new IllegalStateException(msg("Can't apply '{}' since the set isn't empty", event));
            }
            restored.forEach(item -> items.put(item.id(), item));
            return DetailEvent.allDeleted();
        }
        throw new IllegalStateException(msg("Unsupported event '{}'", event));
    }

    private void insertAt(int position, T item, DetailEvent<T> event) {
        if (position < 0 || position > items.size()) {
            throw new IllegalStateException(msg("Can't apply '{}' since the set only contains {} item(s)", event, items.size()));
        }
        var reordered = new ArrayList<>(items.values());
        reordered.add(position, item);
        items.clear();
        reordered.forEach(detail -> items.put(detail.id(), detail));
    }

    private T requirePresent(Id<T> id, DetailEvent<T> event) {
        var item = items.get(id);
        if (item == null) {
            throw new IllegalStateException(msg("Can't apply '{}' since no item with id '{}' is present", event, id));
        }
        return item;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DetailSet)) return false;
        return toList().equals(((DetailSet<?>) o).toList());
    }

    @Override
    public int hashCode() {
        return toList().hashCode();
    }

    @Override
    public String toString() {
        return "DetailSet" + items.values();
    }
}
