package dk.cloudcreate.changetracking.common.identity;

import java.io.Serializable;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Typed identity of an entity.<br>
 * An {@link Id} wraps a raw key value (e.g. a {@link Long} or a {@link String}) together with the type of the entity
 * it identifies, so that identities of different kinds of entities can't be mixed up even when their raw keys have the
 * same type:
 * <pre>{@code
 * Id<Order> orderId         = Id.of(Order.class, 42L);
 * Id<OrderPrimary> primaryId = orderId.convert(OrderPrimary.class);
 * }</pre>
 * Equality, hash code and ordering are determined by the raw key. Two identities are only equal when they also
 * identify the same entity type.
 *
 * @param <ENTITY> the type of entity identified
 */
public final class Id<ENTITY> implements Comparable<Id<ENTITY>>, Serializable {
    private final Class<ENTITY>     entityType;
    private final Comparable<?>     value;

    private Id(Class<ENTITY> entityType, Comparable<?> value) {
        this.entityType = requireNonNull(entityType, "You must supply an entityType");
        this.value = requireNonNull(value, "You must supply an id value");
    }

    /**
     * Create an identity for an entity of type <code>entityType</code>
     *
     * @param entityType the type of entity identified
     * @param value      the raw key value
     * @param <ENTITY>   the type of entity identified
     * @return the identity
     */
    public static <ENTITY> Id<ENTITY> of(Class<ENTITY> entityType, Comparable<?> value) {
        return new Id<>(entityType, value);
    }

    /**
     * Explicitly convert this identity into an identity of a related entity type that shares the same raw key,
     * e.g. converting an owner's identity into the identity of the owner's primary value
     *
     * @param otherEntityType the related entity type
     * @param <OTHER>         the related entity type
     * @return an identity with the same raw key for <code>otherEntityType</code>
     */
    public <OTHER> Id<OTHER> convert(Class<OTHER> otherEntityType) {
        return new Id<>(otherEntityType, value);
    }

    /**
     * @return the raw key value
     */
    public Comparable<?> value() {
        return value;
    }

    /**
     * @return the raw key value cast to the type the caller expects
     */
    @SuppressWarnings("unchecked")
    public <T extends Comparable<?>> T valueAs(Class<T> valueType) {
        requireNonNull(valueType, "You must supply a valueType");
        if (!valueType.isInstance(value)) {
            throw new IllegalArgumentException(msg("Id value '{}' of type '{}' isn't a '{}'",
                                                   value,
                                                   value.getClass().getName(),
                                                   valueType.getName()));
        }
        return (T) value;
    }

    public Class<ENTITY> entityType() {
        return entityType;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    @Override
    public int compareTo(Id<ENTITY> other) {
        requireNonNull(other, "Cannot compare to a null Id");
        return ((Comparable) value).compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Id)) return false;
        var id = (Id<?>) o;
        return entityType.equals(id.entityType) && value.equals(id.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return entityType.getSimpleName() + "#" + value;
    }
}
