package dk.cloudcreate.changetracking.common.identity;

/**
 * A sub-entity that belongs to exactly one owner, e.g. an order line belonging to an order.<br>
 * An owner never holds two owned entities with the same {@link #id()}.
 *
 * @param <SELF>  the owned entity type
 * @param <OWNER> the owner type
 */
public interface OwnedEntity<SELF, OWNER> extends Identifiable<SELF> {
    /**
     * @return the identity of the owner this entity belongs to
     */
    Id<OWNER> ownerId();
}
