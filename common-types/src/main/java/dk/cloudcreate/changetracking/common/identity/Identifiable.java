package dk.cloudcreate.changetracking.common.identity;

/**
 * An entity that exposes its own typed {@link Id}
 *
 * @param <SELF> the entity type itself
 */
public interface Identifiable<SELF> {
    Id<SELF> id();
}
