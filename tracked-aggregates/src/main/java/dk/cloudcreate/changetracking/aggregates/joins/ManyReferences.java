package dk.cloudcreate.changetracking.aggregates.joins;

import dk.cloudcreate.changetracking.common.identity.*;

import java.util.List;

/**
 * An entity that refers to several definitions, e.g. a bundle referring to the products it contains
 *
 * @param <TARGET> the referenced entity type
 */
public interface ManyReferences<TARGET extends Identifiable<TARGET>> {
    /**
     * @return the referenced identities in ascending order
     */
    List<Id<TARGET>> references();
}
