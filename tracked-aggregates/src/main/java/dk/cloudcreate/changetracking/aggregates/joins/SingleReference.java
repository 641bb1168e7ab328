package dk.cloudcreate.changetracking.aggregates.joins;

import dk.cloudcreate.changetracking.common.identity.*;

/**
 * An entity that refers to exactly one definition, e.g. an order item referring to a product
 *
 * @param <TARGET> the referenced entity type
 */
public interface SingleReference<TARGET extends Identifiable<TARGET>> {
    Id<TARGET> reference();
}
