package dk.cloudcreate.changetracking.eventstore.inmemory;

import dk.cloudcreate.changetracking.common.identity.*;

import java.util.Objects;

public class BasketHeader implements Identifiable<BasketHeader> {
    public final Id<BasketHeader> id;
    public final String           customer;

    public BasketHeader(long id, String customer) {
        this.id = Id.of(BasketHeader.class, id);
        this.customer = customer;
    }

    @Override
    public Id<BasketHeader> id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BasketHeader)) return false;
        var that = (BasketHeader) o;
        return id.equals(that.id) && Objects.equals(customer, that.customer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, customer);
    }

    @Override
    public String toString() {
        return "BasketHeader(" + id + ", " + customer + ")";
    }
}
