package dk.cloudcreate.changetracking.aggregates.order;

import dk.cloudcreate.changetracking.common.identity.*;

import java.util.Objects;

public class ShipmentDetails implements Identifiable<ShipmentDetails> {
    public final Id<ShipmentDetails> id;
    public final String              carrier;

    public ShipmentDetails(Id<ShipmentDetails> id, String carrier) {
        this.id = id;
        this.carrier = carrier;
    }

    @Override
    public Id<ShipmentDetails> id() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShipmentDetails)) return false;
        var that = (ShipmentDetails) o;
        return id.equals(that.id) && Objects.equals(carrier, that.carrier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, carrier);
    }

    @Override
    public String toString() {
        return "ShipmentDetails{" +
                "id=" + id +
                ", carrier='" + carrier + '\'' +
                '}';
    }
}
