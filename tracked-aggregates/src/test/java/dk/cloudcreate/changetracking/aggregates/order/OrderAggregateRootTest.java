package dk.cloudcreate.changetracking.aggregates.order;

import dk.cloudcreate.changetracking.aggregates.StreamingMode;
import dk.cloudcreate.changetracking.aggregates.details.DetailEvent;
import dk.cloudcreate.changetracking.aggregates.nested.NestedEvent;
import dk.cloudcreate.changetracking.aggregates.optimizer.EventOptimizer;
import dk.cloudcreate.changetracking.aggregates.primary.PrimaryEvent;
import dk.cloudcreate.changetracking.common.*;
import dk.cloudcreate.changetracking.common.identity.Id;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OrderAggregateRootTest {
    private static final long ORDER_ID = 42;

    private Order order;

    @BeforeEach
    void setup() {
        order = Order.create(ORDER_ID, 2)._1;
    }

    @Test
    void creating_an_order_records_the_creation_of_the_primary_value() {
        // When
        var created = Order.create(ORDER_ID, 2);

        // Then
        assertThat(created._2.redoEvents()).containsExactly(OrderEvent.primaryChanged(PrimaryEvent.created(new OrderPrimary(ORDER_ID, 0))));
        assertThat(created._1.aggregateId()).isEqualTo(Id.of(Order.class, ORDER_ID));
        assertThat(created._1.uncommittedChanges()).isEqualTo(created._2.redoEvents());
    }

    @Test
    void adding_an_item_flushes_the_primary_update_and_the_item_creation() {
        // Given
        order.markChangesAsCommitted();

        // When
        order.addItem(OrderItem.of(1001, ORDER_ID));

        // Then
        assertThat(order.takeChanges()).containsExactly(OrderEvent.primaryChanged(PrimaryEvent.updated(new OrderPrimary(ORDER_ID, 1))),
                                                        OrderEvent.itemsChanged(DetailEvent.created(OrderItem.of(1001, ORDER_ID))));
        assertThat(order.uncommittedChanges()).isEmpty();
    }

    @Test
    void exceeding_the_item_limit_rolls_back_the_whole_batch() {
        // Given
        order.markChangesAsCommitted();
        order.addItem(OrderItem.of(1001, ORDER_ID));
        order.takeChanges();

        // When
        assertThatThrownBy(() -> order.addItems(List.of(OrderItem.of(1002, ORDER_ID), OrderItem.of(1003, ORDER_ID))))
                .isExactlyInstanceOf(ChangeTrackingException.class)
                .hasMessage("Too many");

        // Then
        assertThat(order.itemCount()).isEqualTo(1);
        assertThat(order.items().toList()).containsExactly(OrderItem.of(1001, ORDER_ID));
        assertThat(order.uncommittedChanges()).isEmpty();
    }

    @Test
    void adding_a_duplicate_item_is_rejected_without_changing_the_order() {
        // Given
        order.addItem(OrderItem.of(1001, ORDER_ID));
        var historyLength = order.changeRecord().historyLength();

        // When
        assertThatThrownBy(() -> order.addItem(OrderItem.of(1001, ORDER_ID)))
                .isExactlyInstanceOf(AlreadyExistsException.class);

        // Then
        assertThat(order.itemCount()).isEqualTo(1);
        assertThat(order.changeRecord().historyLength()).isEqualTo(historyLength);
    }

    @Test
    void replacing_items_with_identical_items_emits_no_item_events() {
        // Given
        order.addItem(OrderItem.of(1001, ORDER_ID));
        order.addItem(OrderItem.of(1002, ORDER_ID));
        order.markChangesAsCommitted();

        // When
        var changes = order.replaceItems(List.of(OrderItem.of(1002, ORDER_ID), OrderItem.of(1001, ORDER_ID)));

        // Then
        assertThat(changes.isEmpty()).isTrue();
        assertThat(order.uncommittedChanges()).isEmpty();
    }

    @Test
    void replacing_items_emits_the_minimal_diff() {
        // Given
        order.addItem(OrderItem.of(1001, ORDER_ID));
        order.addItem(OrderItem.of(1002, ORDER_ID));
        order.markChangesAsCommitted();
        var changed = OrderItem.of(1002, ORDER_ID).withDescription("Changed");

        // When
        order.replaceItems(List.of(changed, OrderItem.of(1003, ORDER_ID)));

        // Then
        assertThat(order.takeChanges()).containsExactly(OrderEvent.itemsChanged(DetailEvent.updated(changed)),
                                                        OrderEvent.itemsChanged(DetailEvent.created(OrderItem.of(1003, ORDER_ID))),
                                                        OrderEvent.itemsChanged(DetailEvent.deleted(Id.of(OrderItem.class, 1001L))));
        assertThat(order.itemCount()).isEqualTo(2);
    }

    @Test
    void undo_and_redo_of_a_complete_history_restores_the_order() {
        // Given
        order.addItem(OrderItem.of(1001, ORDER_ID));
        order.updateOrAddItem(OrderItem.of(1001, ORDER_ID).withDescription("Changed"));
        order.addShipment(7, "DHL");
        order.changeCarrier(7, "UPS");
        order.removeItem(Id.of(OrderItem.class, 1001L));
        var undoManager = order.undoManager();

        // When
        var undone = undoManager.undoAll();

        // Then
        assertThat(undone).isEqualTo(8);
        assertThat(order.primary().isPresent()).isFalse();
        assertThat(order.items().isEmpty()).isTrue();
        assertThat(order.shipments().isEmpty()).isTrue();

        // When
        undoManager.redoN(undone);

        // Then
        assertThat(order.itemCount()).isEqualTo(0);
        assertThat(order.items().isEmpty()).isTrue();
        assertThat(order.shipments().byId(Id.of(Shipment.class, 7L)).map(Shipment::carrier)).hasValue("UPS");
    }

    @Test
    void rehydrating_an_order_from_its_events_recreates_the_state() {
        // Given
        order.addItem(OrderItem.of(1001, ORDER_ID));
        order.addShipment(7, "DHL");
        order.changeCarrier(7, "UPS");
        order.addShipment(8, "GLS");
        order.cancelShipment(8);
        var events = order.uncommittedChanges();

        // When
        var rehydrated = new Order(2).rehydrate(events.stream());

        // Then
        assertThat(rehydrated.hasBeenRehydrated()).isTrue();
        assertThat(rehydrated.primary()).isEqualTo(order.primary());
        assertThat(rehydrated.items()).isEqualTo(order.items());
        assertThat(rehydrated.shipments()).isEqualTo(order.shipments());
        assertThat(rehydrated.uncommittedChanges()).isEmpty();
    }

    @Test
    void cancelling_a_shipment_can_be_undone() {
        // Given
        order.addShipment(7, "DHL");
        order.markChangesAsCommitted();

        // When
        var changes = order.cancelShipment(7);

        // Then
        assertThat(changes.redoEvents()).containsExactly(
                OrderEvent.shipmentsChanged(NestedEvent.deleted(Id.of(Shipment.class, 7L),
                                                                PrimaryEvent.deleted(Id.of(ShipmentDetails.class, 7L)))));
        assertThat(order.shipments().isEmpty()).isTrue();

        // When
        order.undoManager().undo();

        // Then
        assertThat(order.shipments().byId(Id.of(Shipment.class, 7L)).map(Shipment::carrier)).hasValue("DHL");
    }

    @Test
    void clearing_items_records_a_single_bulk_item_event() {
        // Given
        order.addItem(OrderItem.of(1001, ORDER_ID));
        order.addItem(OrderItem.of(1002, ORDER_ID));
        order.markChangesAsCommitted();

        // When
        var events = order.clearItems().redoEvents();

        // Then
        assertThat(events).hasSize(2);
        assertThat(events.get(0)).isEqualTo(OrderEvent.itemsChanged(DetailEvent.allDeleted()));
        assertThat(order.items().isEmpty()).isTrue();

        // And the batch isn't optimized since the bulk event doesn't concern a single item
        assertThat(EventOptimizer.optimize(events)).isEqualTo(events);
    }

    @Test
    void optimizing_the_history_of_a_new_order_merges_per_entity() {
        // Given
        var newOrder = Order.create(ORDER_ID, 2)._1;
        newOrder.addItem(OrderItem.of(1001, ORDER_ID));
        newOrder.updateOrAddItem(OrderItem.of(1001, ORDER_ID).withDescription("Changed"));
        newOrder.addItem(OrderItem.of(1002, ORDER_ID));
        newOrder.removeItem(Id.of(OrderItem.class, 1002L));

        // When
        var optimized = EventOptimizer.optimize(newOrder.uncommittedChanges());

        // Then
        assertThat(optimized).containsExactly(OrderEvent.primaryChanged(PrimaryEvent.created(new OrderPrimary(ORDER_ID, 1))),
                                              OrderEvent.itemsChanged(DetailEvent.created(OrderItem.of(1001, ORDER_ID).withDescription("Changed"))));
    }

    @Test
    void clone_redo_streaming_returns_the_same_events_as_undo_redo_streaming() {
        // Given
        var cloneRedoOrder = new Order(2, StreamingMode.CloneRedo);
        var undoRedoOrder  = new Order(2, StreamingMode.UndoRedo);
        List.of(cloneRedoOrder, undoRedoOrder).forEach(anOrder -> {
            anOrder.rehydrate(Order.create(ORDER_ID, 2)._1.uncommittedChanges().stream());
            anOrder.addItem(OrderItem.of(1001, ORDER_ID));
            anOrder.addShipment(7, "DHL");
        });

        // Then
        assertThat(cloneRedoOrder.uncommittedChanges()).isEqualTo(undoRedoOrder.uncommittedChanges());
        assertThat(cloneRedoOrder.uncommittedChanges()).hasSize(3);
    }

    @Test
    void deleting_the_order_makes_the_primary_value_unavailable() {
        // Given
        order.addItem(OrderItem.of(1001, ORDER_ID));

        // When
        order.delete();

        // Then
        assertThat(order.primary().tryGet()).isEmpty();
        assertThatThrownBy(order::itemCount).isExactlyInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> order.primary().delete()).isExactlyInstanceOf(NotFoundException.class);
    }

    @Test
    void a_rolled_back_item_removal_keeps_the_item_order() {
        // Given
        order.addItem(OrderItem.of(1001, ORDER_ID));
        order.addItem(OrderItem.of(1002, ORDER_ID));
        var itemsBefore = order.items().toList();

        // When
        assertThatThrownBy(() -> order.usingChangeScope(scope -> {
            scope.invoke(() -> order.removeItem(Id.of(OrderItem.class, 1001L)));
            scope.invoke(() -> order.addItems(List.of(OrderItem.of(1003, ORDER_ID), OrderItem.of(1004, ORDER_ID))));
        })).isExactlyInstanceOf(ChangeTrackingException.class)
           .hasMessage("Too many");

        // Then
        assertThat(order.items().toList()).isEqualTo(itemsBefore);
        assertThat(order.items().get(0)).isEqualTo(OrderItem.of(1001, ORDER_ID));
        assertThat(order.itemCount()).isEqualTo(2);
    }
}
