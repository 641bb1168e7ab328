package dk.cloudcreate.changetracking.aggregates.primary;

import dk.cloudcreate.changetracking.aggregates.details.Product;
import dk.cloudcreate.changetracking.changes.Change;
import dk.cloudcreate.changetracking.common.*;
import org.junit.jupiter.api.Test;

import static dk.cloudcreate.changetracking.aggregates.details.Product.productId;
import static org.assertj.core.api.Assertions.*;

class PrimaryTest {
    @Test
    void of_returns_the_primary_together_with_its_creation_change() {
        // When
        var created = Primary.of(new Product("p-1", "Pen"));

        // Then
        assertThat(created._1.get()).isEqualTo(new Product("p-1", "Pen"));
        assertThat(created._2.toList()).containsExactly(Change.of(PrimaryEvent.created(new Product("p-1", "Pen")),
                                                                  PrimaryEvent.deleted(productId("p-1"))));
    }

    @Test
    void set_emits_updated_with_the_previous_value_as_undo() {
        // Given
        var primary = Primary.of(new Product("p-1", "Pen"))._1;

        // When
        var changes = primary.set(new Product("p-1", "Pencil"));

        // Then
        assertThat(changes.toList()).containsExactly(Change.of(PrimaryEvent.updated(new Product("p-1", "Pencil")),
                                                               PrimaryEvent.updated(new Product("p-1", "Pen"))));
        assertThat(primary.set(new Product("p-1", "Pencil")).isEmpty()).isTrue();
    }

    @Test
    void update_applies_the_modifier_to_the_current_value() {
        // Given
        var primary = Primary.of(new Product("p-1", "Pen"))._1;

        // When
        primary.update(current -> new Product("p-1", current.name + "cil"));

        // Then
        assertThat(primary.get().name).isEqualTo("Pencil");
    }

    @Test
    void a_deleted_value_is_unavailable_until_the_deletion_is_reverted() {
        // Given
        var primary = Primary.of(new Product("p-1", "Pen"))._1;

        // When
        var changes = primary.delete();

        // Then
        assertThat(primary.tryGet()).isEmpty();
        assertThat(primary.tryGetId()).isEmpty();
        assertThatThrownBy(primary::get).isExactlyInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> primary.set(new Product("p-1", "Pencil"))).isExactlyInstanceOf(NotFoundException.class);
        assertThatThrownBy(primary::delete).isExactlyInstanceOf(NotFoundException.class);

        // When
        changes.undoEvents().forEach(primary::apply);

        // Then
        assertThat(primary.tryGetId()).hasValue(productId("p-1"));
    }

    @Test
    void create_on_a_present_value_fails() {
        var primary = Primary.of(new Product("p-1", "Pen"))._1;

        assertThatThrownBy(() -> primary.create(new Product("p-2", "Paper")))
                .isExactlyInstanceOf(AlreadyExistsException.class);
    }

    @Test
    void set_requires_the_same_identity() {
        var primary = Primary.of(new Product("p-1", "Pen"))._1;

        assertThatThrownBy(() -> primary.set(new Product("p-2", "Paper")))
                .isInstanceOf(RuntimeException.class);
        assertThat(primary.get()).isEqualTo(new Product("p-1", "Pen"));
    }

    @Test
    void updating_an_empty_primary_is_fatal() {
        var primary = Primary.<Product>empty();

        assertThatThrownBy(() -> primary.apply(PrimaryEvent.updated(new Product("p-1", "Pen"))))
                .isExactlyInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> primary.apply(PrimaryEvent.deleted(productId("p-1"))))
                .isExactlyInstanceOf(IllegalStateException.class);
    }
}
