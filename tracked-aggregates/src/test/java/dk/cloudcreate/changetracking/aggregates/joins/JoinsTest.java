package dk.cloudcreate.changetracking.aggregates.joins;

import dk.cloudcreate.changetracking.aggregates.details.Product;
import dk.cloudcreate.changetracking.common.identity.Id;
import dk.cloudcreate.essentials.shared.functional.tuple.Tuple;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dk.cloudcreate.changetracking.aggregates.details.Product.productId;
import static org.assertj.core.api.Assertions.*;

class JoinsTest {
    private static final List<Product> catalogue = List.of(new Product("apple", "Apple"),
                                                           new Product("banana", "Banana"),
                                                           new Product("cherry", "Cherry"));

    @Test
    void join_pairs_every_reference_with_its_definition() {
        // Given
        var lines = List.of(new ProductLine(1, "apple"),
                            new ProductLine(2, "apple"),
                            new ProductLine(3, "avocado"),
                            new ProductLine(4, "cherry"));

        // When
        var joined = Joins.join(lines, catalogue);

        // Then
        assertThat(joined).containsExactly(Tuple.of(lines.get(0), catalogue.get(0)),
                                           Tuple.of(lines.get(1), catalogue.get(0)),
                                           Tuple.of(lines.get(3), catalogue.get(2)));
    }

    @Test
    void join_of_empty_sides_is_empty() {
        assertThat(Joins.join(List.<ProductLine>of(), catalogue)).isEmpty();
        assertThat(Joins.join(List.of(new ProductLine(1, "apple")), List.<Product>of())).isEmpty();
    }

    @Test
    void join_rejects_unsorted_input() {
        assertThatThrownBy(() -> Joins.join(List.of(new ProductLine(1, "cherry"), new ProductLine(2, "apple")), catalogue))
                .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Joins.join(List.of(new ProductLine(1, "apple")), List.of(catalogue.get(1), catalogue.get(0))))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void referencedBy_resolves_the_definitions_of_many_references() {
        // Given
        ManyReferences<Product> bundle = () -> List.of(productId("banana"), productId("cherry"), productId("durian"));

        // When
        var products = Joins.referencedBy(bundle, catalogue);

        // Then
        assertThat(products).containsExactly(catalogue.get(1), catalogue.get(2));
    }

    private static final class ProductLine implements SingleReference<Product> {
        private final int         lineNumber;
        private final Id<Product> productId;

        private ProductLine(int lineNumber, String productId) {
            this.lineNumber = lineNumber;
            this.productId = productId(productId);
        }

        @Override
        public Id<Product> reference() {
            return productId;
        }

        @Override
        public String toString() {
            return "ProductLine(" + lineNumber + ", " + productId + ")";
        }
    }
}
