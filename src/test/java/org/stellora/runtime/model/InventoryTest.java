package org.stellora.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class InventoryTest {

    @Test
    void ignoresNonPositiveInitialCounts() {
        Inventory inventory = new Inventory(Map.of(ResourceKind.CARBON, 2, ResourceKind.WATER, 0,
                ResourceKind.LIFE, -3));

        assertThat(inventory.toMap()).containsOnly(Map.entry(ResourceKind.CARBON, 2));
        assertThat(inventory.total()).isEqualTo(2);
    }

    @Test
    void pairOfSameKindNeedsTwoUnits() {
        Inventory inventory = new Inventory();
        inventory.add(ResourceKind.CARBON);

        assertThat(inventory.containsPair(ResourceKind.CARBON, ResourceKind.CARBON)).isFalse();
        inventory.add(ResourceKind.CARBON);
        assertThat(inventory.containsPair(ResourceKind.CARBON, ResourceKind.CARBON)).isTrue();
        assertThat(inventory.containsPair(ResourceKind.CARBON, ResourceKind.WATER)).isFalse();
    }

    @Test
    void removingLastUnitDropsTheKind() {
        Inventory inventory = new Inventory(Map.of(ResourceKind.SILICON, 1));

        assertThat(inventory.remove(ResourceKind.SILICON)).isTrue();
        assertThat(inventory.remove(ResourceKind.SILICON)).isFalse();
        assertThat(inventory.isEmpty()).isTrue();
        assertThat(inventory.toMap()).isEmpty();
        assertThatThrownBy(() -> inventory.add(ResourceKind.SILICON, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void energyCellsStayWithinCapacity() {
        EnergyCells cells = new EnergyCells(3, 10);
        assertThat(cells.getCharged()).isEqualTo(3);

        assertThat(cells.discharge()).isTrue();
        cells.destroy(5);
        assertThat(cells.hasCharge()).isFalse();
        assertThat(cells.discharge()).isFalse();
        cells.charge(1);
        assertThat(cells.getCharged()).isEqualTo(1);
    }
}
