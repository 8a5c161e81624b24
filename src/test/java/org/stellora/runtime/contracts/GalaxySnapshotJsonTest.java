package org.stellora.runtime.contracts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.stellora.runtime.explorer.StrategyKind;
import org.stellora.runtime.model.PlanetType;
import org.stellora.runtime.model.RejectionReason;
import org.stellora.runtime.model.ResourceKind;

@Tag("unit")
class GalaxySnapshotJsonTest {

    private static GalaxySnapshot sample() {
        PlanetSnapshot b = new PlanetSnapshot(0, PlanetType.B, Map.of(ResourceKind.WATER, 1), 1, 1, 0, 1,
                Set.of(ResourceKind.HYDROGEN, ResourceKind.OXYGEN), true, ActorStatus.ACTIVE);
        PlanetSnapshot lost = PlanetSnapshot.unknown(1, PlanetType.D);
        ExplorerSnapshot explorer = new ExplorerSnapshot(4, 0, Map.of(ResourceKind.CARBON, 2), 97,
                StrategyKind.BEST_PATH_ADAPTIVE, ResourceKind.AI_PARTNER, true, ActorStatus.ACTIVE, 0,
                RejectionReason.DISCONNECTED);
        ExplorerSnapshot silent = ExplorerSnapshot.unknown(5, null, null);
        return new GalaxySnapshot(12, List.of(b, lost), List.of(explorer, silent), List.of());
    }

    @Test
    void writesEnumsByNameAndOmitsNulls() {
        String json = GalaxySnapshotJson.toJson(sample());

        assertThat(json)
                .contains("\"tick\":12")
                .contains("\"target\":\"AI_PARTNER\"")
                .contains("\"WATER\":1")
                .contains("\"status\":\"UNKNOWN\"")
                .contains("\"lastRejection\":\"DISCONNECTED\"");
        assertThat(json.split("\"lastRejection\"", -1)).hasSize(2);
    }

    @Test
    void readsWhatItWrites() {
        GalaxySnapshot snapshot = sample();

        GalaxySnapshot parsed = GalaxySnapshotJson.fromJson(GalaxySnapshotJson.toPrettyJson(snapshot));

        assertThat(parsed).isEqualTo(snapshot);
        assertThat(parsed.explorer(5).orElseThrow().strategy()).isNull();
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThatThrownBy(() -> GalaxySnapshotJson.fromJson("{\"tick\": \"soon\""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid snapshot document");
        assertThatThrownBy(() -> GalaxySnapshotJson.fromJson(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GalaxySnapshotJson.fromJson("{\"tick\": 3}"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportsMissingOrBrokenMembersAsInvalidDocuments() {
        assertThatThrownBy(() -> GalaxySnapshotJson.fromJson("{\"tick\": 3, \"planets\": [], \"explorers\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("criticalNodes");
        assertThatThrownBy(() -> GalaxySnapshotJson.fromJson(
                "{\"tick\": 3, \"planets\": [null], \"explorers\": [], \"criticalNodes\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid snapshot document");
        assertThatThrownBy(() -> GalaxySnapshotJson.fromJson(
                "{\"tick\": 3, \"planets\": [], \"explorers\": [{\"id\": 1, \"inventory\": {\"GOLD\": 1}}],"
                        + " \"criticalNodes\": []}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("GOLD");
        assertThatThrownBy(() -> GalaxySnapshotJson.fromJson("[1, 2]"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readsMinimalDocument() {
        GalaxySnapshot snapshot = GalaxySnapshotJson.fromJson(
                "{\"tick\": 3, \"planets\": [], \"explorers\": [], \"criticalNodes\": [2]}");

        assertThat(snapshot.tick()).isEqualTo(3);
        assertThat(snapshot.criticalNodes()).containsExactly(2);
        assertThat(snapshot.planets()).isEmpty();
    }
}
