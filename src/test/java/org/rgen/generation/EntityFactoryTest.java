package org.rgen.generation;

import org.rgen.runtime.SimulationParameters;
import org.rgen.runtime.model.Location;
import org.rgen.runtime.model.Npc;
import org.rgen.runtime.model.NpcState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EntityFactoryTest {

    private final EntityFactory factory = new EntityFactory(SimulationParameters.defaults().behavior());

    @Test
    @DisplayName("Location records fill in defaults and derive market capability from the type")
    void createLocation_appliesDefaults() {
        Location minimal = factory.createLocation(new DescriptiveRecord(Map.of("id", "camp_1")), 480);
        Location market = factory.createLocation(new DescriptiveRecord(Map.of(
            "id", "market_1", "type", "market", "has_food", true,
            "connections", List.of("town_1"), "tags", List.of("stalls"))), 480);
        Location closedTown = factory.createLocation(new DescriptiveRecord(Map.of(
            "id", "town_1", "type", "town", "market", false)), 480);

        assertThat(minimal.getName()).isEqualTo("camp_1");
        assertThat(minimal.getType()).isEqualTo("unknown");
        assertThat(minimal.getBiome()).isEqualTo("temperate");
        assertThat(minimal.getConnections()).isEmpty();
        assertThat(minimal.isMarketCapable()).isFalse();
        assertThat(minimal.getCreatedAtMinute()).isEqualTo(480);

        assertThat(market.isMarketCapable()).isTrue();
        assertThat(market.isFoodAvailable()).isTrue();
        assertThat(market.getConnections()).containsExactly("town_1");
        assertThat(closedTown.isMarketCapable()).isFalse();
    }

    @Test
    @DisplayName("A location record without an id is rejected")
    void createLocation_requiresId() {
        assertThatThrownBy(() -> factory.createLocation(new DescriptiveRecord(Map.of("name", "Nowhere")), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("NPC records carry needs, professions and locations")
    void createNpc_readsRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("name", "Durgan Ironfist");
        record.put("race", "dwarf");
        record.put("title", "Master Smith");
        record.put("professions", List.of("blacksmith"));
        record.put("location", "tavern_1");
        record.put("work_location", "forge_1");
        record.put("needs", Map.of("energy", 75.5, "hunger", 12));

        Npc npc = factory.createNpc("npc_4", new DescriptiveRecord(record), 600);

        assertThat(npc.getId()).isEqualTo("npc_4");
        assertThat(npc.getName()).isEqualTo("Durgan Ironfist");
        assertThat(npc.getRace()).isEqualTo("dwarf");
        assertThat(npc.getProfessions()).containsExactly("blacksmith");
        assertThat(npc.getNeeds().getEnergy()).isEqualTo(75.5);
        assertThat(npc.getNeeds().getHunger()).isEqualTo(12.0);
        assertThat(npc.getNeeds().getMood()).isEqualTo(50.0);
        assertThat(npc.getLocationId()).isEqualTo("tavern_1");
        assertThat(npc.getWorkLocationId()).isEqualTo("forge_1");
        assertThat(npc.getState()).isEqualTo(NpcState.IDLE);
        assertThat(npc.getMemoryCapacity()).isEqualTo(20);
    }

    @Test
    @DisplayName("A sparse NPC record gets default race, needs and work location")
    void createNpc_appliesDefaults() {
        Npc npc = factory.createNpc("npc_1", new DescriptiveRecord(Map.of("location", "town_1")), 480);

        assertThat(npc.getName()).isEqualTo("npc_1");
        assertThat(npc.getRace()).isEqualTo("human");
        assertThat(npc.getTitle()).isEmpty();
        assertThat(npc.getProfessions()).isEmpty();
        assertThat(npc.getNeeds().getEnergy()).isEqualTo(100.0);
        assertThat(npc.getNeeds().getHunger()).isEqualTo(0.0);
        assertThat(npc.getWorkLocationId()).isEqualTo("town_1");
    }

    @Test
    @DisplayName("Typed accessors reject values of the wrong type")
    void descriptiveRecord_typedAccess() {
        DescriptiveRecord record = new DescriptiveRecord(Map.of("id", 5, "tags", "not-a-list", "needs", 3));

        assertThatThrownBy(() -> record.getString("id")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> record.getString("missing")).isInstanceOf(IllegalArgumentException.class);
        assertThat(record.getString("missing", "fallback")).isEqualTo("fallback");
        assertThat(record.with("id", "x").getString("id")).isEqualTo("x");
        assertThatThrownBy(() -> record.getStringList("tags")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> record.getRecord("needs")).isInstanceOf(IllegalArgumentException.class);
        assertThat(record.getRecord("absent").asMap()).isEmpty();
    }
}
