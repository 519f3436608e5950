package org.rgen.generation;

import org.rgen.runtime.SimulationParameters;
import org.rgen.runtime.World;
import org.rgen.runtime.model.NpcView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TemplateContentGeneratorTest {

    private final TemplateContentGenerator generator = new TemplateContentGenerator();

    @Test
    @DisplayName("The same request always yields the same world")
    void generateWorld_isDeterministic() {
        GenerationRequest request = new GenerationRequest(42, 8, 20, "Eldermoor");

        GeneratedWorld first = generator.generateWorld(request);
        GeneratedWorld second = new TemplateContentGenerator().generateWorld(request);

        assertThat(first).isEqualTo(second);
        assertThat(generator.generateWorld(new GenerationRequest(43, 8, 20, "Eldermoor")))
            .isNotEqualTo(first);
    }

    @Test
    @DisplayName("Generated worlds have the requested counts and start with a town")
    void generateWorld_honorsCounts() {
        GeneratedWorld world = generator.generateWorld(new GenerationRequest(7, 6, 15, "Vale"));

        assertThat(world.worldName()).isEqualTo("Vale");
        assertThat(world.locations()).hasSize(6);
        assertThat(world.npcs()).hasSize(15);
        assertThat(world.locations().get(0).getString("id")).isEqualTo("town_1");
        assertThat(world.locations()).extracting(r -> r.getString("id")).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Every location is reachable and connections are mutual")
    void generateWorld_isConnected() {
        GeneratedWorld world = generator.generateWorld(new GenerationRequest(99, 12, 0, "Reach"));
        Map<String, List<String>> graph = new HashMap<>();
        for (DescriptiveRecord location : world.locations()) {
            graph.put(location.getString("id"), location.getStringList("connections"));
        }

        graph.forEach((id, neighbours) -> assertThat(neighbours).allSatisfy(n -> {
            assertThat(graph).containsKey(n);
            assertThat(graph.get(n)).contains(id);
        }));

        Set<String> seen = new HashSet<>();
        ArrayDeque<String> queue = new ArrayDeque<>(List.of("town_1"));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (seen.add(current)) {
                queue.addAll(graph.get(current));
            }
        }
        assertThat(seen).isEqualTo(graph.keySet());
    }

    @Test
    @DisplayName("NPC records reference generated locations and carry initial needs in range")
    void generateWorld_npcRecords() {
        GeneratedWorld world = generator.generateWorld(new GenerationRequest(5, 5, 30, "Hollow"));
        Set<String> locationIds = new HashSet<>();
        world.locations().forEach(l -> locationIds.add(l.getString("id")));

        assertThat(world.npcs()).allSatisfy(npc -> {
            assertThat(npc.has("id")).isFalse();
            assertThat(locationIds).contains(npc.getString("location"));
            assertThat(npc.getString("name")).contains(" ");
            DescriptiveRecord needs = npc.getRecord("needs");
            assertThat(needs.getDouble("energy", -1)).isBetween(60.0, 100.0);
            assertThat(needs.getDouble("hunger", -1)).isBetween(0.0, 30.0);
        });
    }

    @Test
    @DisplayName("Spawned NPCs honor the requested race and professions")
    void generateNpc_honorsRequest() {
        DescriptiveRecord npc = generator.generateNpc(
            new NpcRequest(1, "forge_1", "forge", List.of("blacksmith"), "dwarf", 3));

        assertThat(npc.getString("race")).isEqualTo("dwarf");
        assertThat(npc.getStringList("professions")).containsExactly("blacksmith");
        assertThat(npc.getString("location")).isEqualTo("forge_1");
        assertThat(generator.generateNpc(new NpcRequest(1, "forge_1", "forge", List.of("blacksmith"), "dwarf", 3)))
            .isEqualTo(npc);
    }

    @Test
    @DisplayName("Spawned NPCs without professions get ones fitting the location type")
    void generateNpc_picksProfessionsFromLocationType() {
        DescriptiveRecord npc = generator.generateNpc(new NpcRequest(1, "mine_1", "mine", List.of(), null, 1));
        DescriptiveRecord unknownType = generator.generateNpc(new NpcRequest(1, "void_1", "void", List.of(), "gnome", 1));

        assertThat(npc.getStringList("professions")).isNotEmpty();
        assertThat(unknownType.getStringList("professions")).isEmpty();
        assertThat(unknownType.getString("race")).isEqualTo("gnome");
    }

    @Test
    @DisplayName("Templates are validated when loaded")
    void fromJson_rejectsInvalidTemplates() {
        assertThatThrownBy(() -> TemplateContentGenerator.fromJson("")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TemplateContentGenerator.fromJson("{ races: ["))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TemplateContentGenerator(TemplateContentGenerator.fromJson("{ \"races\": [] }")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no races");
        assertThatThrownBy(() -> TemplateContentGenerator.fromResource("org/rgen/generation/missing.json"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A generated world builds into a consistent running world")
    void createNew_fromGeneratedContent() throws Exception {
        SimulationParameters parameters = SimulationParameters.defaults();
        World world = World.createNew(new GenerationRequest(2024, 7, 12, "Brightwater"), generator,
            new EntityFactory(parameters.behavior()), parameters);

        assertThat(world.getSummary().activeLocations()).isEqualTo(7);
        assertThat(world.getSummary().activeNpcs()).isEqualTo(12);
        List<String> npcIds = world.getActiveEntityIds().subList(7, 19);
        assertThat(npcIds).allSatisfy(id -> assertThat(id).startsWith("npc_"));
        for (String id : npcIds) {
            NpcView npc = world.getNpc(id);
            assertThat(world.getLocation(npc.locationId()).npcIds()).contains(id);
        }
        world.tick(600);
    }
}
