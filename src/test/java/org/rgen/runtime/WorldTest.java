package org.rgen.runtime;

import org.rgen.junit.extensions.logging.AllowLog;
import org.rgen.junit.extensions.logging.ExpectLog;
import org.rgen.junit.extensions.logging.LogLevel;
import org.rgen.junit.extensions.logging.LogWatchExtension;
import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.api.EntityNotFoundException;
import org.rgen.runtime.events.EventKind;
import org.rgen.runtime.events.WorldEvent;
import org.rgen.runtime.model.LocationView;
import org.rgen.runtime.model.NpcState;
import org.rgen.runtime.model.NpcView;
import org.rgen.runtime.time.ClockSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.rgen.runtime.TestWorlds.location;
import static org.rgen.runtime.TestWorlds.npc;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class WorldTest {

    @Test
    @DisplayName("createNew registers generated entities and starts on day 1 at 08:00")
    void createNew_registersEntitiesAndStartsClock() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());

        ClockSnapshot clock = world.getClock();
        assertThat(clock.year()).isEqualTo(1L);
        assertThat(clock.dayOfYear()).isEqualTo(1);
        assertThat(clock.timeString()).isEqualTo("08:00");
        assertThat(world.getActiveEntityIds()).containsExactly("forge_1", "tavern_1", "market_1", "smith_1");
        assertThat(world.getNpcsAt("forge_1")).extracting(NpcView::id).containsExactly("smith_1");

        List<WorldEvent> events = world.recentEvents(10);
        assertThat(events).hasSize(1);
        assertThat(events.get(0).sequence()).isEqualTo(1);
        assertThat(events.get(0).kind()).isEqualTo(EventKind.WORLD_CREATED);
        assertThat(events.get(0).get("npcs")).isEqualTo(1L);

        LocationView market = world.getLocation("market_1");
        assertThat(market.marketCapable()).isTrue();
        assertThat(market.marketOpen()).isTrue();
        assertThat(market.weather().condition()).isNotEqualTo("unknown");
    }

    @Test
    @DisplayName("createNew rejects connections to unknown locations")
    void createNew_rejectsDanglingConnection() {
        TestWorlds.Builder builder = new TestWorlds.Builder()
            .location(location("forge_1", "forge", false, "nowhere_1"));

        assertThatThrownBy(() -> TestWorlds.create(builder))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nowhere_1");
    }

    @Test
    @DisplayName("tick rejects zero and negative lengths without advancing")
    void tick_rejectsNonPositiveLength() {
        World world = TestWorlds.create(TestWorlds.standard());

        assertThatThrownBy(() -> world.tick(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> world.tick(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(world.getClock().totalMinutes()).isEqualTo(480);
        assertThat(world.getTickCount()).isZero();
    }

    @Test
    @DisplayName("A blacksmith at the forge during working hours starts working and spends energy")
    void tick_blacksmithWorksDuringWorkingHours() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());

        TickResult result = world.tick(60);

        NpcView smith = world.getNpc("smith_1");
        assertThat(smith.state()).isEqualTo(NpcState.WORKING);
        // 50 - 60 * 0.05 decay - 60 * 0.1 work cost
        assertThat(smith.energy()).isCloseTo(41.0, within(1e-9));
        assertThat(smith.hunger()).isCloseTo(16.0, within(1e-9));
        assertThat(result.tickNumber()).isEqualTo(1);
        assertThat(result.clock().timeString()).isEqualTo("09:00");
        assertThat(world.getEventBus().byKind(EventKind.NPC_STATE_CHANGED))
            .anySatisfy(event -> {
                assertThat(event.sourceId()).isEqualTo("smith_1");
                assertThat(event.get("to")).isEqualTo("WORKING");
            });
        assertThat(world.getEventBus().byKind(EventKind.ITEM_CRAFTED))
            .allSatisfy(event -> assertThat(event.get("profession")).isEqualTo("blacksmith"));
    }

    @Test
    @DisplayName("tick publishes one calendar event per boundary kind with the crossing count")
    void tick_publishesCalendarEvents() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());

        world.tick(24 * 60);

        WorldEvent hours = world.getEventBus().byKind(EventKind.HOUR_PASSED).get(0);
        WorldEvent days = world.getEventBus().byKind(EventKind.DAY_PASSED).get(0);
        assertThat(hours.get("count")).isEqualTo(24L);
        assertThat(days.get("count")).isEqualTo(1L);
        assertThat(days.get("day_of_year")).isEqualTo(2L);
        assertThat(world.getEventBus().byKind(EventKind.SEASON_CHANGED)).isEmpty();
    }

    @Test
    @DisplayName("spawnNpc creates an NPC at the location with the requested professions")
    void spawnNpc_createsNpcAtLocation() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());

        NpcView spawned = world.spawnNpc("tavern_1", List.of("innkeeper", "farmer"));

        NpcView fetched = (NpcView) world.getEntity(spawned.id());
        assertThat(fetched.id()).isEqualTo("npc_1");
        assertThat(fetched.locationId()).isEqualTo("tavern_1");
        assertThat(fetched.workLocationId()).isEqualTo("tavern_1");
        assertThat(fetched.professions()).containsExactly("innkeeper", "farmer");
        assertThat(fetched.race()).isEqualTo("dwarf");
        assertThat(world.getLocation("tavern_1").npcIds()).contains("npc_1");

        WorldEvent event = world.recentEvents(1).get(0);
        assertThat(event.kind()).isEqualTo(EventKind.NPC_SPAWNED);
        assertThat(event.sourceId()).isEqualTo("npc_1");
        assertThat(event.locationId()).isEqualTo("tavern_1");

        TestWorlds.StubGenerator generator = (TestWorlds.StubGenerator) world.getGenerator();
        assertThat(generator.getNpcRequests()).singleElement()
            .satisfies(request -> assertThat(request.locationType()).isEqualTo("tavern"));
    }

    @Test
    @DisplayName("spawnNpc honors an explicit race and mints increasing ids")
    void spawnNpc_honorsRaceAndMintsIds() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());

        NpcView first = world.spawnNpc("forge_1", List.of(), "elf");
        NpcView second = world.spawnNpc("forge_1", List.of("blacksmith"));

        assertThat(first.race()).isEqualTo("elf");
        assertThat(first.professions()).isEmpty();
        assertThat(second.id()).isEqualTo("npc_2");
    }

    @Test
    @DisplayName("spawnNpc at an unknown location fails without creating anything or publishing")
    void spawnNpc_unknownLocationIsNotFound() {
        World world = TestWorlds.create(TestWorlds.standard());
        List<String> idsBefore = world.getActiveEntityIds();
        long publishedBefore = world.getEventBus().getTotalPublished();

        assertThatThrownBy(() -> world.spawnNpc("unknown_loc", List.of("blacksmith")))
            .isInstanceOf(EntityNotFoundException.class)
            .satisfies(e -> assertThat(((EntityNotFoundException) e).getEntityId()).isEqualTo("unknown_loc"));

        assertThat(world.getActiveEntityIds()).isEqualTo(idsBefore);
        assertThat(world.getEventBus().getTotalPublished()).isEqualTo(publishedBefore);
        assertThat(((TestWorlds.StubGenerator) world.getGenerator()).getNpcRequests()).isEmpty();
    }

    @Test
    @DisplayName("spawnNpc rejects blank professions and spawning at an NPC id")
    void spawnNpc_rejectsMalformedRequests() {
        World world = TestWorlds.create(TestWorlds.standard());

        assertThatThrownBy(() -> world.spawnNpc("forge_1", List.of(" ")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> world.spawnNpc("smith_1", List.of()))
            .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    @DisplayName("removeEntity soft-deletes the NPC and keeps the removal in history")
    void removeEntity_softDeletes() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());

        assertThat(world.removeEntity("smith_1")).isTrue();

        assertThatThrownBy(() -> world.getEntity("smith_1")).isInstanceOf(EntityNotFoundException.class);
        assertThat(world.getLocation("forge_1").npcIds()).doesNotContain("smith_1");
        assertThat(world.getEventBus().byKind(EventKind.ENTITY_REMOVED))
            .singleElement()
            .satisfies(event -> assertThat(event.sourceId()).isEqualTo("smith_1"));
        assertThat(world.removeEntity("smith_1")).isFalse();
        assertThat(world.getSummary().inactiveEntities()).isEqualTo(1);
        assertThatThrownBy(() -> world.removeEntity("ghost_1")).isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    @DisplayName("requestTravel moves the NPC one hop per tick along the shortest path")
    void requestTravel_movesOneHopPerTick() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard()
            .npc(npc("wanderer_1", "forge_1", 100, 0)));

        assertThat(world.requestTravel("wanderer_1", "market_1")).isTrue();
        assertThat(world.getNpc("wanderer_1").travelPath()).containsExactly("tavern_1", "market_1");

        world.tick(1);
        NpcView midway = world.getNpc("wanderer_1");
        assertThat(midway.state()).isEqualTo(NpcState.TRAVELING);
        assertThat(midway.locationId()).isEqualTo("tavern_1");
        assertThat(world.getLocation("forge_1").npcIds()).doesNotContain("wanderer_1");
        assertThat(world.getLocation("tavern_1").npcIds()).contains("wanderer_1");

        world.tick(1);
        NpcView arrived = world.getNpc("wanderer_1");
        assertThat(arrived.locationId()).isEqualTo("market_1");
        assertThat(arrived.travelPath()).isEmpty();
        assertThat(world.getEventBus().byKind(EventKind.TRAVEL_COMPLETED))
            .singleElement()
            .satisfies(event -> assertThat(event.get("destination")).isEqualTo("market_1"));
        assertThat(world.getEventBus().bySource("wanderer_1"))
            .extracting(WorldEvent::kind)
            .containsSubsequence(EventKind.TRAVEL_STARTED, EventKind.LOCATION_EXITED, EventKind.LOCATION_ENTERED,
                EventKind.LOCATION_EXITED, EventKind.LOCATION_ENTERED, EventKind.TRAVEL_COMPLETED);
    }

    @Test
    @DisplayName("requestTravel returns false at the destination and fails when unreachable")
    void requestTravel_handlesTrivialAndUnreachableDestinations() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard()
            .location(location("island_1", "wilderness", false)));

        assertThat(world.requestTravel("smith_1", "forge_1")).isFalse();
        assertThatThrownBy(() -> world.requestTravel("smith_1", "island_1"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not reachable");
        assertThatThrownBy(() -> world.requestTravel("smith_1", "atlantis_1"))
            .isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    @DisplayName("A removed location referenced by an NPC halts the world on the next tick")
    @AllowLog(level = LogLevel.ERROR, loggerPattern = ".*World", messagePattern = ".*halted.*")
    void tick_brokenReferenceHaltsWorld() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());
        world.removeEntity("forge_1");

        assertThatThrownBy(() -> world.tick(10)).isInstanceOf(CorruptDataException.class);

        assertThat(world.isHalted()).isTrue();
        assertThat(world.getSummary().halted()).isTrue();
        WorldEvent error = world.recentEvents(1).get(0);
        assertThat(error.kind()).isEqualTo(EventKind.ERROR);
        assertThat(error.get("error_type")).isEqualTo("INTEGRITY_VIOLATION");
        assertThat(world.getOperationalErrors()).extracting(e -> e.errorType()).contains("INTEGRITY_VIOLATION");
        assertThatThrownBy(() -> world.tick(10)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> world.spawnNpc("tavern_1", List.of())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("A failing listener becomes an ERROR event and the tick completes")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*EventBus", messagePattern = ".*failed on event.*")
    void tick_listenerFailureIsIsolated() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());
        List<WorldEvent> seen = new ArrayList<>();
        world.getEventBus().subscribe(EventKind.NPC_STATE_CHANGED, event -> {
            throw new IllegalStateException("listener broke");
        });
        world.getEventBus().subscribe(EventKind.NPC_STATE_CHANGED, seen::add);

        world.tick(60);

        assertThat(seen).hasSize(1);
        assertThat(world.getNpc("smith_1").state()).isEqualTo(NpcState.WORKING);
        assertThat(world.getEventBus().byKind(EventKind.ERROR))
            .singleElement()
            .satisfies(event -> {
                assertThat(event.get("error_type")).isEqualTo("LISTENER_FAILURE");
                assertThat(event.get("message")).isEqualTo("listener broke");
            });
    }

    @Test
    @DisplayName("A failing scheduled callback is reported as an ERROR event without stopping the tick")
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*WorldClock", messagePattern = ".*failed.*")
    void tick_callbackFailureIsReported() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());
        List<Long> fired = new ArrayList<>();
        world.schedule(5, (minute, clock) -> {
            throw new IllegalStateException("boom");
        });
        world.schedule(6, (minute, clock) -> fired.add(minute));

        world.tick(10);

        assertThat(fired).containsExactly(486L);
        assertThat(world.getEventBus().byKind(EventKind.ERROR))
            .singleElement()
            .satisfies(event -> {
                assertThat(event.get("error_type")).isEqualTo("CALLBACK_FAILURE");
                assertThat(event.get("trigger_minute")).isEqualTo(485L);
            });
        assertThat(world.getOperationalErrors()).hasSize(1);
    }

    @Test
    @DisplayName("Two worlds built from the same seed evolve identically")
    void tick_isDeterministicForSameSeed() throws Exception {
        World first = TestWorlds.create(TestWorlds.standard().npc(npc("cook_1", "tavern_1", 70, 55, "innkeeper")));
        World second = TestWorlds.create(TestWorlds.standard().npc(npc("cook_1", "tavern_1", 70, 55, "innkeeper")));

        for (int i = 0; i < 60; i++) {
            first.tick(30);
            second.tick(30);
        }

        assertThat(first.recentEvents(1000)).isEqualTo(second.recentEvents(1000));
        assertThat(first.getNpc("cook_1")).isEqualTo(second.getNpc("cook_1"));
        assertThat(first.getLocation("tavern_1")).isEqualTo(second.getLocation("tavern_1"));
    }

    @Test
    @DisplayName("Clock fields stay in calendar range over long runs")
    void tick_keepsClockInRange() throws Exception {
        World world = TestWorlds.create(TestWorlds.standard());
        long previous = world.getClock().totalMinutes();

        for (int i = 0; i < 200; i++) {
            world.tick(997);
            ClockSnapshot clock = world.getClock();
            assertThat(clock.totalMinutes()).isGreaterThan(previous);
            assertThat(clock.month()).isBetween(1, 12);
            assertThat(clock.dayOfMonth()).isBetween(1, 30);
            assertThat(clock.hour()).isBetween(0, 23);
            assertThat(clock.minute()).isBetween(0, 59);
            previous = clock.totalMinutes();
        }
        assertThat(world.getEventBus().byKind(EventKind.SEASON_CHANGED)).isNotEmpty();
    }
}
