package org.rgen.runtime.behavior;

import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.events.EventKind;
import org.rgen.runtime.events.EventPayloads;
import org.rgen.runtime.model.Location;
import org.rgen.runtime.model.MemoryEntry;
import org.rgen.runtime.model.Needs;
import org.rgen.runtime.model.Npc;
import org.rgen.runtime.model.NpcState;
import org.rgen.runtime.model.Weather;
import org.rgen.runtime.spi.IRandomProvider;
import org.rgen.runtime.time.CalendarBoundary;
import org.rgen.runtime.time.ClockSnapshot;
import org.rgen.runtime.time.WorkingHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Per-tick update of NPCs and locations.
 * <p>
 * An NPC first pays its needs for the elapsed minutes and then takes the first applicable state,
 * in priority order: sleeping, eating, working, traveling, then socializing or idle. Locations
 * re-roll their weather on every hour boundary and open or close their market with the default
 * working window.
 * </p>
 * <p>
 * Stateless apart from its configuration; all randomness comes from the context so that a world
 * replays identically from a given seed.
 * </p>
 */
public class BehaviorEngine {

    private static final Logger LOG = LoggerFactory.getLogger(BehaviorEngine.class);

    /** Mood at which the configured socialize chance applies unscaled. */
    private static final double NEUTRAL_MOOD = 50.0;

    private final BehaviorParameters parameters;
    private final ProfessionCatalog professions;
    private final WeatherModel weather;

    public BehaviorEngine(BehaviorParameters parameters, ProfessionCatalog professions, WeatherModel weather) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.professions = Objects.requireNonNull(professions, "professions");
        this.weather = Objects.requireNonNull(weather, "weather");
    }

    public BehaviorParameters getParameters() {
        return parameters;
    }

    public ProfessionCatalog getProfessions() {
        return professions;
    }

    /**
     * Advances one NPC by one tick.
     *
     * @return true if the NPC changed state or location.
     * @throws CorruptDataException if the NPC's location or next travel hop does not resolve.
     */
    public boolean updateNpc(Npc npc, BehaviorContext ctx) throws CorruptDataException {
        Location here = ctx.resolveLocation(npc.getLocationId());
        long delta = ctx.deltaMinutes();
        Needs needs = npc.getNeeds();
        NpcState previous = npc.getState();

        needs.setEnergy(needs.getEnergy() - parameters.energyDecayPerMinute() * delta);
        needs.setHunger(needs.getHunger() + parameters.hungerGrowthPerMinute() * delta);

        NpcState next;
        boolean moved = false;
        if (needs.getEnergy() <= parameters.sleepThreshold()
            || (previous == NpcState.SLEEPING && needs.getEnergy() < parameters.wakeThreshold())) {
            next = NpcState.SLEEPING;
            needs.setEnergy(needs.getEnergy() + parameters.sleepRecoveryPerMinute() * delta);
        } else if (previous == NpcState.SLEEPING) {
            // Woke up this tick.
            next = NpcState.IDLE;
        } else if (needs.getHunger() >= parameters.eatThreshold() && here.isFoodAvailable()) {
            next = NpcState.EATING;
            eat(npc, here, ctx);
        } else {
            if (needs.getHunger() >= parameters.eatThreshold()) {
                goHungry(npc, here, ctx);
            }
            Profession profession = currentProfession(npc, ctx.now());
            if (profession != null && here.getId().equals(npc.getWorkLocationId())) {
                next = NpcState.WORKING;
                work(npc, profession, here, ctx);
            } else if (npc.isTraveling()) {
                next = NpcState.TRAVELING;
                moved = travel(npc, here, ctx);
            } else {
                next = socializeOrIdle(npc, previous, here, ctx);
            }
        }

        npc.setState(next);
        if (next != previous) {
            ctx.emit(EventKind.NPC_STATE_CHANGED, npc.getId(), npc.getLocationId(), EventPayloads.of(
                "from", previous.name(),
                "to", next.name(),
                "energy", needs.getEnergy(),
                "hunger", needs.getHunger()));
        }
        return next != previous || moved;
    }

    /**
     * Returns the first of the NPC's professions whose working window contains the current hour,
     * or null if the NPC has none or none is on duty.
     */
    Profession currentProfession(Npc npc, ClockSnapshot now) {
        for (String name : npc.getProfessions()) {
            Profession profession = professions.resolve(name);
            if (profession.hours().contains(now.hour())) {
                return profession;
            }
        }
        return null;
    }

    private void eat(Npc npc, Location here, BehaviorContext ctx) {
        Needs needs = npc.getNeeds();
        double before = needs.getHunger();
        needs.setHunger(before - parameters.eatHungerReduction());
        npc.remember(new MemoryEntry(ctx.now().totalMinutes(), "ate", parameters.ateMoodImpact(),
            "ate at " + here.getName()));
        ctx.emit(EventKind.NPC_ATE, npc.getId(), here.getId(), EventPayloads.of(
            "hunger_before", before,
            "hunger_after", needs.getHunger()));
    }

    private void goHungry(Npc npc, Location here, BehaviorContext ctx) {
        MemoryEntry last = npc.lastMemory();
        if (last != null && "went_hungry".equals(last.kind())) {
            return;
        }
        npc.remember(new MemoryEntry(ctx.now().totalMinutes(), "went_hungry", parameters.wentHungryMoodImpact(),
            "no food at " + here.getName()));
    }

    private void work(Npc npc, Profession profession, Location here, BehaviorContext ctx) {
        long delta = ctx.deltaMinutes();
        Needs needs = npc.getNeeds();
        needs.setEnergy(needs.getEnergy() - parameters.workEnergyCostPerMinute() * delta);

        List<String> crafts = profession.crafts();
        if (crafts.isEmpty()) {
            return;
        }
        double chance = Math.min(1.0, parameters.craftChancePerMinute() * delta * profession.skill());
        IRandomProvider random = ctx.random();
        if (random.nextDouble() < chance) {
            String item = crafts.get(random.nextInt(crafts.size()));
            npc.remember(new MemoryEntry(ctx.now().totalMinutes(), "crafted", parameters.craftedMoodImpact(), item));
            ctx.emit(EventKind.ITEM_CRAFTED, npc.getId(), here.getId(), EventPayloads.of(
                "item", item,
                "profession", profession.name()));
        }
    }

    private boolean travel(Npc npc, Location here, BehaviorContext ctx) throws CorruptDataException {
        String hop = npc.peekNextHop();
        Location next = ctx.resolveLocation(hop);
        String destination = npc.getTravelDestination();
        npc.pollNextHop();
        ctx.move(npc, here, next);
        ctx.emit(EventKind.LOCATION_EXITED, npc.getId(), here.getId(), EventPayloads.of(
            "location_name", here.getName(),
            "next", next.getId()));
        ctx.emit(EventKind.LOCATION_ENTERED, npc.getId(), next.getId(), EventPayloads.of(
            "location_name", next.getName(),
            "previous", here.getId()));
        if (!npc.isTraveling()) {
            ctx.emit(EventKind.TRAVEL_COMPLETED, npc.getId(), next.getId(), EventPayloads.of(
                "destination", destination));
            LOG.debug("{} arrived at {}", npc.getId(), destination);
        }
        return true;
    }

    private NpcState socializeOrIdle(Npc npc, NpcState previous, Location here, BehaviorContext ctx) {
        List<String> companions = ctx.companionsOf(npc);
        if (companions.isEmpty()) {
            return NpcState.IDLE;
        }
        IRandomProvider random = ctx.random();
        double chance = Math.min(1.0, parameters.socializeChance() * npc.getNeeds().getMood() / NEUTRAL_MOOD);
        if (random.nextDouble() >= chance) {
            return NpcState.IDLE;
        }
        if (previous != NpcState.SOCIALIZING) {
            String partner = companions.get(random.nextInt(companions.size()));
            npc.remember(new MemoryEntry(ctx.now().totalMinutes(), "socialized", parameters.socializedMoodImpact(),
                "talked with " + partner));
            ctx.emit(EventKind.NPC_SOCIALIZED, npc.getId(), here.getId(), EventPayloads.of("partner", partner));
        }
        return NpcState.SOCIALIZING;
    }

    /**
     * Sets the initial weather and market state of a new location without publishing events.
     */
    public void initializeLocation(Location location, ClockSnapshot now, IRandomProvider random) {
        location.setWeather(weather.roll(location.getBiome(), now.season(), random));
        if (location.isMarketCapable()) {
            location.setMarketOpen(WorkingHours.DEFAULT.contains(now.hour()));
        }
    }

    /**
     * Advances one location by one tick.
     *
     * @return true if its weather or market state changed.
     */
    public boolean updateLocation(Location location, BehaviorContext ctx) {
        boolean changed = false;
        ClockSnapshot now = ctx.now();
        if (ctx.crossed(CalendarBoundary.HOUR) > 0 || Weather.UNKNOWN.equals(location.getWeather())) {
            Weather previous = location.getWeather();
            Weather rolled = weather.roll(location.getBiome(), now.season(), ctx.random());
            if (!rolled.equals(previous)) {
                location.setWeather(rolled);
                changed = true;
                if (!rolled.condition().equals(previous.condition())) {
                    ctx.emit(EventKind.WEATHER_CHANGED, location.getId(), location.getId(), EventPayloads.of(
                        "condition", rolled.condition(),
                        "temperature", rolled.temperature(),
                        "previous_condition", previous.condition()));
                }
            }
        }
        if (location.isMarketCapable()) {
            boolean shouldBeOpen = WorkingHours.DEFAULT.contains(now.hour());
            if (shouldBeOpen != location.isMarketOpen()) {
                location.setMarketOpen(shouldBeOpen);
                changed = true;
                ctx.emit(shouldBeOpen ? EventKind.MARKET_OPENED : EventKind.MARKET_CLOSED,
                    location.getId(), location.getId(), EventPayloads.of("location_name", location.getName()));
            }
        }
        return changed;
    }
}
