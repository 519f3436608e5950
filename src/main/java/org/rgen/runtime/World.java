package org.rgen.runtime;

import org.rgen.generation.DescriptiveRecord;
import org.rgen.generation.GeneratedWorld;
import org.rgen.generation.GenerationRequest;
import org.rgen.generation.IContentGenerator;
import org.rgen.generation.IEntityFactory;
import org.rgen.generation.NpcRequest;
import org.rgen.runtime.api.CorruptDataException;
import org.rgen.runtime.api.EntityNotFoundException;
import org.rgen.runtime.api.OperationalError;
import org.rgen.runtime.behavior.BehaviorContext;
import org.rgen.runtime.behavior.BehaviorEngine;
import org.rgen.runtime.events.EventBus;
import org.rgen.runtime.events.EventKind;
import org.rgen.runtime.events.EventPayloads;
import org.rgen.runtime.events.WorldEvent;
import org.rgen.runtime.internal.services.SeededRandomProvider;
import org.rgen.runtime.model.Entity;
import org.rgen.runtime.model.EntityView;
import org.rgen.runtime.model.Location;
import org.rgen.runtime.model.LocationView;
import org.rgen.runtime.model.Needs;
import org.rgen.runtime.model.Npc;
import org.rgen.runtime.model.NpcView;
import org.rgen.runtime.spi.IRandomProvider;
import org.rgen.runtime.time.AdvanceResult;
import org.rgen.runtime.time.CalendarBoundary;
import org.rgen.runtime.time.CallbackFailure;
import org.rgen.runtime.time.ClockSnapshot;
import org.rgen.runtime.time.IClockCallback;
import org.rgen.runtime.time.ScheduledTask;
import org.rgen.runtime.time.WorldClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The living world: owns the clock, the event bus, the random provider and every entity, and is
 * the only mutator of entity state.
 * <p>
 * Entities are kept in registration order, which is also the order in which {@link #tick(long)}
 * updates them. Removal is a soft delete; ids stay reserved for the life of the world.
 * </p>
 * <p>
 * A world is driven by exactly one thread at a time. Hosts with several threads must serialize
 * every call.
 * </p>
 */
public class World {

    private static final Logger LOG = LoggerFactory.getLogger(World.class);

    private static final String NPC_ID_PREFIX = "npc_";
    private static final int MAX_OPERATIONAL_ERRORS = 100;

    private final String name;
    private final long seed;
    private final SimulationParameters parameters;
    private final IContentGenerator generator;
    private final IEntityFactory factory;
    private final WorldClock clock;
    private final EventBus events;
    private final SeededRandomProvider random;
    private final BehaviorEngine behavior;
    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final Deque<OperationalError> errors = new ArrayDeque<>();

    private long nextNpcNumber = 1;
    private long tickCount;
    private boolean halted;
    private String haltReason;

    private World(String name, long seed, long clockMinutes, SimulationParameters parameters,
                  IContentGenerator generator, IEntityFactory factory) {
        this.name = name;
        this.seed = seed;
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.clock = new WorldClock(clockMinutes);
        this.events = new EventBus(parameters.historyCapacity(), clock::getTotalMinutes);
        this.random = new SeededRandomProvider(seed);
        this.behavior = new BehaviorEngine(parameters.behavior(), parameters.professions(), parameters.weather());
    }

    /**
     * Builds a new world from generated content. Locations are registered first, then each
     * location's NPCs, both in generator order. The clock starts at Year 1, Day 1, 08:00.
     *
     * @throws IllegalArgumentException if the generated content is inconsistent (duplicate ids,
     *                                  unknown connection or location references).
     */
    public static World createNew(GenerationRequest request, IContentGenerator generator, IEntityFactory factory,
                                  SimulationParameters parameters) {
        Objects.requireNonNull(request, "request");
        GeneratedWorld generated = generator.generateWorld(request);
        World world = new World(request.worldName(), request.seed(), WorldClock.START_MINUTE, parameters,
            generator, factory);
        long now = world.clock.getTotalMinutes();

        List<Location> locations = new ArrayList<>();
        for (DescriptiveRecord record : generated.locations()) {
            Location location = factory.createLocation(record, now);
            world.register(location);
            locations.add(location);
        }
        for (Location location : locations) {
            for (String connection : location.getConnections()) {
                if (!(world.entities.get(connection) instanceof Location)) {
                    throw new IllegalArgumentException("Location '" + location.getId()
                        + "' connects to unknown location '" + connection + "'");
                }
            }
        }

        Map<String, List<DescriptiveRecord>> npcsByLocation = new HashMap<>();
        for (DescriptiveRecord record : generated.npcs()) {
            String locationId = record.getString("location");
            if (!(world.entities.get(locationId) instanceof Location)) {
                throw new IllegalArgumentException("Generated NPC references unknown location '" + locationId + "'");
            }
            npcsByLocation.computeIfAbsent(locationId, k -> new ArrayList<>()).add(record);
        }
        int npcCount = 0;
        for (Location location : locations) {
            for (DescriptiveRecord record : npcsByLocation.getOrDefault(location.getId(), List.of())) {
                String id = record.has("id") ? record.getString("id") : world.mintNpcId();
                Npc npc = factory.createNpc(id, record, now);
                npc.setLocationId(location.getId());
                if (npc.getWorkLocationId() == null) {
                    npc.setWorkLocationId(location.getId());
                } else if (!(world.entities.get(npc.getWorkLocationId()) instanceof Location)) {
                    throw new IllegalArgumentException("NPC '" + id + "' works at unknown location '"
                        + npc.getWorkLocationId() + "'");
                }
                world.register(npc);
                location.addToRoster(id);
                npcCount++;
            }
        }

        ClockSnapshot start = world.clock.snapshot();
        for (Location location : locations) {
            world.behavior.initializeLocation(location, start, world.random);
        }
        world.events.publish(EventKind.WORLD_CREATED, null, EventPayloads.of(
            "name", world.name,
            "seed", world.seed,
            "locations", locations.size(),
            "npcs", npcCount));
        LOG.info("World '{}' created from seed {}: {} locations, {} NPCs", world.name, world.seed,
            locations.size(), npcCount);
        return world;
    }

    /**
     * Rebuilds a world from a captured state and verifies its referential integrity.
     *
     * @throws CorruptDataException if the state is internally inconsistent.
     */
    public static World restore(WorldState state, SimulationParameters parameters, IContentGenerator generator,
                                IEntityFactory factory) throws CorruptDataException {
        World world;
        try {
            world = new World(state.name(), state.seed(), state.clockMinutes(), parameters, generator, factory);
        } catch (IllegalArgumentException e) {
            throw new CorruptDataException("Invalid world header: " + e.getMessage(), e);
        }
        for (EntityView view : state.entities()) {
            if (world.entities.containsKey(view.id())) {
                throw new CorruptDataException("Duplicate entity id '" + view.id() + "'");
            }
            try {
                world.entities.put(view.id(), fromView(view));
            } catch (IllegalArgumentException e) {
                throw new CorruptDataException("Entity '" + view.id() + "' is invalid: " + e.getMessage(), e);
            }
        }
        try {
            world.random.loadState(state.rngState());
            world.events.restore(state.eventTail(), state.nextEventSequence(), state.totalEventsPublished());
        } catch (IllegalArgumentException e) {
            throw new CorruptDataException("World state is invalid: " + e.getMessage(), e);
        }
        world.nextNpcNumber = state.nextNpcNumber();
        world.tickCount = state.tickCount();
        world.verifyIntegrity();
        LOG.info("World '{}' restored at {} with {} entities", world.name,
            world.clock.snapshot().fullDateTimeString(), world.entities.size());
        return world;
    }

    private static Entity fromView(EntityView view) {
        if (view instanceof NpcView) {
            NpcView v = (NpcView) view;
            Npc npc = new Npc(v.id(), v.name(), v.createdAtMinute(), v.race(), v.title(), v.professions(),
                new Needs(v.energy(), v.hunger(), v.mood()), v.moodBaseline(), v.memoryCapacity());
            npc.setState(Objects.requireNonNull(v.state(), "state"));
            npc.setLocationId(v.locationId());
            npc.setWorkLocationId(v.workLocationId());
            npc.setTravelPath(v.travelPath());
            npc.restoreMemory(v.memory());
            npc.setActive(v.active());
            return npc;
        }
        if (view instanceof LocationView) {
            LocationView v = (LocationView) view;
            Location location = new Location(v.id(), v.name(), v.createdAtMinute(), v.type(), v.biome(), v.tags(),
                v.connections(), v.foodAvailable(), v.marketCapable());
            location.setWeather(Objects.requireNonNull(v.weather(), "weather"));
            location.setMarketOpen(v.marketOpen());
            v.npcIds().forEach(location::addToRoster);
            location.setActive(v.active());
            return location;
        }
        throw new IllegalArgumentException("Unsupported entity view " + view.getClass().getSimpleName());
    }

    /**
     * Captures the full world state. The result shares nothing mutable with the world.
     *
     * @param eventTail number of trailing events to include.
     */
    public WorldState captureState(int eventTail) {
        List<EntityView> views = new ArrayList<>(entities.size());
        for (Entity entity : entities.values()) {
            views.add(entity.toView());
        }
        return new WorldState(name, seed, clock.getTotalMinutes(), tickCount, nextNpcNumber, views,
            events.recent(eventTail), events.getNextSequence(), events.getTotalPublished(), random.saveState());
    }

    // Commands

    /**
     * Spawns a new NPC at an active location.
     *
     * @param professions requested professions, in order; may be empty.
     * @param race        requested race, or null to let the generator choose.
     * @return a view of the new NPC.
     * @throws EntityNotFoundException  if the location is unknown or inactive.
     * @throws IllegalArgumentException if the request is malformed.
     */
    public NpcView spawnNpc(String locationId, List<String> professions, String race) throws EntityNotFoundException {
        ensureNotHalted();
        if (locationId == null || locationId.isBlank()) {
            throw new IllegalArgumentException("locationId must not be blank");
        }
        if (professions == null) {
            throw new IllegalArgumentException("professions must not be null");
        }
        for (String profession : professions) {
            if (profession == null || profession.isBlank()) {
                throw new IllegalArgumentException("Profession names must not be blank");
            }
        }
        if (race != null && race.isBlank()) {
            throw new IllegalArgumentException("race must not be blank");
        }
        Location location = requireLocation(locationId);

        DescriptiveRecord record = generator.generateNpc(
            new NpcRequest(seed, locationId, location.getType(), professions, race, nextNpcNumber));
        record = record.with("location", locationId)
            .with("work_location", locationId)
            .with("professions", List.copyOf(professions));
        if (race != null) {
            record = record.with("race", race);
        }
        String id = peekNpcId();
        Npc npc = factory.createNpc(id, record, clock.getTotalMinutes());
        npc.setLocationId(locationId);
        npc.setWorkLocationId(locationId);

        mintNpcId();
        register(npc);
        location.addToRoster(id);
        events.publish(EventKind.NPC_SPAWNED, id, locationId, EventPayloads.of(
            "name", npc.getName(),
            "race", npc.getRace(),
            "professions", npc.getProfessions()));
        LOG.debug("Spawned {} ({}) at {}", id, npc.getName(), locationId);
        return npc.toView();
    }

    public NpcView spawnNpc(String locationId, List<String> professions) throws EntityNotFoundException {
        return spawnNpc(locationId, professions, null);
    }

    /**
     * Soft-deletes an entity. An NPC also leaves its location's roster. Event history is kept.
     *
     * @return true if the entity was active, false if it had already been removed.
     * @throws EntityNotFoundException if the id was never registered.
     */
    public boolean removeEntity(String id) throws EntityNotFoundException {
        Entity entity = entities.get(id);
        if (entity == null) {
            throw new EntityNotFoundException(id, "No entity with id '" + id + "'");
        }
        if (!entity.isActive()) {
            return false;
        }
        entity.setActive(false);
        String locationId = null;
        if (entity instanceof Npc) {
            Npc npc = (Npc) entity;
            locationId = npc.getLocationId();
            Entity location = locationId == null ? null : entities.get(locationId);
            if (location instanceof Location) {
                ((Location) location).removeFromRoster(id);
            }
            npc.clearTravel();
        } else {
            locationId = id;
        }
        events.publish(EventKind.ENTITY_REMOVED, id, locationId, EventPayloads.of(
            "kind", entity.getKind().name(),
            "name", entity.getName()));
        LOG.debug("Removed {} {}", entity.getKind(), id);
        return true;
    }

    /**
     * Sends an NPC along the shortest connection path to a destination. The NPC moves one hop per
     * tick whenever nothing more urgent claims it.
     *
     * @return false if the NPC already is at the destination, true if travel was started.
     * @throws EntityNotFoundException  if the NPC or destination is unknown or inactive.
     * @throws IllegalArgumentException if the destination cannot be reached.
     */
    public boolean requestTravel(String npcId, String destinationId) throws EntityNotFoundException {
        ensureNotHalted();
        Npc npc = requireNpc(npcId);
        Location destination = requireLocation(destinationId);
        if (destination.getId().equals(npc.getLocationId())) {
            return false;
        }
        List<String> path = shortestPath(npc.getLocationId(), destination.getId());
        if (path == null) {
            throw new IllegalArgumentException("Location '" + destinationId + "' is not reachable from '"
                + npc.getLocationId() + "'");
        }
        npc.setTravelPath(path);
        events.publish(EventKind.TRAVEL_STARTED, npcId, npc.getLocationId(), EventPayloads.of(
            "destination", destinationId,
            "path", path));
        return true;
    }

    /**
     * Breadth-first search over active locations in connection order.
     *
     * @return hops from (excluding) start to (including) goal, or null if unreachable.
     */
    private List<String> shortestPath(String start, String goal) {
        Map<String, String> cameFrom = new HashMap<>();
        ArrayDeque<String> queue = new ArrayDeque<>();
        cameFrom.put(start, start);
        queue.add(start);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(goal)) {
                List<String> path = new ArrayList<>();
                for (String step = goal; !step.equals(start); step = cameFrom.get(step)) {
                    path.add(step);
                }
                Collections.reverse(path);
                return path;
            }
            Entity entity = entities.get(current);
            if (!(entity instanceof Location)) {
                continue;
            }
            for (String next : ((Location) entity).getConnections()) {
                Entity neighbour = entities.get(next);
                if (neighbour instanceof Location && neighbour.isActive() && !cameFrom.containsKey(next)) {
                    cameFrom.put(next, current);
                    queue.add(next);
                }
            }
        }
        return null;
    }

    /**
     * Advances the world by one tick: the clock moves, calendar events are published, and every
     * active entity is updated in registration order.
     * <p>
     * A failure while updating one entity is logged and published as an {@link EventKind#ERROR}
     * event; the remaining entities are still updated. A broken reference between entities halts
     * the world instead.
     * </p>
     *
     * @param deltaMinutes minutes to advance, must be > 0.
     * @throws CorruptDataException     if an entity references a missing or inactive location.
     * @throws IllegalArgumentException if deltaMinutes is not positive.
     * @throws IllegalStateException    if the world has been halted.
     */
    public TickResult tick(long deltaMinutes) throws CorruptDataException {
        ensureNotHalted();
        if (deltaMinutes <= 0) {
            throw new IllegalArgumentException("Tick length must be a positive number of minutes: " + deltaMinutes);
        }
        long publishedBefore = events.getTotalPublished();
        AdvanceResult advance = clock.advance(deltaMinutes);
        tickCount++;
        publishCalendarEvents(advance);
        for (CallbackFailure failure : advance.callbackFailures()) {
            recordError("CALLBACK_FAILURE", "Scheduled callback " + failure.taskId() + " failed",
                String.valueOf(failure.cause().getMessage()));
            events.publish(EventKind.ERROR, null, EventPayloads.of(
                "error_type", "CALLBACK_FAILURE",
                "task_id", failure.taskId(),
                "trigger_minute", failure.triggerMinute(),
                "message", String.valueOf(failure.cause().getMessage())));
        }

        TickContext context = new TickContext(advance, deltaMinutes);
        int updated = 0;
        int changed = 0;
        // Listeners may spawn entities mid-tick; those start updating on the next tick.
        for (Entity entity : new ArrayList<>(entities.values())) {
            if (!entity.isActive()) {
                continue;
            }
            updated++;
            try {
                boolean entityChanged = entity instanceof Npc
                    ? behavior.updateNpc((Npc) entity, context)
                    : behavior.updateLocation((Location) entity, context);
                if (entityChanged) {
                    changed++;
                }
            } catch (CorruptDataException e) {
                halt(entity, e);
                throw e;
            } catch (RuntimeException e) {
                LOG.warn("Update of {} failed at minute {}: {}", entity.getId(), clock.getTotalMinutes(), e.getMessage());
                recordError("ENTITY_UPDATE_FAILED", "Update of " + entity.getId() + " failed",
                    e.getClass().getName() + ": " + e.getMessage());
                events.publish(EventKind.ERROR, entity.getId(), null, EventPayloads.of(
                    "error_type", "ENTITY_UPDATE_FAILED",
                    "message", String.valueOf(e.getMessage()),
                    "exception", e.getClass().getName()));
            }
        }

        int emitted = (int) (events.getTotalPublished() - publishedBefore);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Tick {} of '{}' -> {}: {} updated, {} changed, {} events", tickCount, name,
                advance.after().timeString(), updated, changed, emitted);
        }
        return new TickResult(tickCount, emitted, updated, changed, advance.after());
    }

    private void publishCalendarEvents(AdvanceResult advance) {
        ClockSnapshot after = advance.after();
        for (CalendarBoundary boundary : CalendarBoundary.values()) {
            long count = advance.crossedCount(boundary);
            if (count == 0) {
                continue;
            }
            switch (boundary) {
                case HOUR -> events.publish(EventKind.HOUR_PASSED, null, EventPayloads.of(
                    "count", count, "hour", after.hour()));
                case DAY -> events.publish(EventKind.DAY_PASSED, null, EventPayloads.of(
                    "count", count, "day_of_year", after.dayOfYear(), "day_of_month", after.dayOfMonth()));
                case MONTH -> events.publish(EventKind.MONTH_PASSED, null, EventPayloads.of(
                    "count", count, "month", after.month()));
                case SEASON -> events.publish(EventKind.SEASON_CHANGED, null, EventPayloads.of(
                    "count", count, "season", after.season().key()));
                case YEAR -> events.publish(EventKind.YEAR_PASSED, null, EventPayloads.of(
                    "count", count, "year", after.year()));
            }
        }
    }

    private void halt(Entity entity, CorruptDataException e) {
        halted = true;
        haltReason = e.getMessage();
        LOG.error("World '{}' halted while updating {}: {}", name, entity.getId(), e.getMessage());
        recordError("INTEGRITY_VIOLATION", e.getMessage(), "entity=" + entity.getId());
        events.publish(EventKind.ERROR, entity.getId(), null, EventPayloads.of(
            "error_type", "INTEGRITY_VIOLATION",
            "message", e.getMessage()));
    }

    private void ensureNotHalted() {
        if (halted) {
            throw new IllegalStateException("World '" + name + "' is halted: " + haltReason);
        }
    }

    // Scheduling

    public ScheduledTask schedule(long delayMinutes, IClockCallback callback) {
        return clock.schedule(delayMinutes, callback);
    }

    public ScheduledTask scheduleRecurring(long delayMinutes, long intervalMinutes, IClockCallback callback) {
        return clock.scheduleRecurring(delayMinutes, intervalMinutes, callback);
    }

    public boolean cancel(ScheduledTask task) {
        return clock.cancel(task);
    }

    // Queries

    /**
     * @throws EntityNotFoundException if the id is unknown or the entity was removed.
     */
    public EntityView getEntity(String id) throws EntityNotFoundException {
        return requireActive(id).toView();
    }

    public NpcView getNpc(String id) throws EntityNotFoundException {
        return requireNpc(id).toView();
    }

    public LocationView getLocation(String id) throws EntityNotFoundException {
        return requireLocation(id).toView();
    }

    /**
     * @return views of the NPCs at a location, in roster order.
     */
    public List<NpcView> getNpcsAt(String locationId) throws EntityNotFoundException {
        Location location = requireLocation(locationId);
        List<NpcView> result = new ArrayList<>();
        for (String npcId : location.getRoster()) {
            Entity entity = entities.get(npcId);
            if (entity instanceof Npc && entity.isActive()) {
                result.add(((Npc) entity).toView());
            }
        }
        return result;
    }

    /**
     * @return ids of all active entities in registration order.
     */
    public List<String> getActiveEntityIds() {
        List<String> ids = new ArrayList<>();
        for (Entity entity : entities.values()) {
            if (entity.isActive()) {
                ids.add(entity.getId());
            }
        }
        return ids;
    }

    public WorldSummary getSummary() {
        int locations = 0;
        int npcs = 0;
        int inactive = 0;
        for (Entity entity : entities.values()) {
            if (!entity.isActive()) {
                inactive++;
            } else if (entity instanceof Npc) {
                npcs++;
            } else {
                locations++;
            }
        }
        return new WorldSummary(name, seed, clock.snapshot(), tickCount, locations, npcs, inactive,
            events.getTotalPublished(), events.historySize(), halted);
    }

    public List<WorldEvent> recentEvents(int n) {
        return events.recent(n);
    }

    public ClockSnapshot getClock() {
        return clock.snapshot();
    }

    /**
     * @return minutes until the next time-of-day bucket starts.
     */
    public int minutesUntilNextPeriod() {
        return clock.minutesUntilNextPeriod();
    }

    /**
     * The bus, for subscriptions and for publishing {@link EventKind#CUSTOM} events.
     */
    public EventBus getEventBus() {
        return events;
    }

    public String getName() {
        return name;
    }

    public long getSeed() {
        return seed;
    }

    public long getTickCount() {
        return tickCount;
    }

    public boolean isHalted() {
        return halted;
    }

    public SimulationParameters getParameters() {
        return parameters;
    }

    public IContentGenerator getGenerator() {
        return generator;
    }

    public IEntityFactory getFactory() {
        return factory;
    }

    /**
     * @return recent operational errors, oldest first.
     */
    public List<OperationalError> getOperationalErrors() {
        return List.copyOf(errors);
    }

    // Internals

    private void register(Entity entity) {
        if (entities.containsKey(entity.getId())) {
            throw new IllegalArgumentException("Duplicate entity id '" + entity.getId() + "'");
        }
        entities.put(entity.getId(), entity);
    }

    private String peekNpcId() {
        long number = nextNpcNumber;
        while (entities.containsKey(NPC_ID_PREFIX + number)) {
            number++;
        }
        return NPC_ID_PREFIX + number;
    }

    private String mintNpcId() {
        String id = peekNpcId();
        nextNpcNumber = Long.parseLong(id.substring(NPC_ID_PREFIX.length())) + 1;
        return id;
    }

    private Entity requireActive(String id) throws EntityNotFoundException {
        Entity entity = id == null ? null : entities.get(id);
        if (entity == null || !entity.isActive()) {
            throw new EntityNotFoundException(id, "No active entity with id '" + id + "'");
        }
        return entity;
    }

    private Npc requireNpc(String id) throws EntityNotFoundException {
        Entity entity = requireActive(id);
        if (!(entity instanceof Npc)) {
            throw new EntityNotFoundException(id, "Entity '" + id + "' is not an NPC");
        }
        return (Npc) entity;
    }

    private Location requireLocation(String id) throws EntityNotFoundException {
        Entity entity = requireActive(id);
        if (!(entity instanceof Location)) {
            throw new EntityNotFoundException(id, "Entity '" + id + "' is not a location");
        }
        return (Location) entity;
    }

    private void recordError(String type, String message, String details) {
        if (errors.size() == MAX_OPERATIONAL_ERRORS) {
            errors.pollFirst();
        }
        errors.addLast(new OperationalError(Instant.now(), type, message, details));
    }

    /**
     * Checks every cross-entity reference: NPC locations, work sites and travel hops, location
     * rosters and connections.
     */
    private void verifyIntegrity() throws CorruptDataException {
        for (Entity entity : entities.values()) {
            if (entity instanceof Npc) {
                Npc npc = (Npc) entity;
                if (!npc.isActive()) {
                    continue;
                }
                Location location = activeLocationOrNull(npc.getLocationId());
                if (location == null) {
                    throw new CorruptDataException("NPC '" + npc.getId() + "' references missing location '"
                        + npc.getLocationId() + "'");
                }
                if (!location.getRoster().contains(npc.getId())) {
                    throw new CorruptDataException("NPC '" + npc.getId() + "' is missing from the roster of '"
                        + location.getId() + "'");
                }
                if (npc.getWorkLocationId() != null && !(entities.get(npc.getWorkLocationId()) instanceof Location)) {
                    throw new CorruptDataException("NPC '" + npc.getId() + "' works at missing location '"
                        + npc.getWorkLocationId() + "'");
                }
                for (String hop : npc.getTravelPath()) {
                    if (activeLocationOrNull(hop) == null) {
                        throw new CorruptDataException("NPC '" + npc.getId() + "' travels through missing location '"
                            + hop + "'");
                    }
                }
            } else {
                Location location = (Location) entity;
                for (String npcId : location.getRoster()) {
                    Entity member = entities.get(npcId);
                    if (!(member instanceof Npc) || !member.isActive()
                        || !location.getId().equals(((Npc) member).getLocationId())) {
                        throw new CorruptDataException("Roster of '" + location.getId()
                            + "' lists '" + npcId + "' which is not an active NPC there");
                    }
                }
                for (String connection : location.getConnections()) {
                    if (!(entities.get(connection) instanceof Location)) {
                        throw new CorruptDataException("Location '" + location.getId()
                            + "' connects to missing location '" + connection + "'");
                    }
                }
            }
        }
    }

    private Location activeLocationOrNull(String id) {
        Entity entity = id == null ? null : entities.get(id);
        return entity instanceof Location && entity.isActive() ? (Location) entity : null;
    }

    /**
     * Behavior callbacks for one tick, backed by this world.
     */
    private final class TickContext implements BehaviorContext {

        private final AdvanceResult advance;
        private final long delta;

        TickContext(AdvanceResult advance, long delta) {
            this.advance = advance;
            this.delta = delta;
        }

        @Override
        public ClockSnapshot now() {
            return advance.after();
        }

        @Override
        public long deltaMinutes() {
            return delta;
        }

        @Override
        public long crossed(CalendarBoundary boundary) {
            return advance.crossedCount(boundary);
        }

        @Override
        public IRandomProvider random() {
            return random;
        }

        @Override
        public Location resolveLocation(String locationId) throws CorruptDataException {
            Location location = activeLocationOrNull(locationId);
            if (location == null) {
                throw new CorruptDataException("Location reference '" + locationId
                    + "' does not resolve to an active location");
            }
            return location;
        }

        @Override
        public List<String> companionsOf(Npc npc) {
            Location location = activeLocationOrNull(npc.getLocationId());
            if (location == null) {
                return List.of();
            }
            List<String> companions = new ArrayList<>();
            for (String id : location.getRoster()) {
                Entity other = entities.get(id);
                if (!id.equals(npc.getId()) && other != null && other.isActive()) {
                    companions.add(id);
                }
            }
            return companions;
        }

        @Override
        public void move(Npc npc, Location from, Location to) {
            from.removeFromRoster(npc.getId());
            to.addToRoster(npc.getId());
            npc.setLocationId(to.getId());
        }

        @Override
        public void emit(EventKind kind, String sourceId, String locationId, Map<String, ?> payload) {
            events.publish(kind, sourceId, locationId, payload);
        }
    }
}
