package org.rgen.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A living NPC: race, title, an ordered set of professions, needs, the current behavior state and
 * a bounded personal memory log from which mood is derived.
 * <p>
 * Location ids are weak references resolved through the owning world. The travel path holds the
 * remaining hops to the destination, the next hop first.
 * </p>
 */
public class Npc extends Entity {

    /** Weight multiplier applied per step of age when memories are folded into mood. */
    static final double MEMORY_RECENCY_DECAY = 0.9;

    private final String race;
    private final String title;
    private final List<String> professions;
    private final int memoryCapacity;
    private final double moodBaseline;
    private final Needs needs;
    private final ArrayDeque<MemoryEntry> memory;
    private final ArrayDeque<String> travelPath = new ArrayDeque<>();

    private NpcState state = NpcState.IDLE;
    private String locationId;
    private String workLocationId;

    public Npc(String id, String name, long createdAtMinute, String race, String title,
               List<String> professions, Needs needs, double moodBaseline, int memoryCapacity) {
        super(id, EntityKind.NPC, name, createdAtMinute);
        if (memoryCapacity <= 0) {
            throw new IllegalArgumentException("memoryCapacity must be > 0: " + memoryCapacity);
        }
        this.race = race == null ? "unknown" : race;
        this.title = title == null ? "" : title;
        this.professions = validateProfessions(professions);
        this.needs = needs == null ? new Needs(100.0, 0.0, moodBaseline) : needs;
        this.moodBaseline = Needs.clamp(moodBaseline);
        this.memoryCapacity = memoryCapacity;
        this.memory = new ArrayDeque<>(memoryCapacity);
    }

    private static List<String> validateProfessions(List<String> professions) {
        if (professions == null) {
            throw new IllegalArgumentException("professions must not be null");
        }
        LinkedHashSet<String> ordered = new LinkedHashSet<>();
        for (String profession : professions) {
            if (profession == null || profession.isBlank()) {
                throw new IllegalArgumentException("Profession names must not be blank");
            }
            ordered.add(profession);
        }
        return Collections.unmodifiableList(new ArrayList<>(ordered));
    }

    public String getRace() {
        return race;
    }

    public String getTitle() {
        return title;
    }

    /**
     * @return the professions in declaration order, without duplicates.
     */
    public List<String> getProfessions() {
        return professions;
    }

    public boolean hasProfession() {
        return !professions.isEmpty();
    }

    public Needs getNeeds() {
        return needs;
    }

    public NpcState getState() {
        return state;
    }

    public void setState(NpcState state) {
        this.state = state;
    }

    public String getLocationId() {
        return locationId;
    }

    public void setLocationId(String locationId) {
        this.locationId = locationId;
    }

    public String getWorkLocationId() {
        return workLocationId;
    }

    public void setWorkLocationId(String workLocationId) {
        this.workLocationId = workLocationId;
    }

    public double getMoodBaseline() {
        return moodBaseline;
    }

    public int getMemoryCapacity() {
        return memoryCapacity;
    }

    // Travel

    public boolean isTraveling() {
        return !travelPath.isEmpty();
    }

    /**
     * @return remaining hops, next hop first.
     */
    public List<String> getTravelPath() {
        return List.copyOf(travelPath);
    }

    public void setTravelPath(List<String> hops) {
        travelPath.clear();
        travelPath.addAll(hops);
    }

    public String peekNextHop() {
        return travelPath.peekFirst();
    }

    public String pollNextHop() {
        return travelPath.pollFirst();
    }

    public String getTravelDestination() {
        return travelPath.peekLast();
    }

    public void clearTravel() {
        travelPath.clear();
    }

    // Memory and mood

    /**
     * Appends a memory, evicting the oldest once the log is full, and recomputes mood.
     */
    public void remember(MemoryEntry entry) {
        if (memory.size() == memoryCapacity) {
            memory.pollFirst();
        }
        memory.addLast(entry);
        recomputeMood();
    }

    /**
     * @return the newest memory, or null if the log is empty.
     */
    public MemoryEntry lastMemory() {
        return memory.peekLast();
    }

    /**
     * @return the memory log, oldest first.
     */
    public List<MemoryEntry> getMemory() {
        return List.copyOf(memory);
    }

    /**
     * Sets mood to the baseline plus the recency-weighted sum of remembered impacts.
     * The newest memory has weight 1, each older one 0.9 times the next newer one.
     */
    public void recomputeMood() {
        double weight = 1.0;
        double sum = 0.0;
        Iterator<MemoryEntry> newestFirst = memory.descendingIterator();
        while (newestFirst.hasNext()) {
            sum += newestFirst.next().impact() * weight;
            weight *= MEMORY_RECENCY_DECAY;
        }
        needs.setMood(moodBaseline + sum);
    }

    /**
     * Restores the memory log verbatim without recomputing mood.
     */
    public void restoreMemory(List<MemoryEntry> entries) {
        memory.clear();
        int skip = Math.max(0, entries.size() - memoryCapacity);
        for (int i = skip; i < entries.size(); i++) {
            memory.addLast(entries.get(i));
        }
    }

    @Override
    public NpcView toView() {
        return new NpcView(getId(), getName(), isActive(), getCreatedAtMinute(), race, title, professions,
            needs.getEnergy(), needs.getHunger(), needs.getMood(), state, locationId, workLocationId,
            getTravelPath(), getMemory(), moodBaseline, memoryCapacity);
    }
}
