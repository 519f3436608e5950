package org.rgen.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A place in the world. Holds the ordered roster of NPC ids currently present, its weather, and
 * for market-capable types whether the market is open.
 */
public class Location extends Entity {

    private final String type;
    private final String biome;
    private final List<String> tags;
    private final List<String> connections;
    private final boolean foodAvailable;
    private final boolean marketCapable;
    private final LinkedHashSet<String> roster = new LinkedHashSet<>();

    private Weather weather = Weather.UNKNOWN;
    private boolean marketOpen;

    public Location(String id, String name, long createdAtMinute, String type, String biome, List<String> tags,
                    List<String> connections, boolean foodAvailable, boolean marketCapable) {
        super(id, EntityKind.LOCATION, name, createdAtMinute);
        this.type = type == null ? "unknown" : type;
        this.biome = biome == null ? "temperate" : biome;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.connections = connections == null ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(connections)));
        this.foodAvailable = foodAvailable;
        this.marketCapable = marketCapable;
    }

    public String getType() {
        return type;
    }

    public String getBiome() {
        return biome;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * @return ids of directly connected locations, in declaration order.
     */
    public List<String> getConnections() {
        return connections;
    }

    public boolean isFoodAvailable() {
        return foodAvailable;
    }

    public boolean isMarketCapable() {
        return marketCapable;
    }

    public Weather getWeather() {
        return weather;
    }

    public void setWeather(Weather weather) {
        this.weather = weather;
    }

    public boolean isMarketOpen() {
        return marketOpen;
    }

    public void setMarketOpen(boolean marketOpen) {
        this.marketOpen = marketOpen;
    }

    /**
     * @return the NPC ids present, in arrival order.
     */
    public Set<String> getRoster() {
        return Collections.unmodifiableSet(roster);
    }

    public boolean addToRoster(String npcId) {
        return roster.add(npcId);
    }

    public boolean removeFromRoster(String npcId) {
        return roster.remove(npcId);
    }

    @Override
    public LocationView toView() {
        return new LocationView(getId(), getName(), isActive(), getCreatedAtMinute(), type, biome, tags, connections,
            List.copyOf(roster), weather, marketOpen, foodAvailable, marketCapable);
    }
}
