package org.rgen.generation;

import org.rgen.runtime.behavior.BehaviorParameters;
import org.rgen.runtime.model.Location;
import org.rgen.runtime.model.Needs;
import org.rgen.runtime.model.Npc;

import java.util.Objects;

/**
 * Default {@link IEntityFactory}.
 * <p>
 * Location records: {@code id} (required), {@code name}, {@code type}, {@code biome}, {@code tags},
 * {@code connections}, {@code has_food}, and optionally {@code market} which otherwise follows the
 * configured market location types.
 * </p>
 * <p>
 * NPC records: {@code name}, {@code race}, {@code title}, {@code professions}, {@code location},
 * optionally {@code work_location} (defaults to {@code location}) and {@code needs} with
 * {@code energy} and {@code hunger}. Mood starts at the configured baseline.
 * </p>
 */
public class EntityFactory implements IEntityFactory {

    private final BehaviorParameters parameters;

    public EntityFactory(BehaviorParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    @Override
    public Location createLocation(DescriptiveRecord record, long createdAtMinute) {
        String id = record.getString("id");
        String type = record.getString("type", "unknown");
        boolean market = record.getBoolean("market", parameters.marketLocationTypes().contains(type));
        return new Location(id, record.getString("name", id), createdAtMinute, type,
            record.getString("biome", "temperate"), record.getStringList("tags"),
            record.getStringList("connections"), record.getBoolean("has_food", false), market);
    }

    @Override
    public Npc createNpc(String id, DescriptiveRecord record, long createdAtMinute) {
        DescriptiveRecord needs = record.getRecord("needs");
        double baseline = parameters.moodBaseline();
        Npc npc = new Npc(id, record.getString("name", id), createdAtMinute,
            record.getString("race", "human"), record.getString("title", ""),
            record.getStringList("professions"),
            new Needs(needs.getDouble("energy", 100.0), needs.getDouble("hunger", 0.0), baseline),
            baseline, parameters.memoryCapacity());
        String location = record.getString("location", null);
        npc.setLocationId(location);
        npc.setWorkLocationId(record.getString("work_location", location));
        return npc;
    }
}
