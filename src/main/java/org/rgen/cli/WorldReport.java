package org.rgen.cli;

import org.rgen.runtime.World;
import org.rgen.runtime.WorldSummary;
import org.rgen.runtime.api.EntityNotFoundException;
import org.rgen.runtime.events.WorldEvent;
import org.rgen.runtime.model.EntityView;
import org.rgen.runtime.model.LocationView;
import org.rgen.runtime.model.NpcView;
import org.rgen.runtime.time.ClockSnapshot;

import java.io.PrintWriter;
import java.util.List;

/**
 * Plain-text rendering of a world for the command line.
 */
public final class WorldReport {

    private WorldReport() {
    }

    public static void printSummary(PrintWriter out, World world) {
        WorldSummary summary = world.getSummary();
        out.printf("World '%s' (seed %d)%n", summary.name(), summary.seed());
        out.printf("  Time:      %s%n", summary.clock().fullDateTimeString());
        out.printf("  Ticks:     %d%n", summary.tickCount());
        out.printf("  Locations: %d active%n", summary.activeLocations());
        out.printf("  NPCs:      %d active, %d inactive entities%n", summary.activeNpcs(), summary.inactiveEntities());
        out.printf("  Events:    %d published, %d in history%n", summary.totalEventsPublished(),
            summary.eventHistorySize());
        if (summary.halted()) {
            out.println("  HALTED after an integrity violation");
        }
    }

    public static void printEntities(PrintWriter out, World world) {
        for (String id : world.getActiveEntityIds()) {
            EntityView entity;
            try {
                entity = world.getEntity(id);
            } catch (EntityNotFoundException e) {
                // Listed ids are active, lookup cannot miss.
                throw new IllegalStateException(e);
            }
            if (entity instanceof LocationView) {
                LocationView location = (LocationView) entity;
                out.printf("  %-14s %-24s %-10s %-9s %s, %.1f°C%s%n", location.id(), location.name(), location.type(),
                    location.biome(), location.weather().condition(), location.weather().temperature(),
                    location.marketOpen() ? ", market open" : "");
            } else if (entity instanceof NpcView) {
                NpcView npc = (NpcView) entity;
                out.printf("  %-14s %-24s %-11s at %-12s energy %5.1f hunger %5.1f mood %5.1f  %s%n", npc.id(),
                    npc.name(), npc.state(), npc.locationId(), npc.energy(), npc.hunger(), npc.mood(),
                    String.join("/", npc.professions()));
            }
        }
    }

    public static void printEvents(PrintWriter out, List<WorldEvent> events) {
        for (WorldEvent event : events) {
            out.printf("  #%-6d %s  %-18s %-12s %s%n", event.sequence(), ClockSnapshot.of(event.simMinute()).timeString(),
                event.kind(), event.sourceId() == null ? "-" : event.sourceId(), event.payload());
        }
    }
}
