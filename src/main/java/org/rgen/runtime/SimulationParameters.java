package org.rgen.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.rgen.runtime.behavior.BehaviorParameters;
import org.rgen.runtime.behavior.ProfessionCatalog;
import org.rgen.runtime.behavior.WeatherModel;

/**
 * Typed view of the {@code rgen} configuration block used by the simulation core.
 *
 * @param historyCapacity event history cap.
 * @param behavior        NPC thresholds and rates.
 * @param professions     profession schedules and crafts.
 * @param weather         weather tables.
 */
public record SimulationParameters(
    int historyCapacity,
    BehaviorParameters behavior,
    ProfessionCatalog professions,
    WeatherModel weather
) {

    public SimulationParameters {
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("rgen.event-bus.history-capacity must be > 0: " + historyCapacity);
        }
    }

    /**
     * @param config a resolved root configuration containing the {@code rgen} block.
     * @throws IllegalArgumentException if a value is missing or invalid.
     */
    public static SimulationParameters fromConfig(Config config) {
        try {
            Config rgen = config.getConfig("rgen");
            return new SimulationParameters(
                rgen.getInt("event-bus.history-capacity"),
                BehaviorParameters.fromConfig(rgen.getConfig("behavior")),
                ProfessionCatalog.fromConfig(rgen.getConfig("professions")),
                WeatherModel.fromConfig(rgen.getConfig("weather")));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid simulation configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @return the parameters defined by the bundled {@code reference.conf}.
     */
    public static SimulationParameters defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * @return a copy with a different history capacity.
     */
    public SimulationParameters withHistoryCapacity(int capacity) {
        return new SimulationParameters(capacity, behavior, professions, weather);
    }
}
