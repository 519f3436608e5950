package org.rgen.runtime.behavior;

import com.typesafe.config.Config;
import org.rgen.runtime.model.Weather;
import org.rgen.runtime.spi.IRandomProvider;
import org.rgen.runtime.time.Season;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rolls weather from per-season tables, adjusted by biome. Conditions are drawn uniformly from the
 * table (repeat an entry to weight it) and the temperature uniformly from the season range plus
 * the biome offset, rounded to one decimal.
 */
public final class WeatherModel {

    /**
     * @param conditions candidate conditions, non-empty.
     */
    public record SeasonTable(List<String> conditions, double minTemperature, double maxTemperature) {
        public SeasonTable {
            if (conditions == null || conditions.isEmpty()) {
                throw new IllegalArgumentException("Weather conditions must not be empty");
            }
            if (maxTemperature < minTemperature) {
                throw new IllegalArgumentException("max-temperature must be >= min-temperature");
            }
            conditions = List.copyOf(conditions);
        }
    }

    /**
     * @param conditions replaces the season conditions when non-empty.
     */
    public record BiomeAdjustment(double temperatureOffset, List<String> conditions) {
        public BiomeAdjustment {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }
    }

    private final Map<Season, SeasonTable> seasons;
    private final Map<String, BiomeAdjustment> biomes;

    public WeatherModel(Map<Season, SeasonTable> seasons, Map<String, BiomeAdjustment> biomes) {
        for (Season season : Season.values()) {
            if (!seasons.containsKey(season)) {
                throw new IllegalArgumentException("Missing weather table for season " + season.key());
            }
        }
        this.seasons = new EnumMap<>(seasons);
        this.biomes = Map.copyOf(biomes);
    }

    /**
     * @param weather the {@code rgen.weather} block.
     */
    public static WeatherModel fromConfig(Config weather) {
        Map<Season, SeasonTable> seasons = new EnumMap<>(Season.class);
        Config seasonConfig = weather.getConfig("seasons");
        for (Season season : Season.values()) {
            if (!seasonConfig.hasPath(season.key())) {
                throw new IllegalArgumentException("Missing rgen.weather.seasons." + season.key());
            }
            Config table = seasonConfig.getConfig(season.key());
            seasons.put(season, new SeasonTable(table.getStringList("conditions"),
                table.getDouble("min-temperature"), table.getDouble("max-temperature")));
        }
        Map<String, BiomeAdjustment> biomes = new HashMap<>();
        if (weather.hasPath("biomes")) {
            Config biomeConfig = weather.getConfig("biomes");
            for (String biome : biomeConfig.root().keySet()) {
                Config entry = biomeConfig.getConfig(biome);
                biomes.put(biome, new BiomeAdjustment(
                    entry.hasPath("temperature-offset") ? entry.getDouble("temperature-offset") : 0.0,
                    entry.hasPath("conditions") ? entry.getStringList("conditions") : List.of()));
            }
        }
        return new WeatherModel(seasons, biomes);
    }

    /**
     * Draws new weather. Always consumes exactly two values from the random provider.
     */
    public Weather roll(String biome, Season season, IRandomProvider random) {
        SeasonTable table = seasons.get(season);
        BiomeAdjustment adjustment = biomes.getOrDefault(biome, new BiomeAdjustment(0.0, List.of()));
        List<String> conditions = adjustment.conditions().isEmpty() ? table.conditions() : adjustment.conditions();
        String condition = conditions.get(random.nextIntBetween(0, conditions.size() - 1));
        double span = table.maxTemperature() - table.minTemperature();
        double temperature = table.minTemperature() + random.nextDouble() * span + adjustment.temperatureOffset();
        return new Weather(condition, Math.round(temperature * 10.0) / 10.0);
    }
}
