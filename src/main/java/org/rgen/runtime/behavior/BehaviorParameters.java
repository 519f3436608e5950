package org.rgen.runtime.behavior;

import com.typesafe.config.Config;

import java.util.List;
import java.util.Set;

/**
 * Thresholds and per-minute rates of the NPC state machine, read from {@code rgen.behavior}.
 * Rates are multiplied by the tick length in minutes.
 */
public record BehaviorParameters(
    double energyDecayPerMinute,
    double workEnergyCostPerMinute,
    double hungerGrowthPerMinute,
    double sleepRecoveryPerMinute,
    double sleepThreshold,
    double wakeThreshold,
    double eatThreshold,
    double eatHungerReduction,
    double craftChancePerMinute,
    double socializeChance,
    int memoryCapacity,
    double moodBaseline,
    double ateMoodImpact,
    double wentHungryMoodImpact,
    double socializedMoodImpact,
    double craftedMoodImpact,
    Set<String> marketLocationTypes
) {

    public BehaviorParameters {
        requireNonNegative("energy-decay-per-minute", energyDecayPerMinute);
        requireNonNegative("work-energy-cost-per-minute", workEnergyCostPerMinute);
        requireNonNegative("hunger-growth-per-minute", hungerGrowthPerMinute);
        requireNonNegative("sleep-recovery-per-minute", sleepRecoveryPerMinute);
        requireNonNegative("craft-chance-per-minute", craftChancePerMinute);
        if (sleepThreshold >= wakeThreshold) {
            throw new IllegalArgumentException("rgen.behavior.sleep-threshold (" + sleepThreshold
                + ") must be below wake-threshold (" + wakeThreshold + ")");
        }
        if (socializeChance < 0 || socializeChance > 1) {
            throw new IllegalArgumentException("rgen.behavior.socialize-chance must be in [0, 1]: " + socializeChance);
        }
        if (memoryCapacity <= 0) {
            throw new IllegalArgumentException("rgen.behavior.memory-capacity must be > 0: " + memoryCapacity);
        }
        marketLocationTypes = Set.copyOf(marketLocationTypes);
    }

    private static void requireNonNegative(String key, double value) {
        if (value < 0 || Double.isNaN(value)) {
            throw new IllegalArgumentException("rgen.behavior." + key + " must be >= 0: " + value);
        }
    }

    /**
     * @param behavior the {@code rgen.behavior} block.
     */
    public static BehaviorParameters fromConfig(Config behavior) {
        Config impact = behavior.getConfig("mood-impact");
        List<String> marketTypes = behavior.getStringList("market-location-types");
        return new BehaviorParameters(
            behavior.getDouble("energy-decay-per-minute"),
            behavior.getDouble("work-energy-cost-per-minute"),
            behavior.getDouble("hunger-growth-per-minute"),
            behavior.getDouble("sleep-recovery-per-minute"),
            behavior.getDouble("sleep-threshold"),
            behavior.getDouble("wake-threshold"),
            behavior.getDouble("eat-threshold"),
            behavior.getDouble("eat-hunger-reduction"),
            behavior.getDouble("craft-chance-per-minute"),
            behavior.getDouble("socialize-chance"),
            behavior.getInt("memory-capacity"),
            behavior.getDouble("mood-baseline"),
            impact.getDouble("ate"),
            impact.getDouble("went-hungry"),
            impact.getDouble("socialized"),
            impact.getDouble("crafted"),
            Set.copyOf(marketTypes));
    }
}
