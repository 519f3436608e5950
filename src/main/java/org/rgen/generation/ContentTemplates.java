package org.rgen.generation;

import java.util.List;
import java.util.Map;

/**
 * Tables read from {@code templates.json} by {@link TemplateContentGenerator}.
 */
public final class ContentTemplates {

    public List<RaceTemplate> races;
    public Map<String, List<String>> titles;
    public List<String> placeRoots;
    public List<LocationTemplate> locationTypes;
    public double extraConnectionChance;
    public double secondProfessionChance;
    public Range initialEnergy;
    public Range initialHunger;

    public static final class RaceTemplate {
        public String name;
        public int weight;
        public List<String> givenNames;
        public List<String> familyNames;
    }

    public static final class LocationTemplate {
        public String type;
        public List<String> namePatterns;
        public List<String> biomes;
        public List<String> tags;
        public boolean hasFood;
        public List<String> professions;
    }

    public static final class Range {
        public double min;
        public double max;
    }
}
