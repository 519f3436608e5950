package org.rgen.generation;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.rgen.runtime.internal.services.SeededRandomProvider;
import org.rgen.runtime.spi.IRandomProvider;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Table-driven {@link IContentGenerator}.
 * <p>
 * Every request draws from its own random stream derived from the request's seed and
 * parameters, so results depend on nothing but the request and the tables. Locations are
 * connected as a chain in generation order, with occasional extra links back to earlier
 * locations; the resulting graph is always connected.
 * </p>
 */
public class TemplateContentGenerator implements IContentGenerator {

    public static final String DEFAULT_RESOURCE_PATH = "org/rgen/generation/templates.json";

    private static final Gson GSON = new GsonBuilder()
        .setLenient()
        .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
        .create();

    private final ContentTemplates templates;
    private final int totalRaceWeight;

    public TemplateContentGenerator() {
        this(fromResource(DEFAULT_RESOURCE_PATH));
    }

    public TemplateContentGenerator(ContentTemplates templates) {
        this.templates = validate(Objects.requireNonNull(templates, "templates"));
        this.totalRaceWeight = templates.races.stream().mapToInt(race -> race.weight).sum();
    }

    /**
     * Loads template tables from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource is missing or is not valid JSON.
     */
    public static ContentTemplates fromResource(String resourcePath) {
        try (InputStream is = TemplateContentGenerator.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalArgumentException("Template resource not found: " + resourcePath);
            }
            return fromJson(new String(is.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read template resource " + resourcePath, e);
        }
    }

    public static ContentTemplates fromJson(String json) {
        try {
            ContentTemplates parsed = GSON.fromJson(json, ContentTemplates.class);
            if (parsed == null) {
                throw new IllegalArgumentException("Template document is empty");
            }
            return parsed;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid template JSON: " + e.getMessage(), e);
        }
    }

    private static ContentTemplates validate(ContentTemplates t) {
        if (t.races == null || t.races.isEmpty()) {
            throw new IllegalArgumentException("Templates define no races");
        }
        for (ContentTemplates.RaceTemplate race : t.races) {
            if (race.name == null || race.weight <= 0 || isEmpty(race.givenNames) || isEmpty(race.familyNames)) {
                throw new IllegalArgumentException("Race template '" + race.name
                    + "' needs a name, a positive weight and given and family names");
            }
        }
        if (t.locationTypes == null || t.locationTypes.isEmpty()) {
            throw new IllegalArgumentException("Templates define no location types");
        }
        for (ContentTemplates.LocationTemplate type : t.locationTypes) {
            if (type.type == null || isEmpty(type.namePatterns) || isEmpty(type.biomes)) {
                throw new IllegalArgumentException("Location template '" + type.type
                    + "' needs a type, name patterns and biomes");
            }
        }
        if (isEmpty(t.placeRoots)) {
            throw new IllegalArgumentException("Templates define no place roots");
        }
        if (t.initialEnergy == null || t.initialHunger == null) {
            throw new IllegalArgumentException("Templates define no initial needs ranges");
        }
        return t;
    }

    private static boolean isEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }

    @Override
    public GeneratedWorld generateWorld(GenerationRequest request) {
        long key = SeededRandomProvider.hashString(request.worldName()) * 31
            + request.locationCount() * 1_000_003L + request.npcCount();
        IRandomProvider random = new SeededRandomProvider(request.seed()).deriveFor("world", key);

        List<ContentTemplates.LocationTemplate> types = new ArrayList<>();
        List<String> locationIds = new ArrayList<>();
        List<Set<String>> connections = new ArrayList<>();
        Map<String, Integer> perType = new LinkedHashMap<>();
        for (int i = 0; i < request.locationCount(); i++) {
            ContentTemplates.LocationTemplate type = i == 0
                ? templates.locationTypes.get(0)
                : pick(templates.locationTypes, random);
            int number = perType.merge(type.type, 1, Integer::sum);
            types.add(type);
            locationIds.add(type.type + "_" + number);
            connections.add(new LinkedHashSet<>());
            if (i > 0) {
                link(connections, i, i - 1, locationIds);
                if (i > 1 && random.nextDouble() < templates.extraConnectionChance) {
                    link(connections, i, random.nextInt(i - 1), locationIds);
                }
            }
        }

        List<DescriptiveRecord> locations = new ArrayList<>();
        for (int i = 0; i < locationIds.size(); i++) {
            ContentTemplates.LocationTemplate type = types.get(i);
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("id", locationIds.get(i));
            record.put("name", placeName(type, random));
            record.put("type", type.type);
            record.put("biome", pick(type.biomes, random));
            record.put("tags", type.tags == null ? List.of() : List.copyOf(type.tags));
            record.put("connections", List.copyOf(connections.get(i)));
            record.put("has_food", type.hasFood);
            locations.add(new DescriptiveRecord(record));
        }

        List<DescriptiveRecord> npcs = new ArrayList<>();
        for (int n = 0; n < request.npcCount(); n++) {
            int index = random.nextInt(locationIds.size());
            ContentTemplates.LocationTemplate type = types.get(index);
            List<String> professions = pickProfessions(type, random);
            npcs.add(npcRecord(pickRace(random), professions, locationIds.get(index), random));
        }
        return new GeneratedWorld(request.worldName(), request.seed(), locations, npcs);
    }

    @Override
    public DescriptiveRecord generateNpc(NpcRequest request) {
        IRandomProvider random = new SeededRandomProvider(request.seed())
            .deriveFor("spawn:" + request.locationId(), request.spawnSequence());
        ContentTemplates.RaceTemplate race = request.race() == null ? pickRace(random) : findRace(request.race());
        List<String> professions = request.professions();
        if (professions.isEmpty()) {
            ContentTemplates.LocationTemplate type = findLocationType(request.locationType());
            professions = type == null ? List.of() : pickProfessions(type, random);
        }
        DescriptiveRecord record = npcRecord(race, professions, request.locationId(), random);
        return request.race() == null ? record : record.with("race", request.race());
    }

    private DescriptiveRecord npcRecord(ContentTemplates.RaceTemplate race, List<String> professions,
                                        String locationId, IRandomProvider random) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("name", pick(race.givenNames, random) + " " + pick(race.familyNames, random));
        record.put("race", race.name);
        record.put("title", title(professions, random));
        record.put("professions", List.copyOf(professions));
        record.put("location", locationId);
        record.put("work_location", locationId);
        Map<String, Object> needs = new LinkedHashMap<>();
        needs.put("energy", roll(templates.initialEnergy, random));
        needs.put("hunger", roll(templates.initialHunger, random));
        record.put("needs", needs);
        return new DescriptiveRecord(record);
    }

    private List<String> pickProfessions(ContentTemplates.LocationTemplate type, IRandomProvider random) {
        if (isEmpty(type.professions)) {
            return List.of();
        }
        String first = pick(type.professions, random);
        if (type.professions.size() > 1 && random.nextDouble() < templates.secondProfessionChance) {
            String second = pick(type.professions, random);
            if (!second.equals(first)) {
                return List.of(first, second);
            }
        }
        return List.of(first);
    }

    private String title(List<String> professions, IRandomProvider random) {
        if (professions.isEmpty() || templates.titles == null) {
            return "";
        }
        List<String> titles = templates.titles.get(professions.get(0));
        return isEmpty(titles) ? "" : pick(titles, random);
    }

    private String placeName(ContentTemplates.LocationTemplate type, IRandomProvider random) {
        return pick(type.namePatterns, random).replace("{root}", pick(templates.placeRoots, random));
    }

    private ContentTemplates.RaceTemplate pickRace(IRandomProvider random) {
        int roll = random.nextInt(totalRaceWeight);
        for (ContentTemplates.RaceTemplate race : templates.races) {
            roll -= race.weight;
            if (roll < 0) {
                return race;
            }
        }
        return templates.races.get(templates.races.size() - 1);
    }

    // Requested races outside the tables still get names, borrowed from the first race.
    private ContentTemplates.RaceTemplate findRace(String name) {
        for (ContentTemplates.RaceTemplate race : templates.races) {
            if (race.name.equals(name)) {
                return race;
            }
        }
        return templates.races.get(0);
    }

    private ContentTemplates.LocationTemplate findLocationType(String type) {
        for (ContentTemplates.LocationTemplate template : templates.locationTypes) {
            if (template.type.equals(type)) {
                return template;
            }
        }
        return null;
    }

    private static void link(List<Set<String>> connections, int a, int b, List<String> ids) {
        connections.get(a).add(ids.get(b));
        connections.get(b).add(ids.get(a));
    }

    private static double roll(ContentTemplates.Range range, IRandomProvider random) {
        double value = range.min + random.nextDouble() * (range.max - range.min);
        return Math.round(value * 10.0) / 10.0;
    }

    private static <T> T pick(List<T> values, IRandomProvider random) {
        return values.get(random.nextInt(values.size()));
    }
}
