package org.rgen.runtime.behavior;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigUtil;
import org.rgen.runtime.time.WorkingHours;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Known professions by name. Unknown names resolve to {@link Profession#generic(String)}.
 */
public final class ProfessionCatalog {

    private final Map<String, Profession> professions;

    public ProfessionCatalog(Collection<Profession> professions) {
        Map<String, Profession> byName = new LinkedHashMap<>();
        for (Profession profession : professions) {
            if (byName.put(profession.name(), profession) != null) {
                throw new IllegalArgumentException("Duplicate profession: " + profession.name());
            }
        }
        this.professions = Collections.unmodifiableMap(byName);
    }

    /**
     * @param config the {@code rgen.professions} block.
     */
    public static ProfessionCatalog fromConfig(Config config) {
        ConfigObject root = config.root();
        List<Profession> list = new ArrayList<>();
        for (String name : root.keySet()) {
            Config entry = config.getConfig(ConfigUtil.quoteString(name));
            int start = entry.hasPath("start-hour") ? entry.getInt("start-hour") : WorkingHours.DEFAULT.startHour();
            int end = entry.hasPath("end-hour") ? entry.getInt("end-hour") : WorkingHours.DEFAULT.endHour();
            double skill = entry.hasPath("skill") ? entry.getDouble("skill") : 1.0;
            List<String> crafts = entry.hasPath("crafts") ? entry.getStringList("crafts") : List.of();
            try {
                list.add(new Profession(name, new WorkingHours(start, end), skill, crafts));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid rgen.professions." + name + ": " + e.getMessage(), e);
            }
        }
        return new ProfessionCatalog(list);
    }

    public Profession resolve(String name) {
        Profession profession = professions.get(name);
        return profession != null ? profession : Profession.generic(name);
    }

    public boolean isKnown(String name) {
        return professions.containsKey(name);
    }

    public Collection<Profession> all() {
        return professions.values();
    }
}
