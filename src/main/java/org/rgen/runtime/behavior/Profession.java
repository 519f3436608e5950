package org.rgen.runtime.behavior;

import org.rgen.runtime.time.WorkingHours;

import java.util.List;

/**
 * Work schedule and crafting ability of one profession.
 *
 * @param name   profession name as used on NPCs.
 * @param hours  daily working window.
 * @param skill  multiplier on the per-minute craft chance.
 * @param crafts item templates this profession can produce, possibly empty.
 */
public record Profession(String name, WorkingHours hours, double skill, List<String> crafts) {

    public Profession {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Profession name must not be blank");
        }
        if (skill < 0) {
            throw new IllegalArgumentException("Skill of profession '" + name + "' must be >= 0: " + skill);
        }
        crafts = List.copyOf(crafts);
    }

    /**
     * A profession with the default window, skill 1.0 and nothing to craft.
     */
    public static Profession generic(String name) {
        return new Profession(name, WorkingHours.DEFAULT, 1.0, List.of());
    }
}
