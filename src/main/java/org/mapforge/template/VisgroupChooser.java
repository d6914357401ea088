package org.mapforge.template;

import org.mapforge.keyvalues.Keyvalues;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Picks additional visgroups for an import, on top of the explicitly requested ones.
 */
@FunctionalInterface
public interface VisgroupChooser {

    /**
     * @param template the template being imported.
     * @param rand a random source seeded for this import.
     * @return the chosen visgroup names.
     */
    Set<String> choose(Template template, Random rand);

    /**
     * @return a chooser adding nothing.
     */
    static VisgroupChooser none() {
        return (template, rand) -> Set.of();
    }

    /**
     * @return a chooser adding every visgroup of the template.
     */
    static VisgroupChooser all() {
        return (template, rand) -> template.visgroupNames();
    }

    /**
     * @param candidates the visgroups to pick from; empty means all named visgroups.
     * @return a chooser adding exactly one of the candidates, uniformly at random.
     */
    static VisgroupChooser randomOne(List<String> candidates) {
        return (template, rand) -> {
            List<String> pool = new ArrayList<>();
            if (candidates.isEmpty()) {
                template.visgroupNames().stream().filter(g -> !g.isEmpty()).forEach(pool::add);
            } else {
                candidates.forEach(c -> pool.add(Keyvalues.fold(c)));
            }
            if (pool.isEmpty()) {
                return Set.of();
            }
            return Set.of(pool.get(rand.nextInt(pool.size())));
        };
    }

    /**
     * @param chances visgroup name to the percentage chance (0-100) of adding it.
     * @return a chooser rolling independently for each visgroup, in the given order.
     */
    static VisgroupChooser withChance(Map<String, Double> chances) {
        Map<String, Double> ordered = new LinkedHashMap<>(chances);
        return (template, rand) -> {
            Set<String> chosen = new LinkedHashSet<>();
            ordered.forEach((group, chance) -> {
                if (rand.nextDouble() * 100.0 < chance) {
                    chosen.add(Keyvalues.fold(group));
                }
            });
            return chosen;
        };
    }
}
