package org.mapforge.template;

import org.mapforge.keyvalues.Keyvalues;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A template reference as written in configuration: {@code id} or {@code id:group1,group2}.
 *
 * @param id The case-folded template id.
 * @param visgroups The case-folded visgroups requested after the colon.
 */
public record TemplateName(String id, Set<String> visgroups) {

    /**
     * @param text the reference.
     * @return the parsed reference.
     */
    public static TemplateName parse(String text) {
        String folded = Keyvalues.fold(text.trim());
        int colon = folded.indexOf(':');
        if (colon < 0) {
            return new TemplateName(folded, Set.of());
        }
        Set<String> groups = new LinkedHashSet<>();
        for (String group : folded.substring(colon + 1).split(",")) {
            if (!group.isBlank()) {
                groups.add(group.trim());
            }
        }
        return new TemplateName(folded.substring(0, colon).trim(), groups);
    }
}
