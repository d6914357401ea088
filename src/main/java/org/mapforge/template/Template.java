package org.mapforge.template;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.mapforge.map.Solid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * A named set of brushes and overlays, split into visgroups, that can be stamped into a map.
 * Templates are immutable once the library is loaded.
 * <p>
 * The unnamed visgroup {@code ""} holds the parts that are always imported.
 */
public final class Template {

    private final String id;
    private final Map<String, VisgroupContents> groups;
    private final Set<Integer> skipFaces;
    private final Set<Integer> realignFaces;
    private final Set<Integer> verticalFaces;
    private final Set<Integer> overlayFaces;
    private final List<ColorPicker> colorPickers;
    private final TemplateBrushType defaultType;

    Template(String id,
             Map<String, VisgroupContents> groups,
             Set<Integer> skipFaces,
             Set<Integer> realignFaces,
             Set<Integer> verticalFaces,
             Set<Integer> overlayFaces,
             List<ColorPicker> colorPickers,
             TemplateBrushType defaultType) {
        this.id = id;
        this.groups = Collections.unmodifiableMap(groups);
        this.skipFaces = Set.copyOf(skipFaces);
        this.realignFaces = Set.copyOf(realignFaces);
        this.verticalFaces = Set.copyOf(verticalFaces);
        this.overlayFaces = Set.copyOf(overlayFaces);
        this.colorPickers = List.copyOf(colorPickers);
        this.defaultType = defaultType;
    }

    public String id() {
        return id;
    }

    /**
     * @return the visgroup names, sorted; always includes {@code ""}.
     */
    public Set<String> visgroupNames() {
        Set<String> names = new TreeSet<>(groups.keySet());
        names.add("");
        return names;
    }

    /**
     * Collects the parts of the requested visgroups plus the unnamed one.
     *
     * @param visgroups the requested visgroup names, case-insensitive.
     * @return the merged contents, in visgroup declaration order.
     * @throws IllegalArgumentException if a visgroup is unknown.
     */
    public VisgroupContents visgrouped(Set<String> visgroups) {
        Set<String> wanted = new LinkedHashSet<>();
        wanted.add("");
        for (String group : visgroups) {
            String folded = Keyvalues.fold(group);
            if (!folded.isEmpty() && !groups.containsKey(folded)) {
                throw new IllegalArgumentException("Unknown visgroup \"" + group + "\" for template \"" + id
                        + "\"! Valid: " + visgroupNames());
            }
            wanted.add(folded);
        }
        List<Solid> world = new ArrayList<>();
        List<Solid> detail = new ArrayList<>();
        List<Entity> overlays = new ArrayList<>();
        for (Map.Entry<String, VisgroupContents> e : groups.entrySet()) {
            if (wanted.contains(e.getKey())) {
                world.addAll(e.getValue().world());
                detail.addAll(e.getValue().detail());
                overlays.addAll(e.getValue().overlays());
            }
        }
        return new VisgroupContents(world, detail, overlays);
    }

    /**
     * @return face identifiers the retexturer never touches.
     */
    public Set<Integer> skipFaces() {
        return skipFaces;
    }

    /**
     * @return face identifiers whose texture axes are reset to world alignment.
     */
    public Set<Integer> realignFaces() {
        return realignFaces;
    }

    /**
     * @return face identifiers whose texture is turned in quarter steps until it stands upright.
     */
    public Set<Integer> verticalFaces() {
        return verticalFaces;
    }

    /**
     * @return face identifiers overlays are moved onto when the template replaces a surface.
     */
    public Set<Integer> overlayFaces() {
        return overlayFaces;
    }

    public List<ColorPicker> colorPickers() {
        return colorPickers;
    }

    /**
     * @return the brush type used when an import does not force one.
     */
    public TemplateBrushType defaultType() {
        return defaultType;
    }

    @Override
    public String toString() {
        return "Template[" + id + ", groups=" + visgroupNames() + "]";
    }
}
