package org.mapforge.template;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.mapforge.map.MapDocumentReader;
import org.mapforge.map.MapFormatException;
import org.mapforge.map.Solid;
import org.mapforge.math.Orientation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All templates, loaded from a template document.
 * <p>
 * The document uses marker entities keyed by {@code template_id} (and optionally {@code visgroup}):
 * <ul>
 *     <li>{@code bee2_template_world} / {@code bee2_template_detail}: brushes of the template.</li>
 *     <li>{@code bee2_template_overlay}: an overlay whose {@code sides} refer to template faces.</li>
 *     <li>{@code bee2_template_conf}: {@code skip_faces}, {@code realign_faces}, {@code vertical_faces},
 *     {@code overlay_faces}
 *     and {@code temp_type}.</li>
 *     <li>{@code bee2_template_colorpicker}: a colour picker.</li>
 *     <li>{@code bee2_template_scaling}: a single cube used as a {@link ScalingTemplate}.</li>
 * </ul>
 * The library document keeps owning the brushes; imports copy them.
 */
public class TemplateLibrary {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateLibrary.class);

    private final MapDocument source;
    private final Map<String, Template> templates;
    private final Map<String, ScalingTemplate> scaling;

    private TemplateLibrary(MapDocument source, Map<String, Template> templates, Map<String, ScalingTemplate> scaling) {
        this.source = source;
        this.templates = templates;
        this.scaling = scaling;
    }

    /**
     * @return a library without templates.
     */
    public static TemplateLibrary empty() {
        return new TemplateLibrary(new MapDocument(), Map.of(), Map.of());
    }

    /**
     * Reads a template document from disk.
     * @param file the document.
     * @return the library.
     * @throws IOException if the file cannot be read.
     * @throws MapFormatException if the document is malformed.
     */
    public static TemplateLibrary load(Path file) throws IOException, MapFormatException {
        return load(MapDocumentReader.read(file));
    }

    /**
     * Collects the templates of an already loaded template document.
     * @param doc the document.
     * @return the library.
     */
    public static TemplateLibrary load(MapDocument doc) {
        Map<String, Builder> builders = new LinkedHashMap<>();
        Map<String, ScalingTemplate> scaling = new HashMap<>();

        for (Entity ent : doc.entities()) {
            String id = Keyvalues.fold(ent.get("template_id").trim());
            String cls = Keyvalues.fold(ent.classname());
            if (!cls.startsWith("bee2_template_")) {
                continue;
            }
            if (id.isEmpty()) {
                LOG.warn("Template entity {} has no template_id, ignored", ent);
                continue;
            }
            String visgroup = Keyvalues.fold(ent.get("visgroup").trim());
            switch (cls) {
                case "bee2_template_world" -> builders.computeIfAbsent(id, Builder::new).group(visgroup).world.addAll(ent.solids());
                case "bee2_template_detail" -> builders.computeIfAbsent(id, Builder::new).group(visgroup).detail.addAll(ent.solids());
                case "bee2_template_overlay" -> builders.computeIfAbsent(id, Builder::new).group(visgroup).overlays.add(ent);
                case "bee2_template_conf" -> builders.computeIfAbsent(id, Builder::new).configure(ent);
                case "bee2_template_colorpicker" -> {
                    Builder builder = builders.computeIfAbsent(id, Builder::new);
                    builder.group(visgroup);
                    builder.pickers.add(parsePicker(ent));
                }
                case "bee2_template_scaling" -> {
                    if (scaling.containsKey(id)) {
                        throw new IllegalArgumentException("Duplicate scaling template \"" + id + "\"");
                    }
                    scaling.put(id, ScalingTemplate.parse(id, ent.solids()));
                }
                default -> LOG.warn("Unknown template entity class '{}' ({})", ent.classname(), ent);
            }
        }

        Map<String, Template> templates = new LinkedHashMap<>();
        builders.forEach((id, b) -> templates.put(id, b.build()));
        LOG.info("Loaded {} templates and {} scaling templates", templates.size(), scaling.size());
        return new TemplateLibrary(doc, templates, scaling);
    }

    /**
     * @param name a template id, case-insensitive; a {@code :visgroups} suffix is ignored.
     * @return the template.
     * @throws InvalidTemplateNameException if there is no such template.
     */
    public Template get(String name) {
        String id = TemplateName.parse(name).id();
        Template template = templates.get(id);
        if (template == null) {
            throw new InvalidTemplateNameException(name, knownNames());
        }
        return template;
    }

    /**
     * @param name a scaling template id, case-insensitive.
     * @return the scaling template.
     * @throws InvalidTemplateNameException if there is no such scaling template.
     */
    public ScalingTemplate scaling(String name) {
        ScalingTemplate tmp = scaling.get(Keyvalues.fold(name.trim()));
        if (tmp == null) {
            throw new InvalidTemplateNameException(name, scaling.keySet().stream().sorted().toList());
        }
        return tmp;
    }

    public boolean has(String name) {
        return templates.containsKey(TemplateName.parse(name).id());
    }

    /**
     * @return every template id, sorted.
     */
    public List<String> knownNames() {
        return templates.keySet().stream().sorted().toList();
    }

    /**
     * @return the document the templates live in.
     */
    public MapDocument source() {
        return source;
    }

    private static ColorPicker parsePicker(Entity ent) {
        Set<Integer> faces = new LinkedHashSet<>(parseIds(ent.get("faces")));
        Orientation orient = ent.orientation();
        return new ColorPicker(
                parseInt(ent.get("priority", "0")),
                ent.get("targetname", ent.toString()),
                ent.origin(),
                orient.forward(),
                faces,
                Keyvalues.parseBool(ent.get("grid_snap"), false),
                AfterPickMode.parse(ent.get("after", ent.get("remove_brush", "0"))),
                ent.get("tex_white"),
                ent.get("tex_black"),
                Keyvalues.fold(ent.get("visgroup").trim()));
    }

    static Set<Integer> parseIds(String text) {
        Set<Integer> ids = new HashSet<>();
        for (String part : text.trim().split("[\\s,]+")) {
            if (part.isEmpty()) {
                continue;
            }
            try {
                ids.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring malformed face id '{}'", part);
            }
        }
        return ids;
    }

    private static int parseInt(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring malformed priority '{}'", text);
            return 0;
        }
    }

    private static final class Builder {
        private final String id;
        private final Map<String, Group> groups = new LinkedHashMap<>();
        private final List<ColorPicker> pickers = new ArrayList<>();
        private final Set<Integer> skip = new HashSet<>();
        private final Set<Integer> realign = new HashSet<>();
        private final Set<Integer> vertical = new HashSet<>();
        private final Set<Integer> overlay = new HashSet<>();
        private TemplateBrushType type = TemplateBrushType.DEFAULT;

        Builder(String id) {
            this.id = id;
        }

        Group group(String visgroup) {
            return groups.computeIfAbsent(visgroup, k -> new Group());
        }

        void configure(Entity conf) {
            skip.addAll(parseIds(conf.get("skip_faces")));
            realign.addAll(parseIds(conf.get("realign_faces")));
            vertical.addAll(parseIds(conf.get("vertical_faces")));
            overlay.addAll(parseIds(conf.get("overlay_faces")));
            type = TemplateBrushType.parse(conf.get("temp_type", "default"));
        }

        Template build() {
            Map<String, VisgroupContents> contents = new LinkedHashMap<>();
            groups.forEach((name, g) -> contents.put(name,
                    new VisgroupContents(List.copyOf(g.world), List.copyOf(g.detail), List.copyOf(g.overlays))));
            return new Template(id, contents, skip, realign, vertical, overlay, pickers, type);
        }
    }

    private static final class Group {
        private final List<Solid> world = new ArrayList<>();
        private final List<Solid> detail = new ArrayList<>();
        private final List<Entity> overlays = new ArrayList<>();
    }

    @Override
    public String toString() {
        return "TemplateLibrary[" + templates.size() + " templates]";
    }
}
