package org.mapforge.template;

import org.mapforge.index.FaceIndex;
import org.mapforge.index.FaceRef;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.mapforge.map.Side;
import org.mapforge.map.Solid;
import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;
import org.mapforge.texturing.MapRandom;
import org.mapforge.texturing.Materials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Copies templates into a document.
 * <p>
 * Every copied face gets a fresh identifier from the target document, so importing the same
 * template twice never produces shared identifiers. Overlays follow their faces through the
 * identifier mapping; an overlay with none of its faces imported is dropped.
 */
public class TemplateImporter {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateImporter.class);

    private static final Set<String> ROTATED_OVERLAY_KEYS = Set.of("basisnormal", "basisu", "basisv");
    private static final Set<String> POSITION_OVERLAY_KEYS = Set.of("origin", "basisorigin");

    private final TemplateLibrary library;

    public TemplateImporter(TemplateLibrary library) {
        this.library = library;
    }

    public TemplateLibrary library() {
        return library;
    }

    /**
     * Imports a template, seeding the visgroup chooser from the request.
     * @param map the target document.
     * @param request what to import.
     * @return the imported parts.
     */
    public ImportedTemplate importTemplate(MapDocument map, ImportRequest request) {
        Random rand = new MapRandom(new byte[0]).seed("template_visgroups", request.name(), request.origin());
        return importTemplate(map, request, rand);
    }

    /**
     * Imports a template.
     *
     * @param map the target document.
     * @param request what to import.
     * @param rand the random source handed to the visgroup chooser.
     * @return the imported parts.
     * @throws InvalidTemplateNameException if the template does not exist.
     * @throws IllegalArgumentException if a requested visgroup does not exist.
     */
    public ImportedTemplate importTemplate(MapDocument map, ImportRequest request, Random rand) {
        TemplateName name = TemplateName.parse(request.name());
        Template template = library.get(name.id());

        Set<String> visgroups = new LinkedHashSet<>();
        visgroups.add("");
        visgroups.addAll(name.visgroups());
        visgroups.addAll(request.visgroups());
        visgroups.addAll(request.chooser().choose(template, rand));
        VisgroupContents contents = template.visgrouped(visgroups);

        TemplateBrushType type = request.forceType() != null ? request.forceType() : template.defaultType();
        Vec origin = request.origin();
        Orientation orient = request.orientation();

        Map<Integer, Integer> idRemap = new LinkedHashMap<>();
        List<Solid> world = new ArrayList<>();
        List<Solid> detail = new ArrayList<>();
        for (Solid solid : contents.world()) {
            Solid copy = solid.copy(map, idRemap);
            copy.localise(origin, orient);
            (type == TemplateBrushType.DETAIL ? detail : world).add(copy);
        }
        for (Solid solid : contents.detail()) {
            Solid copy = solid.copy(map, idRemap);
            copy.localise(origin, orient);
            (type == TemplateBrushType.WORLD ? world : detail).add(copy);
        }

        Entity detailEnt = null;
        if (request.addToMap()) {
            world.forEach(map::addBrush);
            if (!detail.isEmpty()) {
                detailEnt = map.createEntity(MapDocument.DETAIL_CLASS);
                for (Solid solid : detail) {
                    map.addSolid(detailEnt, solid);
                }
            }
        }

        List<Entity> overlays = new ArrayList<>();
        for (Entity source : contents.overlays()) {
            copyOverlay(map, source, idRemap, origin, orient, request.targetname()).ifPresent(overlays::add);
        }

        LOG.debug("Imported template {} at {} ({} world, {} detail, {} overlays, groups {})",
                template.id(), origin, world.size(), detail.size(), overlays.size(), visgroups);
        return new ImportedTemplate(List.copyOf(world), List.copyOf(detail), detailEnt, List.copyOf(overlays),
                Collections.unmodifiableMap(idRemap), template, origin, orient, Collections.unmodifiableSet(visgroups));
    }

    private Optional<Entity> copyOverlay(MapDocument map, Entity source, Map<Integer, Integer> idRemap,
                                         Vec origin, Orientation orient, String targetname) {
        List<Integer> faces = new ArrayList<>();
        for (int face : MapDocument.overlayFaces(source)) {
            Integer copy = idRemap.get(face);
            if (copy != null) {
                faces.add(copy);
            }
        }
        if (faces.isEmpty()) {
            LOG.debug("Overlay {} has none of its faces imported, skipped", source);
            return Optional.empty();
        }
        Entity overlay = map.createEntity(MapDocument.OVERLAY_CLASS);
        for (Map.Entry<String, String> key : source.keys()) {
            String folded = key.getKey().toLowerCase(Locale.ROOT);
            switch (folded) {
                case "classname", "template_id", "visgroup", "sides" -> {
                    // handled separately or only meaningful in the library
                }
                default -> overlay.put(key.getKey(), transformOverlayKey(folded, key.getValue(), origin, orient));
            }
        }
        MapDocument.setOverlayFaces(overlay, faces);
        String name = overlay.targetname();
        if (!name.isEmpty() && !targetname.isEmpty() && !name.startsWith("@")) {
            overlay.put("targetname", targetname + "-" + name);
        }
        return Optional.of(overlay);
    }

    private static String transformOverlayKey(String key, String value, Vec origin, Orientation orient) {
        if (POSITION_OVERLAY_KEYS.contains(key)) {
            return orient.rotate(Vec.parse(value)).add(origin).snapped().toString();
        } else if (ROTATED_OVERLAY_KEYS.contains(key)) {
            return orient.rotate(Vec.parse(value)).toString();
        }
        return value;
    }

    /**
     * Drops a surface that a template is about to replace from the index, so faces the template adds
     * at the same location are indexed instead of colliding with it.
     *
     * @param index the face index.
     * @param surface the surface being replaced.
     * @param removeBrush whether the whole brush owning the surface goes away.
     */
    public void releaseSurface(FaceIndex index, FaceRef surface, boolean removeBrush) {
        if (removeBrush) {
            index.evict(surface.solid());
        } else {
            index.discard(surface.face().id());
        }
    }

    /**
     * Replaces an indexed surface with an imported template: overlays on the surface move to the
     * template's overlay faces, and the surface is either removed with its whole brush or hidden.
     * The surface leaves the index if {@link #releaseSurface} has not already taken it out.
     *
     * @param map the document.
     * @param index the face index.
     * @param surface the surface being replaced.
     * @param imported the template replacing it.
     * @param removeBrush whether to remove the brush owning the surface instead of hiding the face.
     */
    public void stealFromBrush(MapDocument map, FaceIndex index, FaceRef surface, ImportedTemplate imported,
                               boolean removeBrush) {
        List<Integer> targets = new ArrayList<>();
        for (int face : imported.template().overlayFaces()) {
            Integer copy = imported.idRemap().get(face);
            if (copy != null) {
                targets.add(copy);
            }
        }
        Map<Integer, List<Integer>> mapping = new HashMap<>();
        mapping.put(surface.face().id(), targets);
        if (removeBrush) {
            for (Side side : surface.solid().sides()) {
                mapping.putIfAbsent(side.id(), List.of());
            }
            releaseSurface(index, surface, true);
            map.removeBrush(surface.solid());
        } else {
            releaseSurface(index, surface, false);
            surface.face().setMaterial(Materials.NODRAW);
        }
        int removedOverlays = map.reallocateOverlays(mapping);
        LOG.debug("Template {} replaced face {} ({} overlays removed)",
                imported.template().id(), surface.face().id(), removedOverlays);
    }
}
