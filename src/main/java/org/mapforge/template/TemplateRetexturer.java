package org.mapforge.template;

import org.mapforge.index.FaceIndex;
import org.mapforge.index.FaceLoc;
import org.mapforge.index.FaceRef;
import org.mapforge.index.GridCell;
import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.mapforge.map.Side;
import org.mapforge.map.Solid;
import org.mapforge.map.UVAxis;
import org.mapforge.math.Vec;
import org.mapforge.texturing.MapRandom;
import org.mapforge.texturing.Materials;
import org.mapforge.texturing.Materials.MaterialInfo;
import org.mapforge.texturing.Orient;
import org.mapforge.texturing.SurfaceColor;
import org.mapforge.texturing.TextureSet;
import org.mapforge.texturing.TileSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Gives imported template faces their final materials.
 * <p>
 * Per face, in order: faces on the template's skip list and tool materials are left alone;
 * realign faces get world-aligned texture axes and vertical faces an upright texture; a matching
 * entry of the replacement table wins unconditionally; otherwise recognised panel materials are
 * turned into a texture key from their colour (possibly sampled by a colour picker or forced), size
 * (possibly forced) and orientation, and a material is drawn for that key. The random source depends only on the grid cell of the
 * template origin, the face normal and the texture key, so templates placed in the same cell pick
 * the same variant for the same side.
 * <p>
 * In clumping mode tile faces get the canonical panel material and are added to the face index as
 * ordinary geometry for the wall texturing pass. All other textured faces are marked as owned by the
 * template so that pass skips them.
 */
public class TemplateRetexturer {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateRetexturer.class);

    private final FaceIndex index;
    private final TextureSet textures;
    private final MapRandom random;

    /**
     * @param index the face index of the document the templates were imported into.
     * @param textures the texture set.
     * @param random the map's random sources.
     */
    public TemplateRetexturer(FaceIndex index, TextureSet textures, MapRandom random) {
        this.index = index;
        this.textures = textures;
        this.random = random;
    }

    private record Pick(SurfaceColor color, String material) {
    }

    /**
     * Retextures every brush face and overlay of an import.
     * @param imported the import.
     * @param options the settings.
     */
    public void retexture(ImportedTemplate imported, RetextureOptions options) {
        Template template = imported.template();
        Map<Integer, Integer> reverse = new HashMap<>();
        imported.idRemap().forEach((orig, copy) -> reverse.put(copy, orig));
        Map<String, List<String>> replacements = resolveReplacements(options);
        Map<Integer, Pick> picks = pickColors(imported);
        GridCell cell = GridCell.containing(imported.origin());

        for (Solid solid : imported.allSolids()) {
            for (Side side : solid.sides()) {
                int orig = reverse.getOrDefault(side.id(), -1);
                if (template.skipFaces().contains(orig) || Materials.isTool(side.material())) {
                    continue;
                }
                if (template.realignFaces().contains(orig)) {
                    side.alignToWorld(0.25);
                } else if (template.verticalFaces().contains(orig)) {
                    makeUpright(side);
                }
                retextureFace(solid, side, orig, cell, replacements, picks.get(side.id()), options);
            }
        }

        for (Entity overlay : imported.overlays()) {
            List<String> candidates = replacements.get(Keyvalues.fold(overlay.get("material")));
            if (candidates == null) {
                continue;
            }
            String chosen = pick(candidates, random.seed("template_overlay", cell, overlay.get("material")));
            if (chosen.isEmpty()) {
                index.map().removeEntity(overlay);
            } else {
                overlay.put("material", expand(chosen, cell, Vec.ZERO));
            }
        }
    }

    private void retextureFace(Solid solid, Side side, int orig, GridCell cell, Map<String, List<String>> replacements,
                               Pick pick, RetextureOptions options) {
        Vec normal = side.normal();
        List<String> candidates = replacements.get("#" + orig);
        if (candidates == null) {
            candidates = replacements.get(Keyvalues.fold(side.material()));
        }
        if (candidates != null) {
            String chosen = pick(candidates, random.seed("template_replace", cell, normal, side.material()));
            if (!chosen.isEmpty()) {
                side.setMaterial(expand(chosen, cell, normal));
            }
            index.markTemplateFace(side.id());
            return;
        }

        Optional<MaterialInfo> found = Materials.classify(side.material());
        if (found.isEmpty()) {
            return;
        }
        MaterialInfo info = found.get();
        Orient orient = Orient.of(normal);
        if (!info.isPanel()) {
            if (Materials.isGoo(side.material()) && orient != Orient.FLOOR) {
                // Only the top of a liquid is visible.
                side.setMaterial(Materials.NODRAW);
            } else {
                side.setMaterial(textures.choose(info.specialKey(), random.seed("template", cell, normal, info.specialKey())));
            }
            index.markTemplateFace(side.id());
            return;
        }

        SurfaceColor color;
        if (pick != null) {
            if (!pick.material().isEmpty()) {
                side.setMaterial(pick.material());
                index.markTemplateFace(side.id());
                return;
            }
            color = pick.color();
        } else {
            color = options.colorOverride().apply(info.color());
        }
        TileSize size = options.forceSize() != null ? options.forceSize() : info.size();

        if (options.clumping() && size != TileSize.SPECIAL) {
            side.setMaterial(Materials.canonical(color, size, orient));
            index.insert(FaceLoc.of(side), side, solid, color);
            return;
        }
        String key = TextureSet.keyFor(color, size, orient);
        side.setMaterial(textures.choose(key, random.seed("template", cell, normal, key)));
        index.markTemplateFace(side.id());
    }

    /*
     * Turns the texture in 90 degree steps (u, v -> v, -u) to the step whose V axis points down
     * the most. Floors and ceilings have no vertical axis component and stay as they are.
     */
    static void makeUpright(Side side) {
        UVAxis u = side.uaxis();
        UVAxis v = side.vaxis();
        if (u.axis().z() == 0 && v.axis().z() == 0) {
            return;
        }
        UVAxis negU = new UVAxis(u.axis().neg().snapped(), u.offset(), u.scale());
        UVAxis negV = new UVAxis(v.axis().neg().snapped(), v.offset(), v.scale());
        UVAxis[][] steps = {{u, v}, {v, negU}, {negU, negV}, {negV, u}};
        UVAxis[] best = steps[0];
        for (UVAxis[] step : steps) {
            if (step[1].axis().z() < best[1].axis().z()) {
                best = step;
            }
        }
        side.setUVAxes(best[0], best[1]);
    }

    private Map<String, List<String>> resolveReplacements(RetextureOptions options) {
        Map<String, List<String>> resolved = new LinkedHashMap<>();
        options.replacements().forEach((rawKey, values) -> {
            String key = rawKey;
            if (options.fixup() != null && key.startsWith("$")) {
                key = options.fixup().resolve(key);
            }
            List<String> mats = new ArrayList<>(values.size());
            for (String value : values) {
                mats.add(options.fixup() != null ? options.fixup().resolve(value) : value);
            }
            if (key.startsWith("#")) {
                // "#12 15" names several faces
                for (String id : key.substring(1).trim().split("[\\s,]+")) {
                    if (!id.isEmpty()) {
                        resolved.computeIfAbsent("#" + id, k -> new ArrayList<>()).addAll(mats);
                    }
                }
            } else if (!key.isEmpty()) {
                resolved.computeIfAbsent(Keyvalues.fold(key), k -> new ArrayList<>()).addAll(mats);
            }
        });
        return resolved;
    }

    private static String pick(List<String> candidates, Random rand) {
        if (candidates.isEmpty()) {
            return "";
        }
        return candidates.get(rand.nextInt(candidates.size())).trim();
    }

    private String expand(String material, GridCell cell, Vec normal) {
        if (material.startsWith("<") && material.endsWith(">")) {
            String key = material.substring(1, material.length() - 1);
            return textures.choose(key, random.seed("template", cell, normal, Keyvalues.fold(key)));
        }
        return material;
    }

    private Map<Integer, Pick> pickColors(ImportedTemplate imported) {
        Map<Integer, Pick> picks = new HashMap<>();
        List<ColorPicker> pickers = new ArrayList<>(imported.template().colorPickers());
        pickers.sort(Comparator.comparingInt(ColorPicker::priority));
        MapDocument map = index.map();

        for (ColorPicker picker : pickers) {
            if (!picker.appliesTo(imported.visgroups())) {
                continue;
            }
            Vec pos = imported.orientation().rotate(picker.offset()).add(imported.origin());
            Vec normal = imported.orientation().rotate(picker.normal());
            if (picker.gridSnap()) {
                pos = GridCell.containing(pos.sub(normal)).center().add(normal.mul(GridCell.SIZE / 2.0));
            }
            FaceLoc loc = FaceLoc.at(pos, normal);
            Optional<FaceRef> found = index.lookup(loc);
            if (found.isEmpty() || found.get().color() == SurfaceColor.GOO) {
                LOG.debug("Colour picker {} of {} found no panel at {}", picker.name(), imported.template().id(), loc);
                continue;
            }
            FaceRef surface = found.get();
            String material = surface.color() == SurfaceColor.WHITE ? picker.whiteMaterial() : picker.blackMaterial();
            for (int face : picker.faces()) {
                Integer copy = imported.idRemap().get(face);
                if (copy != null) {
                    picks.put(copy, new Pick(surface.color(), material));
                }
            }
            switch (picker.afterPick()) {
                case NODRAW -> {
                    index.pop(loc);
                    surface.face().setMaterial(Materials.NODRAW);
                }
                case VOID -> {
                    Map<Integer, List<Integer>> dropped = new HashMap<>();
                    surface.solid().sides().forEach(side -> dropped.put(side.id(), List.of()));
                    index.evict(surface.solid());
                    map.removeBrush(surface.solid());
                    map.reallocateOverlays(dropped);
                }
                case NONE -> {
                    // sampled surface stays as it is
                }
            }
        }
        return picks;
    }
}
