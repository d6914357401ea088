package org.mapforge.conditions.rules;

import org.mapforge.conditions.ActionOutcome;
import org.mapforge.conditions.ConditionRegistry;
import org.mapforge.conditions.ContextKey;
import org.mapforge.conditions.Handlers;
import org.mapforge.conditions.MapInfo;
import org.mapforge.conditions.RuleConfig;
import org.mapforge.conditions.RuleModule;
import org.mapforge.conditions.TestOutcome;
import org.mapforge.index.FaceIndex;
import org.mapforge.index.FaceLoc;
import org.mapforge.index.FaceRef;
import org.mapforge.index.GridCell;
import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.mapforge.map.Instances;
import org.mapforge.map.MapDocument;
import org.mapforge.map.Side;
import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;
import org.mapforge.template.ColorOverride;
import org.mapforge.template.ImportRequest;
import org.mapforge.template.ImportedTemplate;
import org.mapforge.template.InvalidTemplateNameException;
import org.mapforge.template.RetextureOptions;
import org.mapforge.template.ScalingTemplate;
import org.mapforge.template.TemplateBrushType;
import org.mapforge.template.TemplateImporter;
import org.mapforge.template.TemplateRetexturer;
import org.mapforge.template.VisgroupChooser;
import org.mapforge.texturing.PresetClump;
import org.mapforge.texturing.TileSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rules working on brushes: surface checks against the face index, template imports, preset
 * texture areas and direct face texturing.
 * <p>
 * Positions are instance-local; {@code 0 0 -64} is the floor surface below the instance origin and
 * directions are outward surface normals, {@code 0 0 1} being a floor.
 */
public class BrushRules implements RuleModule {

    private static final Logger LOG = LoggerFactory.getLogger(BrushRules.class);

    static final String FLOOR_POS = "0 0 -64";
    static final Vec UP = new Vec(0, 0, 1);

    /**
     * A parsed template import.
     *
     * @param id The template reference.
     * @param offset Instance-local origin of the template.
     * @param angles Rotation applied before the instance rotation.
     * @param color Forced panel colour.
     * @param forceSize Forced panel size, or {@code null}.
     * @param forceType Forced brush placement, or {@code null}.
     * @param invertVar A fixup variable that inverts the colour when true; may be empty.
     * @param visgroups Explicitly requested visgroups.
     * @param chooser Picks further visgroups.
     * @param replacements Material or {@code #faceid} to replacement candidates.
     * @param surfacePos Instance-local point of the surface the template replaces, or {@code null}.
     * @param surfaceDir Instance-local normal of that surface.
     * @param removeBrush Whether the replaced surface's brush is removed instead of hidden.
     */
    record TemplatePlacement(String id, String offset, String angles, ColorOverride color, TileSize forceSize,
                             TemplateBrushType forceType, String invertVar, Set<String> visgroups,
                             VisgroupChooser chooser, Map<String, List<String>> replacements,
                             String surfacePos, String surfaceDir, boolean removeBrush) {
    }

    /**
     * @param point1 One corner, instance-local.
     * @param point2 The opposite corner.
     * @param textures Texture key to material.
     */
    record AreaTextures(Vec point1, Vec point2, Map<String, String> textures) {
    }

    @Override
    public String group() {
        return "Brushes";
    }

    @Override
    public void register(ConditionRegistry registry) {
        boolean strict = registry.options().strict();

        registry.registerTest("posIsSolid", Handlers.of(ContextKey.MAP, ContextKey.INDEX, ContextKey.INSTANCE, ContextKey.CONFIG,
                BrushRules::posIsSolid), "posIsSurface");

        registry.registerSetup("templateBrush", (parser, kv) -> parsePlacement(kv, "replaceBrush", "replaceNormal", true));
        registry.registerResult("templateBrush", Handlers.of(
                ContextKey.MAP, ContextKey.INDEX, ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (map, index, info, inst, conf) -> {
                    TemplatePlacement place = conf.setup(TemplatePlacement.class);
                    if (!info.templates().has(place.id())) {
                        return missingTemplate(strict, place.id(), inst, info);
                    }
                    Optional<FaceRef> surface = place.surfacePos() == null
                            ? Optional.empty()
                            : index.lookup(surfaceAt(inst, place.surfacePos(), place.surfaceDir(), false));
                    placeTemplate(map, index, info, inst, place, surface);
                    return ActionOutcome.CONTINUE;
                }));

        registry.registerSetup("stealSurface", (parser, kv) -> parsePlacement(kv, "pos", "dir", false));
        registry.registerResult("stealSurface", Handlers.of(
                ContextKey.MAP, ContextKey.INDEX, ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (map, index, info, inst, conf) -> {
                    TemplatePlacement place = conf.setup(TemplatePlacement.class);
                    if (!info.templates().has(place.id())) {
                        return missingTemplate(strict, place.id(), inst, info);
                    }
                    String pos = place.surfacePos() == null ? FLOOR_POS : place.surfacePos();
                    Optional<FaceRef> surface = index.lookup(surfaceAt(inst, pos, place.surfaceDir(), false));
                    if (surface.isEmpty()) {
                        LOG.debug("No surface to replace for {}", inst);
                        return ActionOutcome.CONTINUE;
                    }
                    placeTemplate(map, index, info, inst, place, surface);
                    return ActionOutcome.CONTINUE;
                }));

        registry.registerSetup("SetAreaTex", (parser, kv) -> parseAreaTextures(kv));
        registry.registerResult("SetAreaTex", Handlers.of(ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (info, inst, conf) -> {
                    AreaTextures area = conf.setup(AreaTextures.class);
                    Orientation orient = inst.orientation();
                    Vec a = orient.rotate(area.point1()).add(inst.origin()).snapped();
                    Vec b = orient.rotate(area.point2()).add(inst.origin()).snapped();
                    if (!info.clumping()) {
                        LOG.debug("SetAreaTex at {} has no effect without clumping", inst);
                    }
                    info.addPresetClump(PresetClump.between(a, b, area.textures()));
                    return ActionOutcome.CONTINUE;
                }));

        registry.registerResult("applyScalingTemplate", Handlers.of(ContextKey.INDEX, ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (index, info, inst, conf) -> {
                    Keyvalues kv = conf.kv();
                    ScalingTemplate scaling;
                    try {
                        scaling = info.templates().scaling(kv.get("template"));
                    } catch (InvalidTemplateNameException e) {
                        if (strict) {
                            throw e;
                        }
                        LOG.warn("{} ({})", e.getMessage(), inst);
                        return ActionOutcome.EXHAUSTED;
                    }
                    Optional<FaceRef> surface = index.lookup(surfaceAt(inst, kv.get("pos", FLOOR_POS), kv.get("dir"),
                            kv.getBool("gridPos", false)));
                    ScalingTemplate rotated = scaling.rotate(inst.orientation());
                    surface.ifPresent(face -> {
                        String before = face.face().material();
                        rotated.apply(face.face());
                        if (!face.face().material().equals(before)) {
                            index.markTemplateFace(face.face().id());
                        }
                    });
                    return ActionOutcome.CONTINUE;
                }));

        registry.registerResult("setTexture", Handlers.of(ContextKey.INDEX, ContextKey.INFO, ContextKey.INSTANCE, ContextKey.CONFIG,
                (index, info, inst, conf) -> {
                    Keyvalues kv = conf.kv();
                    String tex = inst.fixup().substitute(kv.get("tex"));
                    if (tex.isEmpty()) {
                        LOG.warn("setTexture without a texture ({})", inst);
                        return ActionOutcome.EXHAUSTED;
                    }
                    FaceLoc loc = surfaceAt(inst, kv.get("pos", FLOOR_POS), kv.get("dir"), kv.getBool("gridPos", false));
                    index.lookup(loc).ifPresent(face -> {
                        String material = tex;
                        if (tex.startsWith("<") && tex.endsWith(">")) {
                            String key = tex.substring(1, tex.length() - 1);
                            material = info.textures().choose(key, info.random().seed("set_texture", loc.cell(), loc.normal(), key));
                        }
                        face.face().setMaterial(material);
                        index.markTemplateFace(face.face().id());
                    });
                    return ActionOutcome.CONTINUE;
                }));
    }

    /*
     * "posIsSolid" { "pos" "0 0 -64" "dir" "0 0 1" "type" "white" "gridPos" "0" "setVar" "$color" "removeBrush" "0" }
     */
    private static TestOutcome posIsSolid(MapDocument map, FaceIndex index, Entity inst, RuleConfig conf) {
        Keyvalues kv = conf.kv();
        FaceLoc loc = surfaceAt(inst, kv.get("pos", FLOOR_POS), kv.get("dir"), kv.getBool("gridPos", false));
        Optional<FaceRef> found = index.lookup(loc);
        String foundType = found.map(face -> face.color().key()).orElse("none");

        String resultVar = kv.get("setVar");
        if (!resultVar.isEmpty()) {
            inst.fixup().put(resultVar, foundType);
        }
        if (found.isPresent() && kv.getBool("removeBrush", false)) {
            removeBrush(map, index, found.get());
        }
        String wanted = Keyvalues.fold(kv.get("type", "any").trim());
        return switch (wanted) {
            case "any" -> TestOutcome.of(found.isPresent());
            case "none", "white", "black", "goo" -> TestOutcome.of(wanted.equals(foundType));
            default -> {
                LOG.warn("Unknown surface type '{}' for posIsSolid", wanted);
                yield TestOutcome.FAIL;
            }
        };
    }

    private static void removeBrush(MapDocument map, FaceIndex index, FaceRef surface) {
        Map<Integer, List<Integer>> dropped = new HashMap<>();
        for (Side side : surface.solid().sides()) {
            dropped.put(side.id(), List.of());
        }
        index.evict(surface.solid());
        map.removeBrush(surface.solid());
        map.reallocateOverlays(dropped);
    }

    static FaceLoc surfaceAt(Entity inst, String pos, String dir, boolean gridPos) {
        Vec point = Instances.resolveOffset(inst, pos);
        Vec normal = Instances.resolveDirection(inst, dir, UP).norm().snapped();
        if (gridPos) {
            point = new Vec(
                    normal.x() == 0 ? snapToCellCenter(point.x()) : point.x(),
                    normal.y() == 0 ? snapToCellCenter(point.y()) : point.y(),
                    normal.z() == 0 ? snapToCellCenter(point.z()) : point.z());
        }
        return FaceLoc.at(point, normal);
    }

    private static double snapToCellCenter(double v) {
        return Math.floor(v / GridCell.SIZE) * GridCell.SIZE + GridCell.SIZE / 2.0;
    }

    private static ActionOutcome missingTemplate(boolean strict, String id, Entity inst, MapInfo info) {
        if (strict) {
            throw new InvalidTemplateNameException(id, info.templates().knownNames());
        }
        LOG.warn("'{}' is not a valid template, result disabled ({})", id, inst);
        return ActionOutcome.EXHAUSTED;
    }

    private static void placeTemplate(MapDocument map, FaceIndex index, MapInfo info, Entity inst,
                                      TemplatePlacement place, Optional<FaceRef> surface) {
        Orientation orient = Orientation.fromAngles(inst.fixup().substitute(place.angles())).then(inst.orientation());
        Vec origin = Instances.resolveOffset(inst, place.offset());
        ImportRequest request = ImportRequest.of(place.id(), origin, orient)
                .withTargetname(inst.targetname())
                .withForceType(place.forceType())
                .withVisgroups(place.visgroups())
                .withChooser(place.chooser());
        TemplateImporter importer = new TemplateImporter(info.templates());
        surface.ifPresent(face -> importer.releaseSurface(index, face, place.removeBrush()));
        ImportedTemplate imported = importer.importTemplate(map, request,
                info.random().seed("template_visgroups", place.id(), origin, inst.targetname()));

        ColorOverride color = place.color();
        if (!place.invertVar().isEmpty() && inst.fixup().getBool(place.invertVar(), false)) {
            color = invert(color);
        }
        RetextureOptions options = RetextureOptions.defaults()
                .withFixup(inst.fixup())
                .withReplacements(place.replacements())
                .withColorOverride(color)
                .withForceSize(place.forceSize())
                .withClumping(info.clumping());
        new TemplateRetexturer(index, info.textures(), info.random()).retexture(imported, options);

        surface.ifPresent(face -> importer.stealFromBrush(map, index, face, imported, place.removeBrush()));
    }

    static ColorOverride invert(ColorOverride color) {
        return switch (color) {
            case NONE -> ColorOverride.INVERT;
            case INVERT -> ColorOverride.NONE;
            case WHITE -> ColorOverride.BLACK;
            case BLACK -> ColorOverride.WHITE;
        };
    }

    /*
     * "templateBrush"
     * {
     *     "id" "my_template"
     *     "offset" "0 0 0"
     *     "angles" "0 90 0"
     *     "force" "white 4x4 detail"
     *     "invertVar" "$start_reversed"
     *     "visgroup" "lights"
     *     "visgroupMode" "none" // all, one, chance
     *     "visgroupChance" { "lights" "50" }
     *     "replace" { "tile/white_wall_tile003a" "<special.edge>" "#12" "" }
     *     "replaceBrush" "0 0 -64"
     *     "replaceNormal" "0 0 1"
     * }
     */
    static TemplatePlacement parsePlacement(Keyvalues kv, String posKey, String dirKey, boolean removeBrush) {
        if (!kv.isBlock()) {
            kv = Keyvalues.block(kv.realName(), Keyvalues.leaf("id", kv.value()));
        }
        String id = kv.get("id", kv.get("template")).trim();
        if (id.isEmpty()) {
            LOG.warn("{} without a template id, ignored", kv.realName());
            return null;
        }

        ColorOverride color = ColorOverride.NONE;
        TileSize forceSize = null;
        TemplateBrushType forceType = null;
        for (String word : kv.get("force").trim().toLowerCase(Locale.ROOT).split("\\s+")) {
            switch (word) {
                case "white", "black", "invert" -> color = ColorOverride.parse(word);
                case "world", "detail" -> forceType = TemplateBrushType.parse(word);
                case "" -> {
                    // nothing forced
                }
                default -> {
                    Optional<TileSize> size = TileSize.parse(word);
                    if (size.isPresent()) {
                        forceSize = size.get();
                    } else {
                        LOG.warn("Unknown force option '{}' for template {}", word, id);
                    }
                }
            }
        }

        Set<String> visgroups = new LinkedHashSet<>();
        for (Keyvalues group : kv.findAll("visgroup")) {
            if (!group.isBlock()) {
                visgroups.add(Keyvalues.fold(group.value().trim()));
            }
        }

        Map<String, List<String>> replacements = new LinkedHashMap<>();
        for (Keyvalues rep : kv.findBlock("replace")) {
            if (!rep.isBlock()) {
                replacements.computeIfAbsent(rep.realName(), k -> new ArrayList<>()).add(rep.value());
            }
        }

        String surfacePos = kv.find(posKey).filter(p -> !p.isBlock()).map(Keyvalues::value).orElse(null);
        return new TemplatePlacement(
                id,
                kv.get("offset", "0 0 0"),
                kv.get("angles", "0 0 0"),
                color,
                forceSize,
                forceType,
                kv.get("invertVar").trim(),
                visgroups,
                parseChooser(kv, id),
                replacements,
                surfacePos,
                kv.get(dirKey, "0 0 1"),
                kv.getBool("removeBrush", removeBrush));
    }

    private static VisgroupChooser parseChooser(Keyvalues kv, String id) {
        String mode = Keyvalues.fold(kv.get("visgroupMode", "none").trim());
        return switch (mode) {
            case "none" -> VisgroupChooser.none();
            case "all" -> VisgroupChooser.all();
            case "one", "random" -> {
                List<String> candidates = new ArrayList<>();
                kv.findBlock("visgroupChoices").forEach(c -> candidates.add(c.realName()));
                yield VisgroupChooser.randomOne(candidates);
            }
            case "chance" -> {
                Map<String, Double> chances = new LinkedHashMap<>();
                for (Keyvalues c : kv.findBlock("visgroupChance")) {
                    if (!c.isBlock()) {
                        chances.put(c.realName(), LogicRules.parsePercent(c.value()));
                    }
                }
                yield VisgroupChooser.withChance(chances);
            }
            default -> {
                LOG.warn("Unknown visgroup mode '{}' for template {}", mode, id);
                yield VisgroupChooser.none();
            }
        };
    }

    /*
     * Missing keys fall back to related ones: floors and 4x4 to the wall texture, ceilings to the
     * floor, 2x2 to 4x4.
     */
    static AreaTextures parseAreaTextures(Keyvalues kv) {
        if (!kv.isBlock()) {
            return null;
        }
        Map<String, String> textures = new LinkedHashMap<>();
        for (String color : List.of("white", "black")) {
            String wall = kv.get(color);
            String floor = kv.get(color + "Floor", wall);
            String tile4x4 = kv.get(color + "4x4", wall);
            textures.put(color + ".wall", wall);
            textures.put(color + ".floor", floor);
            textures.put(color + ".4x4", tile4x4);
            textures.put(color + ".ceiling", kv.get(color + "Ceiling", floor));
            textures.put(color + ".2x2", kv.get(color + "2x2", tile4x4));
        }
        return new AreaTextures(
                Vec.parse(kv.get("point1"), Vec.ZERO),
                Vec.parse(kv.get("point2"), Vec.ZERO),
                textures);
    }
}
