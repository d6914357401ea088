package org.mapforge.texturing;

import org.mapforge.index.FaceIndex;
import org.mapforge.index.FaceLoc;
import org.mapforge.index.FaceRef;
import org.mapforge.index.GridCell;
import org.mapforge.math.Vec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * The final texturing pass over the indexed panels that templates did not claim.
 * <p>
 * Preset clumps win first. In random mode every face then draws its own material from a source
 * seeded by its cell and normal. In clump mode boxes of cells are laid out from a seeded source,
 * every panel inside a box shares that box's material for its texture key, and panels outside any
 * box use the {@code special.white_gap}/{@code special.black_gap} keys when the texture set has them.
 */
public class WallTexturer {

    private static final Logger LOG = LoggerFactory.getLogger(WallTexturer.class);
    private static final String[] AXES = {"x", "y", "z"};

    private final TextureSet textures;
    private final MapRandom random;
    private final TexturingOptions options;

    public WallTexturer(TextureSet textures, MapRandom random, TexturingOptions options) {
        this.textures = textures;
        this.random = random;
        this.options = options;
    }

    /**
     * Textures every live, non-template panel of the index.
     * @param index the face index.
     * @param presets the preset clumps, earlier ones winning.
     * @return the number of faces retextured.
     */
    public int apply(FaceIndex index, List<PresetClump> presets) {
        List<FaceRef> panels = new ArrayList<>();
        for (FaceRef ref : index.entries()) {
            if (ref.color() != SurfaceColor.GOO && !index.isTemplateFace(ref.face().id())) {
                panels.add(ref);
            }
        }
        List<PresetClump> clumps = options.clumping() ? layOutClumps(panels) : List.of();
        LOG.info("Texturing {} panels ({} clumps, {} preset)", panels.size(), clumps.size(), presets.size());

        int changed = 0;
        for (FaceRef ref : panels) {
            Optional<Materials.MaterialInfo> info = Materials.classify(ref.face().material());
            if (info.isEmpty() || !info.get().isPanel()) {
                continue;
            }
            Orient orient = Orient.of(ref.loc().normal());
            String key = TextureSet.keyFor(ref.color(), info.get().size(), orient);
            ref.face().setMaterial(choose(ref, key, orient, presets, clumps));
            changed++;
        }
        return changed;
    }

    private String choose(FaceRef ref, String key, Orient orient, List<PresetClump> presets, List<PresetClump> clumps) {
        Vec center = ref.face().center();
        for (PresetClump clump : presets) {
            if (clump.contains(center)) {
                Optional<String> mat = clump.material(key);
                if (mat.isPresent()) {
                    return mat.get();
                }
            }
        }
        if (!options.clumping()
                || (orient == Orient.FLOOR && !options.clumpFloor())
                || (orient == Orient.CEILING && !options.clumpCeiling())) {
            return pick(ref.loc(), key);
        }
        for (PresetClump clump : clumps) {
            if (clump.contains(center)) {
                return clump.material(key).orElseGet(() -> pick(ref.loc(), key));
            }
        }
        String gap = "special." + ref.color().key() + "_gap";
        return textures.has(gap) ? pick(ref.loc(), gap) : pick(ref.loc(), key);
    }

    private String pick(FaceLoc loc, String key) {
        return textures.choose(key, random.seed("wall", loc.cell(), loc.normal(), key));
    }

    private List<PresetClump> layOutClumps(List<FaceRef> panels) {
        int perClump = options.clumpSize() * options.clumpWidth() * options.clumpWidth();
        int count = panels.size() / perClump * options.clumpNumber();
        Random rand = random.seed("clumps", count);
        List<PresetClump> clumps = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Vec pos = panels.get(rand.nextInt(panels.size())).loc().cell().min();
            String direction = AXES[rand.nextInt(AXES.length)];
            double[] lo = new double[3];
            double[] hi = new double[3];
            double[] p = {pos.x(), pos.y(), pos.z()};
            for (int axis = 0; axis < 3; axis++) {
                int dist = AXES[axis].equals(direction) ? options.clumpSize() : options.clumpWidth();
                lo[axis] = p[axis] - rand.nextInt(dist + 1) * GridCell.SIZE;
                hi[axis] = p[axis] + rand.nextInt(dist + 1) * GridCell.SIZE;
            }
            Vec min = new Vec(lo[0], lo[1], lo[2]);
            Vec max = new Vec(hi[0], hi[1], hi[2]);
            Map<String, String> mats = new LinkedHashMap<>();
            for (SurfaceColor color : List.of(SurfaceColor.WHITE, SurfaceColor.BLACK)) {
                for (String size : List.of("wall", "floor", "ceiling", "2x2", "4x4")) {
                    String key = color.key() + "." + size;
                    mats.put(key, textures.choose(key, random.seed("clump_tex", min, max, key)));
                }
            }
            clumps.add(PresetClump.between(min, max, mats));
        }
        return clumps;
    }
}
