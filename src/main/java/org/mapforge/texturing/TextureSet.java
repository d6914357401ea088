package org.mapforge.texturing;

import org.mapforge.keyvalues.Keyvalues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * The candidate materials for every texture key ({@code white.wall}, {@code black.floor},
 * {@code special.goo}...). Built-in defaults are replaced key by key by the configured ones.
 * <p>
 * Configuration accepts both {@code "white.wall" "material"} leaves and nested blocks:
 * <pre>
 * "textures"
 * {
 *     "white" { "wall" "tile/a" "wall" "tile/b" }
 *     "black.floor" "metal/c"
 * }
 * </pre>
 */
public class TextureSet {

    private static final Logger LOG = LoggerFactory.getLogger(TextureSet.class);

    private static final Map<String, List<String>> DEFAULTS = new LinkedHashMap<>();

    static {
        DEFAULTS.put("white.wall", List.of(Materials.WHITE_WALL));
        DEFAULTS.put("white.floor", List.of(Materials.WHITE_FLOOR));
        DEFAULTS.put("white.ceiling", List.of(Materials.WHITE_4X4));
        DEFAULTS.put("white.2x2", List.of(Materials.WHITE_2X2));
        DEFAULTS.put("white.4x4", List.of(Materials.WHITE_4X4));
        DEFAULTS.put("black.wall", List.of(Materials.BLACK_WALL));
        DEFAULTS.put("black.floor", List.of(Materials.BLACK_FLOOR));
        DEFAULTS.put("black.ceiling", List.of("metal/black_wall_metal_002e"));
        DEFAULTS.put("black.2x2", List.of(Materials.BLACK_2X2));
        DEFAULTS.put("black.4x4", List.of(Materials.BLACK_4X4));
        DEFAULTS.put("special.behind", List.of("anim_wp/framework/backpanels_cheap"));
        DEFAULTS.put("special.pedestalside", List.of("plastic/plasticwall004a"));
        DEFAULTS.put("special.edge", List.of("anim_wp/framework/squarebeams"));
        DEFAULTS.put("special.glass", List.of("glass/glasswindow007a_less_shiny"));
        DEFAULTS.put("special.grating", List.of("metal/metalgrate018"));
        DEFAULTS.put("special.goo", List.of(Materials.GOO));
        DEFAULTS.put("special.goo_cheap", List.of(Materials.GOO_CHEAP));
    }

    private final Map<String, List<String>> textures;

    private TextureSet(Map<String, List<String>> textures) {
        this.textures = textures;
    }

    /**
     * @return the built-in texture set.
     */
    public static TextureSet defaults() {
        return new TextureSet(new LinkedHashMap<>(DEFAULTS));
    }

    /**
     * Builds a texture set from a {@code textures} block on top of the defaults.
     * @param config the block; may be empty.
     * @return the texture set.
     */
    public static TextureSet fromConfig(Keyvalues config) {
        Map<String, List<String>> configured = new LinkedHashMap<>();
        for (Keyvalues child : config) {
            if (child.isBlock()) {
                for (Keyvalues leaf : child) {
                    if (!leaf.isBlock()) {
                        configured.computeIfAbsent(child.name() + "." + leaf.name(), k -> new ArrayList<>()).add(leaf.value());
                    }
                }
            } else {
                configured.computeIfAbsent(child.name(), k -> new ArrayList<>()).add(child.value());
            }
        }
        Map<String, List<String>> merged = new LinkedHashMap<>(DEFAULTS);
        configured.forEach((key, mats) -> merged.put(key, List.copyOf(mats)));
        LOG.debug("Loaded {} texture keys ({} configured)", merged.size(), configured.size());
        return new TextureSet(merged);
    }

    /**
     * The texture key for a panel face. Floors and ceilings ignore the size.
     *
     * @param color the panel colour.
     * @param size the panel size.
     * @param orient the face orientation.
     * @return the key, e.g. {@code white.2x2}.
     */
    public static String keyFor(SurfaceColor color, TileSize size, Orient orient) {
        return switch (orient) {
            case FLOOR -> color.key() + ".floor";
            case CEILING -> color.key() + ".ceiling";
            case WALL -> color.key() + "." + size.key();
        };
    }

    public boolean has(String key) {
        return textures.containsKey(Keyvalues.fold(key));
    }

    /**
     * @param key the texture key.
     * @return the candidate materials; missing panel keys fall back to {@code <color>.wall}.
     * @throws IllegalArgumentException if neither the key nor its fallback exist.
     */
    public List<String> candidates(String key) {
        String folded = Keyvalues.fold(key);
        List<String> mats = textures.get(folded);
        if (mats == null || mats.isEmpty()) {
            int dot = folded.indexOf('.');
            if (dot > 0) {
                mats = textures.get(folded.substring(0, dot) + ".wall");
            }
        }
        if (mats == null || mats.isEmpty()) {
            throw new IllegalArgumentException("No textures configured for '" + key + "'");
        }
        return mats;
    }

    /**
     * Picks one candidate.
     * @param key the texture key.
     * @param rand the random source; a single draw is taken.
     * @return the material.
     */
    public String choose(String key, Random rand) {
        List<String> mats = candidates(key);
        return mats.get(rand.nextInt(mats.size()));
    }
}
