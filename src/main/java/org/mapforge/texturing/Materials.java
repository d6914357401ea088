package org.mapforge.texturing;

import org.mapforge.keyvalues.Keyvalues;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Well-known materials: the panel materials recognised on incoming geometry and in templates,
 * and the tool materials passed through untouched.
 */
public final class Materials {

    public static final String NODRAW = "tools/toolsnodraw";
    public static final String SKIP = "tools/toolsskip";

    public static final String WHITE_WALL = "tile/white_wall_tile003a";
    public static final String WHITE_FLOOR = "tile/white_floor_tile002a";
    public static final String WHITE_2X2 = "tile/white_wall_tile003c";
    public static final String WHITE_4X4 = "tile/white_wall_tile003f";
    public static final String BLACK_WALL = "metal/black_wall_metal_002c";
    public static final String BLACK_FLOOR = "metal/black_floor_metal_001c";
    public static final String BLACK_2X2 = "metal/black_wall_metal_002a";
    public static final String BLACK_4X4 = "metal/black_wall_metal_002b";
    public static final String GOO = "nature/toxicslime_a2_bridge_intro";
    public static final String GOO_CHEAP = "nature/toxicslime_puzzlemaker_cheap";

    /**
     * What a recognised material stands for: either a coloured panel of some size, or a special
     * surface named by a texture key such as {@code special.glass}.
     *
     * @param color The panel colour, {@code null} for special surfaces.
     * @param size The panel size, {@code null} for special surfaces.
     * @param specialKey The texture key for special surfaces, {@code null} for panels.
     */
    public record MaterialInfo(SurfaceColor color, TileSize size, String specialKey) {

        public static MaterialInfo panel(SurfaceColor color, TileSize size) {
            return new MaterialInfo(color, size, null);
        }

        public static MaterialInfo special(String key) {
            return new MaterialInfo(null, null, key);
        }

        public boolean isPanel() {
            return color != null;
        }
    }

    private static final Map<String, MaterialInfo> TABLE = new HashMap<>();

    static {
        TABLE.put(BLACK_2X2, MaterialInfo.panel(SurfaceColor.BLACK, TileSize.TILE_2X2));
        TABLE.put(BLACK_4X4, MaterialInfo.panel(SurfaceColor.BLACK, TileSize.TILE_4X4));
        TABLE.put(BLACK_WALL, MaterialInfo.panel(SurfaceColor.BLACK, TileSize.WALL));
        TABLE.put("metal/black_wall_metal_002e", MaterialInfo.panel(SurfaceColor.BLACK, TileSize.WALL));
        TABLE.put(BLACK_FLOOR, MaterialInfo.panel(SurfaceColor.BLACK, TileSize.WALL));

        TABLE.put(WHITE_WALL, MaterialInfo.panel(SurfaceColor.WHITE, TileSize.WALL));
        TABLE.put("tile/white_wall_tile001a", MaterialInfo.panel(SurfaceColor.WHITE, TileSize.WALL));
        TABLE.put("tile/white_wall_tile003b", MaterialInfo.panel(SurfaceColor.WHITE, TileSize.WALL));
        TABLE.put("tile/white_wall_tile003h", MaterialInfo.panel(SurfaceColor.WHITE, TileSize.WALL));
        TABLE.put(WHITE_FLOOR, MaterialInfo.panel(SurfaceColor.WHITE, TileSize.WALL));
        TABLE.put(WHITE_2X2, MaterialInfo.panel(SurfaceColor.WHITE, TileSize.TILE_2X2));
        TABLE.put("tile/white_wall_state", MaterialInfo.panel(SurfaceColor.WHITE, TileSize.TILE_2X2));
        TABLE.put(WHITE_4X4, MaterialInfo.panel(SurfaceColor.WHITE, TileSize.TILE_4X4));
        TABLE.put("tile/white_wall_tile004j", MaterialInfo.panel(SurfaceColor.WHITE, TileSize.SPECIAL));

        TABLE.put("anim_wp/framework/backpanels", MaterialInfo.special("special.behind"));
        TABLE.put("anim_wp/framework/backpanels_cheap", MaterialInfo.special("special.behind"));
        TABLE.put("plastic/plasticwall004a", MaterialInfo.special("special.pedestalside"));
        TABLE.put("anim_wp/framework/squarebeams", MaterialInfo.special("special.edge"));
        TABLE.put("glass/glasswindow007a_less_shiny", MaterialInfo.special("special.glass"));
        TABLE.put("metal/metalgrate018", MaterialInfo.special("special.grating"));
        TABLE.put(GOO, MaterialInfo.special("special.goo"));
        TABLE.put(GOO_CHEAP, MaterialInfo.special("special.goo_cheap"));
    }

    private Materials() {
        // Static utility
    }

    /**
     * @param material the material, case-insensitive.
     * @return what it stands for, if recognised.
     */
    public static Optional<MaterialInfo> classify(String material) {
        return Optional.ofNullable(TABLE.get(normalize(material)));
    }

    /**
     * @param material the material.
     * @return the index colour of faces with this material: panels and goo are indexed, nothing else.
     */
    public static Optional<SurfaceColor> indexColor(String material) {
        return classify(material).flatMap(info -> {
            if (info.isPanel()) {
                return Optional.of(info.color());
            }
            return isGoo(material) ? Optional.of(SurfaceColor.GOO) : Optional.empty();
        });
    }

    public static boolean isGoo(String material) {
        String m = normalize(material);
        return m.equals(GOO) || m.equals(GOO_CHEAP);
    }

    /**
     * @param material the material.
     * @return {@code true} for non-rendering tool materials.
     */
    public static boolean isTool(String material) {
        return normalize(material).startsWith("tools/");
    }

    /**
     * The canonical material for a panel, used to hand faces to the wall texturing pass.
     *
     * @param color the colour.
     * @param size the size.
     * @param orient the orientation.
     * @return the material.
     */
    public static String canonical(SurfaceColor color, TileSize size, Orient orient) {
        boolean white = color == SurfaceColor.WHITE;
        if (orient != Orient.WALL) {
            return white ? WHITE_FLOOR : BLACK_FLOOR;
        }
        return switch (size) {
            case TILE_2X2 -> white ? WHITE_2X2 : BLACK_2X2;
            case TILE_4X4 -> white ? WHITE_4X4 : BLACK_4X4;
            default -> white ? WHITE_WALL : BLACK_WALL;
        };
    }

    private static String normalize(String material) {
        return Keyvalues.fold(material).replace('\\', '/');
    }
}
