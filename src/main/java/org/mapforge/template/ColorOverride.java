package org.mapforge.template;

import org.mapforge.texturing.SurfaceColor;

import java.util.Locale;

/**
 * Forces the colour of retextured template panels.
 */
public enum ColorOverride {
    NONE,
    WHITE,
    BLACK,
    INVERT;

    public SurfaceColor apply(SurfaceColor color) {
        return switch (this) {
            case NONE -> color;
            case WHITE -> SurfaceColor.WHITE;
            case BLACK -> SurfaceColor.BLACK;
            case INVERT -> color.inverted();
        };
    }

    /**
     * @param text {@code white}, {@code black}, {@code invert} or anything else for none.
     * @return the override.
     */
    public static ColorOverride parse(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "white" -> WHITE;
            case "black" -> BLACK;
            case "invert" -> INVERT;
            default -> NONE;
        };
    }
}
