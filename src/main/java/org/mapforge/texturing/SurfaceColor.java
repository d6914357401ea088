package org.mapforge.texturing;

import java.util.Locale;
import java.util.Optional;

/**
 * The surface property of an indexed face.
 */
public enum SurfaceColor {
    /** Portal-accepting panels. */
    WHITE,
    /** Panels that reject portals. */
    BLACK,
    /** Liquid surfaces. */
    GOO;

    /**
     * @return the opposite panel colour; goo is unchanged.
     */
    public SurfaceColor inverted() {
        return switch (this) {
            case WHITE -> BLACK;
            case BLACK -> WHITE;
            case GOO -> GOO;
        };
    }

    /**
     * @return the lower-case name used in texture keys.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param text {@code white} or {@code black}, case-insensitive.
     * @return the colour, if recognised.
     */
    public static Optional<SurfaceColor> parse(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "white", "w" -> Optional.of(WHITE);
            case "black", "b" -> Optional.of(BLACK);
            default -> Optional.empty();
        };
    }
}
