package org.mapforge.template;

import java.util.Locale;

/**
 * Where imported template brushes end up.
 */
public enum TemplateBrushType {
    /** Keep each brush where the template put it. */
    DEFAULT,
    /** Merge everything into the world. */
    WORLD,
    /** Merge everything into one detail entity. */
    DETAIL;

    /**
     * @param text {@code default}, {@code world} or {@code detail}, case-insensitive.
     * @return the type; unknown text yields {@link #DEFAULT}.
     */
    public static TemplateBrushType parse(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "world" -> WORLD;
            case "detail" -> DETAIL;
            default -> DEFAULT;
        };
    }
}
