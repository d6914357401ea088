package org.mapforge.texturing;

import java.util.Locale;
import java.util.Optional;

/**
 * The panel size a wall material represents.
 */
public enum TileSize {
    WALL("wall"),
    TILE_2X2("2x2"),
    TILE_4X4("4x4"),
    /** Targets and other one-off panels. */
    SPECIAL("special");

    private final String key;

    TileSize(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<TileSize> parse(String text) {
        String folded = text.trim().toLowerCase(Locale.ROOT);
        for (TileSize size : values()) {
            if (size.key.equals(folded)) {
                return Optional.of(size);
            }
        }
        return Optional.empty();
    }
}
