package org.mapforge.texturing;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Wall texturing settings, read from the {@code mapforge.texturing} configuration section.
 *
 * @param clumping Whether panels are textured in clumps instead of one by one.
 * @param clumpSize How many cells a clump extends along its long axis, in each direction at most.
 * @param clumpWidth How many cells a clump extends along the other axes, in each direction at most.
 * @param clumpNumber Multiplier for the number of clumps.
 * @param clumpFloor Whether floors are clumped.
 * @param clumpCeiling Whether ceilings are clumped.
 */
public record TexturingOptions(
        boolean clumping,
        int clumpSize,
        int clumpWidth,
        int clumpNumber,
        boolean clumpFloor,
        boolean clumpCeiling
) {

    public TexturingOptions {
        if (clumpSize < 1 || clumpWidth < 1 || clumpNumber < 1) {
            throw new IllegalArgumentException("Clump size, width and number must be at least 1, got "
                    + clumpSize + ", " + clumpWidth + ", " + clumpNumber);
        }
    }

    public static TexturingOptions defaults() {
        return new TexturingOptions(false, 4, 2, 6, false, false);
    }

    /**
     * @param config the application configuration.
     * @return the options.
     * @throws ConfigException.BadValue if a clump setting is below 1.
     */
    public static TexturingOptions fromConfig(Config config) {
        Config section = config.getConfig("mapforge.texturing");
        return new TexturingOptions(
                section.getBoolean("clumping"),
                atLeastOne(section, "clump-size"),
                atLeastOne(section, "clump-width"),
                atLeastOne(section, "clump-number"),
                section.getBoolean("clump-floor"),
                section.getBoolean("clump-ceiling"));
    }

    private static int atLeastOne(Config section, String key) {
        int value = section.getInt(key);
        if (value < 1) {
            throw new ConfigException.BadValue(section.getValue(key).origin(), "mapforge.texturing." + key,
                    "must be at least 1, got " + value);
        }
        return value;
    }

    public TexturingOptions withClumping(boolean value) {
        return new TexturingOptions(value, clumpSize, clumpWidth, clumpNumber, clumpFloor, clumpCeiling);
    }
}
