package org.mapforge.template;

import org.mapforge.map.EntityFixup;
import org.mapforge.texturing.TileSize;

import java.util.List;
import java.util.Map;

/**
 * Settings for {@link TemplateRetexturer#retexture}.
 *
 * @param fixup Resolves {@code $var} keys and values of the replacement table; may be {@code null}.
 * @param replacements Material or {@code #faceid} to candidate replacement materials. A candidate
 *                     written as {@code <texture.key>} is looked up in the texture set.
 * @param colorOverride Forces panel colours.
 * @param forceSize Forces the panel size, or {@code null}.
 * @param clumping Whether tile faces are handed to the wall texturing pass instead of being textured now.
 */
public record RetextureOptions(
        EntityFixup fixup,
        Map<String, List<String>> replacements,
        ColorOverride colorOverride,
        TileSize forceSize,
        boolean clumping
) {

    public static RetextureOptions defaults() {
        return new RetextureOptions(null, Map.of(), ColorOverride.NONE, null, false);
    }

    public RetextureOptions withFixup(EntityFixup newFixup) {
        return new RetextureOptions(newFixup, replacements, colorOverride, forceSize, clumping);
    }

    public RetextureOptions withReplacements(Map<String, List<String>> newReplacements) {
        return new RetextureOptions(fixup, newReplacements, colorOverride, forceSize, clumping);
    }

    public RetextureOptions withColorOverride(ColorOverride override) {
        return new RetextureOptions(fixup, replacements, override, forceSize, clumping);
    }

    public RetextureOptions withForceSize(TileSize size) {
        return new RetextureOptions(fixup, replacements, colorOverride, size, clumping);
    }

    public RetextureOptions withClumping(boolean enabled) {
        return new RetextureOptions(fixup, replacements, colorOverride, forceSize, enabled);
    }
}
