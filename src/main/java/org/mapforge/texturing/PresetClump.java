package org.mapforge.texturing;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.math.Vec;

import java.util.Map;
import java.util.Optional;

/**
 * A box of the map whose panels all get fixed materials, one per texture key.
 *
 * @param min The lower corner.
 * @param max The upper corner.
 * @param textures Texture key to material.
 */
public record PresetClump(Vec min, Vec max, Map<String, String> textures) {

    /**
     * @param a one corner.
     * @param b the opposite corner.
     * @param textures texture key to material.
     * @return the clump spanning both corners.
     */
    public static PresetClump between(Vec a, Vec b, Map<String, String> textures) {
        return new PresetClump(
                new Vec(Math.min(a.x(), b.x()), Math.min(a.y(), b.y()), Math.min(a.z(), b.z())),
                new Vec(Math.max(a.x(), b.x()), Math.max(a.y(), b.y()), Math.max(a.z(), b.z())),
                Map.copyOf(textures));
    }

    public boolean contains(Vec point) {
        return point.x() >= min.x() && point.x() <= max.x()
                && point.y() >= min.y() && point.y() <= max.y()
                && point.z() >= min.z() && point.z() <= max.z();
    }

    public Optional<String> material(String key) {
        String mat = textures.get(Keyvalues.fold(key));
        return mat == null || mat.isEmpty() ? Optional.empty() : Optional.of(mat);
    }
}
