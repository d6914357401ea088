package org.mapforge.map;

import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One texture axis of a face, stored as {@code "[x y z offset] scale"}.
 *
 * @param axis The direction the texture axis runs along.
 * @param offset The texture shift, in texels.
 * @param scale Map units per texel.
 */
public record UVAxis(Vec axis, double offset, double scale) {

    private static final Pattern FORMAT = Pattern.compile(
            "\\[\\s*(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s*]\\s*(\\S+)");

    /**
     * Parses the document form.
     * @param text the text.
     * @return the axis.
     * @throws IllegalArgumentException if the text is malformed.
     */
    public static UVAxis parse(String text) {
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed texture axis: " + text);
        }
        try {
            return new UVAxis(
                    new Vec(Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)), Double.parseDouble(m.group(3))),
                    Double.parseDouble(m.group(4)),
                    Double.parseDouble(m.group(5)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed texture axis: " + text, e);
        }
    }

    /**
     * Moves the axis along with geometry rotated by {@code orient} then shifted by {@code origin},
     * keeping the texture fixed to the surface.
     *
     * @param origin the translation.
     * @param orient the rotation.
     * @return the transformed axis.
     */
    public UVAxis localise(Vec origin, Orientation orient) {
        Vec rotated = orient.rotate(axis);
        return new UVAxis(rotated, offset - origin.dot(rotated) / scale, scale);
    }

    public UVAxis withOffset(double newOffset) {
        return new UVAxis(axis, newOffset, scale);
    }

    @Override
    public String toString() {
        return "[" + axis + " " + Vec.format(offset) + "] " + Vec.format(scale);
    }
}
