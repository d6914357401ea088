package org.mapforge.math;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * An immutable 3D vector in map units.
 *
 * @param x The x component.
 * @param y The y component.
 * @param z The z component.
 */
public record Vec(double x, double y, double z) {

    public static final Vec ZERO = new Vec(0, 0, 0);

    private static final double SNAP = 1e-6;

    /**
     * Parses the {@code "x y z"} form used by documents. Brackets and parentheses around the
     * components are ignored.
     *
     * @param text the text to parse, may be {@code null}.
     * @param def the vector returned when the text is missing or malformed.
     * @return the parsed vector.
     */
    public static Vec parse(String text, Vec def) {
        if (text == null) {
            return def;
        }
        String cleaned = text.replace('(', ' ').replace(')', ' ').replace('[', ' ').replace(']', ' ').trim();
        if (cleaned.isEmpty()) {
            return def;
        }
        String[] parts = cleaned.split("\\s+");
        if (parts.length != 3) {
            return def;
        }
        try {
            return new Vec(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]), Double.parseDouble(parts[2]));
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /**
     * @param text the text to parse.
     * @return the parsed vector, or {@link #ZERO} if malformed.
     */
    public static Vec parse(String text) {
        return parse(text, ZERO);
    }

    public Vec add(Vec o) {
        return new Vec(x + o.x, y + o.y, z + o.z);
    }

    public Vec sub(Vec o) {
        return new Vec(x - o.x, y - o.y, z - o.z);
    }

    public Vec mul(double f) {
        return new Vec(x * f, y * f, z * f);
    }

    public Vec neg() {
        return new Vec(-x, -y, -z);
    }

    public double dot(Vec o) {
        return x * o.x + y * o.y + z * o.z;
    }

    public Vec cross(Vec o) {
        return new Vec(y * o.z - z * o.y, z * o.x - x * o.z, x * o.y - y * o.x);
    }

    public double length() {
        return Math.sqrt(dot(this));
    }

    /**
     * @return this vector scaled to unit length, or {@link #ZERO} for a zero vector.
     */
    public Vec norm() {
        double len = length();
        if (len < SNAP) {
            return ZERO;
        }
        return new Vec(x / len, y / len, z / len);
    }

    /**
     * Rounds every component to six decimal places and clears negative zero, so vectors produced by
     * rotations compare and hash equal to the exact values they approximate.
     *
     * @return the snapped vector.
     */
    public Vec snapped() {
        return new Vec(snap(x), snap(y), snap(z));
    }

    public boolean isClose(Vec o, double epsilon) {
        return Math.abs(x - o.x) <= epsilon && Math.abs(y - o.y) <= epsilon && Math.abs(z - o.z) <= epsilon;
    }

    /**
     * @param points the points, not empty.
     * @return the component-wise minimum.
     */
    public static Vec min(Collection<Vec> points) {
        double mx = Double.POSITIVE_INFINITY, my = Double.POSITIVE_INFINITY, mz = Double.POSITIVE_INFINITY;
        for (Vec p : points) {
            mx = Math.min(mx, p.x);
            my = Math.min(my, p.y);
            mz = Math.min(mz, p.z);
        }
        return new Vec(mx, my, mz);
    }

    /**
     * @param points the points, not empty.
     * @return the component-wise maximum.
     */
    public static Vec max(Collection<Vec> points) {
        double mx = Double.NEGATIVE_INFINITY, my = Double.NEGATIVE_INFINITY, mz = Double.NEGATIVE_INFINITY;
        for (Vec p : points) {
            mx = Math.max(mx, p.x);
            my = Math.max(my, p.y);
            mz = Math.max(mz, p.z);
        }
        return new Vec(mx, my, mz);
    }

    private static double snap(double v) {
        double r = Math.round(v * 1e6) / 1e6;
        return r == 0.0 ? 0.0 : r;
    }

    /**
     * Formats one component the way documents store it: integral values without a fraction,
     * others with trailing zeros stripped.
     *
     * @param v the value.
     * @return the text.
     */
    public static String format(double v) {
        double s = snap(v);
        if (s == Math.rint(s) && Math.abs(s) < 1e15) {
            return Long.toString((long) s);
        }
        return BigDecimal.valueOf(s).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return format(x) + " " + format(y) + " " + format(z);
    }
}
