package org.mapforge.index;

import org.mapforge.math.Vec;

/**
 * A cell of the 128-unit block grid.
 *
 * @param x The cell index along x.
 * @param y The cell index along y.
 * @param z The cell index along z.
 */
public record GridCell(int x, int y, int z) {

    public static final int SIZE = 128;

    /**
     * @param point a world position.
     * @return the cell containing it; points on a boundary belong to the higher cell.
     */
    public static GridCell containing(Vec point) {
        return new GridCell(
                (int) Math.floor(point.x() / SIZE),
                (int) Math.floor(point.y() / SIZE),
                (int) Math.floor(point.z() / SIZE));
    }

    public Vec min() {
        return new Vec(x * SIZE, y * SIZE, z * SIZE);
    }

    public Vec center() {
        return min().add(new Vec(SIZE / 2.0, SIZE / 2.0, SIZE / 2.0));
    }

    @Override
    public String toString() {
        return "(" + x + " " + y + " " + z + ")";
    }
}
