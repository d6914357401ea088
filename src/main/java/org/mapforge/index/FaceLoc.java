package org.mapforge.index;

import org.mapforge.map.Side;
import org.mapforge.math.Vec;

/**
 * The key of the face index: the grid cell a surface belongs to, plus the direction it faces.
 * <p>
 * A surface belongs to the cell directly behind it, found by stepping one unit from the surface
 * point against the outward normal. A face on the boundary between two cells is therefore owned by
 * the solid cell it covers, and opposite faces of a thin wall get different keys.
 *
 * @param cell The grid cell.
 * @param normal The outward unit normal, snapped.
 */
public record FaceLoc(GridCell cell, Vec normal) {

    /**
     * @param surfacePoint a point on the surface.
     * @param normal the outward normal.
     * @return the key.
     */
    public static FaceLoc at(Vec surfacePoint, Vec normal) {
        Vec n = normal.norm().snapped();
        return new FaceLoc(GridCell.containing(surfacePoint.sub(n)), n);
    }

    /**
     * @param side a face.
     * @return the key for the face centre.
     */
    public static FaceLoc of(Side side) {
        return at(side.center(), side.normal());
    }

    @Override
    public String toString() {
        return cell + "/" + normal;
    }
}
