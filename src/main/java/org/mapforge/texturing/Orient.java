package org.mapforge.texturing;

import org.mapforge.math.Vec;

/**
 * Which way a face points, for picking floor, ceiling or wall textures.
 * <p>
 * A face counts as horizontal when the z component of its outward normal exceeds {@value #HORIZONTAL}
 * in magnitude, i.e. it is tilted less than about 37 degrees from flat.
 */
public enum Orient {
    FLOOR,
    CEILING,
    WALL;

    public static final double HORIZONTAL = 0.8;

    /**
     * @param outwardNormal the face normal, pointing out of the brush.
     * @return the orientation class.
     */
    public static Orient of(Vec outwardNormal) {
        if (outwardNormal.z() > HORIZONTAL) {
            return FLOOR;
        } else if (outwardNormal.z() < -HORIZONTAL) {
            return CEILING;
        }
        return WALL;
    }
}
