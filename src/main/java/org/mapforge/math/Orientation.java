package org.mapforge.math;

import javax.vecmath.Matrix3d;
import javax.vecmath.Vector3d;

/**
 * An immutable rotation, built from the pitch/yaw/roll Euler angles stored on entities.
 * <p>
 * Positive yaw turns +x towards +y, positive pitch turns +x downwards and positive roll turns +y
 * towards +z. Rotated vectors are {@link Vec#snapped() snapped} so axis-aligned rotations give
 * exact results.
 */
public final class Orientation {

    public static final Orientation IDENTITY = new Orientation(identityMatrix());

    private final Matrix3d matrix;

    private Orientation(Matrix3d matrix) {
        this.matrix = matrix;
    }

    /**
     * @param pitch rotation around y, in degrees.
     * @param yaw rotation around z, in degrees.
     * @param roll rotation around x, in degrees.
     * @return the orientation.
     */
    public static Orientation fromAngles(double pitch, double yaw, double roll) {
        Matrix3d rz = new Matrix3d();
        rz.rotZ(Math.toRadians(yaw));
        Matrix3d ry = new Matrix3d();
        ry.rotY(Math.toRadians(pitch));
        Matrix3d rx = new Matrix3d();
        rx.rotX(Math.toRadians(roll));
        Matrix3d m = new Matrix3d(rz);
        m.mul(ry);
        m.mul(rx);
        return new Orientation(m);
    }

    /**
     * Parses an {@code "pitch yaw roll"} angles value.
     * @param angles the text, may be {@code null}.
     * @return the orientation, identity if missing or malformed.
     */
    public static Orientation fromAngles(String angles) {
        Vec v = Vec.parse(angles, Vec.ZERO);
        return fromAngles(v.x(), v.y(), v.z());
    }

    /**
     * Rotates a vector.
     * @param v the vector.
     * @return the rotated, snapped vector.
     */
    public Vec rotate(Vec v) {
        Vector3d tmp = new Vector3d(v.x(), v.y(), v.z());
        matrix.transform(tmp);
        return new Vec(tmp.x, tmp.y, tmp.z).snapped();
    }

    /**
     * Applies the inverse rotation.
     * @param v the vector in world space.
     * @return the vector in the local space of this orientation.
     */
    public Vec unrotate(Vec v) {
        return inverse().rotate(v);
    }

    /**
     * @return the inverse rotation.
     */
    public Orientation inverse() {
        Matrix3d m = new Matrix3d(matrix);
        m.transpose();
        return new Orientation(m);
    }

    /**
     * Composes two rotations.
     * @param outer the rotation applied after this one.
     * @return a rotation equal to applying this, then {@code outer}.
     */
    public Orientation then(Orientation outer) {
        Matrix3d m = new Matrix3d(outer.matrix);
        m.mul(matrix);
        return new Orientation(m);
    }

    public Vec forward() {
        return rotate(new Vec(1, 0, 0));
    }

    public Vec left() {
        return rotate(new Vec(0, 1, 0));
    }

    public Vec up() {
        return rotate(new Vec(0, 0, 1));
    }

    private static Matrix3d identityMatrix() {
        Matrix3d m = new Matrix3d();
        m.setIdentity();
        return m;
    }

    @Override
    public String toString() {
        return "Orientation[forward=" + forward() + ", left=" + left() + ", up=" + up() + "]";
    }
}
