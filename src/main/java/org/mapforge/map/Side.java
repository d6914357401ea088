package org.mapforge.map;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;

import java.util.ArrayList;
import java.util.List;

/**
 * One face of a {@link Solid}.
 * <p>
 * The face plane is given by three points. Seen from outside the solid they run clockwise, so the
 * outward normal is {@code (p3 - p1) x (p2 - p1)}; this matches the winding editors write.
 * Identifiers are allocated by the owning {@link MapDocument} and are never reused within it.
 */
public class Side {

    private final int id;
    private Vec p1;
    private Vec p2;
    private Vec p3;
    private String material;
    private UVAxis uaxis;
    private UVAxis vaxis;
    private double rotation;
    private int lightmapScale = 16;
    private int smoothingGroups = 0;
    private final List<Keyvalues> extraBlocks = new ArrayList<>();

    Side(int id, Vec p1, Vec p2, Vec p3, String material, UVAxis uaxis, UVAxis vaxis) {
        this.id = id;
        this.p1 = p1;
        this.p2 = p2;
        this.p3 = p3;
        this.material = material;
        this.uaxis = uaxis;
        this.vaxis = vaxis;
    }

    public int id() {
        return id;
    }

    public List<Vec> planePoints() {
        return List.of(p1, p2, p3);
    }

    /**
     * @return the unit normal pointing out of the solid.
     */
    public Vec normal() {
        return p3.sub(p1).cross(p2.sub(p1)).norm().snapped();
    }

    /**
     * Approximates the face centre as the centre of the bounding box of the plane points. For the
     * rectangular faces editors produce the plane points are three corners, which makes this exact.
     *
     * @return the face centre.
     */
    public Vec center() {
        List<Vec> pts = planePoints();
        return Vec.min(pts).add(Vec.max(pts)).mul(0.5).snapped();
    }

    public String material() {
        return material;
    }

    public void setMaterial(String material) {
        this.material = material;
    }

    public UVAxis uaxis() {
        return uaxis;
    }

    public UVAxis vaxis() {
        return vaxis;
    }

    public void setUVAxes(UVAxis u, UVAxis v) {
        this.uaxis = u;
        this.vaxis = v;
    }

    public double rotation() {
        return rotation;
    }

    public void setRotation(double rotation) {
        this.rotation = rotation;
    }

    public int lightmapScale() {
        return lightmapScale;
    }

    public void setLightmapScale(int lightmapScale) {
        this.lightmapScale = lightmapScale;
    }

    public int smoothingGroups() {
        return smoothingGroups;
    }

    public void setSmoothingGroups(int smoothingGroups) {
        this.smoothingGroups = smoothingGroups;
    }

    /**
     * @return unrecognised sub-blocks (e.g. displacement data), written back unchanged.
     */
    public List<Keyvalues> extraBlocks() {
        return extraBlocks;
    }

    /**
     * Rotates then translates the face, carrying the texture with it.
     * @param origin the translation.
     * @param orient the rotation.
     */
    public void localise(Vec origin, Orientation orient) {
        p1 = orient.rotate(p1).add(origin).snapped();
        p2 = orient.rotate(p2).add(origin).snapped();
        p3 = orient.rotate(p3).add(origin).snapped();
        uaxis = uaxis.localise(origin, orient);
        vaxis = vaxis.localise(origin, orient);
    }

    /**
     * Sets the texture axes to the world-aligned defaults for this face's dominant direction.
     * @param scale the texture scale.
     */
    public void alignToWorld(double scale) {
        UVAxis[] axes = worldAxes(normal(), scale);
        uaxis = axes[0];
        vaxis = axes[1];
    }

    /**
     * Copies this face under a new identifier.
     * @param newId the identifier of the copy.
     * @return the copy.
     */
    Side copy(int newId) {
        Side copy = new Side(newId, p1, p2, p3, material, uaxis, vaxis);
        copy.rotation = rotation;
        copy.lightmapScale = lightmapScale;
        copy.smoothingGroups = smoothingGroups;
        extraBlocks.forEach(kv -> copy.extraBlocks.add(kv.copy()));
        return copy;
    }

    /**
     * World-aligned texture axes for a face normal, as editors create them.
     * @param normal the face normal.
     * @param scale the texture scale.
     * @return the U and V axes.
     */
    public static UVAxis[] worldAxes(Vec normal, double scale) {
        double ax = Math.abs(normal.x()), ay = Math.abs(normal.y()), az = Math.abs(normal.z());
        if (az >= ax && az >= ay) {
            return new UVAxis[]{new UVAxis(new Vec(1, 0, 0), 0, scale), new UVAxis(new Vec(0, -1, 0), 0, scale)};
        } else if (ax >= ay) {
            return new UVAxis[]{new UVAxis(new Vec(0, 1, 0), 0, scale), new UVAxis(new Vec(0, 0, -1), 0, scale)};
        } else {
            return new UVAxis[]{new UVAxis(new Vec(1, 0, 0), 0, scale), new UVAxis(new Vec(0, 0, -1), 0, scale)};
        }
    }

    @Override
    public String toString() {
        return "Side#" + id + "[" + material + ", normal=" + normal() + "]";
    }
}
