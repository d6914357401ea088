package org.mapforge.map;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A convex brush: an ordered list of {@link Side faces}.
 */
public class Solid {

    private final int id;
    private final List<Side> sides;
    private final List<Keyvalues> extraBlocks = new ArrayList<>();

    Solid(int id, List<Side> sides) {
        this.id = id;
        this.sides = new ArrayList<>(sides);
    }

    public int id() {
        return id;
    }

    public List<Side> sides() {
        return Collections.unmodifiableList(sides);
    }

    /**
     * @return unrecognised sub-blocks (e.g. editor data), written back unchanged.
     */
    public List<Keyvalues> extraBlocks() {
        return extraBlocks;
    }

    /**
     * Copies this brush into {@code target}, allocating fresh solid and face identifiers there.
     * The copy is not added to any entity.
     *
     * @param target the document providing the identifiers.
     * @param sideMapping receives {@code old face id → new face id} for every face.
     * @return the copy.
     */
    public Solid copy(MapDocument target, Map<Integer, Integer> sideMapping) {
        List<Side> copiedSides = new ArrayList<>(sides.size());
        for (Side side : sides) {
            Side c = side.copy(target.allocateFaceId(0));
            sideMapping.put(side.id(), c.id());
            copiedSides.add(c);
        }
        Solid copy = new Solid(target.allocateSolidId(0), copiedSides);
        extraBlocks.forEach(kv -> copy.extraBlocks.add(kv.copy()));
        return copy;
    }

    /**
     * Rotates then translates every face.
     * @param origin the translation.
     * @param orient the rotation.
     */
    public void localise(Vec origin, Orientation orient) {
        for (Side side : sides) {
            side.localise(origin, orient);
        }
    }

    public Vec bboxMin() {
        return Vec.min(allPoints());
    }

    public Vec bboxMax() {
        return Vec.max(allPoints());
    }

    public Vec center() {
        return bboxMin().add(bboxMax()).mul(0.5).snapped();
    }

    private List<Vec> allPoints() {
        List<Vec> points = new ArrayList<>(sides.size() * 3);
        for (Side side : sides) {
            points.addAll(side.planePoints());
        }
        return points;
    }

    /**
     * Builds an axis-aligned box with world-aligned textures. The box is not added to any entity.
     *
     * @param doc the document providing identifiers.
     * @param p1 one corner.
     * @param p2 the opposite corner.
     * @param material the material for every face.
     * @return the box.
     */
    public static Solid box(MapDocument doc, Vec p1, Vec p2, String material) {
        Vec min = Vec.min(List.of(p1, p2));
        Vec max = Vec.max(List.of(p1, p2));
        Vec dx = new Vec(max.x() - min.x(), 0, 0);
        Vec dy = new Vec(0, max.y() - min.y(), 0);
        Vec dz = new Vec(0, 0, max.z() - min.z());
        List<Side> sides = new ArrayList<>(6);
        // Each face is corner + a, corner + b with a x b along the outward normal.
        sides.add(boxSide(doc, new Vec(min.x(), min.y(), max.z()), dx, dy, material));
        sides.add(boxSide(doc, min, dy, dx, material));
        sides.add(boxSide(doc, new Vec(max.x(), min.y(), min.z()), dy, dz, material));
        sides.add(boxSide(doc, min, dz, dy, material));
        sides.add(boxSide(doc, new Vec(min.x(), max.y(), min.z()), dz, dx, material));
        sides.add(boxSide(doc, min, dx, dz, material));
        return new Solid(doc.allocateSolidId(0), sides);
    }

    private static Side boxSide(MapDocument doc, Vec corner, Vec a, Vec b, String material) {
        Side side = new Side(doc.allocateFaceId(0), corner, corner.add(b), corner.add(a), material,
                new UVAxis(new Vec(1, 0, 0), 0, 0.25), new UVAxis(new Vec(0, -1, 0), 0, 0.25));
        side.alignToWorld(0.25);
        return side;
    }

    @Override
    public String toString() {
        return "Solid#" + id + "[" + sides.size() + " sides, " + bboxMin() + " to " + bboxMax() + "]";
    }
}
