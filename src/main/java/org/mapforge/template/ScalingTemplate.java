package org.mapforge.template;

import org.mapforge.map.Side;
import org.mapforge.map.Solid;
import org.mapforge.map.UVAxis;
import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Texture data taken from the six faces of a single cube, keyed by face normal, and applied to
 * faces pointing the same way.
 * <p>
 * A template that is not a single axis-aligned cube is still accepted: the directions it does
 * provide are used and the rest fall back to world-aligned axes with the material left unchanged.
 */
public final class ScalingTemplate {

    private static final Logger LOG = LoggerFactory.getLogger(ScalingTemplate.class);

    private static final List<Vec> AXES = List.of(
            new Vec(0, 0, 1), new Vec(0, 0, -1),
            new Vec(1, 0, 0), new Vec(-1, 0, 0),
            new Vec(0, 1, 0), new Vec(0, -1, 0));

    /**
     * Texture data of one direction.
     *
     * @param material The material; empty to keep the target's material.
     * @param uaxis The U axis.
     * @param vaxis The V axis.
     * @param rotation The texture rotation.
     */
    public record ScalingFace(String material, UVAxis uaxis, UVAxis vaxis, double rotation) {
    }

    private final String id;
    private final Map<Vec, ScalingFace> faces;

    private ScalingTemplate(String id, Map<Vec, ScalingFace> faces) {
        this.id = id;
        this.faces = faces;
    }

    /**
     * Reads the texture data of a template's brushes.
     * @param id the template id, for messages.
     * @param solids the template brushes; normally exactly one cube.
     * @return the scaling template.
     */
    public static ScalingTemplate parse(String id, List<Solid> solids) {
        Map<Vec, ScalingFace> faces = new LinkedHashMap<>();
        if (solids.size() != 1) {
            LOG.warn("Scaling template \"{}\" has {} brushes instead of one", id, solids.size());
        }
        for (Solid solid : solids) {
            for (Side side : solid.sides()) {
                faces.putIfAbsent(side.normal(), new ScalingFace(side.material(), side.uaxis(), side.vaxis(), side.rotation()));
            }
        }
        for (Vec axis : AXES) {
            if (!faces.containsKey(axis)) {
                LOG.warn("Scaling template \"{}\" has no face pointing {}, using world-aligned axes", id, axis);
                faces.put(axis, worldAligned(axis));
            }
        }
        return new ScalingTemplate(id, faces);
    }

    private static ScalingFace worldAligned(Vec normal) {
        UVAxis[] axes = Side.worldAxes(normal, 0.25);
        return new ScalingFace("", axes[0], axes[1], 0);
    }

    public String id() {
        return id;
    }

    /**
     * @param normal a face normal.
     * @return the data for faces pointing that way, if any.
     */
    public Optional<ScalingFace> get(Vec normal) {
        return Optional.ofNullable(faces.get(normal.norm().snapped()));
    }

    /**
     * @param orient the rotation.
     * @return a copy with every direction and texture axis rotated.
     */
    public ScalingTemplate rotate(Orientation orient) {
        Map<Vec, ScalingFace> rotated = new LinkedHashMap<>();
        faces.forEach((normal, face) -> rotated.put(orient.rotate(normal).snapped(), new ScalingFace(
                face.material(),
                face.uaxis().localise(Vec.ZERO, orient),
                face.vaxis().localise(Vec.ZERO, orient),
                face.rotation())));
        return new ScalingTemplate(id, rotated);
    }

    /**
     * Copies the texture data for the face's direction onto the face.
     * @param side the face.
     * @return {@code true} if data existed for that direction.
     */
    public boolean apply(Side side) {
        Optional<ScalingFace> data = get(side.normal());
        if (data.isEmpty()) {
            return false;
        }
        ScalingFace face = data.get();
        if (!face.material().isEmpty()) {
            side.setMaterial(face.material());
        }
        side.setUVAxes(face.uaxis(), face.vaxis());
        side.setRotation(face.rotation());
        return true;
    }
}
