package org.mapforge.index;

import org.mapforge.map.Side;
import org.mapforge.map.Solid;
import org.mapforge.texturing.SurfaceColor;

/**
 * A resolved face index entry.
 *
 * @param loc The index key.
 * @param face The face.
 * @param solid The brush owning the face.
 * @param color The surface property.
 */
public record FaceRef(FaceLoc loc, Side face, Solid solid, SurfaceColor color) {
}
