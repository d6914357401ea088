package org.mapforge.index;

import org.mapforge.texturing.SurfaceColor;

/**
 * What the face index stores per key. Only identifiers are kept; the face and its brush are
 * resolved through the document on every lookup.
 *
 * @param faceId The face identifier.
 * @param solidId The identifier of the brush owning the face.
 * @param color The surface property.
 */
public record IndexEntry(int faceId, int solidId, SurfaceColor color) {
}
