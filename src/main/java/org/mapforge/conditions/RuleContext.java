package org.mapforge.conditions;

import org.mapforge.index.FaceIndex;
import org.mapforge.map.MapDocument;

/**
 * The per-run values shared by every rule invocation.
 *
 * @param map The document.
 * @param index The face index of the document.
 * @param info Map-wide information.
 */
public record RuleContext(MapDocument map, FaceIndex index, MapInfo info) {
}
