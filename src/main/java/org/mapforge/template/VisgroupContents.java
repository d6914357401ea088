package org.mapforge.template;

import org.mapforge.map.Entity;
import org.mapforge.map.Solid;

import java.util.List;

/**
 * The brushes and overlays of one visgroup of a template. The objects live in the template
 * library's document and are only ever copied out of it.
 *
 * @param world Brushes that go to the world by default.
 * @param detail Brushes that go to a detail entity by default.
 * @param overlays Overlay entities.
 */
public record VisgroupContents(List<Solid> world, List<Solid> detail, List<Entity> overlays) {
}
