package org.mapforge.template;

import org.mapforge.map.Entity;
import org.mapforge.map.Solid;
import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The result of one template import.
 *
 * @param world Brushes placed in the world.
 * @param detailSolids Detail brushes.
 * @param detail The detail entity holding the detail brushes, or {@code null} if there are none or
 *               the copies were not added to the document.
 * @param overlays The copied overlays.
 * @param idRemap Template face identifier to the identifier of its copy.
 * @param template The imported template.
 * @param origin Where the template was placed.
 * @param orientation How the template was rotated.
 * @param visgroups The visgroups imported, including {@code ""}.
 */
public record ImportedTemplate(
        List<Solid> world,
        List<Solid> detailSolids,
        Entity detail,
        List<Entity> overlays,
        Map<Integer, Integer> idRemap,
        Template template,
        Vec origin,
        Orientation orientation,
        Set<String> visgroups
) {

    /**
     * @return world and detail brushes, world first.
     */
    public List<Solid> allSolids() {
        List<Solid> all = new ArrayList<>(world);
        all.addAll(detailSolids);
        return all;
    }

    /**
     * @param newFaceId the identifier of a copied face.
     * @return the identifier of the template face it was copied from.
     */
    public Optional<Integer> originalId(int newFaceId) {
        Map<Integer, Integer> reverse = new HashMap<>();
        idRemap.forEach((orig, copy) -> reverse.put(copy, orig));
        return Optional.ofNullable(reverse.get(newFaceId));
    }
}
