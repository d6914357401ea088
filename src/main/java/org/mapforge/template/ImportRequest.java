package org.mapforge.template;

import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What to import and where.
 *
 * @param name The template reference, {@code id} or {@code id:visgroups}.
 * @param origin Where the template origin goes.
 * @param orientation How the template is rotated.
 * @param targetname The name used to localise overlay names; may be empty.
 * @param forceType Forced brush placement, or {@code null} for the template's own default.
 * @param visgroups Additional visgroups requested explicitly.
 * @param chooser Picks further visgroups.
 * @param addToMap Whether the copies are added to the document.
 */
public record ImportRequest(
        String name,
        Vec origin,
        Orientation orientation,
        String targetname,
        TemplateBrushType forceType,
        Set<String> visgroups,
        VisgroupChooser chooser,
        boolean addToMap
) {

    /**
     * @param name the template reference.
     * @param origin where the template origin goes.
     * @param orientation the rotation.
     * @return a request adding the template to the map with default settings.
     */
    public static ImportRequest of(String name, Vec origin, Orientation orientation) {
        return new ImportRequest(name, origin, orientation, "", null, Set.of(), VisgroupChooser.none(), true);
    }

    public ImportRequest withTargetname(String newTargetname) {
        return new ImportRequest(name, origin, orientation, newTargetname, forceType, visgroups, chooser, addToMap);
    }

    public ImportRequest withForceType(TemplateBrushType type) {
        return new ImportRequest(name, origin, orientation, targetname, type, visgroups, chooser, addToMap);
    }

    public ImportRequest withVisgroups(Set<String> groups) {
        return new ImportRequest(name, origin, orientation, targetname, forceType, new LinkedHashSet<>(groups), chooser, addToMap);
    }

    public ImportRequest withChooser(VisgroupChooser newChooser) {
        return new ImportRequest(name, origin, orientation, targetname, forceType, visgroups, newChooser, addToMap);
    }

    public ImportRequest withAddToMap(boolean add) {
        return new ImportRequest(name, origin, orientation, targetname, forceType, visgroups, chooser, add);
    }
}
