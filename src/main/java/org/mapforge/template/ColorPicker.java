package org.mapforge.template;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.math.Vec;

import java.util.Set;

/**
 * Samples the colour of the surface next to a template and forces it onto some template faces.
 *
 * @param priority Pickers apply in ascending priority, so higher priorities win.
 * @param name A name used in messages.
 * @param offset The sample point, relative to the template origin.
 * @param normal The surface direction to sample, relative to the template.
 * @param faces Template face identifiers receiving the colour.
 * @param gridSnap Whether the sample point is snapped to the centre of its grid cell.
 * @param afterPick What happens to the sampled surface.
 * @param whiteMaterial The material to use instead of a texture key when white is sampled; may be empty.
 * @param blackMaterial The material to use instead of a texture key when black is sampled; may be empty.
 * @param visgroup The visgroup the picker belongs to; empty for pickers that always apply.
 */
public record ColorPicker(
        int priority,
        String name,
        Vec offset,
        Vec normal,
        Set<Integer> faces,
        boolean gridSnap,
        AfterPickMode afterPick,
        String whiteMaterial,
        String blackMaterial,
        String visgroup
) {

    /**
     * @param visgroups the visgroups an import brought in.
     * @return whether this picker applies to that import.
     */
    public boolean appliesTo(Set<String> visgroups) {
        return visgroup.isEmpty() || visgroups.stream().anyMatch(group -> Keyvalues.fold(group).equals(visgroup));
    }
}
