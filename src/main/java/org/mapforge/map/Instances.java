package org.mapforge.map;

import org.mapforge.math.Vec;

/**
 * Helpers for names and positions relative to an instance.
 */
public final class Instances {

    /** Instance names are prefixed to local names: {@code inst-name}. */
    public static final int FIXUP_PREFIX = 0;
    /** Instance names are appended to local names: {@code name-inst}. */
    public static final int FIXUP_POSTFIX = 1;
    /** Local names are left alone. */
    public static final int FIXUP_NONE = 2;

    private Instances() {
        // Static utility
    }

    /**
     * Makes a name local to an instance, following its {@code fixup_style}. Names starting with
     * {@code @} or {@code !} are global and returned unchanged, as are names in unnamed instances.
     *
     * @param inst the instance.
     * @param name the name.
     * @return the instance-local name.
     */
    public static String localName(Entity inst, String name) {
        String targetname = inst.targetname();
        if (name.startsWith("@") || name.startsWith("!") || targetname.isEmpty()) {
            return name;
        }
        return switch (inst.get("fixup_style", "0").trim()) {
            case "1" -> name + "-" + targetname;
            case "2" -> name;
            default -> targetname + "-" + name;
        };
    }

    /**
     * Resolves an instance-relative position, written as {@code "x y z"} and optionally taken from
     * a fixup variable, into world space.
     *
     * @param inst the instance.
     * @param value the configured offset.
     * @return the world position.
     */
    public static Vec resolveOffset(Entity inst, String value) {
        Vec local = Vec.parse(inst.fixup().resolve(value.trim()), Vec.ZERO);
        return inst.orientation().rotate(local).add(inst.origin()).snapped();
    }

    /**
     * Resolves an instance-relative direction into world space.
     *
     * @param inst the instance.
     * @param value the configured direction.
     * @param def the local direction used when the value is missing.
     * @return the world direction.
     */
    public static Vec resolveDirection(Entity inst, String value, Vec def) {
        Vec local = Vec.parse(inst.fixup().resolve(value.trim()), def);
        return inst.orientation().rotate(local);
    }
}
