package org.mapforge.map;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.math.Orientation;
import org.mapforge.math.Vec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A point or brush entity of a {@link MapDocument}.
 * <p>
 * Keys are ordered and case-insensitive. Instances ({@code func_instance}) additionally carry an
 * {@link EntityFixup} table. Entities are created and removed through their document, which keeps
 * identifiers and solid lookups consistent.
 */
public class Entity {

    public static final String INSTANCE_CLASS = "func_instance";

    private final MapDocument map;
    private final int id;
    private final Map<String, Map.Entry<String, String>> keys = new LinkedHashMap<>();
    private final EntityFixup fixup = new EntityFixup();
    private final List<Output> outputs = new ArrayList<>();
    private final List<Solid> solids = new ArrayList<>();
    private final List<Keyvalues> extraBlocks = new ArrayList<>();
    private boolean removed;

    Entity(MapDocument map, int id) {
        this.map = map;
        this.id = id;
    }

    public MapDocument map() {
        return map;
    }

    public int id() {
        return id;
    }

    public String classname() {
        return get("classname");
    }

    public boolean isInstance() {
        return INSTANCE_CLASS.equals(Keyvalues.fold(classname()));
    }

    /**
     * @return {@code true} once the entity was removed from its document.
     */
    public boolean isRemoved() {
        return removed;
    }

    void markRemoved() {
        removed = true;
    }

    public Optional<String> find(String key) {
        return Optional.ofNullable(keys.get(Keyvalues.fold(key))).map(Map.Entry::getValue);
    }

    public String get(String key, String def) {
        return find(key).orElse(def);
    }

    /**
     * @param key the key.
     * @return the value, or {@code ""} if missing.
     */
    public String get(String key) {
        return get(key, "");
    }

    public boolean has(String key) {
        return keys.containsKey(Keyvalues.fold(key));
    }

    /**
     * Sets a key, keeping its position and spelling if it already exists.
     * @param key the key.
     * @param value the value.
     */
    public void put(String key, String value) {
        String folded = Keyvalues.fold(key);
        Map.Entry<String, String> existing = keys.get(folded);
        keys.put(folded, Map.entry(existing != null ? existing.getKey() : key, value));
    }

    public void remove(String key) {
        keys.remove(Keyvalues.fold(key));
    }

    /**
     * @return the keys as {@code (name as written, value)} pairs, in order.
     */
    public List<Map.Entry<String, String>> keys() {
        return List.copyOf(keys.values());
    }

    public Vec origin() {
        return Vec.parse(get("origin"), Vec.ZERO);
    }

    public void setOrigin(Vec origin) {
        put("origin", origin.toString());
    }

    public Orientation orientation() {
        return Orientation.fromAngles(get("angles", "0 0 0"));
    }

    public String targetname() {
        return get("targetname");
    }

    /**
     * @return the instance file, case-folded with forward slashes; empty for other entities.
     */
    public String file() {
        return Keyvalues.fold(get("file")).replace('\\', '/');
    }

    public EntityFixup fixup() {
        return fixup;
    }

    public List<Output> outputs() {
        return outputs;
    }

    public void addOutput(Output output) {
        outputs.add(output);
    }

    /**
     * @return the brushes of a brush entity, in order.
     */
    public List<Solid> solids() {
        return Collections.unmodifiableList(solids);
    }

    void attachSolid(Solid solid) {
        solids.add(solid);
    }

    boolean detachSolid(Solid solid) {
        return solids.remove(solid);
    }

    /**
     * @return unrecognised sub-blocks (e.g. editor data), written back unchanged.
     */
    public List<Keyvalues> extraBlocks() {
        return extraBlocks;
    }

    @Override
    public String toString() {
        String name = targetname();
        return classname() + "#" + id + (name.isEmpty() ? "" : " '" + name + "'")
                + (isInstance() ? " (" + get("file") + ")" : "");
    }
}
