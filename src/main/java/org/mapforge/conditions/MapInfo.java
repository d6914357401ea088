package org.mapforge.conditions;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.map.Entity;
import org.mapforge.map.MapDocument;
import org.mapforge.template.TemplateLibrary;
import org.mapforge.texturing.MapRandom;
import org.mapforge.texturing.PresetClump;
import org.mapforge.texturing.TextureSet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Map-wide information shared by every rule of a run.
 * <p>
 * Style variables and attributes are case-insensitive. The set of placed instance files only
 * grows: files added by rules are recorded, removed instances are not forgotten, so tests that
 * report "no such instance anywhere" stay correct for the whole run.
 */
public class MapInfo {

    private final MapRandom random;
    private final TextureSet textures;
    private final TemplateLibrary templates;
    private final boolean clumping;
    private final Map<String, String> styleVars = new LinkedHashMap<>();
    private final Set<String> attributes = new LinkedHashSet<>();
    private final Set<String> allInstances = new LinkedHashSet<>();
    private final List<Entity> globalInstances = new ArrayList<>();
    private final List<PresetClump> presetClumps = new ArrayList<>();

    public MapInfo(MapRandom random, TextureSet textures, TemplateLibrary templates, boolean clumping) {
        this.random = random;
        this.textures = textures;
        this.templates = templates;
        this.clumping = clumping;
    }

    /**
     * @param map the document; its instance files seed the placed-instance set.
     * @param textures the texture set.
     * @param templates the template library.
     * @param clumping whether wall texturing clumps.
     * @return the information for this document.
     */
    public static MapInfo forDocument(MapDocument map, TextureSet textures, TemplateLibrary templates, boolean clumping) {
        MapInfo info = new MapInfo(MapRandom.fromDocument(map), textures, templates, clumping);
        map.instanceFiles().forEach(info::recordInstance);
        return info;
    }

    public MapRandom random() {
        return random;
    }

    public TextureSet textures() {
        return textures;
    }

    public TemplateLibrary templates() {
        return templates;
    }

    public boolean clumping() {
        return clumping;
    }

    public Optional<String> styleVar(String name) {
        return Optional.ofNullable(styleVars.get(Keyvalues.fold(name)));
    }

    public void setStyleVar(String name, String value) {
        styleVars.put(Keyvalues.fold(name), value);
    }

    public Map<String, String> styleVars() {
        return Collections.unmodifiableMap(styleVars);
    }

    public boolean hasAttr(String name) {
        return attributes.contains(Keyvalues.fold(name));
    }

    public void setAttr(String name) {
        attributes.add(Keyvalues.fold(name));
    }

    /**
     * @param file an instance file that is now part of the map.
     */
    public void recordInstance(String file) {
        if (!file.isEmpty()) {
            allInstances.add(Keyvalues.fold(file).replace('\\', '/'));
        }
    }

    /**
     * @return every instance file placed at any point of the run, case-folded.
     */
    public Set<String> allInstances() {
        return Collections.unmodifiableSet(allInstances);
    }

    public void addGlobalInstance(Entity inst) {
        globalInstances.add(inst);
    }

    public List<Entity> globalInstances() {
        return Collections.unmodifiableList(globalInstances);
    }

    public void addPresetClump(PresetClump clump) {
        presetClumps.add(clump);
    }

    public List<PresetClump> presetClumps() {
        return Collections.unmodifiableList(presetClumps);
    }
}
