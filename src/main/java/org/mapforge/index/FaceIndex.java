package org.mapforge.index;

import org.mapforge.map.MapDocument;
import org.mapforge.map.Side;
import org.mapforge.map.Solid;
import org.mapforge.texturing.Materials;
import org.mapforge.texturing.SurfaceColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps {@link FaceLoc (grid cell, normal)} to the panel or goo face at that spot.
 * <p>
 * At most one entry exists per key. Two faces claiming the same key are overlapping coplanar
 * surfaces: both are retextured to nodraw, neither is indexed, and the key stays blocked for the
 * lifetime of the index. Entries hold identifiers only, so a face or brush removed from the
 * document stops resolving instead of leaking a stale reference.
 * <p>
 * The index also records which faces came from retextured templates; the wall texturing pass
 * leaves those alone.
 */
public class FaceIndex {

    private static final Logger LOG = LoggerFactory.getLogger(FaceIndex.class);

    private final MapDocument map;
    private final Map<FaceLoc, IndexEntry> entries = new LinkedHashMap<>();
    private final Map<Integer, FaceLoc> locByFace = new HashMap<>();
    private final Set<FaceLoc> conflicted = new HashSet<>();
    private final Set<Integer> templateFaces = new HashSet<>();

    /**
     * Creates an empty index over a document.
     * @param map the document faces are resolved against.
     */
    public FaceIndex(MapDocument map) {
        this.map = map;
    }

    /**
     * Indexes every panel and goo face of the world and {@code func_detail} brushes.
     * @param map the document.
     * @return the index.
     */
    public static FaceIndex build(MapDocument map) {
        FaceIndex index = new FaceIndex(map);
        int faces = 0;
        for (Solid solid : map.structuralSolids()) {
            for (Side side : solid.sides()) {
                Optional<SurfaceColor> color = Materials.indexColor(side.material());
                if (color.isPresent()) {
                    index.insert(FaceLoc.of(side), side, solid, color.get());
                    faces++;
                }
            }
        }
        LOG.debug("Indexed {} of {} candidate faces ({} conflicting locations)",
                index.size(), faces, index.conflicted.size());
        return index;
    }

    /**
     * Adds a face. If the key is already taken (or was taken before), both faces become nodraw and
     * the key is left empty.
     *
     * @param loc the key.
     * @param face the face.
     * @param solid the brush owning the face.
     * @param color the surface property.
     * @return {@code true} if the face was indexed.
     */
    public boolean insert(FaceLoc loc, Side face, Solid solid, SurfaceColor color) {
        if (conflicted.contains(loc)) {
            face.setMaterial(Materials.NODRAW);
            return false;
        }
        IndexEntry existing = entries.get(loc);
        if (existing != null && existing.faceId() != face.id()) {
            LOG.warn("Overlapping faces at {}: {} and {}, both set to nodraw", loc, existing.faceId(), face.id());
            map.face(existing.faceId()).ifPresent(other -> other.setMaterial(Materials.NODRAW));
            face.setMaterial(Materials.NODRAW);
            remove(loc);
            conflicted.add(loc);
            return false;
        }
        FaceLoc previous = locByFace.get(face.id());
        if (previous != null && !previous.equals(loc)) {
            entries.remove(previous);
        }
        entries.put(loc, new IndexEntry(face.id(), solid.id(), color));
        locByFace.put(face.id(), loc);
        return true;
    }

    /**
     * @param loc the key.
     * @return the face at that key, if any and if it is still in the document.
     */
    public Optional<FaceRef> lookup(FaceLoc loc) {
        IndexEntry entry = entries.get(loc);
        if (entry == null) {
            return Optional.empty();
        }
        return resolve(loc, entry);
    }

    /**
     * Removes and returns the face at a key.
     * @param loc the key.
     * @return the face, if any and if it is still in the document.
     */
    public Optional<FaceRef> pop(FaceLoc loc) {
        IndexEntry entry = entries.get(loc);
        if (entry == null) {
            return Optional.empty();
        }
        remove(loc);
        return resolve(loc, entry);
    }

    /**
     * Removes every entry pointing at a face of this brush. Call this whenever a brush is removed
     * from the document.
     *
     * @param solid the brush.
     */
    public void evict(Solid solid) {
        for (Side side : solid.sides()) {
            FaceLoc loc = locByFace.get(side.id());
            if (loc != null) {
                remove(loc);
            }
        }
    }

    /**
     * Removes the entry for one face, leaving any other face indexed under the same key alone.
     * @param faceId the face identifier.
     * @return whether the face was indexed.
     */
    public boolean discard(int faceId) {
        FaceLoc loc = locByFace.get(faceId);
        if (loc == null) {
            return false;
        }
        remove(loc);
        return true;
    }

    /**
     * @param faceId a face identifier.
     * @return the key the face is indexed under, if it is indexed.
     */
    public Optional<FaceLoc> locationOf(int faceId) {
        return Optional.ofNullable(locByFace.get(faceId));
    }

    /**
     * @return every live entry in insertion order; entries whose face left the document are skipped.
     */
    public List<FaceRef> entries() {
        List<FaceRef> result = new ArrayList<>(entries.size());
        for (Map.Entry<FaceLoc, IndexEntry> e : entries.entrySet()) {
            resolve(e.getKey(), e.getValue()).ifPresent(result::add);
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    public MapDocument map() {
        return map;
    }

    /**
     * Marks a face as textured by a template, so later texturing passes skip it.
     * @param faceId the face identifier.
     */
    public void markTemplateFace(int faceId) {
        templateFaces.add(faceId);
    }

    public boolean isTemplateFace(int faceId) {
        return templateFaces.contains(faceId);
    }

    private void remove(FaceLoc loc) {
        IndexEntry removed = entries.remove(loc);
        if (removed != null) {
            locByFace.remove(removed.faceId());
        }
    }

    private Optional<FaceRef> resolve(FaceLoc loc, IndexEntry entry) {
        Optional<Side> face = map.face(entry.faceId());
        Optional<Solid> solid = map.solid(entry.solidId());
        if (face.isEmpty() || solid.isEmpty() || solid.get() != map.solidOfFace(entry.faceId()).orElse(null)) {
            return Optional.empty();
        }
        return Optional.of(new FaceRef(loc, face.get(), solid.get(), entry.color()));
    }
}
