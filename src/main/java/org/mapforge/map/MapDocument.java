package org.mapforge.map;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.math.Vec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * An in-memory level document: the world entity and its brushes, plus every other entity in
 * document order.
 * <p>
 * The document owns identifier allocation. Entity, solid and face identifiers are unique within the
 * document at any instant and are never reused after removal, so stale references held elsewhere
 * simply stop resolving. Removal operations are idempotent.
 */
public class MapDocument {

    private static final Logger LOG = LoggerFactory.getLogger(MapDocument.class);

    public static final String OVERLAY_CLASS = "info_overlay";
    public static final String DETAIL_CLASS = "func_detail";

    private final Entity world;
    private final List<Entity> entities = new ArrayList<>();
    private final List<Keyvalues> headerBlocks = new ArrayList<>();
    private final List<Keyvalues> trailerBlocks = new ArrayList<>();

    private final Map<Integer, Solid> solidsById = new HashMap<>();
    private final Map<Integer, Entity> solidOwners = new HashMap<>();
    private final Map<Integer, Side> facesById = new HashMap<>();
    private final Map<Integer, Solid> faceOwners = new HashMap<>();

    private final IdAllocator entityIds = new IdAllocator();
    private final IdAllocator solidIds = new IdAllocator();
    private final IdAllocator faceIds = new IdAllocator();

    /**
     * Creates an empty document containing only the world entity.
     */
    public MapDocument() {
        this.world = new Entity(this, entityIds.allocate(1));
        world.put("classname", "worldspawn");
    }

    /**
     * Hands out unique positive identifiers, honouring a preferred value when it is free.
     */
    private static final class IdAllocator {
        private final Set<Integer> used = new HashSet<>();
        private int next = 1;

        int allocate(int preferred) {
            if (preferred > 0 && used.add(preferred)) {
                return preferred;
            }
            while (used.contains(next)) {
                next++;
            }
            used.add(next);
            return next++;
        }
    }

    public int allocateFaceId(int preferred) {
        return faceIds.allocate(preferred);
    }

    public int allocateSolidId(int preferred) {
        return solidIds.allocate(preferred);
    }

    int allocateEntityId(int preferred) {
        return entityIds.allocate(preferred);
    }

    public Entity world() {
        return world;
    }

    /**
     * @return the non-world entities in document order, excluding removed ones.
     */
    public List<Entity> entities() {
        return Collections.unmodifiableList(entities);
    }

    /**
     * @param classname the class to look for, case-insensitive.
     * @return a snapshot of the matching entities, in document order.
     */
    public List<Entity> byClass(String classname) {
        String folded = Keyvalues.fold(classname);
        return entities.stream()
                .filter(e -> Keyvalues.fold(e.classname()).equals(folded))
                .collect(Collectors.toList());
    }

    /**
     * @return a snapshot of every instance, in document order.
     */
    public List<Entity> instances() {
        return byClass(Entity.INSTANCE_CLASS);
    }

    /**
     * @return the case-folded set of instance files currently placed.
     */
    public Set<String> instanceFiles() {
        Set<String> files = new LinkedHashSet<>();
        for (Entity inst : instances()) {
            files.add(inst.file());
        }
        return files;
    }

    public List<Entity> overlays() {
        return byClass(OVERLAY_CLASS);
    }

    /**
     * Creates an entity at the end of the document.
     * @param classname the entity class.
     * @return the new entity.
     */
    public Entity createEntity(String classname) {
        return createEntity(classname, 0);
    }

    Entity createEntity(String classname, int preferredId) {
        Entity ent = new Entity(this, allocateEntityId(preferredId));
        ent.put("classname", classname);
        entities.add(ent);
        return ent;
    }

    /**
     * Creates an instance entity.
     * @param file the instance file.
     * @param targetname the instance name, may be empty.
     * @param origin the placement.
     * @param angles the rotation as {@code "pitch yaw roll"}.
     * @return the new instance.
     */
    public Entity createInstance(String file, String targetname, Vec origin, String angles) {
        Entity inst = createEntity(Entity.INSTANCE_CLASS);
        inst.put("targetname", targetname);
        inst.put("file", file);
        inst.put("origin", origin.toString());
        inst.put("angles", angles);
        return inst;
    }

    /**
     * Removes an entity and its brushes. Removing an already removed entity does nothing.
     * @param ent the entity.
     * @return {@code true} if the entity was present.
     */
    public boolean removeEntity(Entity ent) {
        if (ent == world) {
            throw new IllegalArgumentException("The world entity cannot be removed");
        }
        if (ent.isRemoved() || !entities.remove(ent)) {
            return false;
        }
        for (Solid solid : List.copyOf(ent.solids())) {
            unregister(solid);
        }
        ent.markRemoved();
        return true;
    }

    /**
     * @return the world brushes, in order.
     */
    public List<Solid> brushes() {
        return world.solids();
    }

    /**
     * Adds a brush to the world.
     * @param solid the brush.
     */
    public void addBrush(Solid solid) {
        addSolid(world, solid);
    }

    /**
     * Adds a brush to a brush entity.
     * @param owner the entity, or {@link #world()}.
     * @param solid the brush; must not belong to any entity yet.
     */
    public void addSolid(Entity owner, Solid solid) {
        if (solidOwners.containsKey(solid.id())) {
            throw new IllegalStateException(solid + " already belongs to " + solidOwners.get(solid.id()));
        }
        owner.attachSolid(solid);
        solidsById.put(solid.id(), solid);
        solidOwners.put(solid.id(), owner);
        for (Side side : solid.sides()) {
            facesById.put(side.id(), side);
            faceOwners.put(side.id(), solid);
        }
    }

    /**
     * Removes a brush from whichever entity owns it. Removing an absent brush does nothing.
     * Overlays on its faces are left alone; see {@link #reallocateOverlays(Map)}.
     *
     * @param solid the brush.
     * @return {@code true} if the brush was present.
     */
    public boolean removeBrush(Solid solid) {
        return unregister(solid);
    }

    private boolean unregister(Solid solid) {
        Entity owner = solidOwners.remove(solid.id());
        if (owner == null) {
            return false;
        }
        owner.detachSolid(solid);
        solidsById.remove(solid.id());
        for (Side side : solid.sides()) {
            facesById.remove(side.id());
            faceOwners.remove(side.id());
        }
        return true;
    }

    public Optional<Solid> solid(int id) {
        return Optional.ofNullable(solidsById.get(id));
    }

    public Optional<Side> face(int id) {
        return Optional.ofNullable(facesById.get(id));
    }

    /**
     * @param faceId the face identifier.
     * @return the brush owning the face, if the face is still in the document.
     */
    public Optional<Solid> solidOfFace(int faceId) {
        return Optional.ofNullable(faceOwners.get(faceId));
    }

    /**
     * @param solid the brush.
     * @return the entity owning it ({@link #world()} for world brushes), if it is in the document.
     */
    public Optional<Entity> ownerOf(Solid solid) {
        return Optional.ofNullable(solidOwners.get(solid.id()));
    }

    /**
     * @return every brush of the world and of {@code func_detail} entities.
     */
    public List<Solid> structuralSolids() {
        List<Solid> result = new ArrayList<>(world.solids());
        for (Entity detail : byClass(DETAIL_CLASS)) {
            result.addAll(detail.solids());
        }
        return result;
    }

    /**
     * Parses the face list of an overlay.
     * @param overlay the overlay entity.
     * @return the face identifiers, in order.
     */
    public static List<Integer> overlayFaces(Entity overlay) {
        List<Integer> ids = new ArrayList<>();
        for (String part : overlay.get("sides").trim().split("\\s+")) {
            if (part.isEmpty()) {
                continue;
            }
            try {
                ids.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring malformed face id '{}' in {}", part, overlay);
            }
        }
        return ids;
    }

    public static void setOverlayFaces(Entity overlay, List<Integer> ids) {
        overlay.put("sides", ids.stream().map(String::valueOf).collect(Collectors.joining(" ")));
    }

    /**
     * Re-points every overlay through a face mapping. Faces absent from the mapping are kept,
     * faces mapped to an empty list are dropped, and an overlay left without faces is removed.
     *
     * @param mapping old face id to the replacement face ids.
     * @return the number of overlays removed.
     */
    public int reallocateOverlays(Map<Integer, List<Integer>> mapping) {
        int removed = 0;
        for (Entity overlay : overlays()) {
            List<Integer> newFaces = new ArrayList<>();
            for (int face : overlayFaces(overlay)) {
                List<Integer> replacement = mapping.get(face);
                if (replacement == null) {
                    newFaces.add(face);
                } else {
                    newFaces.addAll(replacement);
                }
            }
            if (newFaces.isEmpty()) {
                removeEntity(overlay);
                removed++;
            } else {
                setOverlayFaces(overlay, newFaces);
            }
        }
        return removed;
    }

    /**
     * @return top-level blocks written before the world (version info, visgroups...).
     */
    public List<Keyvalues> headerBlocks() {
        return headerBlocks;
    }

    /**
     * @return top-level blocks written after the entities (cameras, cordons...).
     */
    public List<Keyvalues> trailerBlocks() {
        return trailerBlocks;
    }

    @Override
    public String toString() {
        return "MapDocument[" + brushes().size() + " brushes, " + entities.size() + " entities]";
    }
}
