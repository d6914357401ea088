package org.mapforge.map;

import org.mapforge.diagnostics.DiagnosticsEngine;
import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.keyvalues.KeyvaluesParser;
import org.mapforge.keyvalues.KeyvaluesSyntaxException;
import org.mapforge.math.Vec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link MapDocument} from the key/value level format.
 * <p>
 * The recognised structure is {@code world} (keys and {@code solid} blocks), {@code entity}
 * blocks (keys, {@code replaceNN} fixups, {@code connections} and {@code solid} blocks) and, inside
 * solids, {@code side} blocks. Everything else is kept verbatim and written back unchanged.
 * Recoverable problems, such as a duplicate identifier, are reported as warnings; anything that
 * loses geometry is an error.
 */
public class MapDocumentReader {

    private static final Logger LOG = LoggerFactory.getLogger(MapDocumentReader.class);
    private static final Pattern PLANE_POINT = Pattern.compile("\\(([^)]*)\\)");

    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final Deque<String> path = new ArrayDeque<>();

    /**
     * @param diagnostics receives warnings and errors.
     * @param fileName the document name used in messages.
     */
    public MapDocumentReader(DiagnosticsEngine diagnostics, String fileName) {
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Reads and converts a file, failing on any error.
     * @param file the file.
     * @return the document.
     * @throws IOException if the file cannot be read.
     * @throws MapFormatException if the file is malformed.
     */
    public static MapDocument read(Path file) throws IOException, MapFormatException {
        Keyvalues root;
        try {
            root = KeyvaluesParser.parse(file);
        } catch (KeyvaluesSyntaxException e) {
            throw new MapFormatException("Failed to parse " + file + ":\n" + e.getMessage(), e);
        }
        return read(root, file.getFileName().toString());
    }

    /**
     * Converts a parsed tree, failing on any error.
     * @param root the parsed document.
     * @param fileName the document name used in messages.
     * @return the document.
     * @throws MapFormatException if the tree is malformed.
     */
    public static MapDocument read(Keyvalues root, String fileName) throws MapFormatException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        MapDocument doc = new MapDocumentReader(diagnostics, fileName).convert(root);
        diagnostics.throwIfErrors(MapFormatException::new);
        if (diagnostics.warningCount() > 0) {
            LOG.warn("{} problem(s) while reading {}:\n{}", diagnostics.warningCount(), fileName, diagnostics.summary());
        }
        return doc;
    }

    /**
     * Converts a parsed tree, reporting problems to the diagnostics engine.
     * @param root the parsed document.
     * @return the document, containing whatever could be recovered.
     */
    public MapDocument convert(Keyvalues root) {
        MapDocument doc = new MapDocument();
        boolean seenWorld = false;
        for (Keyvalues block : root) {
            switch (block.name()) {
                case "world" -> {
                    seenWorld = true;
                    path.addLast("world");
                    readEntityBody(doc, doc.world(), block);
                    path.removeLast();
                }
                case "entity" -> readEntity(doc, block);
                default -> (seenWorld ? doc.trailerBlocks() : doc.headerBlocks()).add(block.copy());
            }
        }
        return doc;
    }

    private void readEntity(MapDocument doc, Keyvalues block) {
        Entity ent = doc.createEntity(block.get("classname"), block.getInt("id", 0));
        path.addLast(label(block));
        if (block.getInt("id", 0) > 0 && ent.id() != block.getInt("id", 0)) {
            warn("Duplicate entity id " + block.get("id") + ", reassigned to " + ent.id());
        }
        readEntityBody(doc, ent, block);
        path.removeLast();
    }

    private void readEntityBody(MapDocument doc, Entity ent, Keyvalues block) {
        for (Keyvalues child : block) {
            if (child.isBlock()) {
                switch (child.name()) {
                    case "solid" -> readSolid(doc, ent, child);
                    case "connections" -> readConnections(ent, child);
                    default -> ent.extraBlocks().add(child.copy());
                }
            } else if (child.name().equals("id")) {
                // assigned through the document
                continue;
            } else if (child.name().startsWith("replace") && isReplaceKey(child.name())) {
                if (!ent.fixup().parseReplaceKey(child.value())) {
                    warn("Malformed fixup '" + child.value() + "' on " + ent);
                }
            } else {
                ent.put(child.realName(), child.value());
            }
        }
    }

    private static boolean isReplaceKey(String name) {
        return name.length() > "replace".length()
                && name.substring("replace".length()).chars().allMatch(Character::isDigit);
    }

    private void readConnections(Entity ent, Keyvalues block) {
        for (Keyvalues conn : block) {
            if (conn.isBlock()) {
                warn("Unexpected block '" + conn.realName() + "' in connections of " + ent);
                continue;
            }
            try {
                ent.addOutput(Output.parse(conn.realName(), conn.value()));
            } catch (IllegalArgumentException e) {
                warn(e.getMessage());
            }
        }
    }

    private void readSolid(MapDocument doc, Entity owner, Keyvalues block) {
        path.addLast(label(block));
        try {
            readSolidBody(doc, owner, block);
        } finally {
            path.removeLast();
        }
    }

    private void readSolidBody(MapDocument doc, Entity owner, Keyvalues block) {
        List<Side> sides = new ArrayList<>();
        List<Keyvalues> extra = new ArrayList<>();
        for (Keyvalues child : block) {
            if (child.isBlock() && child.name().equals("side")) {
                Side side = readSide(doc, child);
                if (side != null) {
                    sides.add(side);
                }
            } else if (child.isBlock()) {
                extra.add(child.copy());
            }
        }
        if (sides.size() < 4) {
            error("Solid " + block.get("id") + " has only " + sides.size() + " valid sides");
            return;
        }
        int preferred = block.getInt("id", 0);
        Solid solid = new Solid(doc.allocateSolidId(preferred), sides);
        if (preferred > 0 && solid.id() != preferred) {
            warn("Duplicate solid id " + preferred + ", reassigned to " + solid.id());
        }
        solid.extraBlocks().addAll(extra);
        doc.addSolid(owner, solid);
    }

    private Side readSide(MapDocument doc, Keyvalues block) {
        path.addLast(label(block));
        try {
            return readSideBody(doc, block);
        } finally {
            path.removeLast();
        }
    }

    private Side readSideBody(MapDocument doc, Keyvalues block) {
        Matcher m = PLANE_POINT.matcher(block.get("plane"));
        List<Vec> points = new ArrayList<>(3);
        while (m.find()) {
            points.add(Vec.parse(m.group(1), null));
        }
        if (points.size() != 3 || points.contains(null)) {
            error("Side " + block.get("id") + " has a malformed plane: '" + block.get("plane") + "'");
            return null;
        }
        UVAxis u;
        UVAxis v;
        try {
            u = UVAxis.parse(block.get("uaxis", "[1 0 0 0] 0.25"));
            v = UVAxis.parse(block.get("vaxis", "[0 -1 0 0] 0.25"));
        } catch (IllegalArgumentException e) {
            error("Side " + block.get("id") + ": " + e.getMessage());
            return null;
        }
        int preferred = block.getInt("id", 0);
        Side side = new Side(doc.allocateFaceId(preferred), points.get(0), points.get(1), points.get(2),
                block.get("material"), u, v);
        if (preferred > 0 && side.id() != preferred) {
            warn("Duplicate side id " + preferred + ", reassigned to " + side.id());
        }
        side.setRotation(block.getDouble("rotation", 0));
        side.setLightmapScale(block.getInt("lightmapscale", 16));
        side.setSmoothingGroups(block.getInt("smoothing_groups", 0));
        for (Keyvalues child : block) {
            if (child.isBlock()) {
                side.extraBlocks().add(child.copy());
            }
        }
        return side;
    }

    private static String label(Keyvalues block) {
        String id = block.get("id");
        return id.isEmpty() ? block.name() : block.name() + " " + id;
    }

    private void warn(String message) {
        diagnostics.reportWarning(message, fileName, String.join(" > ", path));
    }

    private void error(String message) {
        diagnostics.reportError(message, fileName, String.join(" > ", path));
    }
}
