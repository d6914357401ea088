package org.mapforge.map;

import org.mapforge.keyvalues.Keyvalues;
import org.mapforge.keyvalues.KeyvaluesWriter;
import org.mapforge.math.Vec;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serializes a {@link MapDocument} back to the key/value level format. Output depends only on the
 * document content and order, so equal documents produce identical bytes.
 */
public final class MapDocumentWriter {

    private MapDocumentWriter() {
        // Static utility
    }

    /**
     * @param doc the document.
     * @return the unnamed root of the serialized tree.
     */
    public static Keyvalues toKeyvalues(MapDocument doc) {
        Keyvalues root = Keyvalues.root();
        doc.headerBlocks().forEach(kv -> root.append(kv.copy()));
        root.append(entityBlock("world", doc.world()));
        for (Entity ent : doc.entities()) {
            root.append(entityBlock("entity", ent));
        }
        doc.trailerBlocks().forEach(kv -> root.append(kv.copy()));
        return root;
    }

    public static String toText(MapDocument doc) {
        return KeyvaluesWriter.toText(toKeyvalues(doc));
    }

    /**
     * Writes the document as UTF-8.
     * @param doc the document.
     * @param file the destination.
     * @throws IOException if writing fails.
     */
    public static void write(MapDocument doc, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            KeyvaluesWriter.write(toKeyvalues(doc), out);
        }
    }

    private static Keyvalues entityBlock(String blockName, Entity ent) {
        Keyvalues block = Keyvalues.block(blockName);
        block.append(Keyvalues.leaf("id", Integer.toString(ent.id())));
        for (Map.Entry<String, String> key : ent.keys()) {
            block.append(Keyvalues.leaf(key.getKey(), key.getValue()));
        }
        ent.fixup().toReplaceKeys().forEach(block::append);
        if (!ent.outputs().isEmpty()) {
            Keyvalues conns = Keyvalues.block("connections");
            for (Output out : ent.outputs()) {
                conns.append(Keyvalues.leaf(out.output(), out.toValue()));
            }
            block.append(conns);
        }
        for (Solid solid : ent.solids()) {
            block.append(solidBlock(solid));
        }
        ent.extraBlocks().forEach(kv -> block.append(kv.copy()));
        return block;
    }

    private static Keyvalues solidBlock(Solid solid) {
        Keyvalues block = Keyvalues.block("solid");
        block.append(Keyvalues.leaf("id", Integer.toString(solid.id())));
        for (Side side : solid.sides()) {
            Keyvalues sb = Keyvalues.block("side");
            sb.append(Keyvalues.leaf("id", Integer.toString(side.id())));
            StringBuilder plane = new StringBuilder();
            for (Vec p : side.planePoints()) {
                plane.append(plane.length() > 0 ? " " : "").append('(').append(p).append(')');
            }
            sb.append(Keyvalues.leaf("plane", plane.toString()));
            sb.append(Keyvalues.leaf("material", side.material()));
            sb.append(Keyvalues.leaf("uaxis", side.uaxis().toString()));
            sb.append(Keyvalues.leaf("vaxis", side.vaxis().toString()));
            sb.append(Keyvalues.leaf("rotation", Vec.format(side.rotation())));
            sb.append(Keyvalues.leaf("lightmapscale", Integer.toString(side.lightmapScale())));
            sb.append(Keyvalues.leaf("smoothing_groups", Integer.toString(side.smoothingGroups())));
            side.extraBlocks().forEach(kv -> sb.append(kv.copy()));
            block.append(sb);
        }
        solid.extraBlocks().forEach(kv -> block.append(kv.copy()));
        return block;
    }
}
