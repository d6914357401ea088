package org.mapforge.keyvalues;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serializes {@link Keyvalues} trees with tab indentation and every string quoted.
 * The unnamed root is written as its children only.
 */
public final class KeyvaluesWriter {

    private KeyvaluesWriter() {
        // Static utility
    }

    /**
     * Writes a node (or the children of an unnamed root) to the output.
     * @param kv the node.
     * @param out the destination.
     * @throws IOException if writing fails.
     */
    public static void write(Keyvalues kv, Appendable out) throws IOException {
        if (kv.isBlock() && kv.realName().isEmpty()) {
            for (Keyvalues child : kv) {
                write(child, out, 0);
            }
        } else {
            write(kv, out, 0);
        }
    }

    /**
     * @param kv the node.
     * @return the serialized text.
     */
    public static String toText(Keyvalues kv) {
        StringBuilder sb = new StringBuilder();
        try {
            write(kv, sb);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    private static void write(Keyvalues kv, Appendable out, int depth) throws IOException {
        indent(out, depth);
        if (kv.isBlock()) {
            out.append(quote(kv.realName())).append('\n');
            indent(out, depth);
            out.append("{\n");
            for (Keyvalues child : kv) {
                write(child, out, depth + 1);
            }
            indent(out, depth);
            out.append("}\n");
        } else {
            out.append(quote(kv.realName())).append(' ').append(quote(kv.value())).append('\n');
        }
    }

    private static void indent(Appendable out, int depth) throws IOException {
        for (int i = 0; i < depth; i++) {
            out.append('\t');
        }
    }

    static String quote(String text) {
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
