package org.mapforge.keyvalues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A node of a key/value document: either a leaf carrying a string value or a block carrying an
 * ordered list of child nodes.
 * <p>
 * Names are compared case-insensitively; the spelling from the document is kept in
 * {@link #realName()} and written back unchanged. Children keep document order and duplicate names
 * are allowed. The unnamed root returned by the parser is a block whose real name is empty.
 */
public final class Keyvalues implements Iterable<Keyvalues> {

    private String realName;
    private String value;
    private final List<Keyvalues> children;

    private Keyvalues(String realName, String value, List<Keyvalues> children) {
        this.realName = realName;
        this.value = value;
        this.children = children;
    }

    /**
     * Creates a leaf node.
     * @param name the key.
     * @param value the value, never {@code null}.
     * @return the new leaf.
     */
    public static Keyvalues leaf(String name, String value) {
        if (value == null) {
            throw new IllegalArgumentException("Leaf '" + name + "' needs a value");
        }
        return new Keyvalues(name, value, null);
    }

    /**
     * Creates a block node holding the given children, in order.
     * @param name the block name.
     * @param children the initial children.
     * @return the new block.
     */
    public static Keyvalues block(String name, Keyvalues... children) {
        Keyvalues kv = new Keyvalues(name, null, new ArrayList<>());
        for (Keyvalues child : children) {
            kv.append(child);
        }
        return kv;
    }

    /**
     * Creates a block node holding the given children, in order.
     * @param name the block name.
     * @param children the initial children.
     * @return the new block.
     */
    public static Keyvalues block(String name, List<Keyvalues> children) {
        Keyvalues kv = new Keyvalues(name, null, new ArrayList<>());
        children.forEach(kv::append);
        return kv;
    }

    /**
     * Creates an empty unnamed root block.
     * @return the root.
     */
    public static Keyvalues root() {
        return block("");
    }

    /**
     * @return the case-folded name used for comparisons.
     */
    public String name() {
        return fold(realName);
    }

    public String realName() {
        return realName;
    }

    public void setName(String realName) {
        this.realName = realName;
    }

    public boolean isBlock() {
        return children != null;
    }

    /**
     * Returns the value of a leaf.
     * @return the value.
     * @throws IllegalStateException if this node is a block.
     */
    public String value() {
        if (children != null) {
            throw new IllegalStateException("'" + realName + "' is a block, not a value");
        }
        return value;
    }

    public void setValue(String value) {
        if (children != null) {
            throw new IllegalStateException("Cannot set a value on block '" + realName + "'");
        }
        this.value = value;
    }

    /**
     * @return an unmodifiable view of the children; empty for leaves.
     */
    public List<Keyvalues> children() {
        return children == null ? List.of() : Collections.unmodifiableList(children);
    }

    @Override
    public Iterator<Keyvalues> iterator() {
        return children().iterator();
    }

    /**
     * Appends a child to this block.
     * @param child the node to add.
     * @return this block, for chaining.
     */
    public Keyvalues append(Keyvalues child) {
        requireBlock().add(child);
        return this;
    }

    /**
     * Removes a specific child node (by identity).
     * @param child the node to remove.
     * @return {@code true} if it was present.
     */
    public boolean remove(Keyvalues child) {
        return children != null && children.removeIf(c -> c == child);
    }

    /**
     * Removes every child with the given name.
     * @param name the name to remove.
     */
    public void removeAll(String name) {
        String key = fold(name);
        if (children != null) {
            children.removeIf(c -> c.name().equals(key));
        }
    }

    public boolean has(String name) {
        return find(name).isPresent();
    }

    /**
     * Finds the last child with the given name. Later keys override earlier ones.
     * @param name the key to look for, case-insensitive.
     * @return the matching child, if any.
     */
    public Optional<Keyvalues> find(String name) {
        if (children == null) {
            return Optional.empty();
        }
        String key = fold(name);
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i).name().equals(key)) {
                return Optional.of(children.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * @param name the key to look for, case-insensitive.
     * @return all children with that name, in document order.
     */
    public List<Keyvalues> findAll(String name) {
        String key = fold(name);
        List<Keyvalues> result = new ArrayList<>();
        for (Keyvalues child : children()) {
            if (child.name().equals(key)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Finds the last child block with the given name, or an empty detached block if there is none.
     * @param name the block name.
     * @return the block.
     */
    public Keyvalues findBlock(String name) {
        String key = fold(name);
        List<Keyvalues> all = children();
        for (int i = all.size() - 1; i >= 0; i--) {
            Keyvalues child = all.get(i);
            if (child.isBlock() && child.name().equals(key)) {
                return child;
            }
        }
        return block(name);
    }

    /**
     * Returns the value of the last leaf with the given name.
     * @param name the key.
     * @param def the value to return if the key is missing or is a block.
     * @return the value or {@code def}.
     */
    public String get(String name, String def) {
        return find(name).filter(kv -> !kv.isBlock()).map(Keyvalues::value).orElse(def);
    }

    /**
     * @param name the key.
     * @return the value, or {@code ""} if the key is missing.
     */
    public String get(String name) {
        return get(name, "");
    }

    public int getInt(String name, int def) {
        String raw = get(name, null);
        if (raw == null || raw.isBlank()) {
            return def;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            try {
                return (int) Double.parseDouble(raw.trim());
            } catch (NumberFormatException ignored) {
                return def;
            }
        }
    }

    public double getDouble(String name, double def) {
        String raw = get(name, null);
        if (raw == null || raw.isBlank()) {
            return def;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    public boolean getBool(String name, boolean def) {
        return parseBool(get(name, null), def);
    }

    /**
     * Sets the last leaf with the given name, or appends a new one.
     * @param name the key.
     * @param value the new value.
     */
    public void set(String name, String value) {
        Optional<Keyvalues> existing = find(name).filter(kv -> !kv.isBlock());
        if (existing.isPresent()) {
            existing.get().setValue(value);
        } else {
            append(leaf(name, value));
        }
    }

    /**
     * @return a deep copy of this node.
     */
    public Keyvalues copy() {
        if (children == null) {
            return new Keyvalues(realName, value, null);
        }
        List<Keyvalues> copied = new ArrayList<>(children.size());
        for (Keyvalues child : children) {
            copied.add(child.copy());
        }
        return new Keyvalues(realName, null, copied);
    }

    /**
     * Parses the boolean spellings used in configuration files.
     * @param raw the text, may be {@code null}.
     * @param def the value for missing or unrecognised text.
     * @return the parsed value.
     */
    public static boolean parseBool(String raw, boolean def) {
        if (raw == null) {
            return def;
        }
        return switch (fold(raw.trim())) {
            case "1", "true", "yes", "y", "t" -> true;
            case "0", "false", "no", "n", "f" -> false;
            default -> def;
        };
    }

    /**
     * Case-folds a name the way keys are compared.
     * @param name the name.
     * @return the folded name.
     */
    public static String fold(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private List<Keyvalues> requireBlock() {
        if (children == null) {
            throw new IllegalStateException("'" + realName + "' is a value, not a block");
        }
        return children;
    }

    @Override
    public String toString() {
        return KeyvaluesWriter.toText(this);
    }
}
