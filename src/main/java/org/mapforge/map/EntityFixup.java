package org.mapforge.map;

import org.mapforge.keyvalues.Keyvalues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The ordered {@code $variable → value} table of an instance.
 * <p>
 * Variable names are case-insensitive and may be given with or without the leading {@code $}.
 * The table is stored in documents as {@code "replace01" "$var value"} keys, in insertion order.
 */
public class EntityFixup {

    private static final Logger LOG = LoggerFactory.getLogger(EntityFixup.class);
    private static final Pattern VARIABLE = Pattern.compile("\\$[A-Za-z0-9_\\-]+");

    private final Map<String, Entry> vars = new LinkedHashMap<>();

    /**
     * A single fixup variable.
     *
     * @param name The variable name as written, without {@code $}.
     * @param value The value.
     */
    public record Entry(String name, String value) {
    }

    private static String key(String var) {
        return Keyvalues.fold(var.startsWith("$") ? var.substring(1) : var);
    }

    private static String bare(String var) {
        return var.startsWith("$") ? var.substring(1) : var;
    }

    public Optional<String> get(String var) {
        return Optional.ofNullable(vars.get(key(var))).map(Entry::value);
    }

    public String get(String var, String def) {
        return get(var).orElse(def);
    }

    public boolean getBool(String var, boolean def) {
        return Keyvalues.parseBool(get(var).orElse(null), def);
    }

    public boolean contains(String var) {
        return vars.containsKey(key(var));
    }

    /**
     * Sets a variable, keeping its position if it already exists.
     * @param var the variable, with or without {@code $}.
     * @param value the value.
     */
    public void put(String var, String value) {
        String k = key(var);
        Entry existing = vars.get(k);
        vars.put(k, new Entry(existing != null ? existing.name() : bare(var), value));
    }

    public void remove(String var) {
        vars.remove(key(var));
    }

    public List<Entry> entries() {
        return List.copyOf(vars.values());
    }

    public int size() {
        return vars.size();
    }

    /**
     * Resolves a configuration value against this table: {@code $var} yields the variable,
     * {@code !$var} its boolean inverse, anything else is returned unchanged. Unknown variables
     * resolve to the empty string with a warning.
     *
     * @param value the configured value.
     * @return the resolved value.
     */
    public String resolve(String value) {
        if (value.startsWith("!$")) {
            Optional<String> raw = get(value.substring(1));
            if (raw.isEmpty()) {
                LOG.warn("Unknown fixup variable '{}'", value.substring(1));
                return "";
            }
            return Keyvalues.parseBool(raw.get(), false) ? "0" : "1";
        }
        if (value.startsWith("$")) {
            Optional<String> raw = get(value);
            if (raw.isEmpty()) {
                LOG.warn("Unknown fixup variable '{}'", value);
                return "";
            }
            return raw.get();
        }
        return value;
    }

    /**
     * Replaces every known {@code $var} occurrence inside a longer text. Unknown variables are left
     * as written.
     *
     * @param text the text.
     * @return the substituted text.
     */
    public String substitute(String text) {
        if (text.indexOf('$') < 0) {
            return text;
        }
        Matcher m = VARIABLE.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String token = m.group();
            int len = longestKnownPrefix(token);
            String replacement = len < 0 ? token : vars.get(key(token.substring(0, len))).value() + token.substring(len);
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    // Variable names may be followed directly by other text, e.g. "$side_a".
    private int longestKnownPrefix(String token) {
        for (int len = token.length(); len > 1; len--) {
            if (vars.containsKey(key(token.substring(0, len)))) {
                return len;
            }
        }
        return -1;
    }

    /**
     * Reads a {@code replaceNN} key.
     * @param value the raw {@code "$var value"} text.
     * @return {@code false} if the value is malformed.
     */
    boolean parseReplaceKey(String value) {
        String trimmed = value.trim();
        if (!trimmed.startsWith("$")) {
            return false;
        }
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            put(trimmed, "");
        } else {
            put(trimmed.substring(0, space), trimmed.substring(space + 1));
        }
        return true;
    }

    /**
     * @return the variables as {@code replaceNN} keys, in order.
     */
    List<Keyvalues> toReplaceKeys() {
        List<Keyvalues> result = new ArrayList<>();
        int i = 1;
        for (Entry e : vars.values()) {
            result.add(Keyvalues.leaf(String.format("replace%02d", i++), "$" + e.name() + " " + e.value()));
        }
        return result;
    }

    /**
     * @return the variables sorted by name, for debug output.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        vars.values().stream().sorted(Comparator.comparing(Entry::name)).forEach(
                e -> sb.append(sb.length() > 1 ? ", " : "").append('$').append(e.name()).append('=').append(e.value()));
        return sb.append('}').toString();
    }
}
