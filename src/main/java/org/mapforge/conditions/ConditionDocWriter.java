package org.mapforge.conditions;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes a plain-text reference of every registered test, result and meta-condition, grouped by
 * the module that registered it.
 */
public final class ConditionDocWriter {

    private ConditionDocWriter() {
    }

    public static void write(ConditionRegistry registry, PrintWriter out) {
        for (Map.Entry<String, List<ConditionRegistry.RuleDoc>> group : registry.groups().entrySet()) {
            String title = group.getKey().isEmpty() ? "Other" : group.getKey();
            out.println("# " + title);
            for (String kind : List.of("test", "result", "meta")) {
                List<ConditionRegistry.RuleDoc> docs = group.getValue().stream()
                        .filter(d -> d.kind().equals(kind))
                        .collect(Collectors.toList());
                if (docs.isEmpty()) {
                    continue;
                }
                out.println("## " + kind.substring(0, 1).toUpperCase(Locale.ROOT) + kind.substring(1) + "s");
                for (ConditionRegistry.RuleDoc doc : docs) {
                    out.println(describe(doc));
                }
            }
            out.println();
        }
        out.flush();
    }

    private static String describe(ConditionRegistry.RuleDoc doc) {
        StringBuilder sb = new StringBuilder("- ").append(doc.name());
        if (!doc.aliases().isEmpty()) {
            sb.append(" (aliases: ").append(String.join(", ", doc.aliases())).append(')');
        }
        if (!doc.kinds().isEmpty()) {
            sb.append(" uses ").append(doc.kinds().stream()
                    .map(k -> k.name().toLowerCase(Locale.ROOT))
                    .collect(Collectors.joining(", ")));
        }
        if (doc.staged()) {
            sb.append(" [staged]");
        }
        return sb.toString();
    }
}
