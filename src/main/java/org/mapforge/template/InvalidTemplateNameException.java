package org.mapforge.template;

import java.util.List;

/**
 * Thrown when a template name is not in the library. The message lists every known name so the
 * configuration can be fixed in one go.
 */
public class InvalidTemplateNameException extends RuntimeException {

    private final String requested;
    private final List<String> knownNames;

    /**
     * @param requested the unknown name.
     * @param knownNames every known template name, sorted.
     */
    public InvalidTemplateNameException(String requested, List<String> knownNames) {
        super("Template \"" + requested + "\" does not exist! Valid templates:\n" + String.join("\n", knownNames));
        this.requested = requested;
        this.knownNames = List.copyOf(knownNames);
    }

    public String requested() {
        return requested;
    }

    public List<String> knownNames() {
        return knownNames;
    }
}
