package org.mapforge.template;

import java.util.Locale;

/**
 * What a colour picker does to the surface it sampled.
 */
public enum AfterPickMode {
    /** Leave it alone. */
    NONE,
    /** Remove the brush owning the sampled face. */
    VOID,
    /** Turn the sampled face into nodraw. */
    NODRAW;

    public static AfterPickMode parse(String text) {
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "void", "1" -> VOID;
            case "nodraw", "2" -> NODRAW;
            default -> NONE;
        };
    }
}
