package org.mapforge.conditions;

/**
 * The closed set of values a rule handler can ask for.
 */
public enum ContextKind {
    /** The document being compiled. */
    MAP,
    /** The spatial face index of the document. */
    INDEX,
    /** Map-wide information: randomness, textures, style variables, placed instances. */
    MAP_INFO,
    /** The instance the condition is evaluated against. Not available to staged factories or run-once metas. */
    INSTANCE,
    /** The configuration block of the test or result, with its setup data. */
    CONFIG
}
