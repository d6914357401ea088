package org.mapforge.keyvalues;

/**
 * The kinds of token produced by the {@link KeyvaluesLexer}.
 */
public enum KvTokenType {
    /** A quoted or bare string; the token value holds the unescaped text. */
    STRING,
    OPEN_BRACE,
    CLOSE_BRACE,
    END_OF_FILE
}
