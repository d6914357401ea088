package org.mapforge.keyvalues;

/**
 * A single token extracted by the {@link KeyvaluesLexer}.
 *
 * @param type The type of the token.
 * @param text The processed text: string contents without quotes and with escapes resolved.
 * @param quoted Whether the string was written in quotes.
 * @param line The line number where the token was found.
 * @param fileName The logical document name, for error reporting.
 */
public record KvToken(
        KvTokenType type,
        String text,
        boolean quoted,
        int line,
        String fileName
) {
}
