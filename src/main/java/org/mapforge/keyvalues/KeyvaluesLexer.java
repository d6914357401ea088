package org.mapforge.keyvalues;

import org.mapforge.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts key/value block text into a flat token list.
 * <p>
 * Strings are either quoted (supporting the escapes {@code \" \\ \n \t}) or bare, in which case
 * they run until whitespace, a brace or a quote. {@code //} starts a comment running to the end
 * of the line.
 */
public class KeyvaluesLexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private final List<KvToken> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;

    /**
     * Creates a new lexer.
     * @param source The document text.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the document, for error reporting.
     */
    public KeyvaluesLexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire document.
     * @return A list of the recognized tokens, always terminated by {@link KvTokenType#END_OF_FILE}.
     */
    public List<KvToken> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new KvToken(KvTokenType.END_OF_FILE, "", false, line, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '"' -> quoted();
            case '{' -> addToken(KvTokenType.OPEN_BRACE, "{", false);
            case '}' -> addToken(KvTokenType.CLOSE_BRACE, "}", false);
            case '\n' -> line++;
            case ' ', '\r', '\t', '\uFEFF' -> {
                // whitespace
            }
            case '/' -> {
                if (peek() == '/') {
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    bare();
                }
            }
            default -> bare();
        }
    }

    private void quoted() {
        int startLine = line;
        StringBuilder sb = new StringBuilder();
        while (peek() != '"' && !isAtEnd()) {
            char c = advance();
            if (c == '\n') {
                line++;
                sb.append(c);
            } else if (c == '\\' && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> sb.append('\\').append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            diagnostics.reportError("Unterminated string.", logicalFileName, startLine);
            return;
        }
        advance(); // closing quote
        tokens.add(new KvToken(KvTokenType.STRING, sb.toString(), true, startLine, logicalFileName));
    }

    private void bare() {
        while (!isAtEnd() && !isDelimiter(peek())) advance();
        addToken(KvTokenType.STRING, source.substring(start, current), false);
    }

    private boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '{' || c == '}' || c == '"';
    }

    private void addToken(KvTokenType type, String text, boolean quoted) {
        tokens.add(new KvToken(type, text, quoted, line, logicalFileName));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }
}
