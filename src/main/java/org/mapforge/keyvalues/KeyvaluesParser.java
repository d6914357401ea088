package org.mapforge.keyvalues;

import org.mapforge.diagnostics.DiagnosticsEngine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds a {@link Keyvalues} tree from the tokens of a {@link KeyvaluesLexer}.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine} and parsing continues, so one pass reports
 * every problem. The convenience methods throw {@link KeyvaluesSyntaxException} if any error was
 * collected.
 */
public class KeyvaluesParser {

    private final List<KvToken> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Creates a parser over already-scanned tokens.
     * @param tokens the tokens, terminated by {@link KvTokenType#END_OF_FILE}.
     * @param diagnostics the engine for reporting errors.
     */
    public KeyvaluesParser(List<KvToken> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses text into a tree.
     * @param source the document text.
     * @param fileName the document name used in error messages.
     * @return the unnamed root block.
     * @throws KeyvaluesSyntaxException if the text is malformed.
     */
    public static Keyvalues parse(String source, String fileName) throws KeyvaluesSyntaxException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<KvToken> tokens = new KeyvaluesLexer(source, diagnostics, fileName).scanTokens();
        Keyvalues root = new KeyvaluesParser(tokens, diagnostics).parse();
        diagnostics.throwIfErrors(KeyvaluesSyntaxException::new);
        return root;
    }

    /**
     * Reads and parses a UTF-8 file.
     * @param file the file.
     * @return the unnamed root block.
     * @throws IOException if the file cannot be read.
     * @throws KeyvaluesSyntaxException if the text is malformed.
     */
    public static Keyvalues parse(Path file) throws IOException, KeyvaluesSyntaxException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.getFileName().toString());
    }

    /**
     * Parses all tokens.
     * @return the unnamed root block, containing whatever could be recovered.
     */
    public Keyvalues parse() {
        Keyvalues root = Keyvalues.root();
        parseContents(root, true);
        return root;
    }

    private void parseContents(Keyvalues block, boolean topLevel) {
        while (true) {
            KvToken token = advance();
            switch (token.type()) {
                case END_OF_FILE -> {
                    if (!topLevel) {
                        error(token, "Block '" + block.realName() + "' is never closed.");
                    }
                    return;
                }
                case CLOSE_BRACE -> {
                    if (topLevel) {
                        error(token, "Unexpected '}'.");
                        continue;
                    }
                    return;
                }
                case OPEN_BRACE -> {
                    error(token, "Block has no name.");
                    parseContents(Keyvalues.block(""), false);
                }
                case STRING -> parseEntry(block, token);
            }
        }
    }

    private void parseEntry(Keyvalues parent, KvToken name) {
        KvToken next = peek();
        switch (next.type()) {
            case OPEN_BRACE -> {
                advance();
                Keyvalues child = Keyvalues.block(name.text());
                parent.append(child);
                parseContents(child, false);
            }
            case STRING -> {
                advance();
                parent.append(Keyvalues.leaf(name.text(), next.text()));
            }
            default -> error(name, "Key '" + name.text() + "' has no value.");
        }
    }

    private void error(KvToken token, String message) {
        diagnostics.reportError(message, token.fileName(), token.line());
    }

    private KvToken advance() {
        KvToken token = tokens.get(current);
        if (token.type() != KvTokenType.END_OF_FILE) {
            current++;
        }
        return token;
    }

    private KvToken peek() {
        return tokens.get(current);
    }
}
