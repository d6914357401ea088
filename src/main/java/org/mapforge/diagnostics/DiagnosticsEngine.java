package org.mapforge.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Collects diagnostic messages (errors, warnings) reported while documents are parsed.
 * <p>
 * This decouples error reporting from the readers themselves: a reader keeps going after
 * a problem so a single pass reports everything, and the caller decides whether to fail.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error at a source line.
     *
     * @param message    The error message.
     * @param fileName   The document in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String fileName, int lineNumber) {
        diagnostics.add(Diagnostic.atLine(Diagnostic.Severity.ERROR, message, fileName, lineNumber));
    }

    /**
     * Reports an error inside a parsed block.
     *
     * @param message   The error message.
     * @param fileName  The document in which the error occurred.
     * @param blockPath The enclosing blocks, outermost first.
     */
    public void reportError(String message, String fileName, String blockPath) {
        diagnostics.add(Diagnostic.inBlock(Diagnostic.Severity.ERROR, message, fileName, blockPath));
    }

    public void reportWarning(String message, String fileName, int lineNumber) {
        diagnostics.add(Diagnostic.atLine(Diagnostic.Severity.WARNING, message, fileName, lineNumber));
    }

    public void reportWarning(String message, String fileName, String blockPath) {
        diagnostics.add(Diagnostic.inBlock(Diagnostic.Severity.WARNING, message, fileName, blockPath));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Diagnostic.Severity.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }

    /**
     * Number of collected warnings, used by readers to log a one-line summary.
     *
     * @return the warning count.
     */
    public int warningCount() {
        return (int) diagnostics.stream().filter(d -> d.severity() == Diagnostic.Severity.WARNING).count();
    }

    /**
     * Throws the exception built by {@code factory} from {@link #summary()} if any error was reported.
     *
     * @param factory builds the exception from the summary text.
     * @param <E> the exception type.
     * @throws E if at least one error was reported.
     */
    public <E extends Exception> void throwIfErrors(Function<String, E> factory) throws E {
        if (hasErrors()) {
            throw factory.apply(summary());
        }
    }
}
