package org.mapforge.diagnostics;

/**
 * One problem found in a rule, level or template document.
 * <p>
 * Problems found while tokenizing carry a source line. Problems found later, while converting an
 * already parsed keyvalue tree, carry the path of blocks leading to the offending one instead,
 * such as {@code entity 12 > solid 40 > side 7}.
 *
 * @param severity How bad the problem is.
 * @param message The message.
 * @param fileName The document the problem was found in.
 * @param line The 1-based source line, or 0 if unknown.
 * @param blockPath The enclosing blocks, outermost first; empty if unknown.
 */
public record Diagnostic(
        Severity severity,
        String message,
        String fileName,
        int line,
        String blockPath
) {

    public enum Severity {
        /** The document cannot be used. */
        ERROR,
        /** The reader recovered. */
        WARNING
    }

    public static Diagnostic atLine(Severity severity, String message, String fileName, int line) {
        return new Diagnostic(severity, message, fileName, line, "");
    }

    public static Diagnostic inBlock(Severity severity, String message, String fileName, String blockPath) {
        return new Diagnostic(severity, message, fileName, 0, blockPath);
    }

    /**
     * @return {@code file:line}, {@code file [path]} or just the file name.
     */
    public String location() {
        if (line > 0) {
            return fileName + ":" + line;
        }
        if (!blockPath.isEmpty()) {
            return fileName + " [" + blockPath + "]";
        }
        return fileName;
    }

    @Override
    public String toString() {
        return "[" + severity + "] " + location() + ": " + message;
    }
}
