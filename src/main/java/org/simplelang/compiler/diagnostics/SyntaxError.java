package org.simplelang.compiler.diagnostics;

/**
 * A grammar violation detected by the parser.
 *
 * @param message The fixed message of the failure site, e.g. {@code "Expected '('"}.
 * @param line    The line of the token that was current when the violation was detected.
 */
public record SyntaxError(String message, int line) {

    /**
     * @return The message in the form {@code Syntax Error at line <line>: <message>}.
     */
    public String format() {
        return "Syntax Error at line " + line + ": " + message;
    }

    @Override
    public String toString() {
        return format();
    }
}
