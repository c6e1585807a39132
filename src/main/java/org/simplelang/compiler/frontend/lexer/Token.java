package org.simplelang.compiler.frontend.lexer;

/**
 * Represents a single token handed over by the lexer.
 *
 * @param kind The lexical category of the token.
 * @param line The source line the token was found on. Line {@code 0} is used for
 *             the synthetic end-of-input token.
 */
public record Token(TokenKind kind, int line) {

    public Token {
        if (kind == null) {
            throw new IllegalArgumentException("Token kind must not be null");
        }
        if (line < 0) {
            throw new IllegalArgumentException("Token line must not be negative: " + line);
        }
    }

    /**
     * Creates an end-of-input token.
     * @param line The line to report for it.
     * @return The EOF token.
     */
    public static Token eof(int line) {
        return new Token(TokenKind.EOF, line);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind.lexeme() + "@" + line;
    }
}
