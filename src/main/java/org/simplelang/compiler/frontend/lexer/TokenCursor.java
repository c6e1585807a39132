package org.simplelang.compiler.frontend.lexer;

import java.util.List;

/**
 * Forward-only reader over a token sequence.
 * <p>
 * The cursor has no grammar knowledge. Reading past the end is not an error: every
 * call after exhaustion yields a synthetic {@link TokenKind#EOF} token on line 0.
 */
public final class TokenCursor {

    private static final Token EXHAUSTED = Token.eof(0);

    private final List<Token> tokens;
    private int position = 0;

    /**
     * @param tokens The tokens to read, in source order. The list is copied.
     */
    public TokenCursor(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Returns the next token and moves past it.
     * @return The next token, or the synthetic EOF token once the sequence is exhausted.
     */
    public Token advance() {
        if (position < tokens.size()) {
            return tokens.get(position++);
        }
        return EXHAUSTED;
    }

    /**
     * @return The number of tokens consumed so far, never more than {@link #size()}.
     */
    public int position() {
        return position;
    }

    public int size() {
        return tokens.size();
    }
}
