package org.simplelang.compiler.frontend.parser;

import org.simplelang.compiler.diagnostics.ParseResult;
import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.lexer.TokenKind;

/**
 * Provides statement handlers with access to the current token and the shared productions.
 * This interface decouples handlers from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token current();

    /**
     * Checks if the current token is of the given kind without consuming it.
     * @param kind The token kind to check.
     * @return true if the current token is of the given kind, false otherwise.
     */
    boolean check(TokenKind kind);

    /**
     * Replaces the current token with the next one from the cursor.
     */
    void advance();

    /**
     * Builds a failure carrying the given message and the line of the current token.
     * Callers return the result immediately.
     * @param message The diagnostic message.
     * @return A failed result.
     */
    ParseResult fail(String message);

    /** {@code type identifier ;} */
    ParseResult declaration();

    /** {@code identifier = expression ;} */
    ParseResult assignment();

    /** {@code operand (operator operand)*} */
    ParseResult expression();

    /** Dispatches on the current token to the registered statement handler. */
    ParseResult statement();

    /** {@code { statement* }} */
    ParseResult block();
}
