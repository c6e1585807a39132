package org.simplelang.compiler.frontend.parser;

import org.simplelang.compiler.diagnostics.ParseResult;

/**
 * Handler interface for one statement form.
 * The handler is invoked with the statement's leading token as the current token.
 */
public interface IStatementHandler {

    /**
     * Consumes the statement from the token stream.
     *
     * @param context The parsing context providing access to the token stream.
     * @return Success, or the first syntax error found in the statement.
     */
    ParseResult parse(ParsingContext context);
}
