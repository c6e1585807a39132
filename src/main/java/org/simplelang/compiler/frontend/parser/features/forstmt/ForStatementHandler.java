package org.simplelang.compiler.frontend.parser.features.forstmt;

import org.simplelang.compiler.diagnostics.ParseResult;
import org.simplelang.compiler.frontend.lexer.TokenKind;
import org.simplelang.compiler.frontend.parser.IStatementHandler;
import org.simplelang.compiler.frontend.parser.ParsingContext;

/**
 * Handler for the <code>for</code> statement.
 * <p>
 * The header is <code>for ( declaration expression ; assignment )</code>. The init clause is
 * always a full <code>type identifier ;</code> declaration, and the update clause is an
 * assignment that carries its own <code>;</code> before the closing parenthesis, e.g.
 * <code>for ( int i ; i &lt; 10 ; i = i + 1 ; ) { ... }</code>.
 */
public class ForStatementHandler implements IStatementHandler {

    @Override
    public ParseResult parse(ParsingContext context) {
        context.advance(); // consume 'for'

        if (!context.check(TokenKind.LPAREN)) {
            return context.fail("Expected '(' after for");
        }
        context.advance();

        ParseResult init = context.declaration();
        if (init.isFailure()) {
            return init;
        }

        ParseResult condition = context.expression();
        if (condition.isFailure()) {
            return condition;
        }

        if (!context.check(TokenKind.SEMICOLON)) {
            return context.fail("Missing ';' in for");
        }
        context.advance();

        ParseResult update = context.assignment();
        if (update.isFailure()) {
            return update;
        }

        if (!context.check(TokenKind.RPAREN)) {
            return context.fail("Expected ')'");
        }
        context.advance();

        return context.block();
    }
}
