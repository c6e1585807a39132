package org.simplelang.compiler.frontend.parser.features.ifstmt;

import org.simplelang.compiler.diagnostics.ParseResult;
import org.simplelang.compiler.frontend.lexer.TokenKind;
import org.simplelang.compiler.frontend.parser.IStatementHandler;
import org.simplelang.compiler.frontend.parser.ParsingContext;

/**
 * Handler for the <code>if</code> statement.
 */
public class IfStatementHandler implements IStatementHandler {

    /**
     * Parses <code>if ( expression ) { statement* }</code>. The body may be empty.
     * @param context The parsing context.
     * @return Success, or the first syntax error in the header or body.
     */
    @Override
    public ParseResult parse(ParsingContext context) {
        context.advance(); // consume 'if'

        if (!context.check(TokenKind.LPAREN)) {
            return context.fail("Expected '(' after if");
        }
        context.advance();

        ParseResult condition = context.expression();
        if (condition.isFailure()) {
            return condition;
        }

        if (!context.check(TokenKind.RPAREN)) {
            return context.fail("Expected ')'");
        }
        context.advance();

        return context.block();
    }
}
