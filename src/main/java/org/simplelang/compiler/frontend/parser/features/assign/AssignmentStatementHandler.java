package org.simplelang.compiler.frontend.parser.features.assign;

import org.simplelang.compiler.diagnostics.ParseResult;
import org.simplelang.compiler.frontend.parser.IStatementHandler;
import org.simplelang.compiler.frontend.parser.ParsingContext;

/**
 * Handler for statements starting with an identifier.
 * The syntax is <code>identifier = expression ;</code>.
 */
public class AssignmentStatementHandler implements IStatementHandler {

    @Override
    public ParseResult parse(ParsingContext context) {
        return context.assignment();
    }
}
