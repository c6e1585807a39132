package org.simplelang.compiler.frontend.parser;

import org.simplelang.compiler.frontend.lexer.TokenKind;
import org.simplelang.compiler.frontend.parser.features.assign.AssignmentStatementHandler;
import org.simplelang.compiler.frontend.parser.features.forstmt.ForStatementHandler;
import org.simplelang.compiler.frontend.parser.features.ifstmt.IfStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for statement handlers.
 * Maps the kind of a statement's leading token to the handler that parses it.
 */
public class StatementHandlerRegistry {

    private final Map<TokenKind, IStatementHandler> handlers = new EnumMap<>(TokenKind.class);

    /**
     * Registers a handler for a leading token kind.
     * @param leadingKind The kind that starts the statement (e.g., {@link TokenKind#IF}).
     * @param handler     The handler for this statement.
     */
    public void register(TokenKind leadingKind, IStatementHandler handler) {
        handlers.put(leadingKind, handler);
    }

    /**
     * Looks up the handler for a leading token kind.
     * @param leadingKind The kind of the current token.
     * @return The handler, or empty if no statement starts with this kind.
     */
    public Optional<IStatementHandler> get(TokenKind leadingKind) {
        return Optional.ofNullable(handlers.get(leadingKind));
    }

    /**
     * Creates a registry with the assignment, {@code if} and {@code for} handlers.
     * @return A new registry instance.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(TokenKind.IDENTIFIER, new AssignmentStatementHandler());
        registry.register(TokenKind.IF, new IfStatementHandler());
        registry.register(TokenKind.FOR, new ForStatementHandler());
        return registry;
    }
}
