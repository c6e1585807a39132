package org.simplelang.compiler.frontend.parser;

import org.simplelang.compiler.diagnostics.ParseResult;
import org.simplelang.compiler.diagnostics.SyntaxError;
import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.lexer.TokenCursor;
import org.simplelang.compiler.frontend.lexer.TokenKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent recognizer for the statement language.
 * <p>
 * The parser keeps exactly one current token, read from a {@link TokenCursor}, and never
 * looks further ahead or backtracks. Every production returns a {@link ParseResult}; the
 * first failure is returned unchanged through all enclosing productions and nothing is
 * read after it. A parser instance is good for one {@link #parse()} call.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final TokenCursor cursor;
    private final StatementHandlerRegistry statementHandlers;
    private final ParserOptions options;
    private Token current;

    public Parser(TokenCursor cursor) {
        this(cursor, StatementHandlerRegistry.initialize(), ParserOptions.defaults());
    }

    public Parser(TokenCursor cursor, ParserOptions options) {
        this(cursor, StatementHandlerRegistry.initialize(), options);
    }

    public Parser(TokenCursor cursor, StatementHandlerRegistry statementHandlers, ParserOptions options) {
        this.cursor = cursor;
        this.statementHandlers = statementHandlers;
        this.options = options;
        this.current = cursor.advance();
    }

    /**
     * Parses the whole token sequence as a program.
     * @return Success if the sequence is a valid program, otherwise the first syntax error.
     */
    public ParseResult parse() {
        log.debug("Parsing {} tokens (strictOperands={})", cursor.size(), options.strictOperands());
        ParseResult result = program();
        if (result.isSuccess()) {
            log.debug("Accepted after {} tokens", cursor.position());
        }
        return result;
    }

    /**
     * {@code (declaration | statement)*} up to the end of input. Tokens after an
     * explicit EOF token are never read.
     */
    ParseResult program() {
        while (!check(TokenKind.EOF)) {
            ParseResult result = current.kind().isTypeKeyword() ? declaration() : statement();
            if (result.isFailure()) {
                return result;
            }
        }
        return ParseResult.success();
    }

    @Override
    public ParseResult declaration() {
        advance(); // type keyword, checked by the caller

        if (!check(TokenKind.IDENTIFIER)) {
            return fail("Expected identifier in declaration");
        }
        advance();

        if (!check(TokenKind.SEMICOLON)) {
            return fail("Missing ';' in declaration");
        }
        advance();
        return ParseResult.success();
    }

    @Override
    public ParseResult statement() {
        return statementHandlers.get(current.kind())
                .map(handler -> handler.parse(this))
                .orElseGet(() -> fail("Invalid statement"));
    }

    @Override
    public ParseResult assignment() {
        advance(); // identifier

        if (!check(TokenKind.ASSIGN)) {
            return fail("Expected '=' in assignment");
        }
        advance();

        ParseResult value = expression();
        if (value.isFailure()) {
            return value;
        }

        if (!check(TokenKind.SEMICOLON)) {
            return fail("Missing ';' in assignment");
        }
        advance();
        return ParseResult.success();
    }

    @Override
    public ParseResult expression() {
        ParseResult operand = operand();
        if (operand.isFailure()) {
            return operand;
        }
        while (current.kind().isBinaryOperator()) {
            advance();
            operand = operand();
            if (operand.isFailure()) {
                return operand;
            }
        }
        return ParseResult.success();
    }

    @Override
    public ParseResult block() {
        if (!check(TokenKind.LBRACE)) {
            return fail("Expected '{'");
        }
        advance();

        // EOF has no statement handler, so an unterminated body fails inside this loop
        while (!check(TokenKind.RBRACE)) {
            ParseResult result = statement();
            if (result.isFailure()) {
                return result;
            }
        }
        advance();
        return ParseResult.success();
    }

    private ParseResult operand() {
        if (options.strictOperands() && !isOperand(current.kind())) {
            return fail("Expected operand in expression");
        }
        advance();
        return ParseResult.success();
    }

    private static boolean isOperand(TokenKind kind) {
        return kind == TokenKind.IDENTIFIER || kind == TokenKind.NUMBER || kind == TokenKind.BOOLEAN;
    }

    @Override
    public Token current() {
        return current;
    }

    @Override
    public boolean check(TokenKind kind) {
        return current.is(kind);
    }

    @Override
    public void advance() {
        current = cursor.advance();
    }

    @Override
    public ParseResult fail(String message) {
        SyntaxError error = new SyntaxError(message, current.line());
        log.debug("Rejected at token {}: {}", current, error.format());
        return ParseResult.failure(error);
    }
}
