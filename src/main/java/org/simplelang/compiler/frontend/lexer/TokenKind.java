package org.simplelang.compiler.frontend.lexer;

import java.util.Locale;

/**
 * Defines the lexical categories produced by the upstream lexer.
 */
public enum TokenKind {
    // Type keywords.
    /** The {@code int} keyword. */
    INT("int"),
    /** The {@code bool} keyword. */
    BOOL("bool"),
    /** The {@code string} keyword. */
    STRING("string"),

    // Control keywords.
    /** The {@code if} keyword. */
    IF("if"),
    /** The {@code for} keyword. */
    FOR("for"),

    // Literals.
    /** An identifier, such as a variable name. */
    IDENTIFIER("identifier"),
    /** A numeric literal. */
    NUMBER("number"),
    /** A {@code true}/{@code false} literal. */
    BOOLEAN("boolean"),

    // Operators.
    PLUS("+"),
    MINUS("-"),
    ASSIGN("="),
    GREATER(">"),
    LESS("<"),
    AND("&&"),
    OR("||"),

    // Punctuation.
    SEMICOLON(";"),
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),

    /** Represents the end of the token sequence. */
    EOF("<eof>");

    private final String lexeme;

    TokenKind(String lexeme) {
        this.lexeme = lexeme;
    }

    /**
     * @return The text this kind is displayed as, e.g. {@code ;} or {@code int}.
     */
    public String lexeme() {
        return lexeme;
    }

    /**
     * @return true for {@code int}, {@code bool} and {@code string}.
     */
    public boolean isTypeKeyword() {
        return this == INT || this == BOOL || this == STRING;
    }

    /**
     * @return true for the operators allowed between two expression operands.
     */
    public boolean isBinaryOperator() {
        return switch (this) {
            case PLUS, MINUS, GREATER, LESS, AND, OR -> true;
            default -> false;
        };
    }

    /**
     * Resolves a kind from either its constant name (case-insensitive) or its lexeme.
     *
     * @param text The name or lexeme, e.g. {@code "semicolon"} or {@code ";"}.
     * @return The matching kind.
     * @throws IllegalArgumentException if no kind matches.
     */
    public static TokenKind fromText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Token kind must not be blank");
        }
        String trimmed = text.trim();
        for (TokenKind kind : values()) {
            if (kind.lexeme.equals(trimmed)) {
                return kind;
            }
        }
        try {
            return valueOf(trimmed.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown token kind: " + trimmed, e);
        }
    }
}
