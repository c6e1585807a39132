package org.simplelang.compiler;

import com.typesafe.config.Config;
import org.simplelang.compiler.diagnostics.ParseResult;
import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.lexer.TokenCursor;
import org.simplelang.compiler.frontend.parser.Parser;
import org.simplelang.compiler.frontend.parser.ParserOptions;

import java.util.List;

/**
 * Entry point for checking a lexed program against the grammar.
 * <p>
 * Each {@link #check(List)} call runs on its own cursor and parser, so a checker can be
 * reused and shared between threads.
 */
public class SyntaxChecker {

    private final ParserOptions options;

    public SyntaxChecker() {
        this(ParserOptions.defaults());
    }

    public SyntaxChecker(ParserOptions options) {
        this.options = options;
    }

    public static SyntaxChecker fromConfig(Config config) {
        return new SyntaxChecker(ParserOptions.fromConfig(config));
    }

    /**
     * Checks a token sequence.
     *
     * @param tokens The tokens in source order. An empty list is a valid, empty program.
     * @return Success, or the first syntax error with the line it was detected on.
     */
    public ParseResult check(List<Token> tokens) {
        return new Parser(new TokenCursor(tokens), options).parse();
    }

    public ParserOptions options() {
        return options;
    }
}
