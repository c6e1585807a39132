package org.simplelang.compiler;

import com.typesafe.config.ConfigFactory;
import org.simplelang.compiler.diagnostics.ParseResult;
import org.simplelang.compiler.diagnostics.SyntaxError;
import org.simplelang.compiler.frontend.lexer.Token;
import org.simplelang.compiler.frontend.parser.ParserOptions;
import org.simplelang.test.utils.TestTokens;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.simplelang.compiler.frontend.lexer.TokenKind.*;

@Tag("unit")
class SyntaxCheckerTest {

    private static final List<Token> VALID = TestTokens.line(1, INT, IDENTIFIER, SEMICOLON)
            .andLine(2, IDENTIFIER, ASSIGN, NUMBER, SEMICOLON)
            .andLine(3, IF, LPAREN, IDENTIFIER, GREATER, NUMBER, RPAREN, LBRACE)
            .andLine(4, IDENTIFIER, ASSIGN, IDENTIFIER, MINUS, NUMBER, SEMICOLON)
            .andLine(5, RBRACE)
            .andLine(6, EOF)
            .build();

    private static final List<Token> INVALID = TestTokens.line(1, IDENTIFIER).andLine(2, NUMBER, SEMICOLON).build();

    @Test
    void checkingTheSameTokensTwiceGivesTheSameResult() {
        SyntaxChecker checker = new SyntaxChecker();

        ParseResult first = checker.check(INVALID);
        ParseResult second = checker.check(INVALID);

        assertThat(first).isEqualTo(second);
        assertThat(first.error()).contains(new SyntaxError("Expected '=' in assignment", 2));
        assertThat(checker.check(VALID)).isEqualTo(checker.check(VALID)).isEqualTo(ParseResult.success());
    }

    @Test
    void concurrentChecksDoNotInterfere() {
        SyntaxChecker checker = new SyntaxChecker();

        List<CompletableFuture<ParseResult>> futures = IntStream.range(0, 32)
                .mapToObj(i -> CompletableFuture.supplyAsync(() -> checker.check(i % 2 == 0 ? VALID : INVALID)))
                .toList();

        for (int i = 0; i < futures.size(); i++) {
            assertThat(futures.get(i).join().isSuccess()).isEqualTo(i % 2 == 0);
        }
    }

    @Test
    void optionsAreReadFromConfig() {
        SyntaxChecker strict = SyntaxChecker.fromConfig(
                ConfigFactory.parseString("simplelang.parser.strict-operands = true"));
        SyntaxChecker lenient = SyntaxChecker.fromConfig(ConfigFactory.empty());
        List<Token> strayOperand = TestTokens.line(1, IDENTIFIER, ASSIGN, SEMICOLON, SEMICOLON).build();

        assertThat(strict.options()).isEqualTo(new ParserOptions(true));
        assertThat(lenient.options()).isEqualTo(ParserOptions.defaults());
        assertThat(strict.check(strayOperand).isFailure()).isTrue();
        assertThat(lenient.check(strayOperand).isSuccess()).isTrue();
    }
}
