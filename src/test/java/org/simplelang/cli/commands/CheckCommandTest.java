package org.simplelang.cli.commands;

import org.simplelang.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the check command in-process against the bundled sample listings.
 */
@Tag("unit")
public class CheckCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine cmdLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    @Test
    void testCommandIsRegistered() {
        assertThat(cmdLine.getSubcommands()).containsKey("check");
    }

    @Test
    void testValidProgramIsAccepted() {
        int exitCode = cmdLine.execute("check", "-f", "classpath:samples/valid-program.tokens");

        assertThat(exitCode)
            .describedAs("stderr: %s, stdout: %s", err, out)
            .isEqualTo(CheckCommand.EXIT_ACCEPTED);
        assertThat(out.toString()).contains("OK: samples/valid-program.tokens");
    }

    @Test
    void testValidForLoopIsAccepted() {
        int exitCode = cmdLine.execute("check", "-f", "classpath:samples/valid-for.tokens");

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_ACCEPTED);
    }

    @Test
    void testInvalidSamplesAreRejectedWithLineAndMessage() {
        int exitCode = cmdLine.execute("check",
                "-f", "classpath:samples/invalid-declaration.tokens",
                "-f", "classpath:samples/missing-brace.tokens",
                "-f", "classpath:samples/invalid-assignment.tokens",
                "-f", "classpath:samples/invalid-control.tokens");

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_REJECTED);
        assertThat(err.toString())
            .contains("samples/invalid-declaration.tokens: Syntax Error at line 1: Expected identifier in declaration")
            .contains("samples/missing-brace.tokens: Syntax Error at line 3: Invalid statement")
            .contains("samples/invalid-assignment.tokens: Syntax Error at line 1: Expected '=' in assignment")
            .contains("samples/invalid-control.tokens: Syntax Error at line 1: Expected '(' after for");
    }

    @Test
    void testStrictOperandsOption() throws Exception {
        Path listing = tempDir.resolve("stray.tokens");
        Files.writeString(listing, """
            identifier 1
            = 1
            ; 2
            ; 2
            """);

        assertThat(cmdLine.execute("check", "-f", listing.toString())).isEqualTo(CheckCommand.EXIT_ACCEPTED);

        int strictExit = cmdLine.execute("check", "--strict-operands", "-f", listing.toString());

        assertThat(strictExit).isEqualTo(CheckCommand.EXIT_REJECTED);
        assertThat(err.toString()).contains("Syntax Error at line 2: Expected operand in expression");
    }

    @Test
    void testStrictOperandsFromConfigFile() throws Exception {
        Path config = tempDir.resolve("strict.conf");
        Files.writeString(config, "simplelang.parser.strict-operands = true\n");
        Path listing = tempDir.resolve("stray.tokens");
        Files.writeString(listing, "identifier 1\n= 1\n; 1\n; 1\n");

        int exitCode = cmdLine.execute("--config", config.toString(), "check", "-f", listing.toString());

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_REJECTED);
    }

    @Test
    void testUnreadableListingReturnsLoadError() {
        int exitCode = cmdLine.execute("check", "-f", tempDir.resolve("missing.tokens").toString());

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_LOAD_ERROR);
        assertThat(err.toString()).startsWith("Error:");
    }

    @Test
    void testMalformedListingReturnsLoadError() throws Exception {
        Path listing = tempDir.resolve("bad.tokens");
        Files.writeString(listing, "int 1\nwhile 2\n");

        int exitCode = cmdLine.execute("check", "-f", listing.toString());

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_LOAD_ERROR);
        assertThat(err.toString()).contains("bad.tokens:2");
    }

    @Test
    void testInvalidLogLevelInConfigReturnsLoadError() throws Exception {
        Path config = tempDir.resolve("bad-logging.conf");
        Files.writeString(config, "logging.loggers { org.simplelang.compiler = DEBG }\n");

        int exitCode = cmdLine.execute("--config", config.toString(),
                "check", "-f", "classpath:samples/valid-program.tokens");

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_LOAD_ERROR);
        assertThat(err.toString()).contains("Unknown log level 'DEBG'");
    }

    @Test
    void testMissingConfigFileReturnsLoadError() {
        int exitCode = cmdLine.execute("--config", tempDir.resolve("nope.conf").toString(),
                "check", "-f", "classpath:samples/valid-program.tokens");

        assertThat(exitCode).isEqualTo(CheckCommand.EXIT_LOAD_ERROR);
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    void testMissingRequiredFileOption() {
        int exitCode = cmdLine.execute("check");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--file");
    }
}
