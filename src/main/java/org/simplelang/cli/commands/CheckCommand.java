package org.simplelang.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

import org.simplelang.cli.CommandLineInterface;
import org.simplelang.compiler.SyntaxChecker;
import org.simplelang.compiler.diagnostics.ParseResult;
import org.simplelang.compiler.diagnostics.SyntaxError;
import org.simplelang.compiler.frontend.io.TokenListingLoader;
import org.simplelang.compiler.frontend.parser.ParserOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that checks one or more token listings against the grammar.
 * <p>
 * Exit codes: 0 if every listing is accepted, 1 if at least one is rejected,
 * 2 if a listing or the configuration cannot be loaded.
 */
@Command(
    name = "check",
    description = "Check token listings (one '<kind> <line>' per line) for syntax errors"
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    static final int EXIT_ACCEPTED = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_LOAD_ERROR = 2;

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "Token listing to check; a path or classpath:<resource>. May be repeated."
    )
    private List<String> files;

    @Option(
        names = {"--strict-operands"},
        description = "Only accept identifiers, numbers and booleans as expression operands"
    )
    private boolean strictOperands;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ParserOptions options;
        try {
            options = ParserOptions.fromConfig(parent.getConfig());
        } catch (IllegalArgumentException | ConfigException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_LOAD_ERROR;
        }
        if (strictOperands) {
            options = new ParserOptions(true);
        }
        SyntaxChecker checker = new SyntaxChecker(options);

        int exitCode = EXIT_ACCEPTED;
        for (String file : files) {
            exitCode = Math.max(exitCode, checkOne(checker, file, out, err));
        }
        out.flush();
        err.flush();
        return exitCode;
    }

    private int checkOne(SyntaxChecker checker, String file, PrintWriter out, PrintWriter err) {
        TokenListingLoader.LoadResult listing;
        try {
            listing = TokenListingLoader.load(file);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Cannot load token listing {}: {}", file, e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_LOAD_ERROR;
        }

        ParseResult result = checker.check(listing.tokens());
        if (result.isSuccess()) {
            out.println("OK: " + listing.logicalName());
            return EXIT_ACCEPTED;
        }
        SyntaxError error = result.error().orElseThrow();
        err.println(listing.logicalName() + ": " + error.format());
        return EXIT_REJECTED;
    }
}
