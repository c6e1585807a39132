package org.simplelang.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.simplelang.cli.commands.CheckCommand;
import org.simplelang.cli.config.ConfigLoader;
import org.simplelang.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "simplelang",
    mixinStandardHelpOptions = true,
    version = "SimpleLang Checker 1.0",
    description = "SimpleLang - syntax checker for lexed SimpleLang programs",
    subcommands = {
        CheckCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/simplelang.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("simplelang");
        return commandLine;
    }

    /**
     * Resolves the configuration on first use and applies its logging section.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if {@code --config} names a missing file or a log
     *                                  level is invalid.
     * @throws ConfigException          if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> log.info(message);
                    case WARN -> log.warn(message);
                }
            });
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
