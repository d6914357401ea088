package org.mapforge.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.mapforge.cli.commands.CompileCommand;
import org.mapforge.cli.commands.DumpConditionsCommand;
import org.mapforge.config.ConfigLoader;
import org.mapforge.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "mapforge",
    mixinStandardHelpOptions = true,
    version = "mapforge 1.0",
    description = "mapforge - rule-driven level geometry compiler",
    subcommands = {
        CompileCommand.class,
        DumpConditionsCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: mapforge.conf in the working directory)"
    )
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log at DEBUG level")
    private boolean verbose;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * @return the configured command line, for embedding and tests.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("mapforge");
        return commandLine;
    }

    /**
     * Loads the configuration and applies its logging settings on first use.
     *
     * @return the configuration.
     * @throws CommandLine.ParameterException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            try {
                config = ConfigLoader.load(configFile);
            } catch (ConfigException e) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Failed to load configuration: " + e.getMessage(), e);
            }
            LoggingConfigurator.configure(config);
            if (verbose) {
                LoggingConfigurator.setRootLevel("DEBUG");
            }
        }
        return config;
    }
}
