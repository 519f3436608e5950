package org.rgen.cli;

import com.typesafe.config.Config;
import org.rgen.cli.commands.InspectCommand;
import org.rgen.cli.commands.SimulateCommand;
import org.rgen.node.config.ConfigLoader;
import org.rgen.node.config.LoggingConfigurator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "rgen",
    mixinStandardHelpOptions = true,
    version = "R-Gen 1.0",
    description = "R-Gen - living fantasy world simulation",
    subcommands = {
        SimulateCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to a configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + " in the working directory)"
    )
    private Path configFile;

    private Config config;

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("rgen");
        System.exit(commandLine.execute(args));
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @throws IllegalArgumentException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
