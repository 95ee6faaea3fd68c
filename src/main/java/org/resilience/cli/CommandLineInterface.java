package org.resilience.cli;

import java.io.File;
import java.util.concurrent.Callable;

import org.resilience.cli.commands.RunCommand;
import org.resilience.cli.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "resilience",
    mixinStandardHelpOptions = true,
    version = "Resilience 1.0",
    description = "Resilience - agent-based simulation of foraging, waste and mortality on a toroidal grid",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/resilience.conf)"
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
        commandLine.setCommandName("resilience");
        return commandLine;
    }

    /**
     * Resolves the application configuration on first use and applies the logging format.
     *
     * @return The resolved configuration.
     * @throws IllegalArgumentException if an explicitly named config file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            switch (level) {
                case INFO -> LOG.info(message);
                case WARN -> LOG.warn(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            final String appender = "COLOR".equalsIgnoreCase(format) ? "STDOUT_COLOR" : "STDOUT";
            if (!appender.equals(System.getProperty("resilience.logging.appender"))) {
                System.setProperty("resilience.logging.appender", appender);
                reconfigureLogback();
            }
        }
        return config;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof ch.qos.logback.classic.LoggerContext context)) {
            return;
        }
        try {
            ch.qos.logback.classic.joran.JoranConfigurator configurator = new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
