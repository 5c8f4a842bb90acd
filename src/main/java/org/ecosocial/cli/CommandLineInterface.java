package org.ecosocial.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.ecosocial.cli.commands.RunCommand;
import org.ecosocial.cli.config.ConfigLoader;
import org.ecosocial.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "ecosocial",
    mixinStandardHelpOptions = true,
    version = "EcoSocial 1.0",
    description = "EcoSocial - multi-agent grid ecosystem with cooperation, theft and alliances",
    subcommands = {
        RunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/ecosocial.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show usage
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = createCommandLine();
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance. Tests use this to get the same setup as
     * the entry point.
     *
     * @return a configured CommandLine
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("ecosocial");
        return commandLine;
    }

    /**
     * Returns the resolved configuration, loading it and applying the logging settings on first
     * use.
     *
     * @return the application configuration
     * @throws IllegalArgumentException if an explicitly named config file does not exist
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfiguration();
        }
        return config;
    }

    private Config loadConfiguration() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        final Config loaded = ConfigLoader.resolve(configFile, (level, message) -> {
            switch (level) {
                case INFO -> logger.info(message);
                case WARN -> logger.warn(message);
            }
        });

        // logback.xml picks its console appender from a system property, so a format change needs a reload
        LoggingConfigurator.configure(loaded, CommandLineInterface::reloadLogback);
        return loaded;
    }

    private static void reloadLogback(final String appender) {
        final URL logbackXml = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (logbackXml == null) {
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final JoranConfigurator joran = new JoranConfigurator();
        joran.setContext(context);
        context.reset();
        try {
            joran.doConfigure(logbackXml);
        } catch (JoranException e) {
            System.err.println("Logback reload with appender " + appender + " failed: " + e.getMessage());
        }
    }
}
