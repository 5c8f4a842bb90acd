package org.ecosocial.cli.config;

import java.io.File;
import java.util.Optional;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Locates and composes the HOCON configuration for the command line.
 * <p>
 * The user file is looked up in this order: the {@code --config} option, the
 * {@code config.file} system property, {@code config/ecosocial.conf} below the working
 * directory. The first hit wins; if none exists the classpath defaults are used alone.
 * <p>
 * Layers, highest precedence first: system properties, environment variables, the user file,
 * {@code reference.conf}. Substitutions are resolved once all layers are in place, so an
 * override also reaches every value of {@code reference.conf} that refers to it.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "ecosocial.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a message reported while locating the configuration.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages. The logging system is not configured yet when these are
     * produced, so the caller decides where they go.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    private record Source(File file, String origin) {}

    /**
     * Loads the configuration.
     *
     * @param explicitConfigFile the file given with {@code --config}, or {@code null}
     * @param handler receives one message naming the chosen source
     * @return the resolved configuration
     * @throws IllegalArgumentException if a file named by {@code --config} or
     *                                  {@code -Dconfig.file} does not exist
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        final Optional<Source> source = locate(explicitConfigFile);
        if (source.isEmpty()) {
            handler.log(MessageLevel.WARN, "No '" + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                    + "' found in current directory. Using default configuration from classpath.");
            return loadDefaults();
        }
        final File file = source.get().file();
        handler.log(MessageLevel.INFO, "Using configuration file " + source.get().origin() + ": " + file.getAbsolutePath());
        return loadFromFile(file);
    }

    private static Optional<Source> locate(final File explicitConfigFile) {
        if (explicitConfigFile != null) {
            return Optional.of(requireExisting(new Source(explicitConfigFile, "specified via --config"),
                    "Configuration file not found: "));
        }
        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return Optional.of(requireExisting(new Source(new File(property).getAbsoluteFile(), "specified via -Dconfig.file"),
                    "Configuration file specified via -Dconfig.file not found: "));
        }
        final File inWorkingDir = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        return inWorkingDir.exists()
                ? Optional.of(new Source(inWorkingDir, "found in current directory"))
                : Optional.empty();
    }

    private static Source requireExisting(final Source source, final String error) {
        if (!source.file().exists()) {
            throw new IllegalArgumentException(error + source.file().getAbsolutePath());
        }
        return source;
    }

    static Config loadFromFile(final File configFile) {
        return overrides()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return overrides()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }
}
