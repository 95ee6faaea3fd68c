package org.resilience.cli.config;

import java.io.File;

import org.resilience.runtime.ModelParameters;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Finds and layers the HOCON configuration of a run, and turns its blocks into
 * {@link ModelParameters} and {@link RunSettings}.
 * <p>
 * Layers, highest first: JVM system properties, environment variables, one configuration
 * file, {@code reference.conf}. The file is the first of:
 * <ol>
 *   <li>the file given with {@code --config},</li>
 *   <li>the file named by {@code -Dconfig.file},</li>
 *   <li>{@code config/resilience.conf} under the working directory.</li>
 * </ol>
 * Without any of them only the classpath defaults apply.
 */
public final class ConfigLoader {

    public static final String SIMULATION_PATH = "resilience.simulation";

    static final File WORKING_DIR_FILE = new File("config", "resilience.conf");

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives a line about which configuration source was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Picks the configuration file and loads the layered configuration.
     *
     * @param explicitFile The {@code --config} file, or {@code null}.
     * @param handler Told which source was picked.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if a named file does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved.
     */
    public static Config resolve(File explicitFile, ConfigMessageHandler handler) {
        return load(locate(explicitFile, handler));
    }

    private static File locate(File explicitFile, ConfigMessageHandler handler) {
        if (explicitFile != null) {
            return requireExisting(explicitFile, "--config", handler);
        }
        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return requireExisting(new File(property), "-Dconfig.file", handler);
        }
        if (WORKING_DIR_FILE.isFile()) {
            handler.log(MessageLevel.INFO, "Loading " + WORKING_DIR_FILE.getAbsolutePath());
            return WORKING_DIR_FILE;
        }
        handler.log(MessageLevel.WARN, "No " + WORKING_DIR_FILE.getPath() + " in the working directory, running on defaults");
        return null;
    }

    private static File requireExisting(File file, String source, ConfigMessageHandler handler) {
        File absolute = file.getAbsoluteFile();
        if (!absolute.isFile()) {
            throw new IllegalArgumentException("Configuration file from " + source + " not found: " + absolute);
        }
        handler.log(MessageLevel.INFO, "Loading " + absolute + " (from " + source + ")");
        return absolute;
    }

    /**
     * Layers system properties and environment over the file (if any) and {@code reference.conf}.
     * Substitutions are resolved after layering so overrides reach every reference.
     *
     * @param file The configuration file, or {@code null} for defaults only.
     */
    static Config load(File file) {
        Config layered = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (file != null) {
            layered = layered.withFallback(ConfigFactory.parseFile(file));
        }
        return layered.withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve();
    }

    /**
     * @param config A resolved configuration.
     * @return The validated model parameters from {@code resilience.model}.
     * @throws IllegalArgumentException if the block is absent or a value is out of range.
     */
    public static ModelParameters modelParameters(Config config) {
        return ModelParameters.fromConfig(requireBlock(config, ModelParameters.CONFIG_PATH));
    }

    /**
     * @param config A resolved configuration.
     * @return The validated run settings from {@code resilience.simulation}.
     * @throws IllegalArgumentException if the block is absent or a value is out of range.
     */
    public static RunSettings runSettings(Config config) {
        return RunSettings.fromConfig(requireBlock(config, SIMULATION_PATH));
    }

    private static Config requireBlock(Config config, String path) {
        if (!config.hasPath(path)) {
            throw new IllegalArgumentException("Configuration has no '" + path + "' block");
        }
        return config.getConfig(path);
    }
}
