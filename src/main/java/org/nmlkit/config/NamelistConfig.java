package org.nmlkit.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.nmlkit.model.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads the library configuration and derives read and write options from it.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *     <li>environment variables</li>
 *     <li>JVM system properties ({@code -Dnmlkit.write.column-width=100})</li>
 *     <li>a configuration file, {@code nmlkit.conf} in the working directory by default</li>
 *     <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class NamelistConfig {

    private static final Logger log = LoggerFactory.getLogger(NamelistConfig.class);
    private static final String CONFIG_FILE_NAME = "nmlkit.conf";
    private static final String ROOT_PATH = "nmlkit";

    private final Config config;

    private NamelistConfig(Config config) {
        this.config = config;
    }

    /**
     * Loads the configuration with {@code nmlkit.conf} from the working directory.
     * @return The resolved configuration.
     */
    public static NamelistConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with the given file in place of {@code nmlkit.conf}.
     * @param configFile The configuration file; a missing file is skipped.
     * @return The resolved configuration.
     */
    public static NamelistConfig load(Path configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config propertiesConfig = ConfigFactory.systemProperties();

        final File file = configFile.toFile();
        final Config fileConfig;
        if (file.exists() && !file.isDirectory()) {
            log.debug("Loading configuration from file: {}", file.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(file);
        } else {
            log.debug("Configuration file '{}' not found, using defaults", file.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combined = envConfig
                .withFallback(propertiesConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig);
        return new NamelistConfig(combined.resolve());
    }

    /**
     * Wraps an already loaded configuration, for example one built in a test.
     * @param config The configuration; missing keys fall back to {@code reference.conf}.
     * @return The configuration.
     */
    public static NamelistConfig of(Config config) {
        return new NamelistConfig(config.withFallback(ConfigFactory.parseResources("reference.conf")).resolve());
    }

    public Config config() {
        return config;
    }

    public ReadOptions readOptions() {
        return ReadOptions.fromConfig(section("read"));
    }

    public WriteOptions writeOptions() {
        return WriteOptions.fromConfig(section("write"));
    }

    /**
     * Applies the {@code nmlkit.logging} block to Logback.
     */
    public void applyLogging() {
        LoggingConfigurator.configure(section("logging"));
    }

    private Config section(String name) {
        String path = ROOT_PATH + "." + name;
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }
}
