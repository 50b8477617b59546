package fr.lapetina.ultra.comparison.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from the file system, then the classpath
 * - Loading from an arbitrary stream
 * - Validation of the loaded values
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ComparisonConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ComparisonConfig load() {
        return validate(loadFromPath());
    }

    private ComparisonConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ComparisonConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public ComparisonConfig loadFromStream(InputStream inputStream) {
        return validate(parse(inputStream, "stream"));
    }

    private ComparisonConfig parse(InputStream inputStream, String source) {
        try {
            ComparisonConfig config = yaml.load(inputStream);
            // An empty document yields null
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in: " + source, e);
        }
    }

    /**
     * Checks the values the pipeline depends on.
     *
     * @throws ConfigurationException on the first invalid value
     */
    public static ComparisonConfig validate(ComparisonConfig config) {
        if (config.getServer() == null || config.getClustering() == null
                || config.getSegments() == null || config.getMetrics() == null) {
            throw new ConfigurationException("Configuration sections must not be null");
        }
        if (!(config.getClustering().getMileVarianceThreshold() > 0.0)) {
            throw new ConfigurationException("clustering.mileVarianceThreshold must be positive, got "
                    + config.getClustering().getMileVarianceThreshold());
        }
        if (config.getSegments().getCriticalSegmentLimit() < 1) {
            throw new ConfigurationException("segments.criticalSegmentLimit must be at least 1, got "
                    + config.getSegments().getCriticalSegmentLimit());
        }
        if (config.getServer().getWorkerThreads() < 1) {
            throw new ConfigurationException("server.workerThreads must be at least 1, got "
                    + config.getServer().getWorkerThreads());
        }
        return config;
    }

    /**
     * Creates a default configuration.
     */
    public static ComparisonConfig createDefault() {
        return new ComparisonConfig();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
