package fr.lapetina.ollama.cluster.infrastructure.config;

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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, then classpath
 * - Falling back to a single local server when no file exists
 * - Validation of the server list
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String DEFAULT_SERVER_NAME = "local";
    static final String DEFAULT_SERVER_URL = "http://localhost:11434";

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ClusterConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath, or returns the default
     * configuration if neither exists.
     *
     * @return The loaded, validated configuration
     * @throws ConfigurationException if a file exists but cannot be read or is invalid
     */
    public ClusterConfig load() {
        ClusterConfig config = loadFromPath();
        validate(config);
        log.info("Loaded {} Ollama servers from config", config.getServers().size());
        return config;
    }

    private ClusterConfig loadFromPath() {
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

        log.warn("Config file {} not found, using default config with local server", configPath);
        return createDefault();
    }

    private ClusterConfig loadFromFile(Path path) {
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
    public ClusterConfig loadFromStream(InputStream inputStream) {
        ClusterConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private ClusterConfig parse(InputStream is, String source) {
        try {
            ClusterConfig config = yaml.load(is);
            return config != null ? config : new ClusterConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private void validate(ClusterConfig config) {
        if (config.getServers() == null || config.getServers().isEmpty()) {
            log.warn("No servers configured, adding default local server");
            config.setServers(new ArrayList<>(List.of(defaultServer())));
        }

        Set<String> names = new HashSet<>();
        for (ClusterConfig.ServerConfig server : config.getServers()) {
            if (server.getName() == null || server.getName().isBlank()) {
                throw new ConfigurationException("Server name is required: url=" + server.getUrl());
            }
            if (server.getUrl() == null || server.getUrl().isBlank()) {
                throw new ConfigurationException("Server url is required: name=" + server.getName());
            }
            if (!names.add(server.getName())) {
                throw new ConfigurationException("Duplicate server name: " + server.getName());
            }
            if (server.getMaxErrors() < 1) {
                throw new ConfigurationException("maxErrors must be at least 1: name=" + server.getName());
            }
        }

        if (config.getRetry().getMaxRetries() < 1) {
            throw new ConfigurationException("retry.maxRetries must be at least 1");
        }
        int bufferSize = config.getExtraction().getCompletionBufferSize();
        if (Integer.bitCount(bufferSize) != 1) {
            throw new ConfigurationException("extraction.completionBufferSize must be a power of 2: " + bufferSize);
        }
        if (config.getExtraction().getJobRetentionMs() < 0) {
            throw new ConfigurationException("extraction.jobRetentionMs must not be negative");
        }
    }

    /**
     * Creates a default configuration with a single local server.
     */
    public static ClusterConfig createDefault() {
        ClusterConfig config = new ClusterConfig();
        config.getServers().add(defaultServer());
        return config;
    }

    private static ClusterConfig.ServerConfig defaultServer() {
        ClusterConfig.ServerConfig server = new ClusterConfig.ServerConfig();
        server.setName(DEFAULT_SERVER_NAME);
        server.setUrl(DEFAULT_SERVER_URL);
        return server;
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
