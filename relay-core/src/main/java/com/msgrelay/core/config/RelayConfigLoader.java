package com.msgrelay.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Loads {@link RelayConfig} from YAML, then applies environment overrides and validates.
 *
 * <pre>
 * HTTP_HOST, HTTP_PORT, WEB_ROOT, SOCKET_HOST, SOCKET_PORT,
 * MONGO_URI, DB_NAME, COLLECTION_NAME
 * </pre>
 */
@Slf4j
public final class RelayConfigLoader {

    public static final String DEFAULT_RESOURCE = "relay.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private RelayConfigLoader() {
    }

    /**
     * Reads {@code relay.yml} from the classpath, falling back to built-in defaults when absent.
     */
    public static RelayConfig loadDefault(Map<String, String> env) {
        RelayConfig config;
        try (InputStream in = RelayConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
                config = new RelayConfig();
            } else {
                config = read(in, DEFAULT_RESOURCE);
            }
        } catch (IOException e) {
            throw new ConfigException("Failed to read classpath resource " + DEFAULT_RESOURCE, e);
        }
        return finish(config, env);
    }

    public static RelayConfig load(Path file, Map<String, String> env) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Configuration file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return finish(read(in, file.toString()), env);
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration file " + file, e);
        }
    }

    static RelayConfig read(InputStream in, String source) {
        try {
            JsonNode tree = YAML_MAPPER.readTree(in);
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                return new RelayConfig();
            }
            return YAML_MAPPER.treeToValue(tree, RelayConfig.class);
        } catch (IOException e) {
            throw new ConfigException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    private static RelayConfig finish(RelayConfig config, Map<String, String> env) {
        applyOverrides(config, env);
        validate(config);
        log.info("Configuration loaded: http={}:{}, socket={}:{}, database={}, collection={}",
                config.getHttp().getHost(), config.getHttp().getPort(),
                config.getSocket().getHost(), config.getSocket().getPort(),
                config.getStorage().getDatabase(), config.getStorage().getCollection());
        return config;
    }

    static void applyOverrides(RelayConfig config, Map<String, String> env) {
        RelayConfig.Http http = config.getHttp();
        RelayConfig.Socket socket = config.getSocket();
        RelayConfig.Storage storage = config.getStorage();

        override(env, "HTTP_HOST", http::setHost);
        override(env, "HTTP_PORT", value -> http.setPort(parsePort("HTTP_PORT", value)));
        override(env, "WEB_ROOT", http::setWebRoot);
        override(env, "SOCKET_HOST", socket::setHost);
        override(env, "SOCKET_PORT", value -> socket.setPort(parsePort("SOCKET_PORT", value)));
        override(env, "MONGO_URI", storage::setUri);
        override(env, "DB_NAME", storage::setDatabase);
        override(env, "COLLECTION_NAME", storage::setCollection);
    }

    static void validate(RelayConfig config) {
        RelayConfig.Http http = config.getHttp();
        RelayConfig.Socket socket = config.getSocket();
        RelayConfig.Storage storage = config.getStorage();

        requireText("http.host", http.getHost());
        requirePort("http.port", http.getPort());
        requireText("http.webRoot", http.getWebRoot());
        requirePositive("http.handlerThreads", http.getHandlerThreads());
        requireText("socket.host", socket.getHost());
        requirePort("socket.port", socket.getPort());
        requirePositive("socket.bufferSize", socket.getBufferSize());
        requireText("storage.uri", storage.getUri());
        requireText("storage.database", storage.getDatabase());
        requireText("storage.collection", storage.getCollection());
        requirePositive("storage.healthCheckTimeoutMillis", storage.getHealthCheckTimeoutMillis());
    }

    private static void override(Map<String, String> env, String name, Consumer<String> setter) {
        String value = env.get(name);
        if (value != null && !value.isBlank()) {
            setter.accept(value.trim());
        }
    }

    private static int parsePort(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(name + " must be a number, got '" + value + "'", e);
        }
    }

    private static void requireText(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException(key + " must not be blank");
        }
    }

    private static void requirePort(String key, int port) {
        if (port < 0 || port > 65535) {
            throw new ConfigException(key + " must be between 0 and 65535, got " + port);
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new ConfigException(key + " must be greater than 0, got " + value);
        }
    }
}
