package com.msgrelay.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Typed configuration of both relay units. Defaults apply to anything missing from
 * {@code relay.yml}; see {@link RelayConfigLoader} for the environment overrides.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RelayConfig {

    private Http http = new Http();
    private Socket socket = new Socket();
    private Storage storage = new Storage();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Http {
        private String host = "0.0.0.0";
        private int port = 3000;
        /** Directory holding index.html, message.html, error.html and the static/ folder. */
        private String webRoot = "web";
        /** Threads the request handlers run on, off the Netty I/O loop. */
        private int handlerThreads = 16;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Socket {
        private String host = "127.0.0.1";
        private int port = 5000;
        /** Size of the single receive each connection gets. */
        private int bufferSize = 1024;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Storage {
        private String uri = "mongodb://localhost:27017";
        private String database = "messages_db";
        private String collection = "messages";
        private long healthCheckTimeoutMillis = 5000;
    }
}
