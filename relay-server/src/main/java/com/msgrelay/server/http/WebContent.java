package com.msgrelay.server.http;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the pages and static assets under the web root.
 * Any lookup that fails, for whatever reason, is reported as absent.
 */
@Slf4j
public class WebContent {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private static final String STATIC_DIR = "static";

    private static final Map<String, String> CONTENT_TYPES = Map.ofEntries(
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("css", "text/css"),
            Map.entry("js", "text/javascript"),
            Map.entry("mjs", "text/javascript"),
            Map.entry("json", "application/json"),
            Map.entry("txt", "text/plain"),
            Map.entry("xml", "application/xml"),
            Map.entry("png", "image/png"),
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("gif", "image/gif"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("ico", "image/vnd.microsoft.icon"),
            Map.entry("webp", "image/webp"),
            Map.entry("woff", "font/woff"),
            Map.entry("woff2", "font/woff2"),
            Map.entry("ttf", "font/ttf"),
            Map.entry("pdf", "application/pdf"));

    private final Path webRoot;
    private final Path staticRoot;

    public WebContent(Path webRoot) {
        this.webRoot = webRoot.toAbsolutePath().normalize();
        this.staticRoot = this.webRoot.resolve(STATIC_DIR);
    }

    /**
     * Reads a top-level page such as {@code index.html}.
     */
    public Optional<byte[]> readPage(String name) {
        return read(webRoot.resolve(name));
    }

    /**
     * Reads an asset relative to the static root. Paths that escape the root are absent.
     */
    public Optional<byte[]> readStatic(String relativePath) {
        Path file;
        try {
            file = staticRoot.resolve(relativePath).normalize();
        } catch (InvalidPathException e) {
            log.debug("Rejected static path {}: {}", relativePath, e.getMessage());
            return Optional.empty();
        }
        if (!file.startsWith(staticRoot)) {
            log.warn("Rejected static path outside of {}: {}", staticRoot, relativePath);
            return Optional.empty();
        }
        return read(file);
    }

    /**
     * Guesses a content type from the file extension, {@value #DEFAULT_CONTENT_TYPE} if unknown.
     */
    public static String contentTypeOf(String path) {
        int slash = path.lastIndexOf('/');
        int dot = path.lastIndexOf('.');
        if (dot > slash && dot < path.length() - 1) {
            String known = CONTENT_TYPES.get(path.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (known != null) {
                return known;
            }
        }
        String guessed = URLConnection.guessContentTypeFromName(path);
        return guessed != null ? guessed : DEFAULT_CONTENT_TYPE;
    }

    private Optional<byte[]> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
