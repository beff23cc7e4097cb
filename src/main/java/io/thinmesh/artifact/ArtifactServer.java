package io.thinmesh.artifact;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.thinmesh.error.IntegrityException;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Serves an {@link ArtifactStore} over HTTP so that workers on other hosts can
 * share one store.
 *
 * <pre>
 * PUT  /artifacts          raw body  -&gt; 200 {"hash": "...", "size": n}
 * GET  /artifacts/{hash}             -&gt; 200 raw bytes | 404
 * HEAD /artifacts/{hash}             -&gt; 200 | 404
 * </pre>
 * A malformed hash is answered with 400.
 */
public final class ArtifactServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ArtifactServer.class);
    private static final String PREFIX = "/artifacts";

    private final ArtifactStore store;
    private final HttpServer server;
    private final ExecutorService executor;

    public ArtifactServer(ArtifactStore store, String host, int port, int threads) throws IOException {
        this.store = store;
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads));
        server.createContext(PREFIX, this::handle);
        server.setExecutor(executor);
    }

    public ArtifactServer start() {
        server.start();
        log.info("Artifact server listening on http://{}:{}{}", server.getAddress().getHostString(), port(), PREFIX);
        return this;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public String baseUrl() {
        return "http://" + server.getAddress().getHostString() + ":" + port();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            String method = exchange.getRequestMethod();
            String path = exchange.getRequestURI().getPath();
            String rest = path.length() > PREFIX.length() ? path.substring(PREFIX.length() + 1) : "";
            if (rest.isEmpty()) {
                if ("PUT".equals(method) || "POST".equals(method)) {
                    handlePut(exchange);
                } else {
                    sendStatus(exchange, 405);
                }
                return;
            }
            if (!Hashing.isSha256Hex(rest)) {
                writeJson(exchange, Map.of("error", "invalid artifact hash"), 400);
                return;
            }
            switch (method) {
                case "GET" -> handleGet(exchange, rest);
                case "HEAD" -> handleHead(exchange, rest);
                default -> sendStatus(exchange, 405);
            }
        } catch (IntegrityException e) {
            log.error("Integrity failure serving {}: {}", exchange.getRequestURI(), e.getMessage());
            writeJson(exchange, Map.of("error", e.getMessage()), 500);
        } catch (RuntimeException e) {
            log.warn("Artifact request {} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
            writeJson(exchange, Map.of("error", String.valueOf(e.getMessage())), 503);
        } finally {
            exchange.close();
        }
    }

    private void handlePut(HttpExchange exchange) throws IOException {
        byte[] body;
        try (InputStream in = exchange.getRequestBody()) {
            body = in.readAllBytes();
        }
        String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
        ArtifactRef ref = store.put(body, contentType);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("hash", ref.hash());
        out.put("size", ref.size());
        writeJson(exchange, out, 200);
    }

    private void handleGet(HttpExchange exchange, String hash) throws IOException {
        Optional<byte[]> bytes = store.get(hash);
        if (bytes.isEmpty()) {
            writeJson(exchange, Map.of("error", "artifact not found"), 404);
            return;
        }
        String contentType = store.stat(hash).map(ArtifactRef::contentType).orElse(null);
        exchange.getResponseHeaders().set("Content-Type",
                contentType == null ? "application/octet-stream" : contentType);
        exchange.sendResponseHeaders(200, bytes.get().length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes.get());
        }
    }

    private void handleHead(HttpExchange exchange, String hash) throws IOException {
        Optional<ArtifactRef> ref = store.stat(hash);
        if (ref.isEmpty()) {
            sendStatus(exchange, 404);
            return;
        }
        exchange.getResponseHeaders().set("X-Artifact-Size", Long.toString(ref.get().size()));
        if (ref.get().contentType() != null) {
            exchange.getResponseHeaders().set("X-Artifact-Content-Type", ref.get().contentType());
        }
        sendStatus(exchange, 200);
    }

    private static void sendStatus(HttpExchange exchange, int status) throws IOException {
        exchange.sendResponseHeaders(status, -1);
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }
}
