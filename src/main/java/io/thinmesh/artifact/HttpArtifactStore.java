package io.thinmesh.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import io.thinmesh.error.IntegrityException;
import io.thinmesh.error.TransientStorageException;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;
import io.thinmesh.util.Retries;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Client of {@link ArtifactServer}. The hash returned by the server and the
 * bytes it serves are both checked against a locally computed digest.
 */
public final class HttpArtifactStore implements ArtifactStore {
    private final String baseUrl;
    private final HttpClient client;
    private final Duration requestTimeout;
    private final Retries.Policy retryPolicy;

    public HttpArtifactStore(String baseUrl) {
        this(baseUrl, Duration.ofSeconds(30), Retries.Policy.DEFAULT);
    }

    public HttpArtifactStore(String baseUrl, Duration requestTimeout, Retries.Policy retryPolicy) {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.baseUrl = trimmed;
        this.requestTimeout = requestTimeout;
        this.retryPolicy = retryPolicy;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @Override
    public ArtifactRef put(byte[] bytes, String contentType) {
        String expected = Hashing.sha256Hex(bytes);
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(baseUrl + "/artifacts"))
                .timeout(requestTimeout)
                .PUT(HttpRequest.BodyPublishers.ofByteArray(bytes));
        if (contentType != null && !contentType.isBlank()) {
            request.header("Content-Type", contentType);
        }
        HttpRequest built = request.build();
        return Retries.call("artifact put " + expected, retryPolicy, () -> {
            HttpResponse<String> response = send(built, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw failure("put", expected, response.statusCode());
            }
            String returned;
            try {
                JsonNode body = Jsons.compactMapper().readTree(response.body());
                returned = body.path("hash").asText("");
            } catch (IOException e) {
                throw new TransientStorageException("Unreadable put response for artifact " + expected, e);
            }
            if (!expected.equals(returned)) {
                throw new IntegrityException("artifact server stored " + expected + " as " + returned);
            }
            return new ArtifactRef(expected, bytes.length, contentType, Instant.now().toEpochMilli());
        });
    }

    @Override
    public Optional<byte[]> get(String hash) {
        Hashing.requireSha256Hex(hash);
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/artifacts/" + hash))
                .timeout(requestTimeout)
                .GET()
                .build();
        return Retries.call("artifact get " + hash, retryPolicy, () -> {
            HttpResponse<byte[]> response = send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == 404) {
                return Optional.empty();
            }
            if (response.statusCode() != 200) {
                throw failure("get", hash, response.statusCode());
            }
            byte[] body = response.body();
            String actual = Hashing.sha256Hex(body);
            if (!actual.equals(hash)) {
                throw new IntegrityException("artifact " + hash + " downloaded with hash " + actual);
            }
            return Optional.of(body);
        });
    }

    @Override
    public boolean exists(String hash) {
        Hashing.requireSha256Hex(hash);
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/artifacts/" + hash))
                .timeout(requestTimeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        return Retries.call("artifact exists " + hash, retryPolicy, () -> {
            HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() == 200) {
                return true;
            }
            if (response.statusCode() == 404) {
                return false;
            }
            throw failure("exists", hash, response.statusCode());
        });
    }

    @Override
    public Optional<ArtifactRef> stat(String hash) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/artifacts/" + Hashing.requireSha256Hex(hash)))
                .timeout(requestTimeout)
                .method("HEAD", HttpRequest.BodyPublishers.noBody())
                .build();
        return Retries.call("artifact stat " + hash, retryPolicy, () -> {
            HttpResponse<Void> response = send(request, HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() == 404) {
                return Optional.empty();
            }
            if (response.statusCode() != 200) {
                throw failure("stat", hash, response.statusCode());
            }
            long size = response.headers().firstValueAsLong("X-Artifact-Size").orElse(-1L);
            String contentType = response.headers().firstValue("X-Artifact-Content-Type").orElse(null);
            return Optional.of(new ArtifactRef(hash, size, contentType, 0L));
        });
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return client.send(request, handler);
        } catch (IOException e) {
            throw new TransientStorageException("Artifact server unreachable at " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStorageException("Interrupted calling artifact server", e);
        }
    }

    private static RuntimeException failure(String op, String hash, int status) {
        if (status == 400) {
            return new IllegalArgumentException("artifact server rejected " + op + " of " + hash);
        }
        return new TransientStorageException("artifact " + op + " of " + hash + " returned HTTP " + status);
    }
}
