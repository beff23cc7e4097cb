package io.thinmesh.artifact;

import io.thinmesh.util.Hashing;
import io.thinmesh.util.Retries;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

final class ArtifactServerTest {

    @Test
    void httpClientRoundTripsThroughServer() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-artifact-server-");
        try (ArtifactServer server = new ArtifactServer(new FileArtifactStore(root), "127.0.0.1", 0, 2).start()) {
            HttpArtifactStore client = new HttpArtifactStore(server.baseUrl(), Duration.ofSeconds(5),
                    new Retries.Policy(1, 10L, 10L));
            byte[] bytes = "shared across machines".getBytes(StandardCharsets.UTF_8);

            ArtifactRef ref = client.put(bytes, "text/plain");

            Assertions.assertEquals(Hashing.sha256Hex(bytes), ref.hash());
            Assertions.assertTrue(client.exists(ref.hash()));
            Assertions.assertArrayEquals(bytes, client.get(ref.hash()).orElseThrow());
            Assertions.assertEquals(ref.hash(), client.put(bytes).hash());
            Assertions.assertEquals("text/plain", client.stat(ref.hash()).orElseThrow().contentType());

            String absent = Hashing.sha256Hex("absent");
            Assertions.assertFalse(client.exists(absent));
            Assertions.assertTrue(client.get(absent).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidHashIsBadRequest() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-artifact-server-400-");
        try (ArtifactServer server = new ArtifactServer(new FileArtifactStore(root), "127.0.0.1", 0, 1).start()) {
            HttpClient http = HttpClient.newHttpClient();
            HttpResponse<String> bad = http.send(
                    HttpRequest.newBuilder(URI.create(server.baseUrl() + "/artifacts/not-a-hash")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> missing = http.send(
                    HttpRequest.newBuilder(URI.create(server.baseUrl() + "/artifacts/" + "0".repeat(64))).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            Assertions.assertEquals(400, bad.statusCode());
            Assertions.assertEquals(404, missing.statusCode());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
