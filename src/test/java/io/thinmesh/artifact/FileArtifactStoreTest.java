package io.thinmesh.artifact;

import io.thinmesh.error.IntegrityException;
import io.thinmesh.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

final class FileArtifactStoreTest {

    @Test
    void putIsIdempotentAndContentAddressed() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-artifacts-");
        try {
            FileArtifactStore store = new FileArtifactStore(root);
            byte[] bytes = "the quick brown fox".getBytes(StandardCharsets.UTF_8);

            ArtifactRef first = store.put(bytes, "text/plain");
            ArtifactRef second = store.put(bytes.clone());

            Assertions.assertEquals(Hashing.sha256Hex(bytes), first.hash());
            Assertions.assertEquals(first.hash(), second.hash());
            Assertions.assertEquals(bytes.length, first.size());
            Assertions.assertEquals("text/plain", second.contentType());
            Assertions.assertArrayEquals(bytes, store.get(first.hash()).orElseThrow());
            Assertions.assertTrue(store.exists(first.hash()));

            try (Stream<Path> files = Files.walk(root)) {
                long blobs = files.filter(Files::isRegularFile)
                        .filter(p -> p.getFileName().toString().equals(first.hash()))
                        .count();
                Assertions.assertEquals(1L, blobs);
            }
            Path expected = root.resolve(first.hash().substring(0, 2)).resolve(first.hash().substring(2, 4)).resolve(first.hash());
            Assertions.assertTrue(Files.isRegularFile(expected));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingArtifactIsEmptyNotError() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-artifacts-missing-");
        try {
            FileArtifactStore store = new FileArtifactStore(root);
            String hash = Hashing.sha256Hex("never stored");

            Assertions.assertEquals(Optional.empty(), store.get(hash));
            Assertions.assertFalse(store.exists(hash));
            Assertions.assertTrue(store.stat(hash).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void corruptedBlobFailsIntegrityCheck() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-artifacts-corrupt-");
        try {
            FileArtifactStore store = new FileArtifactStore(root);
            ArtifactRef ref = store.put("original".getBytes(StandardCharsets.UTF_8));
            Files.writeString(store.blobPath(ref.hash()), "tampered");

            Assertions.assertThrows(IntegrityException.class, () -> store.get(ref.hash()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void putRepairsACorruptedBlobForTheSameContent() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-artifacts-repair-");
        try {
            FileArtifactStore store = new FileArtifactStore(root);
            byte[] bytes = "original".getBytes(StandardCharsets.UTF_8);
            ArtifactRef ref = store.put(bytes);
            Files.writeString(store.blobPath(ref.hash()), "tampered");

            ArtifactRef again = store.put(bytes);

            Assertions.assertEquals(ref.hash(), again.hash());
            Assertions.assertEquals(bytes.length, again.size());
            Assertions.assertArrayEquals(bytes, store.get(ref.hash()).orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedHashIsRejectedBeforeFilesystemUse() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-artifacts-hash-");
        try {
            FileArtifactStore store = new FileArtifactStore(root);

            Assertions.assertThrows(IllegalArgumentException.class, () -> store.get("../../etc/passwd"));
            Assertions.assertThrows(IllegalArgumentException.class, () -> store.exists("ABCDEF"));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> store.get("A".repeat(64)));
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
