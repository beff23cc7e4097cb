package io.thinmesh.artifact;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.thinmesh.error.IntegrityException;
import io.thinmesh.error.TransientStorageException;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;
import io.thinmesh.util.Retries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;

/**
 * Artifact store on a local or shared filesystem. Blobs live at
 * {@code <root>/ab/cd/<hash>} with an optional {@code <hash>.meta.json}
 * sidecar holding the content-type hint.
 */
public final class FileArtifactStore implements ArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(FileArtifactStore.class);
    private static final String META_SUFFIX = ".meta.json";

    private final Path root;
    private final Retries.Policy retryPolicy;

    public FileArtifactStore(Path root) {
        this(root, Retries.Policy.DEFAULT);
    }

    public FileArtifactStore(Path root, Retries.Policy retryPolicy) {
        this.root = root;
        this.retryPolicy = retryPolicy;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new TransientStorageException("Failed to create artifact directory: " + root, e);
        }
    }

    public Path root() {
        return root;
    }

    @Override
    public ArtifactRef put(byte[] bytes, String contentType) {
        if (bytes == null) {
            throw new IllegalArgumentException("artifact bytes must not be null");
        }
        String hash = Hashing.sha256Hex(bytes);
        return Retries.call("artifact put " + hash, retryPolicy, () -> write(hash, bytes, contentType));
    }

    private ArtifactRef write(String hash, byte[] bytes, String contentType) {
        Path target = blobPath(hash);
        try {
            if (Files.exists(target)) {
                if (hashOf(target).equals(hash)) {
                    return readRef(hash, target);
                }
                log.warn("Artifact {} on disk is corrupted; rewriting it", hash);
            }
            Path shard = target.getParent();
            Files.createDirectories(shard);
            long now = Instant.now().toEpochMilli();
            if (contentType != null && !contentType.isBlank()) {
                ObjectNode meta = Jsons.compactMapper().createObjectNode();
                meta.put("content_type", contentType);
                meta.put("created_at_ms", now);
                moveIntoPlace(shard, metaPath(hash), Jsons.toCompactJson(meta).getBytes(StandardCharsets.UTF_8));
            }
            moveIntoPlace(shard, target, bytes);
            String written = hashOf(target);
            if (!written.equals(hash)) {
                throw new IntegrityException("artifact " + hash + " hashes to " + written + " after write");
            }
            log.debug("Stored artifact {} ({} bytes)", hash, bytes.length);
            return new ArtifactRef(hash, bytes.length, blankToNull(contentType), now);
        } catch (IOException e) {
            throw new TransientStorageException("Failed to write artifact " + hash, e);
        }
    }

    private void moveIntoPlace(Path dir, Path target, byte[] bytes) throws IOException {
        Path tmp = Files.createTempFile(dir, ".tmp-", ".part");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public Optional<byte[]> get(String hash) {
        Hashing.requireSha256Hex(hash);
        Path path = blobPath(hash);
        return Retries.call("artifact get " + hash, retryPolicy, () -> {
            try {
                byte[] bytes = Files.readAllBytes(path);
                String actual = Hashing.sha256Hex(bytes);
                if (!actual.equals(hash)) {
                    throw new IntegrityException("artifact " + hash + " is corrupted, content hashes to " + actual);
                }
                return Optional.of(bytes);
            } catch (NoSuchFileException e) {
                return Optional.empty();
            } catch (IOException e) {
                throw new TransientStorageException("Failed to read artifact " + hash, e);
            }
        });
    }

    @Override
    public boolean exists(String hash) {
        Hashing.requireSha256Hex(hash);
        return Files.isRegularFile(blobPath(hash));
    }

    @Override
    public Optional<ArtifactRef> stat(String hash) {
        Hashing.requireSha256Hex(hash);
        Path path = blobPath(hash);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(readRef(hash, path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TransientStorageException("Failed to stat artifact " + hash, e);
        }
    }

    private static String hashOf(Path blob) throws IOException {
        return Hashing.sha256Hex(Files.readAllBytes(blob));
    }

    private ArtifactRef readRef(String hash, Path blob) throws IOException {
        long size = Files.size(blob);
        long created = Files.getLastModifiedTime(blob).toMillis();
        String contentType = null;
        Path meta = metaPath(hash);
        if (Files.isRegularFile(meta)) {
            JsonNode node = Jsons.compactMapper().readTree(Files.readString(meta));
            contentType = blankToNull(node.path("content_type").asText(null));
            created = node.path("created_at_ms").asLong(created);
        }
        return new ArtifactRef(hash, size, contentType, created);
    }

    Path blobPath(String hash) {
        return root.resolve(hash.substring(0, 2)).resolve(hash.substring(2, 4)).resolve(hash);
    }

    private Path metaPath(String hash) {
        return blobPath(hash).resolveSibling(hash + META_SUFFIX);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
