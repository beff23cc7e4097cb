package io.thinmesh.artifact;

import java.util.Optional;

/**
 * Content-addressed blob store. A blob's identity is the lowercase hex SHA-256
 * of its bytes, so {@code put} of equal bytes is a no-op returning the same
 * hash. Blobs are never mutated or deleted through this interface.
 *
 * <p>Backend unavailability surfaces as
 * {@link io.thinmesh.error.TransientStorageException} after local retries;
 * bytes that do not hash to their name surface as
 * {@link io.thinmesh.error.IntegrityException}.
 */
public interface ArtifactStore extends AutoCloseable {

    default ArtifactRef put(byte[] bytes) {
        return put(bytes, null);
    }

    /**
     * @param contentType advisory hint only, stored alongside and never parsed
     */
    ArtifactRef put(byte[] bytes, String contentType);

    /**
     * @return the bytes, or empty when no artifact has this hash
     */
    Optional<byte[]> get(String hash);

    boolean exists(String hash);

    Optional<ArtifactRef> stat(String hash);

    @Override
    default void close() {
    }
}
