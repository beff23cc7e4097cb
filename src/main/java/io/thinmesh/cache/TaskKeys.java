package io.thinmesh.cache;

import io.thinmesh.util.Hashing;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;

/**
 * The single task identity function. The key is SHA-256 over a framing in
 * which every field is preceded by its 8-byte big-endian length, so no two
 * different (type, inputs, params) triples frame to the same bytes.
 */
public final class TaskKeys {
    private static final byte[] DOMAIN = "thinmesh.task.v1".getBytes(StandardCharsets.UTF_8);

    private TaskKeys() {
    }

    public static String derive(String taskType, List<String> inputHashes, byte[] params) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("task type must not be blank");
        }
        MessageDigest digest = Hashing.sha256();
        frame(digest, DOMAIN);
        frame(digest, taskType.getBytes(StandardCharsets.UTF_8));
        List<String> inputs = inputHashes == null ? List.of() : inputHashes;
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(inputs.size()).array());
        for (String hash : inputs) {
            frame(digest, Hashing.requireSha256Hex(hash).getBytes(StandardCharsets.US_ASCII));
        }
        frame(digest, params == null ? new byte[0] : params);
        return HexFormat.of().formatHex(digest.digest());
    }

    private static void frame(MessageDigest digest, byte[] field) {
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(field.length).array());
        digest.update(field);
    }
}
