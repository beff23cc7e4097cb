package io.thinmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.thinmesh.error.IntegrityException;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash-chained JSON-lines audit trail of run lifecycle events. Each row carries
 * the hash of the previous row, so truncation or edits in the middle of the file
 * are detected by {@link #verify()}.
 *
 * <p>Appends take an exclusive file lock and re-read the chain tail when another
 * process wrote since our last append, so a planner and its workers can share
 * one file.
 */
public final class AuditLogger {
    private static final int TAIL_WINDOW_BYTES = 64 * 1024;

    private final Path auditFile;
    private String previousHash = "";
    private long knownSize = -1L;

    public AuditLogger(Path auditFile) {
        this.auditFile = auditFile;
        try {
            Files.createDirectories(auditFile.getParent());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log directory: " + auditFile.getParent(), e);
        }
    }

    public synchronized void log(AuditEvent event) {
        try (FileChannel channel = FileChannel.open(auditFile,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
             FileLock ignored = channel.lock()) {
            long size = channel.size();
            if (size != knownSize) {
                previousHash = readTailHash(channel, size);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("timestamp", Instant.now().toString());
            row.put("action", event.action());
            row.put("actor", event.actor());
            row.put("resource", event.resource());
            row.put("result", event.result());
            row.put("run_id", event.runId());
            row.put("task_key", event.taskKey());
            row.put("details", event.details());
            row.put("prev_hash", previousHash);
            String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
            row.put("hash", rowHash);
            byte[] line = (Jsons.toCompactJson(row) + "\n").getBytes(StandardCharsets.UTF_8);
            channel.position(size);
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            previousHash = rowHash;
            knownSize = size + line.length;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write audit log " + auditFile, e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path file() {
        return auditFile;
    }

    /**
     * Re-computes every row hash and checks the chain links.
     */
    public IntegrityReport verify() {
        if (!Files.exists(auditFile)) {
            return new IntegrityReport(true, 0, -1, "");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read audit log " + auditFile, e);
        }
        String expectedPrev = "";
        int checked = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = Jsons.mapper().readTree(line);
            } catch (IOException e) {
                return new IntegrityReport(false, checked, i + 1, "unparseable row");
            }
            String prev = node.path("prev_hash").asText("");
            if (!prev.equals(expectedPrev)) {
                return new IntegrityReport(false, checked, i + 1, "prev_hash does not link to the previous row");
            }
            Map<String, Object> row = Jsons.mapper().convertValue(node, Jsons.mapper().getTypeFactory()
                    .constructMapType(LinkedHashMap.class, String.class, Object.class));
            String hash = String.valueOf(row.remove("hash"));
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                return new IntegrityReport(false, checked, i + 1, "row hash mismatch");
            }
            expectedPrev = hash;
            checked++;
        }
        return new IntegrityReport(true, checked, -1, "");
    }

    public List<String> tail(int lines) {
        if (!Files.exists(auditFile) || lines <= 0) {
            return List.of();
        }
        try {
            List<String> all = new ArrayList<>();
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    all.add(line);
                }
            }
            return List.copyOf(all.subList(Math.max(0, all.size() - lines), all.size()));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read audit log " + auditFile, e);
        }
    }

    private String readTailHash(FileChannel channel, long size) throws IOException {
        if (size == 0L) {
            return "";
        }
        long start = Math.max(0L, size - TAIL_WINDOW_BYTES);
        ByteBuffer buffer = ByteBuffer.allocate((int) (size - start));
        channel.position(start);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                break;
            }
        }
        String window = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
        String[] rows = window.split("\n");
        for (int i = rows.length - 1; i >= 0; i--) {
            if (rows[i].isBlank()) {
                continue;
            }
            try {
                String hash = Jsons.mapper().readTree(rows[i]).path("hash").asText("");
                if (!Hashing.isSha256Hex(hash)) {
                    throw new IntegrityException("last audit row of " + auditFile + " carries no hash");
                }
                return hash;
            } catch (IOException e) {
                throw new IntegrityException("last audit row of " + auditFile + " is not valid JSON", e);
            }
        }
        return "";
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String runId,
            String taskKey,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result,
                                    String runId, String taskKey, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, runId, taskKey, details == null ? Map.of() : details);
        }

        public static AuditEvent ofRun(String action, String actor, String result, String runId, Map<String, Object> details) {
            return of(action, actor, "run/" + runId, result, runId, null, details);
        }
    }

    public record IntegrityReport(boolean valid, int rowsChecked, int firstBadLine, String reason) {
    }
}
