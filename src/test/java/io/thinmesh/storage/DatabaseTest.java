package io.thinmesh.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class DatabaseTest {

    @Test
    void initIsRepeatableAndCreatesTheDeadLetterIndex() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-database-");
        try {
            Database db = new Database(root.resolve("thinmesh.db"));
            db.init();
            db.init();

            List<String> names = db.read("list schema objects", c -> {
                List<String> out = new ArrayList<>();
                try (PreparedStatement ps = c.prepareStatement("SELECT name FROM sqlite_master WHERE type IN ('table','index')");
                     ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(rs.getString(1));
                    }
                }
                return out;
            });

            Assertions.assertTrue(names.contains("idx_messages_dead"));
            Assertions.assertTrue(names.contains("messages"));
            Assertions.assertFalse(names.contains("schema_migrations"));
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
