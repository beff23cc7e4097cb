package io.thinmesh.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.thinmesh.error.IntegrityException;
import io.thinmesh.error.RunSpecException;
import io.thinmesh.planner.RunOutcome;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

final class ThinMeshCommandTest {

    @Test
    void artifactPutThenGetRoundTrips() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cli-artifact-");
        try {
            Path source = root.resolve("in.txt");
            Files.writeString(source, "cli payload");
            Captured put = execute("--root", root.resolve("data").toString(), "artifact", "put", source.toString());
            Assertions.assertEquals(0, put.exitCode());
            String hash = Jsons.mapper().readTree(put.stdout()).path("hash").asText();
            Assertions.assertEquals(Hashing.sha256Hex("cli payload"), hash);

            Path out = root.resolve("out").resolve("copy.txt");
            Captured get = execute("--root", root.resolve("data").toString(), "artifact", "get", hash, "--out", out.toString());
            Assertions.assertEquals(0, get.exitCode());
            Assertions.assertEquals("cli payload", Files.readString(out));

            Captured missing = execute("--root", root.resolve("data").toString(), "artifact", "get",
                    Hashing.sha256Hex("absent"), "--out", out.toString());
            Assertions.assertEquals(1, missing.exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runPrintsOutcomeAndExitsWithItsCode() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cli-run-");
        try {
            String data = root.resolve("data").toString();
            Path spec = root.resolve("spec.json");
            Files.writeString(spec, """
                    {"tasks": [
                      {"id": "a", "type": "echo", "inputs": [{"text": "one"}, {"text": "two"}]},
                      {"id": "b", "type": "echo", "depends_on": ["a"]}
                    ]}
                    """);

            Captured run = execute("--root", data, "run", "run-1", "--spec", spec.toString(), "--local-workers", "1");
            Assertions.assertEquals(RunOutcome.EXIT_COMPLETED, run.exitCode());
            JsonNode outcome = Jsons.mapper().readTree(run.stdout());
            Assertions.assertEquals("COMPLETED", outcome.path("status").asText());
            Assertions.assertEquals(2, outcome.path("dispatched").asInt());

            Captured status = execute("--root", data, "status", "run-1");
            Assertions.assertEquals(0, status.exitCode());
            Assertions.assertEquals("DONE", Jsons.mapper().readTree(status.stdout()).path("nodes").path("b").asText());

            Captured metrics = execute("--root", data, "metrics");
            Assertions.assertTrue(metrics.stdout().contains("thinmesh_run_info{run_id=\"run-1\",status=\"completed\"} 1"));

            Captured dead = execute("--root", data, "dead-letters", "run-1");
            Assertions.assertEquals(0, Jsons.mapper().readTree(dead.stdout()).size());

            Assertions.assertEquals(0, execute("--root", data, "cancel", "run-1").exitCode());
            Assertions.assertEquals(1, execute("--root", data, "cancel", "ghost").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidSpecIsAUsageError() throws Exception {
        Path root = Files.createTempDirectory("thinmesh-test-cli-usage-");
        try {
            Path spec = root.resolve("cyclic.json");
            Files.writeString(spec, """
                    {"tasks": [
                      {"id": "a", "type": "echo", "depends_on": ["b"]},
                      {"id": "b", "type": "echo", "depends_on": ["a"]}
                    ]}
                    """);

            Captured run = execute("--root", root.resolve("data").toString(), "run", "run-1", "--spec", spec.toString());

            Assertions.assertEquals(RunOutcome.EXIT_USAGE, run.exitCode());
            Assertions.assertTrue(run.stderr().contains("RunSpecException"));
            Assertions.assertEquals(RunOutcome.EXIT_USAGE, execute("run").exitCode());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exceptionsMapToExitCodes() {
        Assertions.assertEquals(RunOutcome.EXIT_FATAL, ThinMeshCommand.exitCodeFor(new IntegrityException("bad")));
        Assertions.assertEquals(RunOutcome.EXIT_USAGE, ThinMeshCommand.exitCodeFor(new RunSpecException("bad")));
        Assertions.assertEquals(RunOutcome.EXIT_USAGE, ThinMeshCommand.exitCodeFor(new IllegalArgumentException("bad")));
        Assertions.assertEquals(RunOutcome.EXIT_FAILED, ThinMeshCommand.exitCodeFor(new IllegalStateException("bad")));
    }

    private static Captured execute(String... args) {
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
            int code = ThinMeshCommand.newCommandLine().execute(args);
            return new Captured(code, out.toString(StandardCharsets.UTF_8), err.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private record Captured(int exitCode, String stdout, String stderr) {
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
