package io.thinmesh.planner;

import io.thinmesh.artifact.ArtifactRef;
import io.thinmesh.artifact.ArtifactStore;
import io.thinmesh.error.IntegrityException;
import io.thinmesh.error.RunSpecException;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads run specs and turns literal inputs into artifact references.
 */
public final class RunSpecLoader {
    private static final String SPEC_CONTENT_TYPE = "application/vnd.thinmesh.run-spec+json";

    private final ArtifactStore artifacts;

    public RunSpecLoader(ArtifactStore artifacts) {
        this.artifacts = artifacts;
    }

    public RunSpec read(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RunSpecException("Cannot read run spec " + file + ": " + e.getMessage(), e);
        }
        return parse(json);
    }

    public RunSpec parse(String json) {
        try {
            return Jsons.mapper().readValue(json, RunSpec.class);
        } catch (IOException e) {
            throw new RunSpecException("Invalid run spec JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Stores every {@code text} and {@code file} input and rewrites it to an
     * {@code artifact} reference. Relative file paths resolve against
     * {@code baseDir}; referenced artifacts must already exist.
     */
    public RunSpec resolveInputs(RunSpec spec, Path baseDir) {
        List<RunSpec.TaskSpec> tasks = new ArrayList<>(spec.tasks().size());
        for (RunSpec.TaskSpec task : spec.tasks()) {
            List<RunSpec.InputSpec> resolved = new ArrayList<>(task.inputs().size());
            for (RunSpec.InputSpec input : task.inputs()) {
                resolved.add(RunSpec.InputSpec.ofArtifact(store(task.id(), input, baseDir)));
            }
            tasks.add(task.withInputs(resolved));
        }
        return new RunSpec(tasks);
    }

    /**
     * @return the hash of the stored spec
     */
    public String store(RunSpec resolved) {
        byte[] bytes = Jsons.canonicalBytes(Jsons.compactMapper().valueToTree(resolved));
        ArtifactRef ref = artifacts.put(bytes, SPEC_CONTENT_TYPE);
        return ref.hash();
    }

    public RunSpec loadStored(String specHash) {
        byte[] bytes = artifacts.get(specHash)
                .orElseThrow(() -> new IntegrityException("stored run spec " + specHash + " is missing from the artifact store"));
        return parse(new String(bytes, StandardCharsets.UTF_8));
    }

    private String store(String taskId, RunSpec.InputSpec input, Path baseDir) {
        if (input == null || input.kinds() != 1) {
            throw new RunSpecException("task " + taskId + ": each input needs exactly one of text, file, artifact");
        }
        if (input.artifact() != null) {
            if (!Hashing.isSha256Hex(input.artifact())) {
                throw new RunSpecException("task " + taskId + ": malformed artifact hash " + input.artifact());
            }
            if (!artifacts.exists(input.artifact())) {
                throw new RunSpecException("task " + taskId + ": artifact " + input.artifact() + " does not exist");
            }
            return input.artifact();
        }
        if (input.text() != null) {
            return artifacts.put(input.text().getBytes(StandardCharsets.UTF_8), "text/plain; charset=utf-8").hash();
        }
        Path path = baseDir == null ? Path.of(input.file()) : baseDir.resolve(input.file());
        try {
            return artifacts.put(Files.readAllBytes(path)).hash();
        } catch (IOException e) {
            throw new RunSpecException("task " + taskId + ": cannot read input file " + path + ": " + e.getMessage(), e);
        }
    }
}
