package io.thinmesh.manifest;

import io.thinmesh.error.IntegrityException;
import io.thinmesh.model.ManifestEntry;
import io.thinmesh.util.Hashing;
import io.thinmesh.util.Jsons;

public final class ManifestEntries {
    private ManifestEntries() {
    }

    /**
     * Parses and validates one stored manifest line.
     *
     * @param position where the line came from, for the error message
     */
    public static ManifestEntry parse(String json, String position) {
        ManifestEntry entry;
        try {
            entry = Jsons.fromJson(json, ManifestEntry.class);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("corrupted manifest entry at " + position, e);
        }
        if (entry == null || entry.resolution() == null || !Hashing.isSha256Hex(entry.taskKey())) {
            throw new IntegrityException("corrupted manifest entry at " + position);
        }
        if (entry.resolution() != ManifestEntry.Resolution.FAILED && !Hashing.isSha256Hex(entry.artifactHash())) {
            throw new IntegrityException("manifest entry at " + position + " has malformed artifact hash");
        }
        return entry;
    }
}
