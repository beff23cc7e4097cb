package io.thinmesh.model;

/**
 * Result of an atomic record-if-absent on the manifest. When a resolution
 * already existed, {@code artifactHash} is the earlier one and wins.
 */
public record RecordResult(boolean recorded, String artifactHash, long costChargedMicros) {
    public static RecordResult recorded(String artifactHash, long costMicros) {
        return new RecordResult(true, artifactHash, costMicros);
    }

    public static RecordResult existing(String artifactHash, long costMicros) {
        return new RecordResult(false, artifactHash, costMicros);
    }
}
