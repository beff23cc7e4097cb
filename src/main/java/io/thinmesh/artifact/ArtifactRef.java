package io.thinmesh.artifact;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ArtifactRef(
        @JsonProperty("hash") String hash,
        @JsonProperty("size") long size,
        @JsonProperty("content_type") String contentType,
        @JsonProperty("created_at_ms") long createdAtMs
) {
}
