package io.thinmesh.model;

import java.util.List;

public record CompletionBatch(List<CompletionEvent> events, String cursor) {
    public CompletionBatch {
        events = List.copyOf(events);
    }

    public static CompletionBatch empty(String cursor) {
        return new CompletionBatch(List.of(), cursor);
    }
}
