package io.thinmesh.cache;

/**
 * Answer of {@link ResumeCacheManager#resolve(String)} for one task key.
 */
public record Resolution(Kind kind, String artifactHash) {
    public enum Kind {
        RESOLVED,
        PENDING,
        ABSENT
    }

    private static final Resolution PENDING = new Resolution(Kind.PENDING, null);
    private static final Resolution ABSENT = new Resolution(Kind.ABSENT, null);

    public static Resolution resolved(String artifactHash) {
        return new Resolution(Kind.RESOLVED, artifactHash);
    }

    public static Resolution pending() {
        return PENDING;
    }

    public static Resolution absent() {
        return ABSENT;
    }
}
