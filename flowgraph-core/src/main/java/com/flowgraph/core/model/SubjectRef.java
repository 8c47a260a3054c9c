package com.flowgraph.core.model;

import java.util.Objects;

/**
 * Type-erased reference to whatever a workflow instance is tracking.
 *
 * The engine only stores the pair. It never resolves it, checks that the
 * subject exists or cascades anything into it; keeping the pair resolvable
 * is the caller's job.
 */
public record SubjectRef(String kind, String id) {

    public SubjectRef {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("Subject kind cannot be empty");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Subject id cannot be empty");
        }
    }

    public static SubjectRef of(String kind, String id) {
        return new SubjectRef(kind, id);
    }

    /**
     * Reference with a non-string identifier, stored as its string form.
     */
    public static SubjectRef of(String kind, Object id) {
        return new SubjectRef(kind, Objects.toString(id, null));
    }

    @Override
    public String toString() {
        return kind + "/" + id;
    }
}
