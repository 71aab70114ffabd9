package com.vidnyan.depscope.domain.graph;

import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.ReferenceKind;

import java.util.Comparator;
import java.util.Objects;

/**
 * Resolved dependency between two known artifacts.
 * Immutable value object.
 */
public record Edge(
    ArtifactId source,
    ArtifactId target,
    ReferenceKind kind
) {

    /**
     * Canonical edge order: source, then target, then kind.
     */
    public static final Comparator<Edge> ORDER = Comparator
            .comparing(Edge::source)
            .thenComparing(Edge::target)
            .thenComparing(Edge::kind);

    public Edge {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean isSelfLoop() {
        return source.equals(target);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return source + " → " + target + " (" + kind.label() + ")";
    }
}
