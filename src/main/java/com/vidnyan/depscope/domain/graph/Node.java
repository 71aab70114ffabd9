package com.vidnyan.depscope.domain.graph;

import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;

import java.util.Objects;

/**
 * One resolved artifact in the dependency graph.
 * Edges are held by the graph's indices, not by the node.
 */
public record Node(
    ArtifactId id,
    ArtifactFamily family,
    String path
) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(path, "path");
    }
}
