package com.vidnyan.depscope.domain.exception;

import com.vidnyan.depscope.domain.model.ArtifactId;

/**
 * A per-node query named an artifact that is not part of the graph.
 */
public class NodeNotFoundException extends DepscopeException {

    private final ArtifactId id;

    public NodeNotFoundException(ArtifactId id) {
        super("Node not found in dependency graph: " + id);
        this.id = id;
    }

    public ArtifactId getId() {
        return id;
    }
}
