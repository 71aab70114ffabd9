package com.vidnyan.depscope.domain.graph;

import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.Reference;
import com.vidnyan.depscope.domain.model.SourceArtifact;

import java.util.List;

/**
 * An artifact together with the references extracted from it.
 * Input unit of the graph builder.
 */
public record ExtractedArtifact(
    SourceArtifact artifact,
    List<Reference> references
) {

    public ExtractedArtifact {
        references = List.copyOf(references);
    }

    public ArtifactId id() {
        return artifact.id();
    }
}
