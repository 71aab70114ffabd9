package com.vidnyan.depscope.domain.graph;

import com.vidnyan.depscope.domain.model.ArtifactId;

import java.util.Comparator;

/**
 * A reference whose specifier matches no analyzed artifact
 * (third-party module, undeclared variable, ...). Never part of the graph.
 */
public record ExternalReference(
    ArtifactId source,
    String specifier
) {

    public static final Comparator<ExternalReference> ORDER = Comparator
            .comparing(ExternalReference::source)
            .thenComparing(ExternalReference::specifier);
}
