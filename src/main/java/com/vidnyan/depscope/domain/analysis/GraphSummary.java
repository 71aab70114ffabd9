package com.vidnyan.depscope.domain.analysis;

import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;

import java.util.List;

/**
 * Structured digest of an analysis, the input contract of the external
 * summarization collaborator. Carries no generated prose.
 */
public record GraphSummary(
    ArtifactFamily family,
    int nodeCount,
    int edgeCount,
    int externalReferenceCount,
    int cycleCount,
    List<List<ArtifactId>> cycles,
    List<CentralityScore> topCentral,
    List<NodeCount> mostDependedUpon,
    List<NodeCount> mostDependencies,
    List<SpecifierCount> topExternal,
    List<NodeDependencyCounts> nodes
) {

    /**
     * A node with a single count attached.
     */
    public record NodeCount(ArtifactId id, int count) {}

    /**
     * An external specifier and the number of artifacts referring to it.
     */
    public record SpecifierCount(String specifier, int count) {}

    /**
     * Direct and transitive fan-out and fan-in of one node.
     */
    public record NodeDependencyCounts(
        ArtifactId id,
        int directDependencies,
        int transitiveDependencies,
        int directDependents,
        int transitiveDependents
    ) {}
}
