package com.vidnyan.depscope.application.port.in;

import com.vidnyan.depscope.application.port.out.GraphExporter.ExportFormat;
import com.vidnyan.depscope.domain.analysis.AnalysisResult;
import com.vidnyan.depscope.domain.analysis.CentralityScore;
import com.vidnyan.depscope.domain.analysis.GraphSummary;
import com.vidnyan.depscope.domain.graph.DependencyGraph;
import com.vidnyan.depscope.domain.graph.ExternalReference;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.AnalysisWarning;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: analyze the dependency structure of a source tree.
 * This is the only entry point exposed to external collaborators.
 */
public interface AnalyzeDependenciesUseCase {

    /**
     * Read, extract, build and analyze.
     *
     * @throws com.vidnyan.depscope.domain.exception.RootNotFoundException if the root is missing
     * @throws com.vidnyan.depscope.domain.exception.UnsupportedFamilyException if no extractor handles the family
     */
    AnalysisReport analyze(AnalysisRequest request);

    /**
     * Artifacts the node depends on.
     *
     * @throws com.vidnyan.depscope.domain.exception.NodeNotFoundException for an unknown id
     */
    List<ArtifactId> dependenciesOf(AnalysisReport report, ArtifactId id, boolean transitive);

    /**
     * Artifacts that depend on the node.
     *
     * @throws com.vidnyan.depscope.domain.exception.NodeNotFoundException for an unknown id
     */
    List<ArtifactId> dependentsOf(AnalysisReport report, ArtifactId id, boolean transitive);

    /**
     * Everything known about one node.
     *
     * @throws com.vidnyan.depscope.domain.exception.NodeNotFoundException for an unknown id
     */
    NodeReport describe(AnalysisReport report, ArtifactId id);

    String export(AnalysisReport report, ExportFormat format);

    GraphSummary summarize(AnalysisReport report);

    GraphSummary summarize(AnalysisReport report, int topN);

    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        Path root,
        ArtifactFamily family
    ) {
        public static AnalysisRequest of(Path root, ArtifactFamily family) {
            return new AnalysisRequest(root, family);
        }
    }

    /**
     * Outcome of one analysis: immutable graph, derived analysis and collected warnings.
     */
    record AnalysisReport(
        Path root,
        ArtifactFamily family,
        DependencyGraph graph,
        List<ExternalReference> externalReferences,
        AnalysisResult analysis,
        List<AnalysisWarning> warnings,
        AnalysisStats stats
    ) {
        public boolean hasWarnings() {
            return !warnings.isEmpty();
        }

        public List<ExternalReference> externalReferencesOf(ArtifactId id) {
            return externalReferences.stream()
                    .filter(ref -> ref.source().equals(id))
                    .toList();
        }
    }

    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int filesRead,
        int artifactsDeclared,
        int referencesExtracted,
        int edges,
        int externalReferences,
        long totalDurationMs
    ) {}

    /**
     * Detail view of one node.
     */
    record NodeReport(
        Node node,
        List<ArtifactId> directDependencies,
        List<ArtifactId> transitiveDependencies,
        List<ArtifactId> directDependents,
        List<ArtifactId> transitiveDependents,
        CentralityScore centrality,
        List<List<ArtifactId>> cycles,
        List<ExternalReference> externalReferences
    ) {}
}
