package com.vidnyan.depscope.application.port.out;

import com.vidnyan.depscope.domain.analysis.AnalysisResult;
import com.vidnyan.depscope.domain.analysis.GraphSummary;
import com.vidnyan.depscope.domain.graph.DependencyGraph;
import com.vidnyan.depscope.domain.graph.ExternalReference;
import com.vidnyan.depscope.domain.model.ArtifactFamily;

import java.util.List;
import java.util.Locale;

/**
 * Port for serializing a graph and its analysis into an interchange format.
 * Exports are pure: the same snapshot always yields byte-identical output.
 */
public interface GraphExporter {

    ExportFormat format();

    String export(Snapshot snapshot);

    /**
     * Everything an exporter may render.
     *
     * @param analysis may be {@code null} when only the graph is exported
     * @param summary may be {@code null}; required only by summary-based formats
     */
    record Snapshot(
        ArtifactFamily family,
        DependencyGraph graph,
        List<ExternalReference> externalReferences,
        AnalysisResult analysis,
        GraphSummary summary
    ) {

        public Snapshot {
            externalReferences = List.copyOf(externalReferences);
        }

        /**
         * Analysis, or an empty one when none was supplied.
         */
        public AnalysisResult analysisOrEmpty() {
            return analysis != null ? analysis : AnalysisResult.empty();
        }
    }

    /**
     * Supported output formats.
     */
    enum ExportFormat {
        JSON,
        DOT,
        GRAPHML,
        ADJACENCY,
        MARKDOWN;

        public static ExportFormat fromName(String name) {
            return switch (name.trim().toUpperCase(Locale.ROOT)) {
                case "JSON" -> JSON;
                case "DOT", "GRAPHVIZ" -> DOT;
                case "GRAPHML" -> GRAPHML;
                case "ADJACENCY" -> ADJACENCY;
                case "MARKDOWN", "MD", "LLM-CONTEXT" -> MARKDOWN;
                default -> throw new IllegalArgumentException("Unknown export format: " + name);
            };
        }
    }
}
