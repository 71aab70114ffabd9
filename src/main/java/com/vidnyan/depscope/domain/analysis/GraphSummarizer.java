package com.vidnyan.depscope.domain.analysis;

import com.vidnyan.depscope.domain.graph.DependencyGraph;
import com.vidnyan.depscope.domain.graph.ExternalReference;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.ArtifactFamily;

import java.util.*;
import java.util.function.ToIntFunction;

/**
 * Builds the {@link GraphSummary} handed to summarization collaborators.
 */
public final class GraphSummarizer {

    private final GraphAnalyzer analyzer;

    public GraphSummarizer(GraphAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    public GraphSummary summarize(ArtifactFamily family,
                                  DependencyGraph graph,
                                  List<ExternalReference> externals,
                                  AnalysisResult analysis,
                                  int topN) {
        List<GraphSummary.NodeDependencyCounts> counts = new ArrayList<>(graph.nodes().size());
        for (Node node : graph.nodes()) {
            counts.add(new GraphSummary.NodeDependencyCounts(
                    node.id(),
                    graph.successors(node.id()).size(),
                    analyzer.dependenciesOf(graph, node.id(), true).size(),
                    graph.predecessors(node.id()).size(),
                    analyzer.dependentsOf(graph, node.id(), true).size()));
        }

        return new GraphSummary(
                family,
                graph.nodes().size(),
                graph.edges().size(),
                externals.size(),
                analysis.cycles().size(),
                analysis.cycles(),
                analysis.topCentral(topN),
                top(counts, GraphSummary.NodeDependencyCounts::directDependents, topN),
                top(counts, GraphSummary.NodeDependencyCounts::directDependencies, topN),
                topExternal(externals, topN),
                List.copyOf(counts));
    }

    private List<GraphSummary.NodeCount> top(List<GraphSummary.NodeDependencyCounts> counts,
                                             ToIntFunction<GraphSummary.NodeDependencyCounts> metric,
                                             int topN) {
        return counts.stream()
                .filter(c -> metric.applyAsInt(c) > 0)
                .sorted(Comparator.comparingInt(metric).reversed()
                        .thenComparing(GraphSummary.NodeDependencyCounts::id))
                .limit(Math.max(0, topN))
                .map(c -> new GraphSummary.NodeCount(c.id(), metric.applyAsInt(c)))
                .toList();
    }

    /**
     * Rank external specifiers by the number of distinct artifacts using them.
     */
    private List<GraphSummary.SpecifierCount> topExternal(List<ExternalReference> externals, int topN) {
        Map<String, Set<String>> users = new TreeMap<>();
        for (ExternalReference ref : externals) {
            users.computeIfAbsent(ref.specifier(), k -> new HashSet<>()).add(ref.source().value());
        }
        return users.entrySet().stream()
                .map(e -> new GraphSummary.SpecifierCount(e.getKey(), e.getValue().size()))
                .sorted(Comparator.comparingInt(GraphSummary.SpecifierCount::count).reversed()
                        .thenComparing(GraphSummary.SpecifierCount::specifier))
                .limit(Math.max(0, topN))
                .toList();
    }
}
