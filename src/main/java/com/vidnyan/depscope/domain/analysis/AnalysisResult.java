package com.vidnyan.depscope.domain.analysis;

import com.vidnyan.depscope.domain.model.ArtifactId;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only structural insight derived from a dependency graph.
 *
 * @param cycles strongly connected components of size ≥ 2, members sorted,
 *               ordered by their smallest member
 * @param centrality one score per node, ranked
 */
public record AnalysisResult(
    List<List<ArtifactId>> cycles,
    List<CentralityScore> centrality
) {

    private static final AnalysisResult EMPTY = new AnalysisResult(List.of(), List.of());

    public AnalysisResult {
        cycles = cycles.stream().map(List::copyOf).toList();
        centrality = List.copyOf(centrality);
    }

    public static AnalysisResult empty() {
        return EMPTY;
    }

    public Optional<CentralityScore> centralityOf(ArtifactId id) {
        return centrality.stream().filter(c -> c.id().equals(id)).findFirst();
    }

    public List<List<ArtifactId>> cyclesContaining(ArtifactId id) {
        return cycles.stream().filter(c -> c.contains(id)).toList();
    }

    /**
     * Every id that belongs to at least one cycle.
     */
    public Set<ArtifactId> cycleMembers() {
        Set<ArtifactId> members = new HashSet<>();
        cycles.forEach(members::addAll);
        return members;
    }

    /**
     * Top N nodes by centrality.
     */
    public List<CentralityScore> topCentral(int n) {
        return centrality.stream().limit(Math.max(0, n)).toList();
    }
}
