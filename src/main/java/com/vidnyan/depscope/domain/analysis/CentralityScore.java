package com.vidnyan.depscope.domain.analysis;

import com.vidnyan.depscope.domain.model.ArtifactId;

import java.util.Comparator;

/**
 * Degree centrality of one node: (in + out) / total edge count.
 */
public record CentralityScore(
    ArtifactId id,
    int inDegree,
    int outDegree,
    double score
) {

    /**
     * Highest score first, ties broken by id.
     */
    public static final Comparator<CentralityScore> RANKING = Comparator
            .comparingDouble(CentralityScore::score).reversed()
            .thenComparing(CentralityScore::id);
}
