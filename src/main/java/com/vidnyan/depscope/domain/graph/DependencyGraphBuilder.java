package com.vidnyan.depscope.domain.graph;

import com.vidnyan.depscope.domain.model.AnalysisWarning;
import com.vidnyan.depscope.domain.model.AnalysisWarning.WarningType;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.Location;
import com.vidnyan.depscope.domain.model.Reference;
import com.vidnyan.depscope.domain.model.ReferenceKind;
import com.vidnyan.depscope.domain.model.SourceArtifact;

import java.util.*;

/**
 * Resolves extracted references against the set of known artifacts
 * and assembles the immutable dependency graph.
 * <p>
 * Deterministic: the same set of extracted artifacts yields the same node,
 * edge and external reference ordering regardless of input order.
 */
public final class DependencyGraphBuilder {

    private static final Comparator<ExtractedArtifact> INPUT_ORDER = Comparator
            .comparing(ExtractedArtifact::id)
            .thenComparing(e -> e.artifact().relativePath())
            .thenComparingInt(e -> e.artifact().firstLine());

    /**
     * Build the graph.
     * Duplicate ids keep the artifact whose path sorts first.
     */
    public BuildResult build(Collection<ExtractedArtifact> artifacts) {
        List<ExtractedArtifact> sorted = new ArrayList<>(artifacts);
        sorted.sort(INPUT_ORDER);

        List<AnalysisWarning> warnings = new ArrayList<>();
        Map<ArtifactId, ExtractedArtifact> unique = new LinkedHashMap<>();
        for (ExtractedArtifact extracted : sorted) {
            ExtractedArtifact first = unique.putIfAbsent(extracted.id(), extracted);
            if (first != null) {
                SourceArtifact dup = extracted.artifact();
                warnings.add(new AnalysisWarning(
                        WarningType.DUPLICATE_ARTIFACT,
                        Location.at(dup.relativePath(), dup.firstLine()),
                        dup.id(),
                        "Address already declared in " + first.artifact().relativePath() + "; ignored"));
            }
        }

        List<Node> nodes = new ArrayList<>(unique.size());
        for (ExtractedArtifact extracted : unique.values()) {
            SourceArtifact artifact = extracted.artifact();
            nodes.add(new Node(artifact.id(), artifact.family(), artifact.relativePath()));
        }

        ArtifactIndex index = new ArtifactIndex(unique.keySet());
        Set<Edge> edges = new TreeSet<>(Edge.ORDER);
        Set<ExternalReference> externals = new TreeSet<>(ExternalReference.ORDER);

        for (ExtractedArtifact extracted : unique.values()) {
            SourceArtifact artifact = extracted.artifact();
            for (Reference reference : extracted.references()) {
                List<ArtifactId> targets = index.resolve(reference, artifact.family());
                if (targets.isEmpty()) {
                    externals.add(new ExternalReference(artifact.id(), reference.externalSpecifier()));
                    continue;
                }
                for (ArtifactId target : targets) {
                    if (target.equals(artifact.id())) {
                        if (reference.kind() == ReferenceKind.CONDITIONAL) {
                            warnings.add(new AnalysisWarning(
                                    WarningType.AMBIGUOUS_SELF_REFERENCE,
                                    Location.at(artifact.relativePath(), reference.line()),
                                    artifact.id(),
                                    "Conditional self-reference '" + reference.specifier()
                                            + "' suppressed; not reported as a cycle"));
                        }
                        continue;
                    }
                    edges.add(new Edge(artifact.id(), target, reference.kind()));
                }
            }
        }

        warnings.sort(AnalysisWarning.ORDER);
        return new BuildResult(
                DependencyGraph.of(nodes, edges),
                List.copyOf(externals),
                List.copyOf(warnings));
    }

    /**
     * Builder output.
     */
    public record BuildResult(
        DependencyGraph graph,
        List<ExternalReference> externalReferences,
        List<AnalysisWarning> warnings
    ) {}
}
