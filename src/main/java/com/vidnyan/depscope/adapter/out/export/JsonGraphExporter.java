package com.vidnyan.depscope.adapter.out.export;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.depscope.application.port.out.GraphExporter;
import com.vidnyan.depscope.domain.analysis.AnalysisResult;
import com.vidnyan.depscope.domain.analysis.CentralityScore;
import com.vidnyan.depscope.domain.exception.DepscopeException;
import com.vidnyan.depscope.domain.exception.GraphDocumentException;
import com.vidnyan.depscope.domain.graph.DependencyGraph;
import com.vidnyan.depscope.domain.graph.Edge;
import com.vidnyan.depscope.domain.graph.ExternalReference;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.ReferenceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * JSON interchange document. The only format that can be read back.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonGraphExporter implements GraphExporter {

    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");
    private static final DefaultPrettyPrinter PRINTER = new DefaultPrettyPrinter()
            .withObjectIndenter(INDENTER)
            .withArrayIndenter(INDENTER);

    private final ObjectMapper objectMapper;

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public String export(Snapshot snapshot) {
        GraphDocument document = toDocument(snapshot);
        try {
            return objectMapper.writer(PRINTER).writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new GraphDocumentException("Failed to write graph document", e);
        }
    }

    /**
     * Read a document produced by {@link #export} back into a snapshot.
     * Degrees of the centrality entries are recomputed from the edges.
     */
    public Snapshot read(String json) {
        GraphDocument document;
        try {
            document = objectMapper.readValue(json, GraphDocument.class);
        } catch (JsonProcessingException e) {
            throw new GraphDocumentException("Malformed graph document: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.family() == null) {
            throw new GraphDocumentException("Graph document has no family");
        }

        try {
            ArtifactFamily family = ArtifactFamily.fromName(document.family());
            List<Node> nodes = orEmpty(document.nodes()).stream()
                    .map(n -> new Node(ArtifactId.of(n.id()), ArtifactFamily.fromName(n.family()), n.path()))
                    .toList();
            List<Edge> edges = orEmpty(document.edges()).stream()
                    .map(e -> new Edge(ArtifactId.of(e.source()), ArtifactId.of(e.target()),
                            ReferenceKind.fromLabel(e.kind())))
                    .toList();
            DependencyGraph graph = DependencyGraph.of(nodes, edges);

            List<ExternalReference> externals = orEmpty(document.externalReferences()).stream()
                    .map(x -> new ExternalReference(ArtifactId.of(x.source()), x.specifier()))
                    .toList();
            List<List<ArtifactId>> cycles = orEmpty(document.cycles()).stream()
                    .map(cycle -> cycle.stream().map(ArtifactId::of).toList())
                    .toList();
            List<CentralityScore> centrality = orEmpty(document.centrality()).stream()
                    .map(c -> {
                        ArtifactId id = ArtifactId.of(c.id());
                        return new CentralityScore(id, graph.inDegree(id), graph.outDegree(id), c.score());
                    })
                    .toList();

            log.debug("Read graph document: {} nodes, {} edges", nodes.size(), edges.size());
            return new Snapshot(family, graph, externals, new AnalysisResult(cycles, centrality), null);
        } catch (IllegalArgumentException | NullPointerException | DepscopeException e) {
            throw new GraphDocumentException("Invalid graph document: " + e.getMessage(), e);
        }
    }

    private static GraphDocument toDocument(Snapshot snapshot) {
        AnalysisResult analysis = snapshot.analysisOrEmpty();
        return new GraphDocument(
                snapshot.family().label(),
                snapshot.graph().nodes().stream()
                        .map(n -> new NodeEntry(n.id().value(), n.family().label(), n.path()))
                        .toList(),
                snapshot.graph().edges().stream()
                        .map(e -> new EdgeEntry(e.source().value(), e.target().value(), e.kind().label()))
                        .toList(),
                snapshot.externalReferences().stream()
                        .sorted(ExternalReference.ORDER)
                        .map(x -> new ExternalEntry(x.source().value(), x.specifier()))
                        .toList(),
                analysis.cycles().stream()
                        .map(cycle -> cycle.stream().map(ArtifactId::value).toList())
                        .toList(),
                analysis.centrality().stream()
                        .map(c -> new CentralityEntry(c.id().value(), c.score()))
                        .toList());
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return Objects.requireNonNullElse(list, List.of());
    }

    @JsonPropertyOrder({"family", "nodes", "edges", "externalReferences", "cycles", "centrality"})
    record GraphDocument(
        String family,
        List<NodeEntry> nodes,
        List<EdgeEntry> edges,
        List<ExternalEntry> externalReferences,
        List<List<String>> cycles,
        List<CentralityEntry> centrality
    ) {}

    @JsonPropertyOrder({"id", "family", "path"})
    record NodeEntry(String id, String family, String path) {}

    @JsonPropertyOrder({"source", "target", "kind"})
    record EdgeEntry(String source, String target, String kind) {}

    @JsonPropertyOrder({"source", "specifier"})
    record ExternalEntry(String source, String specifier) {}

    @JsonPropertyOrder({"id", "score"})
    record CentralityEntry(String id, double score) {}
}
