package com.vidnyan.depscope.adapter.out.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.depscope.AnalysisProperties;
import com.vidnyan.depscope.application.port.out.GraphExporter;
import com.vidnyan.depscope.application.port.out.GraphExporter.ExportFormat;
import com.vidnyan.depscope.application.port.out.GraphExporter.Snapshot;
import com.vidnyan.depscope.domain.analysis.AnalysisResult;
import com.vidnyan.depscope.domain.analysis.GraphAnalyzer;
import com.vidnyan.depscope.domain.exception.GraphDocumentException;
import com.vidnyan.depscope.domain.graph.DependencyGraph;
import com.vidnyan.depscope.domain.graph.Edge;
import com.vidnyan.depscope.domain.graph.ExternalReference;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.ReferenceKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphExportersTest {

    private final JsonGraphExporter json = new JsonGraphExporter(new ObjectMapper());
    private final List<GraphExporter> exporters = List.of(json, new DotGraphExporter(),
            new GraphMlGraphExporter(), new AdjacencyGraphExporter(), new MarkdownContextExporter(AnalysisProperties.defaults()));

    @Test
    void export_ShouldBeByteIdenticalForIdenticalInput() {
        for (GraphExporter exporter : exporters) {
            assertEquals(exporter.export(snapshot()), exporter.export(snapshot()), exporter.format().name());
            assertFalse(exporter.export(snapshot()).contains("\r"), exporter.format().name());
        }
    }

    @Test
    void json_ShouldWriteFieldsInFixedOrder() {
        String document = json.export(snapshot());

        int family = document.indexOf("\"family\"");
        int nodes = document.indexOf("\"nodes\"");
        int edges = document.indexOf("\"edges\"");
        int externals = document.indexOf("\"externalReferences\"");
        int cycles = document.indexOf("\"cycles\"");
        int centrality = document.indexOf("\"centrality\"");
        assertTrue(family < nodes && nodes < edges && edges < externals && externals < cycles && cycles < centrality);
        assertTrue(document.contains("\"kind\" : \"conditional\""));
        assertTrue(document.startsWith("{\n  \"family\" : \"terraform\""));
    }

    @Test
    void json_ShouldReadBackEquivalentGraph() {
        Snapshot original = snapshot();

        Snapshot read = json.read(json.export(original));

        assertEquals(original.family(), read.family());
        assertEquals(original.graph(), read.graph());
        assertEquals(original.externalReferences(), read.externalReferences());
        assertEquals(original.analysis().cycles(), read.analysis().cycles());
        assertEquals(original.analysis().centrality(), read.analysis().centrality());
        assertEquals(json.export(original), json.export(read));
    }

    @Test
    void json_ShouldRejectMalformedDocuments() {
        assertThrows(GraphDocumentException.class, () -> json.read("{not json"));
        assertThrows(GraphDocumentException.class, () -> json.read("{\"nodes\": []}"));
        assertThrows(GraphDocumentException.class, () -> json.read(
                "{\"family\":\"python\",\"nodes\":[],\"edges\":[{\"source\":\"a\",\"target\":\"b\",\"kind\":\"direct\"}]}"));
        assertThrows(GraphDocumentException.class, () -> json.read("{\"family\":\"cobol\"}"));
    }

    @Test
    void dot_ShouldStyleCyclesAndEdgeKinds() {
        String dot = new DotGraphExporter().export(snapshot());

        assertTrue(dot.startsWith("digraph \"terraform\" {\n"));
        assertTrue(dot.contains("\"aws_instance.a\" [tooltip=\"main.tf\", color=red, fontcolor=red];"));
        assertTrue(dot.contains("\"var.region\" [tooltip=\"vars.tf\"];"));
        assertTrue(dot.contains("\"aws_instance.a\" -> \"aws_instance.b\" [style=dotted];"));
        assertTrue(dot.contains("\"aws_instance.b\" -> \"aws_instance.a\";"));
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    void graphMl_ShouldCarryNodeAndEdgeAttributes() {
        String xml = new GraphMlGraphExporter().export(snapshot());

        assertTrue(xml.contains("<node id=\"aws_instance.a\">"));
        assertTrue(xml.contains("<data key=\"inCycle\">true</data>"));
        assertTrue(xml.contains("<data key=\"inCycle\">false</data>"));
        assertTrue(xml.contains("<data key=\"centrality\">0.666667</data>"));
        assertTrue(xml.contains("<data key=\"kind\">conditional</data>"));
        assertEquals("a &lt;b&gt; &amp; &quot;c&quot;", GraphMlGraphExporter.escape("a <b> & \"c\""));
    }

    @Test
    void graphMl_ShouldScoreEveryNodeFromItsOwnCentrality() {
        String xml = new GraphMlGraphExporter().export(snapshot());

        assertTrue(xml.contains("<node id=\"aws_instance.b\">\n"
                + "      <data key=\"family\">terraform</data>\n"
                + "      <data key=\"path\">main.tf</data>\n"
                + "      <data key=\"centrality\">1.000000</data>\n"));
        assertTrue(xml.contains("<data key=\"centrality\">0.333333</data>"));

        Snapshot withoutAnalysis = new Snapshot(ArtifactFamily.TERRAFORM, snapshot().graph(), List.of(), null, null);
        String bare = new GraphMlGraphExporter().export(withoutAnalysis);
        assertEquals(3, bare.split("<data key=\"centrality\">0.000000</data>", -1).length - 1);
    }

    @Test
    void markdown_ShouldLimitTablesToConfiguredTopN() {
        AnalysisProperties properties = AnalysisProperties.defaults();
        properties.setSummaryTopN(1);

        String markdown = new MarkdownContextExporter(properties).export(snapshot());

        assertTrue(markdown.contains("| `aws_instance.b` | 1 | 2 | 1.0000 |"));
        assertFalse(markdown.contains("| `aws_instance.a` |"));
    }

    @Test
    void adjacency_ShouldListDistinctSortedSuccessors() {
        String adjacency = new AdjacencyGraphExporter().export(snapshot());

        assertEquals("aws_instance.a -> aws_instance.b\n"
                + "aws_instance.b -> aws_instance.a, var.region\n"
                + "var.region ->\n", adjacency);
    }

    @Test
    void markdown_ShouldRenderSummarySections() {
        String markdown = new MarkdownContextExporter(AnalysisProperties.defaults()).export(snapshot());

        assertTrue(markdown.startsWith("# Dependency Analysis: terraform\n"));
        assertTrue(markdown.contains("- Dependency cycles: 1"));
        assertTrue(markdown.contains("`aws_instance.a` ↔ `aws_instance.b`"));
        assertTrue(markdown.contains("- `var.undeclared`: referenced by 1 artifact"));
    }

    @Test
    void formatNames_ShouldAcceptAliases() {
        assertEquals(ExportFormat.DOT, ExportFormat.fromName("graphviz"));
        assertEquals(ExportFormat.MARKDOWN, ExportFormat.fromName("llm-context"));
        assertThrows(IllegalArgumentException.class, () -> ExportFormat.fromName("pdf"));
    }

    /**
     * a ⇄ b cycle, b → var.region, one external reference.
     */
    private static Snapshot snapshot() {
        DependencyGraph graph = DependencyGraph.of(
                List.of(new Node(id("aws_instance.a"), ArtifactFamily.TERRAFORM, "main.tf"),
                        new Node(id("aws_instance.b"), ArtifactFamily.TERRAFORM, "main.tf"),
                        new Node(id("var.region"), ArtifactFamily.TERRAFORM, "vars.tf")),
                List.of(new Edge(id("aws_instance.a"), id("aws_instance.b"), ReferenceKind.CONDITIONAL),
                        new Edge(id("aws_instance.b"), id("aws_instance.a"), ReferenceKind.DIRECT),
                        new Edge(id("aws_instance.b"), id("var.region"), ReferenceKind.DIRECT)));
        AnalysisResult analysis = new GraphAnalyzer().analyze(graph);
        return new Snapshot(ArtifactFamily.TERRAFORM, graph,
                List.of(new ExternalReference(id("aws_instance.b"), "var.undeclared")), analysis, null);
    }

    private static ArtifactId id(String value) {
        return ArtifactId.of(value);
    }
}
