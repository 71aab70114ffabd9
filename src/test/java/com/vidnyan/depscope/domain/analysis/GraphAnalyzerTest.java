package com.vidnyan.depscope.domain.analysis;

import com.vidnyan.depscope.domain.exception.NodeNotFoundException;
import com.vidnyan.depscope.domain.graph.DependencyGraph;
import com.vidnyan.depscope.domain.graph.Edge;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.ReferenceKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GraphAnalyzerTest {

    private final GraphAnalyzer analyzer = new GraphAnalyzer();

    @Test
    void findCycles_ShouldReportTriangleOnce() {
        DependencyGraph graph = graph(List.of("a", "b", "c"), "a>b", "b>c", "c>a");

        AnalysisResult result = analyzer.analyze(graph);

        assertEquals(List.of(ids("a", "b", "c")), result.cycles());
    }

    @Test
    void findCycles_ShouldSortMembersAndOrderCyclesBySmallestMember() {
        DependencyGraph graph = graph(List.of("a", "b", "m", "x", "y", "z"),
                "z>y", "y>z", "b>a", "a>b", "a>m", "m>x");

        assertEquals(List.of(ids("a", "b"), ids("y", "z")), analyzer.findCycles(graph));
    }

    @Test
    void findCycles_ShouldIgnoreAcyclicGraphs() {
        DependencyGraph graph = graph(List.of("a", "b", "c", "d"), "a>b", "a>c", "b>d", "c>d");

        assertTrue(analyzer.findCycles(graph).isEmpty());
    }

    @Test
    void findCycles_ShouldNotDependOnEdgeInsertionOrder() {
        List<String> edges = new ArrayList<>(List.of("a>b", "b>c", "c>a", "c>d", "d>e", "e>d", "f>a"));
        List<List<ArtifactId>> expected = analyzer.findCycles(graph(List.of("a", "b", "c", "d", "e", "f"),
                edges.toArray(new String[0])));

        Random random = new Random(3);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(edges, random);
            assertEquals(expected, analyzer.findCycles(graph(List.of("f", "e", "d", "c", "b", "a"),
                    edges.toArray(new String[0]))));
        }
        assertEquals(List.of(ids("a", "b", "c"), ids("d", "e")), expected);
    }

    @Test
    void findCycles_ShouldHandleLongChainsWithoutRecursion() {
        int size = 20_000;
        List<String> nodes = new ArrayList<>();
        List<String> edges = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            nodes.add(String.format("n%05d", i));
            if (i > 0) {
                edges.add(String.format("n%05d>n%05d", i - 1, i));
            }
        }
        edges.add(String.format("n%05d>n%05d", size - 1, 0));

        List<List<ArtifactId>> cycles = analyzer.findCycles(graph(nodes, edges.toArray(new String[0])));

        assertEquals(1, cycles.size());
        assertEquals(size, cycles.get(0).size());
    }

    @Test
    void rankCentrality_ShouldUseDegreeOverEdgeCount() {
        DependencyGraph graph = graph(List.of("hub", "a", "b", "c"), "a>hub", "b>hub", "hub>c");

        List<CentralityScore> scores = analyzer.rankCentrality(graph);

        assertEquals(id("hub"), scores.get(0).id());
        assertEquals(1.0, scores.get(0).score(), 1e-9);
        assertEquals(2, scores.get(0).inDegree());
        assertEquals(1, scores.get(0).outDegree());
        // ties broken by id
        assertEquals(List.of(id("a"), id("b"), id("c")),
                scores.subList(1, 4).stream().map(CentralityScore::id).toList());
        assertEquals(1.0 / 3, scores.get(1).score(), 1e-9);
    }

    @Test
    void rankCentrality_ShouldBeZeroWithoutEdges() {
        List<CentralityScore> scores = analyzer.rankCentrality(graph(List.of("b", "a")));

        assertEquals(List.of(id("a"), id("b")), scores.stream().map(CentralityScore::id).toList());
        assertTrue(scores.stream().allMatch(s -> s.score() == 0.0));
    }

    @Test
    void closures_ShouldExcludeStartNodeEvenOnCycles() {
        DependencyGraph graph = graph(List.of("a", "b", "c", "d"), "a>b", "b>c", "c>a", "c>d");

        assertEquals(ids("b"), analyzer.dependenciesOf(graph, id("a"), false));
        assertEquals(ids("b", "c", "d"), analyzer.dependenciesOf(graph, id("a"), true));
        assertEquals(ids("c"), analyzer.dependentsOf(graph, id("a"), false));
        assertEquals(ids("a", "b", "c"), analyzer.dependentsOf(graph, id("d"), true));
        assertTrue(analyzer.dependenciesOf(graph, id("d"), true).isEmpty());
    }

    @Test
    void reachable_ShouldStopAtMaxDepth() {
        DependencyGraph graph = graph(List.of("a", "b", "c", "d"), "a>b", "b>c", "c>d");

        assertEquals(ids("b", "c"), analyzer.reachable(graph, id("a"), Direction.DEPENDENCIES, 2));
        assertEquals(ids("b", "c", "d"), analyzer.reachable(graph, id("a"), Direction.DEPENDENCIES, 3));
        assertThrows(IllegalArgumentException.class,
                () -> analyzer.reachable(graph, id("a"), Direction.DEPENDENCIES, 0));
    }

    @Test
    void closures_ShouldRejectUnknownNode() {
        DependencyGraph graph = graph(List.of("a"));

        NodeNotFoundException e = assertThrows(NodeNotFoundException.class,
                () -> analyzer.dependenciesOf(graph, id("missing"), true));
        assertEquals(id("missing"), e.getId());
    }

    @Test
    void analyze_ShouldReturnEmptyResultForEmptyGraph() {
        AnalysisResult result = analyzer.analyze(DependencyGraph.empty());

        assertTrue(result.cycles().isEmpty());
        assertTrue(result.centrality().isEmpty());
    }

    /**
     * Nodes plus edges written as {@code "source>target"}.
     */
    private static DependencyGraph graph(List<String> nodes, String... edges) {
        List<Node> nodeList = nodes.stream()
                .map(n -> new Node(id(n), ArtifactFamily.PYTHON, n + ".py"))
                .toList();
        List<Edge> edgeList = Arrays.stream(edges)
                .map(e -> e.split(">"))
                .map(parts -> new Edge(id(parts[0]), id(parts[1]), ReferenceKind.DIRECT))
                .toList();
        return DependencyGraph.of(nodeList, edgeList);
    }

    private static List<ArtifactId> ids(String... values) {
        return Arrays.stream(values).map(ArtifactId::of).toList();
    }

    private static ArtifactId id(String value) {
        return ArtifactId.of(value);
    }
}
