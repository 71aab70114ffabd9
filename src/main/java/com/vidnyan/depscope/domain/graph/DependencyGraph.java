package com.vidnyan.depscope.domain.graph;

import com.vidnyan.depscope.domain.model.ArtifactId;

import java.util.*;

/**
 * Artifact-level dependency graph.
 * Bidirectional index: source → outgoing edges, target → incoming edges.
 * Both indices are derived once from the edge list at construction.
 * Immutable and thread-safe.
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY = new DependencyGraph(List.of(), List.of());

    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<ArtifactId, Node> nodesById;
    private final Map<ArtifactId, List<Edge>> outgoing;
    private final Map<ArtifactId, List<Edge>> incoming;

    private DependencyGraph(List<Node> sortedNodes, List<Edge> sortedEdges) {
        Map<ArtifactId, Node> byId = new LinkedHashMap<>();
        for (Node node : sortedNodes) {
            if (byId.put(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node: " + node.id());
            }
        }

        Map<ArtifactId, List<Edge>> out = new HashMap<>();
        Map<ArtifactId, List<Edge>> in = new HashMap<>();
        Edge previous = null;
        for (Edge edge : sortedEdges) {
            if (!byId.containsKey(edge.source()) || !byId.containsKey(edge.target())) {
                throw new IllegalArgumentException("Dangling edge: " + edge.format());
            }
            if (edge.isSelfLoop()) {
                throw new IllegalArgumentException("Self-referential edge: " + edge.format());
            }
            if (edge.equals(previous)) {
                throw new IllegalArgumentException("Duplicate edge: " + edge.format());
            }
            out.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
            previous = edge;
        }
        out.replaceAll((k, v) -> List.copyOf(v));
        in.replaceAll((k, v) -> List.copyOf(v));

        this.nodes = List.copyOf(sortedNodes);
        this.edges = List.copyOf(sortedEdges);
        this.nodesById = Collections.unmodifiableMap(byId);
        this.outgoing = Collections.unmodifiableMap(out);
        this.incoming = Collections.unmodifiableMap(in);
    }

    /**
     * Create a graph, sorting nodes by id and edges by source, target and kind.
     *
     * @throws IllegalArgumentException if an edge is dangling, self-referential or duplicated
     */
    public static DependencyGraph of(Collection<Node> nodes, Collection<Edge> edges) {
        List<Node> sortedNodes = new ArrayList<>(nodes);
        sortedNodes.sort(Comparator.comparing(Node::id));
        List<Edge> sortedEdges = new ArrayList<>(edges);
        sortedEdges.sort(Edge.ORDER);
        return new DependencyGraph(sortedNodes, sortedEdges);
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    /**
     * All nodes, sorted by id.
     */
    public List<Node> nodes() {
        return nodes;
    }

    /**
     * All edges in canonical order.
     */
    public List<Edge> edges() {
        return edges;
    }

    public Optional<Node> node(ArtifactId id) {
        return Optional.ofNullable(nodesById.get(id));
    }

    public boolean contains(ArtifactId id) {
        return nodesById.containsKey(id);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Get all outgoing edges of a node.
     */
    public List<Edge> outgoing(ArtifactId id) {
        return outgoing.getOrDefault(id, List.of());
    }

    /**
     * Get all incoming edges of a node.
     */
    public List<Edge> incoming(ArtifactId id) {
        return incoming.getOrDefault(id, List.of());
    }

    /**
     * Distinct targets of a node's outgoing edges, sorted.
     */
    public List<ArtifactId> successors(ArtifactId id) {
        return outgoing(id).stream().map(Edge::target).distinct().toList();
    }

    /**
     * Distinct sources of a node's incoming edges, sorted.
     */
    public List<ArtifactId> predecessors(ArtifactId id) {
        return incoming(id).stream().map(Edge::source).distinct().sorted().toList();
    }

    public int inDegree(ArtifactId id) {
        return incoming(id).size();
    }

    public int outDegree(ArtifactId id) {
        return outgoing(id).size();
    }

    /**
     * Get graph statistics.
     */
    public Stats stats() {
        return new Stats(nodes.size(), edges.size());
    }

    public record Stats(int nodeCount, int edgeCount) {}

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DependencyGraph other)) return false;
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "DependencyGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
