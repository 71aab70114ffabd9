package com.vidnyan.depscope.domain.analysis;

import com.vidnyan.depscope.domain.exception.NodeNotFoundException;
import com.vidnyan.depscope.domain.graph.DependencyGraph;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.ArtifactId;

import java.util.*;

/**
 * Structural analysis over a built dependency graph.
 * Every method is a pure function of the graph; results can be recomputed at will.
 */
public final class GraphAnalyzer {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * Compute cycles and centrality.
     */
    public AnalysisResult analyze(DependencyGraph graph) {
        if (graph.isEmpty()) {
            return AnalysisResult.empty();
        }
        return new AnalysisResult(findCycles(graph), rankCentrality(graph));
    }

    /**
     * Find every strongly connected component with at least two members.
     * Members are sorted; cycles are ordered by their smallest member.
     * The graph never holds self-edges, so single-node cycles cannot occur.
     */
    public List<List<ArtifactId>> findCycles(DependencyGraph graph) {
        List<List<ArtifactId>> cycles = new ArrayList<>();
        for (List<ArtifactId> component : stronglyConnectedComponents(graph)) {
            if (component.size() > 1) {
                List<ArtifactId> cycle = new ArrayList<>(component);
                Collections.sort(cycle);
                cycles.add(List.copyOf(cycle));
            }
        }
        cycles.sort(Comparator.comparing(c -> c.get(0)));
        return cycles;
    }

    /**
     * Tarjan's algorithm with an explicit work stack, so deep dependency
     * chains cannot overflow the call stack.
     */
    private List<List<ArtifactId>> stronglyConnectedComponents(DependencyGraph graph) {
        Map<ArtifactId, Integer> index = new HashMap<>();
        Map<ArtifactId, Integer> lowLink = new HashMap<>();
        Deque<ArtifactId> stack = new ArrayDeque<>();
        Set<ArtifactId> onStack = new HashSet<>();
        List<List<ArtifactId>> components = new ArrayList<>();
        int counter = 0;

        for (Node start : graph.nodes()) {
            if (index.containsKey(start.id())) {
                continue;
            }
            Deque<Frame> work = new ArrayDeque<>();
            index.put(start.id(), counter);
            lowLink.put(start.id(), counter);
            counter++;
            stack.push(start.id());
            onStack.add(start.id());
            work.push(new Frame(start.id(), graph.successors(start.id()).iterator()));

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.successors().hasNext()) {
                    ArtifactId next = frame.successors().next();
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        work.push(new Frame(next, graph.successors(next).iterator()));
                    } else if (onStack.contains(next)) {
                        lowLink.merge(frame.id(), index.get(next), Math::min);
                    }
                    continue;
                }

                work.pop();
                if (lowLink.get(frame.id()).equals(index.get(frame.id()))) {
                    List<ArtifactId> component = new ArrayList<>();
                    ArtifactId member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(frame.id()));
                    components.add(component);
                }
                if (!work.isEmpty()) {
                    lowLink.merge(work.peek().id(), lowLink.get(frame.id()), Math::min);
                }
            }
        }
        return components;
    }

    private record Frame(ArtifactId id, Iterator<ArtifactId> successors) {}

    /**
     * Degree centrality: (in + out) / |E|, ranked highest first, ties by id.
     * An approximation chosen for linear cost, not betweenness or eigenvector centrality.
     */
    public List<CentralityScore> rankCentrality(DependencyGraph graph) {
        int edgeCount = graph.edges().size();
        List<CentralityScore> scores = new ArrayList<>(graph.nodes().size());
        for (Node node : graph.nodes()) {
            int in = graph.inDegree(node.id());
            int out = graph.outDegree(node.id());
            double score = edgeCount == 0 ? 0.0 : (double) (in + out) / edgeCount;
            scores.add(new CentralityScore(node.id(), in, out, score));
        }
        scores.sort(CentralityScore.RANKING);
        return scores;
    }

    /**
     * Artifacts the given node depends on, directly or transitively.
     */
    public List<ArtifactId> dependenciesOf(DependencyGraph graph, ArtifactId id, boolean transitive) {
        return reachable(graph, id, Direction.DEPENDENCIES, transitive ? UNBOUNDED : 1);
    }

    /**
     * Artifacts depending on the given node, directly or transitively.
     */
    public List<ArtifactId> dependentsOf(DependencyGraph graph, ArtifactId id, boolean transitive) {
        return reachable(graph, id, Direction.DEPENDENTS, transitive ? UNBOUNDED : 1);
    }

    /**
     * Breadth-first traversal up to {@code maxDepth} hops. Each node is visited once,
     * so cycles terminate. The start node is never part of its own result.
     *
     * @throws NodeNotFoundException if the id is not in the graph
     */
    public List<ArtifactId> reachable(DependencyGraph graph, ArtifactId id, Direction direction, int maxDepth) {
        if (!graph.contains(id)) {
            throw new NodeNotFoundException(id);
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }

        Set<ArtifactId> visited = new HashSet<>();
        visited.add(id);
        Queue<ArtifactId> frontier = new ArrayDeque<>();
        frontier.add(id);
        int depth = 0;

        while (!frontier.isEmpty() && depth < maxDepth) {
            Queue<ArtifactId> next = new ArrayDeque<>();
            for (ArtifactId current : frontier) {
                List<ArtifactId> neighbours = direction == Direction.DEPENDENCIES
                        ? graph.successors(current)
                        : graph.predecessors(current);
                for (ArtifactId neighbour : neighbours) {
                    if (visited.add(neighbour)) {
                        next.add(neighbour);
                    }
                }
            }
            frontier = next;
            depth++;
        }

        visited.remove(id);
        List<ArtifactId> result = new ArrayList<>(visited);
        Collections.sort(result);
        return result;
    }
}
