package com.vidnyan.depscope.adapter.out.export;

import com.vidnyan.depscope.application.port.out.GraphExporter;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.ArtifactId;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Plain-text adjacency list, one line per node: {@code id -> dep1, dep2}.
 */
@Component
public class AdjacencyGraphExporter implements GraphExporter {

    @Override
    public ExportFormat format() {
        return ExportFormat.ADJACENCY;
    }

    @Override
    public String export(Snapshot snapshot) {
        StringBuilder out = new StringBuilder();
        for (Node node : snapshot.graph().nodes()) {
            String targets = snapshot.graph().successors(node.id()).stream()
                    .map(ArtifactId::value)
                    .collect(Collectors.joining(", "));
            out.append(node.id().value()).append(" ->");
            if (!targets.isEmpty()) {
                out.append(' ').append(targets);
            }
            out.append('\n');
        }
        return out.toString();
    }
}
