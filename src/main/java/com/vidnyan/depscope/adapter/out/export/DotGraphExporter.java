package com.vidnyan.depscope.adapter.out.export;

import com.vidnyan.depscope.application.port.out.GraphExporter;
import com.vidnyan.depscope.domain.graph.Edge;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.ArtifactId;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Graphviz description of the graph.
 * Cycle members are drawn red; wildcard edges dashed, conditional edges dotted.
 */
@Component
public class DotGraphExporter implements GraphExporter {

    @Override
    public ExportFormat format() {
        return ExportFormat.DOT;
    }

    @Override
    public String export(Snapshot snapshot) {
        Set<ArtifactId> inCycle = snapshot.analysisOrEmpty().cycleMembers();
        StringBuilder dot = new StringBuilder();
        dot.append("digraph ").append(quote(snapshot.family().label())).append(" {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box, fontname=\"Helvetica\"];\n");

        for (Node node : snapshot.graph().nodes()) {
            dot.append("  ").append(quote(node.id().value()));
            dot.append(" [tooltip=").append(quote(node.path()));
            if (inCycle.contains(node.id())) {
                dot.append(", color=red, fontcolor=red");
            }
            dot.append("];\n");
        }

        for (Edge edge : snapshot.graph().edges()) {
            dot.append("  ").append(quote(edge.source().value()))
                    .append(" -> ").append(quote(edge.target().value()));
            switch (edge.kind()) {
                case WILDCARD -> dot.append(" [style=dashed]");
                case CONDITIONAL -> dot.append(" [style=dotted]");
                default -> { }
            }
            dot.append(";\n");
        }

        dot.append("}\n");
        return dot.toString();
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
