package com.vidnyan.depscope.adapter.out.export;

import com.vidnyan.depscope.application.port.out.GraphExporter;
import com.vidnyan.depscope.domain.analysis.AnalysisResult;
import com.vidnyan.depscope.domain.analysis.CentralityScore;
import com.vidnyan.depscope.domain.graph.Edge;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.ArtifactId;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * GraphML document with node family, path, centrality and cycle membership,
 * and the reference kind on every edge.
 */
@Component
public class GraphMlGraphExporter implements GraphExporter {

    @Override
    public ExportFormat format() {
        return ExportFormat.GRAPHML;
    }

    @Override
    public String export(Snapshot snapshot) {
        AnalysisResult analysis = snapshot.analysisOrEmpty();
        Set<ArtifactId> inCycle = analysis.cycleMembers();
        Map<ArtifactId, Double> scores = new HashMap<>();
        for (CentralityScore score : analysis.centrality()) {
            scores.put(score.id(), score.score());
        }

        StringBuilder xml = new StringBuilder();
        xml.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        xml.append("<graphml xmlns=\"http://graphml.graphdrawing.org/xmlns\">\n");
        xml.append("  <key id=\"family\" for=\"node\" attr.name=\"family\" attr.type=\"string\"/>\n");
        xml.append("  <key id=\"path\" for=\"node\" attr.name=\"path\" attr.type=\"string\"/>\n");
        xml.append("  <key id=\"centrality\" for=\"node\" attr.name=\"centrality\" attr.type=\"double\"/>\n");
        xml.append("  <key id=\"inCycle\" for=\"node\" attr.name=\"inCycle\" attr.type=\"boolean\"/>\n");
        xml.append("  <key id=\"kind\" for=\"edge\" attr.name=\"kind\" attr.type=\"string\"/>\n");
        xml.append("  <graph id=\"").append(escape(snapshot.family().label()))
                .append("\" edgedefault=\"directed\">\n");

        for (Node node : snapshot.graph().nodes()) {
            double score = scores.getOrDefault(node.id(), 0.0);
            xml.append("    <node id=\"").append(escape(node.id().value())).append("\">\n");
            data(xml, "family", node.family().label());
            data(xml, "path", node.path());
            data(xml, "centrality", String.format(Locale.ROOT, "%.6f", score));
            data(xml, "inCycle", String.valueOf(inCycle.contains(node.id())));
            xml.append("    </node>\n");
        }

        int index = 0;
        for (Edge edge : snapshot.graph().edges()) {
            xml.append("    <edge id=\"e").append(index++)
                    .append("\" source=\"").append(escape(edge.source().value()))
                    .append("\" target=\"").append(escape(edge.target().value())).append("\">\n");
            data(xml, "kind", edge.kind().label());
            xml.append("    </edge>\n");
        }

        xml.append("  </graph>\n");
        xml.append("</graphml>\n");
        return xml.toString();
    }

    private static void data(StringBuilder xml, String key, String value) {
        xml.append("      <data key=\"").append(key).append("\">")
                .append(escape(value)).append("</data>\n");
    }

    static String escape(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
