package com.vidnyan.depscope.adapter.out.export;

import com.vidnyan.depscope.AnalysisProperties;
import com.vidnyan.depscope.application.port.out.GraphExporter;
import com.vidnyan.depscope.domain.analysis.CentralityScore;
import com.vidnyan.depscope.domain.analysis.GraphAnalyzer;
import com.vidnyan.depscope.domain.analysis.GraphSummarizer;
import com.vidnyan.depscope.domain.analysis.GraphSummary;
import com.vidnyan.depscope.domain.model.ArtifactId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Markdown digest of a {@link GraphSummary}, meant as context for a language model.
 * Pure formatting: every sentence is a fixed template filled with counts and ids.
 * A snapshot without a summary is summarized here with the configured top-N.
 */
@Component
@RequiredArgsConstructor
public class MarkdownContextExporter implements GraphExporter {

    private final AnalysisProperties properties;

    @Override
    public ExportFormat format() {
        return ExportFormat.MARKDOWN;
    }

    @Override
    public String export(Snapshot snapshot) {
        GraphSummary summary = snapshot.summary() != null
                ? snapshot.summary()
                : new GraphSummarizer(new GraphAnalyzer()).summarize(snapshot.family(), snapshot.graph(),
                        snapshot.externalReferences(), snapshot.analysisOrEmpty(), properties.getSummaryTopN());

        StringBuilder md = new StringBuilder();
        md.append("# Dependency Analysis: ").append(summary.family().label()).append("\n\n");

        md.append("## Overview\n\n");
        md.append("- Artifacts: ").append(summary.nodeCount()).append('\n');
        md.append("- Internal dependencies: ").append(summary.edgeCount()).append('\n');
        md.append("- External references: ").append(summary.externalReferenceCount()).append('\n');
        md.append("- Dependency cycles: ").append(summary.cycleCount()).append("\n\n");

        md.append("## Dependency Cycles\n\n");
        if (summary.cycles().isEmpty()) {
            md.append("No dependency cycles found.\n\n");
        } else {
            for (List<ArtifactId> cycle : summary.cycles()) {
                md.append("- ").append(cycle.stream()
                        .map(id -> "`" + id + "`")
                        .collect(Collectors.joining(" ↔ "))).append('\n');
            }
            md.append('\n');
        }

        md.append("## Most Central Artifacts\n\n");
        if (summary.topCentral().isEmpty()) {
            md.append("None.\n\n");
        } else {
            md.append("| Artifact | In | Out | Centrality |\n");
            md.append("|---|---:|---:|---:|\n");
            for (CentralityScore score : summary.topCentral()) {
                md.append("| `").append(score.id()).append("` | ")
                        .append(score.inDegree()).append(" | ")
                        .append(score.outDegree()).append(" | ")
                        .append(String.format(Locale.ROOT, "%.4f", score.score())).append(" |\n");
            }
            md.append('\n');
        }

        appendCounts(md, "Most Depended-Upon", summary.mostDependedUpon(), "dependents");
        appendCounts(md, "Most Dependencies", summary.mostDependencies(), "dependencies");

        md.append("## External Dependencies\n\n");
        if (summary.topExternal().isEmpty()) {
            md.append("None.\n");
        } else {
            for (GraphSummary.SpecifierCount external : summary.topExternal()) {
                md.append("- `").append(external.specifier()).append("`: referenced by ")
                        .append(external.count()).append(external.count() == 1 ? " artifact\n" : " artifacts\n");
            }
        }
        return md.toString();
    }

    private static void appendCounts(StringBuilder md, String title, List<GraphSummary.NodeCount> counts,
                                     String unit) {
        md.append("## ").append(title).append("\n\n");
        if (counts.isEmpty()) {
            md.append("None.\n\n");
            return;
        }
        for (GraphSummary.NodeCount count : counts) {
            md.append("- `").append(count.id()).append("`: ").append(count.count())
                    .append(' ').append(unit).append('\n');
        }
        md.append('\n');
    }
}
