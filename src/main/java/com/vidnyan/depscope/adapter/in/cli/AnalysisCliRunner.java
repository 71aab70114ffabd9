package com.vidnyan.depscope.adapter.in.cli;

import com.vidnyan.depscope.AnalysisProperties;
import com.vidnyan.depscope.application.port.in.AnalyzeDependenciesUseCase;
import com.vidnyan.depscope.application.port.in.AnalyzeDependenciesUseCase.AnalysisReport;
import com.vidnyan.depscope.application.port.in.AnalyzeDependenciesUseCase.AnalysisRequest;
import com.vidnyan.depscope.application.port.out.GraphExporter.ExportFormat;
import com.vidnyan.depscope.domain.analysis.CentralityScore;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * CLI Runner for a one-shot analysis.
 * Runs when depscope.analyze.path is set, then closes the context.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisCliRunner implements CommandLineRunner {

    private final AnalyzeDependenciesUseCase analyzeDependenciesUseCase;
    private final AnalysisProperties properties;
    private final ConfigurableApplicationContext context;

    @Value("${depscope.analyze.path:}")
    private String sourcePath;

    @Value("${depscope.analyze.family:python}")
    private String family;

    @Value("${depscope.analyze.format:json}")
    private String format;

    @Value("${depscope.analyze.output:}")
    private String output;

    @Override
    public void run(String... args) throws Exception {
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set depscope.analyze.path property.");
            return;
        }

        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║           depscope - dependency graph analysis               ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
            log.info("║ Family:    {}", family);
            log.info("╚══════════════════════════════════════════════════════════════╝");

            AnalysisRequest request = AnalysisRequest.of(Path.of(sourcePath), ArtifactFamily.fromName(family));
            AnalysisReport report = analyzeDependenciesUseCase.analyze(request);

            printResults(report);

            ExportFormat exportFormat = ExportFormat.fromName(format);
            String document = analyzeDependenciesUseCase.export(report, exportFormat);
            if (output == null || output.isBlank()) {
                System.out.print(document);
            } else {
                Path target = Path.of(output);
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                Files.writeString(target, document, StandardCharsets.UTF_8);
                log.info("Wrote {} export to {}", exportFormat, target);
            }

            log.info("");
            log.info("Analysis complete!");
        } finally {
            // Ensure application shuts down after analysis
            SpringApplication.exit(context, () -> 0);
        }
    }

    private void printResults(AnalysisReport report) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" ANALYSIS RESULTS");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Files read:          {}", report.stats().filesRead());
        log.info(" Artifacts:           {}", report.stats().artifactsDeclared());
        log.info(" References:          {}", report.stats().referencesExtracted());
        log.info(" Internal edges:      {}", report.stats().edges());
        log.info(" External references: {}", report.stats().externalReferences());
        log.info(" Warnings:            {}", report.warnings().size());
        log.info(" Duration:            {}ms", report.stats().totalDurationMs());
        log.info("───────────────────────────────────────────────────────────────");

        List<List<ArtifactId>> cycles = report.analysis().cycles();
        if (cycles.isEmpty()) {
            log.info(" No dependency cycles found.");
        } else {
            log.info(" CYCLES ({}):", cycles.size());
            for (List<ArtifactId> cycle : cycles) {
                log.info("   {}", cycle.stream().map(ArtifactId::value).collect(Collectors.joining(" ↔ ")));
            }
        }

        List<CentralityScore> topCentral = report.analysis().topCentral(properties.getSummaryTopN());
        if (!topCentral.isEmpty()) {
            log.info("");
            log.info(" MOST CENTRAL:");
            for (CentralityScore score : topCentral) {
                log.info("   {} (in {}, out {}, {})", score.id(), score.inDegree(), score.outDegree(),
                        String.format(Locale.ROOT, "%.4f", score.score()));
            }
        }
        log.info("═══════════════════════════════════════════════════════════════");
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
