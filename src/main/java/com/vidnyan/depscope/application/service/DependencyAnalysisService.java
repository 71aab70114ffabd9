package com.vidnyan.depscope.application.service;

import com.vidnyan.depscope.AnalysisProperties;
import com.vidnyan.depscope.application.port.in.AnalyzeDependenciesUseCase;
import com.vidnyan.depscope.application.port.out.ArtifactReader;
import com.vidnyan.depscope.application.port.out.GraphExporter;
import com.vidnyan.depscope.application.port.out.GraphExporter.ExportFormat;
import com.vidnyan.depscope.application.port.out.ReferenceExtractor;
import com.vidnyan.depscope.domain.analysis.AnalysisResult;
import com.vidnyan.depscope.domain.analysis.CentralityScore;
import com.vidnyan.depscope.domain.analysis.GraphAnalyzer;
import com.vidnyan.depscope.domain.analysis.GraphSummarizer;
import com.vidnyan.depscope.domain.analysis.GraphSummary;
import com.vidnyan.depscope.domain.exception.AnalysisCancelledException;
import com.vidnyan.depscope.domain.exception.NodeNotFoundException;
import com.vidnyan.depscope.domain.graph.DependencyGraphBuilder;
import com.vidnyan.depscope.domain.graph.ExtractedArtifact;
import com.vidnyan.depscope.domain.graph.Node;
import com.vidnyan.depscope.domain.model.AnalysisWarning;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.Location;
import com.vidnyan.depscope.domain.model.SourceArtifact;
import com.vidnyan.depscope.domain.model.SourceFile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main application service that orchestrates the analysis workflow.
 * Implements the primary use case.
 */
@Slf4j
@Service
public class DependencyAnalysisService implements AnalyzeDependenciesUseCase {

    private final ArtifactReader artifactReader;
    private final ExtractorRegistry extractorRegistry;
    private final Map<ExportFormat, GraphExporter> exporters = new EnumMap<>(ExportFormat.class);
    private final AnalysisProperties properties;

    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
    private final GraphAnalyzer graphAnalyzer = new GraphAnalyzer();
    private final GraphSummarizer graphSummarizer = new GraphSummarizer(graphAnalyzer);

    public DependencyAnalysisService(ArtifactReader artifactReader,
                                     ExtractorRegistry extractorRegistry,
                                     List<GraphExporter> exporters,
                                     AnalysisProperties properties) {
        this.artifactReader = artifactReader;
        this.extractorRegistry = extractorRegistry;
        this.properties = properties;
        exporters.forEach(exporter -> this.exporters.putIfAbsent(exporter.format(), exporter));
    }

    @Override
    public AnalysisReport analyze(AnalysisRequest request) {
        Instant startTime = Instant.now();
        log.info("Starting {} analysis of: {}", request.family().label(), request.root());

        ReferenceExtractor extractor = extractorRegistry.require(request.family());
        ArtifactReader.ArtifactSource source = artifactReader.open(request.root(), request.family());

        // Step 1: Read files and extract references on the worker pool
        log.info("Step 1: Reading and extracting with {} ({} workers)...",
                extractor.getName(), properties.getWorkerCount());
        List<AnalysisWarning> warnings = new ArrayList<>();
        List<ExtractedArtifact> extracted = new ArrayList<>();
        int filesRead = extractAll(source, extractor, extracted, warnings);

        int referenceCount = extracted.stream().mapToInt(e -> e.references().size()).sum();
        log.info("Extracted: {} artifacts, {} references from {} files",
                extracted.size(), referenceCount, filesRead);

        // Step 2: Build graph
        log.info("Step 2: Building dependency graph...");
        DependencyGraphBuilder.BuildResult built = graphBuilder.build(extracted);
        warnings.addAll(built.warnings());
        log.info("Built: {} nodes, {} edges, {} external references",
                built.graph().stats().nodeCount(),
                built.graph().stats().edgeCount(),
                built.externalReferences().size());

        // Step 3: Analyze
        log.info("Step 3: Analyzing graph...");
        AnalysisResult analysis = graphAnalyzer.analyze(built.graph());
        log.info("Found {} cycles", analysis.cycles().size());

        warnings.sort(AnalysisWarning.ORDER);
        warnings.forEach(w -> log.warn("  {}", w.format()));

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                filesRead,
                extracted.size(),
                referenceCount,
                built.graph().stats().edgeCount(),
                built.externalReferences().size(),
                totalDuration.toMillis()
        );

        log.info("Analysis complete: {} nodes, {} warnings in {}ms",
                built.graph().stats().nodeCount(), warnings.size(), stats.totalDurationMs());

        return new AnalysisReport(
                request.root(),
                request.family(),
                built.graph(),
                built.externalReferences(),
                analysis,
                List.copyOf(warnings),
                stats);
    }

    @Override
    public List<ArtifactId> dependenciesOf(AnalysisReport report, ArtifactId id, boolean transitive) {
        return graphAnalyzer.dependenciesOf(report.graph(), id, transitive);
    }

    @Override
    public List<ArtifactId> dependentsOf(AnalysisReport report, ArtifactId id, boolean transitive) {
        return graphAnalyzer.dependentsOf(report.graph(), id, transitive);
    }

    @Override
    public NodeReport describe(AnalysisReport report, ArtifactId id) {
        Node node = report.graph().node(id).orElseThrow(() -> new NodeNotFoundException(id));
        return new NodeReport(
                node,
                graphAnalyzer.dependenciesOf(report.graph(), id, false),
                graphAnalyzer.dependenciesOf(report.graph(), id, true),
                graphAnalyzer.dependentsOf(report.graph(), id, false),
                graphAnalyzer.dependentsOf(report.graph(), id, true),
                report.analysis().centralityOf(id).orElse(new CentralityScore(id, 0, 0, 0.0)),
                report.analysis().cyclesContaining(id),
                report.externalReferencesOf(id));
    }

    @Override
    public String export(AnalysisReport report, ExportFormat format) {
        GraphExporter exporter = exporters.get(format);
        if (exporter == null) {
            throw new IllegalArgumentException("No exporter registered for format: " + format);
        }
        log.debug("Exporting {} graph as {}", report.family().label(), format);
        // Only the markdown digest renders a summary
        GraphSummary summary = format == ExportFormat.MARKDOWN ? summarize(report) : null;
        return exporter.export(new GraphExporter.Snapshot(
                report.family(),
                report.graph(),
                report.externalReferences(),
                report.analysis(),
                summary));
    }

    @Override
    public GraphSummary summarize(AnalysisReport report) {
        return summarize(report, properties.getSummaryTopN());
    }

    @Override
    public GraphSummary summarize(AnalysisReport report, int topN) {
        return graphSummarizer.summarize(report.family(), report.graph(),
                report.externalReferences(), report.analysis(), topN);
    }

    /**
     * Submit one extraction task per file as the reader yields it, then collect in path order.
     *
     * @return number of files read
     */
    private int extractAll(ArtifactReader.ArtifactSource source,
                           ReferenceExtractor extractor,
                           List<ExtractedArtifact> extracted,
                           List<AnalysisWarning> warnings) {
        ExecutorService executor = Executors.newFixedThreadPool(properties.getWorkerCount(), workerThreads());
        List<PendingFile> pending = new ArrayList<>();
        try {
            for (ArtifactReader.ReadOutcome outcome : source) {
                if (Thread.currentThread().isInterrupted()) {
                    cancel(pending, 0);
                    throw new AnalysisCancelledException("Analysis cancelled while reading " + source.root(), null);
                }
                if (!outcome.isRead()) {
                    warnings.add(outcome.warning());
                    continue;
                }
                SourceFile file = outcome.file();
                pending.add(new PendingFile(file.relativePath(),
                        executor.submit(() -> extractFile(extractor, file))));
            }

            for (int i = 0; i < pending.size(); i++) {
                PendingFile next = pending.get(i);
                try {
                    FileExtraction result = next.future().get();
                    extracted.addAll(result.artifacts());
                    warnings.addAll(result.warnings());
                } catch (InterruptedException e) {
                    cancel(pending, i);
                    Thread.currentThread().interrupt();
                    throw new AnalysisCancelledException("Analysis cancelled after " + i + " of "
                            + pending.size() + " files", e);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("Error extracting {}: {}", next.relativePath(), cause.getMessage());
                    warnings.add(AnalysisWarning.extraction(Location.of(next.relativePath()), null,
                            "Extraction failed: " + cause));
                }
            }
        } finally {
            executor.shutdown();
        }
        return pending.size();
    }

    private static FileExtraction extractFile(ReferenceExtractor extractor, SourceFile file) {
        ReferenceExtractor.Declaration declaration = extractor.declare(file);
        List<AnalysisWarning> warnings = new ArrayList<>(declaration.warnings());
        List<ExtractedArtifact> artifacts = new ArrayList<>(declaration.artifacts().size());
        for (SourceArtifact artifact : declaration.artifacts()) {
            ReferenceExtractor.ExtractionOutcome outcome = extractor.extract(artifact);
            artifacts.add(new ExtractedArtifact(artifact, outcome.references()));
            warnings.addAll(outcome.warnings());
        }
        return new FileExtraction(artifacts, warnings);
    }

    /**
     * Tasks already running finish their current file; the rest never start.
     */
    private static void cancel(List<PendingFile> pending, int from) {
        for (int i = from; i < pending.size(); i++) {
            pending.get(i).future().cancel(false);
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "depscope-extract-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record PendingFile(String relativePath, Future<FileExtraction> future) {}

    private record FileExtraction(List<ExtractedArtifact> artifacts, List<AnalysisWarning> warnings) {}
}
