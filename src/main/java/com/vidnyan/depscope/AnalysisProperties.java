package com.vidnyan.depscope;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.yml or application.properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "depscope.analysis")
public class AnalysisProperties {

    /**
     * Number of extraction worker threads.
     * Default: available processors
     */
    private int workerCount = Runtime.getRuntime().availableProcessors();

    /**
     * Directory names never descended into.
     */
    private List<String> excludedDirectories = new ArrayList<>();

    /**
     * Files larger than this are skipped with a read warning.
     */
    private long maxFileSizeBytes = 2L * 1024 * 1024;

    /**
     * Size of the ranked lists in graph summaries.
     */
    private int summaryTopN = 10;

    @PostConstruct
    public void init() {
        if (workerCount < 1) {
            workerCount = 1;
        }
        if (summaryTopN < 0) {
            summaryTopN = 0;
        }
        // Set default exclusions if not configured
        if (excludedDirectories.isEmpty()) {
            excludedDirectories.addAll(List.of(
                    ".git", ".hg", ".svn", ".idea", "__pycache__", ".terraform",
                    "node_modules", ".venv", "venv", "target", "build"));
        }
    }

    /**
     * Properties with defaults applied, for use outside the Spring context.
     */
    public static AnalysisProperties defaults() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.init();
        return properties;
    }
}
