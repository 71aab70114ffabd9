package com.vidnyan.depscope.domain.model;

import java.util.Comparator;

/**
 * Non-fatal problem recorded during an analysis.
 * Warnings travel with the result so partial analyses stay usable.
 */
public record AnalysisWarning(
    WarningType type,
    Location location,
    ArtifactId artifact,
    String message
) {

    public static final Comparator<AnalysisWarning> ORDER = Comparator
            .comparing((AnalysisWarning w) -> w.location().filePath())
            .thenComparingInt(w -> w.location().line())
            .thenComparing(AnalysisWarning::type)
            .thenComparing(AnalysisWarning::message);

    public enum WarningType {
        ARTIFACT_READ,              // file could not be read and was skipped
        EXTRACTION,                 // malformed reference syntax inside an artifact
        DUPLICATE_ARTIFACT,         // two files declare the same address
        AMBIGUOUS_SELF_REFERENCE    // artifact refers to itself through an index or count
    }

    public static AnalysisWarning read(String filePath, String message) {
        return new AnalysisWarning(WarningType.ARTIFACT_READ, Location.of(filePath), null, message);
    }

    public static AnalysisWarning extraction(Location location, ArtifactId artifact, String message) {
        return new AnalysisWarning(WarningType.EXTRACTION, location, artifact, message);
    }

    /**
     * Format for logs.
     */
    public String format() {
        String subject = artifact != null ? " [" + artifact + "]" : "";
        return type + " " + location.format() + subject + ": " + message;
    }
}
