package com.vidnyan.depscope.application.port.out;

import com.vidnyan.depscope.domain.model.AnalysisWarning;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.Reference;
import com.vidnyan.depscope.domain.model.SourceArtifact;
import com.vidnyan.depscope.domain.model.SourceFile;

import java.util.List;

/**
 * Extraction strategy for one artifact family.
 * Implementations are pure and stateless so files can be processed concurrently.
 */
public interface ReferenceExtractor {

    /**
     * Family handled by this strategy.
     */
    ArtifactFamily family();

    /**
     * Split a file into the artifacts it declares and assign their addresses.
     */
    Declaration declare(SourceFile file);

    /**
     * Extract the dependency references of one artifact.
     * Deterministic for identical input; never performs I/O.
     */
    ExtractionOutcome extract(SourceArtifact artifact);

    /**
     * Extract from raw text addressed by {@code id}, treated as a non-aggregate artifact.
     */
    default ExtractionOutcome extract(String rawText, ArtifactId id) {
        return extract(SourceArtifact.module(id, family(), id.value(), rawText, false));
    }

    /**
     * Get the strategy name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Artifacts declared by one file.
     */
    record Declaration(
        List<SourceArtifact> artifacts,
        List<AnalysisWarning> warnings
    ) {

        public Declaration {
            artifacts = List.copyOf(artifacts);
            warnings = List.copyOf(warnings);
        }

        public static Declaration of(SourceArtifact artifact) {
            return new Declaration(List.of(artifact), List.of());
        }

        public static Declaration none() {
            return new Declaration(List.of(), List.of());
        }
    }

    /**
     * References of one artifact plus any malformed-syntax warnings.
     */
    record ExtractionOutcome(
        List<Reference> references,
        List<AnalysisWarning> warnings
    ) {

        public ExtractionOutcome {
            references = List.copyOf(references);
            warnings = List.copyOf(warnings);
        }
    }
}
