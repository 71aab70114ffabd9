package com.vidnyan.depscope.application.port.out;

import com.vidnyan.depscope.domain.model.AnalysisWarning;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.SourceFile;

import java.nio.file.Path;

/**
 * Port for enumerating source files of one artifact family under an analysis root.
 * Implemented by adapters (e.g., file system adapter).
 */
public interface ArtifactReader {

    /**
     * Open a lazy, restartable view of the family's files under {@code root}.
     *
     * @throws com.vidnyan.depscope.domain.exception.RootNotFoundException
     *         if the root does not exist or is not a directory
     */
    ArtifactSource open(Path root, ArtifactFamily family);

    /**
     * Lazy sequence of read outcomes. Every call to {@code iterator()} starts a
     * fresh walk; file contents are read one at a time as the iterator advances.
     */
    interface ArtifactSource extends Iterable<ReadOutcome> {

        Path root();

        ArtifactFamily family();
    }

    /**
     * Either a successfully read file or the warning explaining why it was skipped.
     */
    record ReadOutcome(
        SourceFile file,
        AnalysisWarning warning
    ) {

        public static ReadOutcome of(SourceFile file) {
            return new ReadOutcome(file, null);
        }

        public static ReadOutcome failed(AnalysisWarning warning) {
            return new ReadOutcome(null, warning);
        }

        public boolean isRead() {
            return file != null;
        }
    }
}
