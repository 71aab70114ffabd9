package com.vidnyan.depscope.adapter.out.filesystem;

import com.vidnyan.depscope.AnalysisProperties;
import com.vidnyan.depscope.application.port.out.ArtifactReader;
import com.vidnyan.depscope.domain.exception.RootNotFoundException;
import com.vidnyan.depscope.domain.model.AnalysisWarning;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.SourceFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/**
 * Scans an analysis root for source files of one artifact family.
 * Excluded directories are pruned, binary files skipped, unreadable files reported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemArtifactReader implements ArtifactReader {

    private static final int SNIFF_BYTES = 8192;

    private final AnalysisProperties properties;

    @Override
    public ArtifactSource open(Path root, ArtifactFamily family) {
        if (root == null || !Files.isDirectory(root)) {
            throw new RootNotFoundException(root);
        }
        return new FileSystemArtifactSource(root.toAbsolutePath().normalize(), family);
    }

    /**
     * Walk the root and return matching files sorted by relative path,
     * plus warnings for entries the walk could not visit.
     */
    ScanResult scanSourceFiles(Path root, ArtifactFamily family) {
        Set<String> excluded = new HashSet<>(properties.getExcludedDirectories());
        List<Path> files = new ArrayList<>();
        List<AnalysisWarning> warnings = new ArrayList<>();

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && excluded.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && family.matches(file.getFileName().toString())) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Cannot visit {}: {}", file, e.getMessage());
                    warnings.add(AnalysisWarning.read(relativize(root, file), "Cannot visit: " + e.getMessage()));
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Walk of {} stopped early: {}", root, e.getMessage());
            warnings.add(AnalysisWarning.read(".", "Directory walk failed: " + e.getMessage()));
        }

        files.sort(Comparator.comparing(p -> relativize(root, p)));
        return new ScanResult(files, warnings);
    }

    /**
     * Read one file. Returns {@code null} for binary content, which is skipped silently.
     */
    ReadOutcome read(Path root, Path file) {
        String relative = relativize(root, file);
        try {
            long size = Files.size(file);
            if (size > properties.getMaxFileSizeBytes()) {
                log.warn("Skipping {}: {} bytes exceeds limit", relative, size);
                return ReadOutcome.failed(AnalysisWarning.read(relative,
                        "File size " + size + " exceeds limit of " + properties.getMaxFileSizeBytes() + " bytes"));
            }
            byte[] bytes = Files.readAllBytes(file);
            if (isBinary(bytes)) {
                log.debug("Skipping binary file {}", relative);
                return null;
            }
            return ReadOutcome.of(new SourceFile(file, relative, decode(bytes)));
        } catch (CharacterCodingException e) {
            log.warn("Skipping {}: not valid UTF-8", relative);
            return ReadOutcome.failed(AnalysisWarning.read(relative, "Not valid UTF-8 text"));
        } catch (IOException e) {
            log.warn("Skipping {}: {}", relative, e.getMessage());
            return ReadOutcome.failed(AnalysisWarning.read(relative, "Unreadable: " + e.getMessage()));
        }
    }

    private static boolean isBinary(byte[] bytes) {
        int limit = Math.min(bytes.length, SNIFF_BYTES);
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static String decode(byte[] bytes) throws CharacterCodingException {
        String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        // Drop a leading byte order mark
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    static String relativize(Path root, Path file) {
        String relative = root.relativize(file).toString();
        return relative.replace(file.getFileSystem().getSeparator(), "/");
    }

    record ScanResult(List<Path> files, List<AnalysisWarning> warnings) {}

    /**
     * Restartable view: each iterator re-walks the tree and reads lazily.
     */
    private final class FileSystemArtifactSource implements ArtifactSource {

        private final Path root;
        private final ArtifactFamily family;

        private FileSystemArtifactSource(Path root, ArtifactFamily family) {
            this.root = root;
            this.family = family;
        }

        @Override
        public Path root() {
            return root;
        }

        @Override
        public ArtifactFamily family() {
            return family;
        }

        @Override
        public Iterator<ReadOutcome> iterator() {
            ScanResult scan = scanSourceFiles(root, family);
            log.debug("Found {} {} files under {}", scan.files().size(), family, root);
            return new ReadIterator(root, scan);
        }
    }

    private final class ReadIterator implements Iterator<ReadOutcome> {

        private final Path root;
        private final Iterator<AnalysisWarning> walkWarnings;
        private final Iterator<Path> files;
        private ReadOutcome next;

        private ReadIterator(Path root, ScanResult scan) {
            this.root = root;
            this.walkWarnings = scan.warnings().iterator();
            this.files = scan.files().iterator();
        }

        @Override
        public boolean hasNext() {
            while (next == null) {
                if (walkWarnings.hasNext()) {
                    next = ReadOutcome.failed(walkWarnings.next());
                } else if (files.hasNext()) {
                    next = read(root, files.next());
                } else {
                    return false;
                }
            }
            return true;
        }

        @Override
        public ReadOutcome next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ReadOutcome outcome = next;
            next = null;
            return outcome;
        }
    }
}
