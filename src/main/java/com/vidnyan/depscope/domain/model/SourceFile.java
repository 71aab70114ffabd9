package com.vidnyan.depscope.domain.model;

import java.nio.file.Path;

/**
 * One file read from the analysis root.
 *
 * @param path absolute location on disk
 * @param relativePath path relative to the analysis root, always '/'-separated
 * @param text decoded file content
 */
public record SourceFile(
    Path path,
    String relativePath,
    String text
) {

    /**
     * File name without directories.
     */
    public String fileName() {
        int slash = relativePath.lastIndexOf('/');
        return slash >= 0 ? relativePath.substring(slash + 1) : relativePath;
    }
}
