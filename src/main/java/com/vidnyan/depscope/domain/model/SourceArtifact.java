package com.vidnyan.depscope.domain.model;

/**
 * One addressable unit declared by a source file: a whole module file,
 * or a single block of a resource file.
 *
 * @param id canonical address
 * @param family artifact family
 * @param relativePath file the artifact was declared in
 * @param text raw text of the artifact
 * @param firstLine 1-based line of {@code text} inside the file
 * @param aggregate true for package aggregates such as {@code __init__.py}
 */
public record SourceArtifact(
    ArtifactId id,
    ArtifactFamily family,
    String relativePath,
    String text,
    int firstLine,
    boolean aggregate
) {

    public static SourceArtifact module(ArtifactId id, ArtifactFamily family, String relativePath,
                                        String text, boolean aggregate) {
        return new SourceArtifact(id, family, relativePath, text, 1, aggregate);
    }

    /**
     * Convert a line inside {@code text} to a line inside the file.
     */
    public int fileLine(int localLine) {
        return firstLine + localLine - 1;
    }

    public Location location(int localLine) {
        return Location.at(relativePath, fileLine(localLine));
    }
}
