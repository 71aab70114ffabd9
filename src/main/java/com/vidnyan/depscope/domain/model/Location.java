package com.vidnyan.depscope.domain.model;

/**
 * Position inside an analyzed file. Line 0 means the whole file.
 */
public record Location(
    String filePath,
    int line
) {

    public static Location of(String filePath) {
        return new Location(filePath, 0);
    }

    public static Location at(String filePath, int line) {
        return new Location(filePath, line);
    }

    /**
     * Format as readable string.
     */
    public String format() {
        return line > 0 ? filePath + ":" + line : filePath;
    }
}
