package com.vidnyan.depscope.domain.model;

import com.vidnyan.depscope.domain.exception.UnsupportedFamilyException;

import java.util.List;
import java.util.Locale;

/**
 * Artifact families the engine knows how to address.
 * Each family needs a registered extractor strategy to be analyzable.
 */
public enum ArtifactFamily {
    PYTHON(List.of(".py")),
    JAVA(List.of(".java")),
    TERRAFORM(List.of(".tf"));

    private final List<String> extensions;

    ArtifactFamily(List<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * Check whether a file name carries one of this family's extensions.
     */
    public boolean matches(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    /**
     * Lower-case name used in exported documents.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a family selector, accepting a few common aliases.
     */
    public static ArtifactFamily fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnsupportedFamilyException(String.valueOf(name));
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "PYTHON", "PY" -> PYTHON;
            case "JAVA" -> JAVA;
            case "TERRAFORM", "TF", "HCL" -> TERRAFORM;
            default -> throw new UnsupportedFamilyException(name);
        };
    }
}
