package com.vidnyan.depscope.domain.model;

import java.util.Objects;

/**
 * Globally unique key of one parsed artifact.
 * Dotted path for module families ({@code pkg.sub.mod}),
 * {@code type.name} for resource families ({@code aws_instance.bastion}).
 */
public record ArtifactId(String value) implements Comparable<ArtifactId> {

    public ArtifactId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("ArtifactId must not be blank");
        }
    }

    public static ArtifactId of(String value) {
        return new ArtifactId(value);
    }

    /**
     * Parent in the dotted address space, or empty for a single-segment id.
     */
    public String parent() {
        int lastDot = value.lastIndexOf('.');
        return lastDot > 0 ? value.substring(0, lastDot) : "";
    }

    @Override
    public int compareTo(ArtifactId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
