package com.vidnyan.depscope.domain.model;

import java.util.Objects;

/**
 * A raw dependency mention extracted from one artifact, before resolution.
 * Immutable value object.
 *
 * @param externalSpecifier what is recorded as the external reference when the
 *                          specifier resolves to no artifact; for {@code from m import n}
 *                          this is the module path {@code m}
 */
public record Reference(
    ArtifactId source,
    String specifier,
    ReferenceKind kind,
    int line,
    String externalSpecifier
) {

    public Reference {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(specifier, "specifier");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(externalSpecifier, "externalSpecifier");
    }

    public Reference(ArtifactId source, String specifier, ReferenceKind kind, int line) {
        this(source, specifier, kind, line, specifier);
    }
}
