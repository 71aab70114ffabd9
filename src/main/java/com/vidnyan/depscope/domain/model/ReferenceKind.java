package com.vidnyan.depscope.domain.model;

import java.util.Locale;

/**
 * How a reference was written in the source artifact.
 */
public enum ReferenceKind {
    DIRECT,         // plain import or attribute reference
    WILDCARD,       // blanket import of everything a module exports
    CONDITIONAL;    // indexed, splat or count-driven reference

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ReferenceKind fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
