package com.vidnyan.depscope.domain.graph;

import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.Reference;
import com.vidnyan.depscope.domain.model.ReferenceKind;

import java.util.*;

/**
 * Lookup table of known artifact ids used to resolve reference specifiers.
 * Resolution is exact first, then a family-specific fallback.
 */
final class ArtifactIndex {

    private final Set<String> known;
    private final Map<String, List<ArtifactId>> membersByParent;

    ArtifactIndex(Collection<ArtifactId> ids) {
        this.known = new HashSet<>();
        Map<String, List<ArtifactId>> members = new HashMap<>();
        for (ArtifactId id : ids) {
            known.add(id.value());
            members.computeIfAbsent(id.parent(), k -> new ArrayList<>()).add(id);
        }
        members.values().forEach(Collections::sort);
        this.membersByParent = members;
    }

    /**
     * Resolve a reference to zero or more known artifacts, sorted.
     * An empty result means the reference is external.
     */
    List<ArtifactId> resolve(Reference reference, ArtifactFamily family) {
        String specifier = reference.specifier();
        if (known.contains(specifier)) {
            return List.of(ArtifactId.of(specifier));
        }
        return switch (family) {
            case PYTHON -> longestKnownPrefix(specifier);
            case JAVA -> reference.kind() == ReferenceKind.WILDCARD
                    ? membersByParent.getOrDefault(specifier, List.of())
                    : longestKnownPrefix(specifier);
            case TERRAFORM -> List.of();
        };
    }

    /**
     * Strip trailing dotted segments until a known id remains:
     * {@code pkg.mod.name} → {@code pkg.mod} → {@code pkg}.
     */
    private List<ArtifactId> longestKnownPrefix(String specifier) {
        String candidate = specifier;
        int lastDot = candidate.lastIndexOf('.');
        while (lastDot > 0) {
            candidate = candidate.substring(0, lastDot);
            if (known.contains(candidate)) {
                return List.of(ArtifactId.of(candidate));
            }
            lastDot = candidate.lastIndexOf('.');
        }
        return List.of();
    }
}
