package com.vidnyan.depscope.application.service;

import com.vidnyan.depscope.application.port.out.ReferenceExtractor;
import com.vidnyan.depscope.domain.exception.UnsupportedFamilyException;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Family → extractor table, filled from every {@link ReferenceExtractor} bean.
 * Adding a family means adding one extractor; nothing else changes.
 */
@Slf4j
@Component
public class ExtractorRegistry {

    private final Map<ArtifactFamily, ReferenceExtractor> extractors = new EnumMap<>(ArtifactFamily.class);

    public ExtractorRegistry(List<ReferenceExtractor> extractors) {
        for (ReferenceExtractor extractor : extractors) {
            ReferenceExtractor previous = this.extractors.putIfAbsent(extractor.family(), extractor);
            if (previous != null) {
                throw new IllegalStateException("Two extractors registered for " + extractor.family()
                        + ": " + previous.getName() + ", " + extractor.getName());
            }
        }
        log.debug("Extractor registry: {}", this.extractors.keySet());
    }

    public Optional<ReferenceExtractor> find(ArtifactFamily family) {
        return Optional.ofNullable(extractors.get(family));
    }

    /**
     * @throws UnsupportedFamilyException if no extractor handles the family
     */
    public ReferenceExtractor require(ArtifactFamily family) {
        return find(family).orElseThrow(() -> new UnsupportedFamilyException(String.valueOf(family)));
    }

    public Set<ArtifactFamily> families() {
        return Collections.unmodifiableSet(extractors.keySet());
    }
}
