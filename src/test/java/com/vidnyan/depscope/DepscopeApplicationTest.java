package com.vidnyan.depscope;

import com.vidnyan.depscope.application.port.in.AnalyzeDependenciesUseCase;
import com.vidnyan.depscope.application.service.ExtractorRegistry;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class DepscopeApplicationTest {

    @Autowired
    private ExtractorRegistry extractorRegistry;

    @Autowired
    private AnalyzeDependenciesUseCase analyzeDependenciesUseCase;

    @Autowired
    private AnalysisProperties analysisProperties;

    @Test
    void contextLoads_WithEveryFamilyRegistered() {
        assertEquals(EnumSet.allOf(ArtifactFamily.class), extractorRegistry.families());
        assertNotNull(analyzeDependenciesUseCase);
        assertEquals(10, analysisProperties.getSummaryTopN());
        assertTrue(analysisProperties.getExcludedDirectories().contains("node_modules"));
    }
}
