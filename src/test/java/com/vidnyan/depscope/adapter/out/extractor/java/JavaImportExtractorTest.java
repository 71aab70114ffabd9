package com.vidnyan.depscope.adapter.out.extractor.java;

import com.vidnyan.depscope.application.port.out.ReferenceExtractor.ExtractionOutcome;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.Reference;
import com.vidnyan.depscope.domain.model.ReferenceKind;
import com.vidnyan.depscope.domain.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaImportExtractorTest {

    private final JavaImportExtractor extractor = new JavaImportExtractor();

    @Test
    void declare_ShouldStripSourceRoot() {
        assertEquals(ArtifactId.of("com.acme.Foo"), declaredId("src/main/java/com/acme/Foo.java"));
        assertEquals(ArtifactId.of("com.acme.FooTest"), declaredId("module/src/test/java/com/acme/FooTest.java"));
        assertEquals(ArtifactId.of("com.acme.Bar"), declaredId("com/acme/Bar.java"));
    }

    @Test
    void declare_ShouldSkipDescriptorFiles() {
        SourceFile info = new SourceFile(Path.of("package-info.java"), "src/main/java/com/acme/package-info.java",
                "package com.acme;");

        assertTrue(extractor.declare(info).artifacts().isEmpty());
    }

    @Test
    void extract_ShouldMapImportsToReferences() {
        String source = """
                package com.acme;

                import java.util.List;
                import com.acme.util.*;
                import static com.acme.Constants.MAX;

                public class Foo {
                    List<String> names;
                }
                """;

        ExtractionOutcome outcome = extractor.extract(source, ArtifactId.of("com.acme.Foo"));

        List<Reference> references = outcome.references();
        assertEquals(3, references.size());
        assertEquals("java.util.List", references.get(0).specifier());
        assertEquals(ReferenceKind.DIRECT, references.get(0).kind());
        assertEquals(3, references.get(0).line());
        assertEquals("com.acme.util", references.get(1).specifier());
        assertEquals(ReferenceKind.WILDCARD, references.get(1).kind());
        assertEquals("com.acme.Constants.MAX", references.get(2).specifier());
        assertTrue(outcome.warnings().isEmpty());
    }

    @Test
    void extract_ShouldReportParseProblems() {
        ExtractionOutcome outcome = extractor.extract("import java.util.List;\nclass Broken {",
                ArtifactId.of("Broken"));

        assertFalse(outcome.warnings().isEmpty());
        assertTrue(outcome.warnings().get(0).message().startsWith("Parse problem"));
    }

    private ArtifactId declaredId(String relativePath) {
        SourceFile file = new SourceFile(Path.of(relativePath), relativePath, "class X {}");
        return extractor.declare(file).artifacts().get(0).id();
    }
}
