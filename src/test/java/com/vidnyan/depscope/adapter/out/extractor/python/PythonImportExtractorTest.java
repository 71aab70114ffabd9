package com.vidnyan.depscope.adapter.out.extractor.python;

import com.vidnyan.depscope.application.port.out.ReferenceExtractor.Declaration;
import com.vidnyan.depscope.application.port.out.ReferenceExtractor.ExtractionOutcome;
import com.vidnyan.depscope.domain.model.ArtifactFamily;
import com.vidnyan.depscope.domain.model.ArtifactId;
import com.vidnyan.depscope.domain.model.Reference;
import com.vidnyan.depscope.domain.model.ReferenceKind;
import com.vidnyan.depscope.domain.model.SourceArtifact;
import com.vidnyan.depscope.domain.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonImportExtractorTest {

    private final PythonImportExtractor extractor = new PythonImportExtractor();

    @Test
    void declare_ShouldMapPathToDottedModule() {
        Declaration declaration = extractor.declare(file("pkg/sub/mod.py", "pass\n"));

        assertEquals(1, declaration.artifacts().size());
        SourceArtifact artifact = declaration.artifacts().get(0);
        assertEquals(ArtifactId.of("pkg.sub.mod"), artifact.id());
        assertEquals(ArtifactFamily.PYTHON, artifact.family());
        assertFalse(artifact.aggregate());
    }

    @Test
    void declare_ShouldTreatInitAsPackageAggregate() {
        SourceArtifact artifact = extractor.declare(file("pkg/sub/__init__.py", "")).artifacts().get(0);

        assertEquals(ArtifactId.of("pkg.sub"), artifact.id());
        assertTrue(artifact.aggregate());
    }

    @Test
    void declare_ShouldWarnForInitAtRoot() {
        Declaration declaration = extractor.declare(file("__init__.py", ""));

        assertTrue(declaration.artifacts().isEmpty());
        assertEquals(1, declaration.warnings().size());
    }

    @Test
    void extract_ShouldHandlePlainAliasedAndMultiNameImports() {
        String source = """
                import os
                import numpy as np, pkg.util
                from collections import OrderedDict, defaultdict as dd
                """;

        List<String> specifiers = specifiers(extractor.extract(source, ArtifactId.of("app")));

        assertEquals(List.of("os", "numpy", "pkg.util", "collections.OrderedDict", "collections.defaultdict"),
                specifiers);
    }

    @Test
    void extract_ShouldJoinParenthesisedImportsAndKeepFirstLine() {
        String source = """
                x = 1
                from pkg.models import (
                    User,
                    Group,  # trailing comment
                )
                """;

        ExtractionOutcome outcome = extractor.extract(source, ArtifactId.of("app"));

        assertEquals(List.of("pkg.models.User", "pkg.models.Group"), specifiers(outcome));
        assertTrue(outcome.references().stream().allMatch(r -> r.line() == 2));
        assertTrue(outcome.warnings().isEmpty());
    }

    @Test
    void extract_ShouldRecordModulePathAsExternalSpecifierOfFromImports() {
        ExtractionOutcome outcome = extractor.extract("from typing import List, Dict\nimport os.path\n",
                ArtifactId.of("app"));

        assertEquals(List.of("typing.List", "typing.Dict", "os.path"), specifiers(outcome));
        assertEquals(List.of("typing", "typing", "os.path"),
                outcome.references().stream().map(Reference::externalSpecifier).toList());
    }

    @Test
    void extract_ShouldFindImportsAfterCompoundStatementHeaders() {
        String source = """
                try: import ujson as json
                except ImportError: import json
                if TYPE_CHECKING: from app import models
                def load(path: str) -> dict: import yaml
                while (n := next(it)): import gc
                else: pass
                """;

        ExtractionOutcome outcome = extractor.extract(source, ArtifactId.of("m"));

        assertEquals(List.of("ujson", "json", "app.models", "yaml", "gc"), specifiers(outcome));
        assertEquals(List.of(1, 2, 3, 4, 5), outcome.references().stream().map(Reference::line).toList());
        assertTrue(outcome.warnings().isEmpty());
    }

    @Test
    void extract_ShouldNotTreatKeywordPrefixedNamesAsHeaders() {
        ExtractionOutcome outcome = extractor.extract("elsewhere = {'a': 1}\nclass_map: dict = {}\nimport ok\n",
                ArtifactId.of("m"));

        assertEquals(List.of("ok"), specifiers(outcome));
        assertTrue(outcome.warnings().isEmpty());
    }

    @Test
    void extract_ShouldMarkWildcardImports() {
        ExtractionOutcome outcome = extractor.extract("from pkg.helpers import *\n", ArtifactId.of("app"));

        assertEquals(1, outcome.references().size());
        Reference reference = outcome.references().get(0);
        assertEquals("pkg.helpers", reference.specifier());
        assertEquals(ReferenceKind.WILDCARD, reference.kind());
    }

    @Test
    void extract_ShouldResolveRelativeImportsAgainstPackage() {
        SourceArtifact module = SourceArtifact.module(ArtifactId.of("pkg.sub.mod"), ArtifactFamily.PYTHON,
                "pkg/sub/mod.py", "from . import sibling\nfrom .util import helper\nfrom ..core import Base\n",
                false);

        List<String> specifiers = specifiers(extractor.extract(module));

        assertEquals(List.of("pkg.sub.sibling", "pkg.sub.util.helper", "pkg.core.Base"), specifiers);
    }

    @Test
    void extract_ShouldResolveRelativeImportsInsidePackageInit() {
        SourceArtifact init = SourceArtifact.module(ArtifactId.of("pkg"), ArtifactFamily.PYTHON,
                "pkg/__init__.py", "from .core import Engine\n", true);

        assertEquals(List.of("pkg.core.Engine"), specifiers(extractor.extract(init)));
    }

    @Test
    void extract_ShouldWarnForRelativeImportBeyondTopLevel() {
        SourceArtifact module = SourceArtifact.module(ArtifactId.of("pkg.mod"), ArtifactFamily.PYTHON,
                "pkg/mod.py", "from ... import x\nimport os\n", false);

        ExtractionOutcome outcome = extractor.extract(module);

        assertEquals(List.of("os"), specifiers(outcome));
        assertEquals(1, outcome.warnings().size());
        assertEquals(1, outcome.warnings().get(0).location().line());
        assertEquals(ArtifactId.of("pkg.mod"), outcome.warnings().get(0).artifact());
    }

    @Test
    void extract_ShouldIgnoreImportsInsideStringsAndComments() {
        String source = """
                # import commented
                doc = \"\"\"
                import fake
                \"\"\"
                s = "from nowhere import thing"
                import real
                """;

        assertEquals(List.of("real"), specifiers(extractor.extract(source, ArtifactId.of("app"))));
    }

    @Test
    void extract_ShouldWarnOnMalformedStatementsAndContinue() {
        String source = """
                from pkg import
                import 3d
                import ok
                """;

        ExtractionOutcome outcome = extractor.extract(source, ArtifactId.of("app"));

        assertEquals(List.of("ok"), specifiers(outcome));
        assertEquals(2, outcome.warnings().size());
    }

    @Test
    void extract_ShouldReportUnterminatedString() {
        ExtractionOutcome outcome = extractor.extract("import a\nx = 'oops\nimport b\n", ArtifactId.of("app"));

        assertEquals(List.of("a", "b"), specifiers(outcome));
        assertEquals(1, outcome.warnings().size());
        assertEquals(2, outcome.warnings().get(0).location().line());
    }

    @Test
    void extract_ShouldDeduplicateRepeatedImports() {
        ExtractionOutcome outcome = extractor.extract("import os\nimport os\n", ArtifactId.of("app"));

        assertEquals(1, outcome.references().size());
        assertEquals(1, outcome.references().get(0).line());
    }

    @Test
    void extract_ShouldBeDeterministic() {
        String source = "import b\nfrom a import (x, y)\nimport c; import d\n";

        assertEquals(extractor.extract(source, ArtifactId.of("m")), extractor.extract(source, ArtifactId.of("m")));
    }

    private static SourceFile file(String relativePath, String text) {
        return new SourceFile(Path.of(relativePath), relativePath, text);
    }

    private static List<String> specifiers(ExtractionOutcome outcome) {
        return outcome.references().stream().map(Reference::specifier).toList();
    }
}
