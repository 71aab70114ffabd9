package com.vidnyan.depscope.adapter.out.extractor.java;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.vidnyan.depscope.application.port.out.ReferenceExtractor;
import com.vidnyan.depscope.domain.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Import-declaration extractor for Java compilation units, backed by JavaParser.
 * <p>
 * Addresses follow the source layout: {@code src/main/java/com/acme/Foo.java} → {@code com.acme.Foo}.
 * On-demand imports ({@code com.acme.*}) become wildcard references on the package.
 */
@Slf4j
@Component
public class JavaImportExtractor implements ReferenceExtractor {

    private static final List<String> SOURCE_ROOTS = List.of("src/main/java/", "src/test/java/", "src/");
    private static final Set<String> DESCRIPTOR_FILES = Set.of("package-info.java", "module-info.java");

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    @Override
    public ArtifactFamily family() {
        return ArtifactFamily.JAVA;
    }

    @Override
    public Declaration declare(SourceFile file) {
        if (DESCRIPTOR_FILES.contains(file.fileName())) {
            return Declaration.none();
        }
        String path = file.relativePath();
        String relative = path;
        for (String root : SOURCE_ROOTS) {
            int at = relative.indexOf(root);
            if (at == 0 || (at > 0 && relative.charAt(at - 1) == '/')) {
                relative = relative.substring(at + root.length());
                break;
            }
        }
        String typeName = relative.substring(0, relative.length() - ".java".length()).replace('/', '.');
        return Declaration.of(SourceArtifact.module(ArtifactId.of(typeName), family(), path, file.text(), false));
    }

    @Override
    public ExtractionOutcome extract(SourceArtifact artifact) {
        // JavaParser instances are not thread-safe; one per artifact
        JavaParser parser = new JavaParser(configuration);
        ParseResult<CompilationUnit> result = parser.parse(artifact.text());

        List<AnalysisWarning> warnings = new ArrayList<>();
        for (Problem problem : result.getProblems()) {
            int line = problem.getLocation()
                    .flatMap(range -> range.getBegin().getRange())
                    .map(range -> range.begin.line)
                    .orElse(1);
            warnings.add(AnalysisWarning.extraction(artifact.location(line), artifact.id(),
                    "Parse problem: " + problem.getVerboseMessage()));
        }

        Optional<CompilationUnit> unit = result.getResult();
        if (unit.isEmpty()) {
            log.debug("{}: no compilation unit, {} problems", artifact.id(), warnings.size());
            return new ExtractionOutcome(List.of(), warnings);
        }

        Map<String, Reference> references = new LinkedHashMap<>();
        for (ImportDeclaration declaration : unit.get().getImports()) {
            String name = declaration.getNameAsString();
            ReferenceKind kind = declaration.isAsterisk() ? ReferenceKind.WILDCARD : ReferenceKind.DIRECT;
            int line = declaration.getBegin().map(position -> position.line).orElse(1);
            references.putIfAbsent(kind + ":" + name,
                    new Reference(artifact.id(), name, kind, artifact.fileLine(line)));
        }

        log.debug("{}: {} imports", artifact.id(), references.size());
        return new ExtractionOutcome(List.copyOf(references.values()), warnings);
    }
}
