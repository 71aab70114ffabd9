package com.vidnyan.depscope.adapter.out.extractor.python;

import com.vidnyan.depscope.application.port.out.ReferenceExtractor;
import com.vidnyan.depscope.domain.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Import-statement extractor for Python modules.
 * <p>
 * Handles plain, aliased, multi-name, parenthesised, wildcard and relative imports,
 * including imports that follow a compound-statement header on the same line
 * ({@code try: import ujson as json}).
 * Relative imports are normalised against the importing module's package, so
 * {@code from .util import x} inside {@code pkg.mod} becomes {@code pkg.util.x}.
 * <p>
 * {@code from m import n} is resolved as {@code m.n} (submodule first, then module),
 * but an unresolved one is recorded externally as the module path {@code m}.
 */
@Slf4j
@Component
public class PythonImportExtractor implements ReferenceExtractor {

    private static final String INIT_MODULE = "__init__";
    private static final Pattern DOTTED_NAME = Pattern.compile("[A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)*");
    private static final Pattern IMPORT = Pattern.compile("^import(?:\\s+(.*))?$");
    private static final Pattern FROM_IMPORT = Pattern.compile("^from\\s+(\\.*)\\s*([\\w.]*)\\s+import\\b\\s*(.*)$");
    private static final Pattern ALIAS = Pattern.compile("^(\\S+)(?:\\s+as\\s+[A-Za-z_]\\w*)?$");
    private static final Pattern COMPOUND_HEADER = Pattern.compile(
            "^(?:if|elif|else|try|except|finally|with|for|while|def|class|async)\\b.*");

    @Override
    public ArtifactFamily family() {
        return ArtifactFamily.PYTHON;
    }

    /**
     * One artifact per file: {@code a/b/c.py} → {@code a.b.c}, {@code a/b/__init__.py} → {@code a.b}.
     */
    @Override
    public Declaration declare(SourceFile file) {
        String path = file.relativePath();
        String withoutExtension = path.substring(0, path.length() - ".py".length());
        List<String> segments = new ArrayList<>(Arrays.asList(withoutExtension.split("/")));
        boolean aggregate = INIT_MODULE.equals(segments.get(segments.size() - 1));
        if (aggregate) {
            segments.remove(segments.size() - 1);
        }
        if (segments.isEmpty()) {
            return new Declaration(List.of(), List.of(AnalysisWarning.extraction(
                    Location.of(path), null, "Package initializer at the analysis root has no module address")));
        }

        ArtifactId id = ArtifactId.of(String.join(".", segments));
        return Declaration.of(SourceArtifact.module(id, family(), path, file.text(), aggregate));
    }

    @Override
    public ExtractionOutcome extract(SourceArtifact artifact) {
        PythonSourceScanner.ScanResult scan = PythonSourceScanner.scan(artifact.text());
        Map<String, Reference> references = new LinkedHashMap<>();
        List<AnalysisWarning> warnings = new ArrayList<>();

        for (PythonSourceScanner.Problem problem : scan.problems()) {
            warnings.add(AnalysisWarning.extraction(artifact.location(problem.line()), artifact.id(), problem.message()));
        }

        for (PythonSourceScanner.LogicalLine logical : scan.lines()) {
            for (String statement : logical.text().split(";")) {
                String trimmed = stripCompoundHeaders(statement.strip());
                if (trimmed.startsWith("import") || trimmed.startsWith("from")) {
                    parseStatement(trimmed, logical.line(), artifact, references, warnings);
                }
            }
        }

        log.debug("{}: {} imports, {} warnings", artifact.id(), references.size(), warnings.size());
        return new ExtractionOutcome(List.copyOf(references.values()), warnings);
    }

    private void parseStatement(String statement, int line, SourceArtifact artifact,
                                Map<String, Reference> references, List<AnalysisWarning> warnings) {
        Matcher from = FROM_IMPORT.matcher(statement);
        if (from.matches()) {
            parseFromImport(from.group(1).length(), from.group(2), from.group(3), line, artifact, references, warnings);
            return;
        }

        Matcher plain = IMPORT.matcher(statement);
        if (plain.matches()) {
            String names = plain.group(1);
            if (names == null || names.isBlank()) {
                warn(warnings, artifact, line, "Import statement without module names");
                return;
            }
            for (String item : names.split(",")) {
                String module = stripAlias(item);
                if (module == null || !DOTTED_NAME.matcher(module).matches()) {
                    warn(warnings, artifact, line, "Invalid module name in import: '" + item.strip() + "'");
                    continue;
                }
                add(references, artifact, module, ReferenceKind.DIRECT, line, module);
            }
            return;
        }

        // "from x" / "import" prefixes of longer identifiers are ordinary code
        if (statement.matches("^from\\s.*") || statement.equals("from")) {
            warn(warnings, artifact, line, "Malformed from-import statement: '" + statement + "'");
        }
    }

    private void parseFromImport(int level, String module, String names, int line, SourceArtifact artifact,
                                 Map<String, Reference> references, List<AnalysisWarning> warnings) {
        if (!module.isEmpty() && !DOTTED_NAME.matcher(module).matches()) {
            warn(warnings, artifact, line, "Invalid module path in from-import: '" + module + "'");
            return;
        }
        if (level == 0 && module.isEmpty()) {
            warn(warnings, artifact, line, "From-import without a module path");
            return;
        }

        String base = module;
        if (level > 0) {
            Optional<String> resolved = resolveRelative(artifact, level, module);
            if (resolved.isEmpty()) {
                warn(warnings, artifact, line, "Relative import beyond top-level package: '"
                        + ".".repeat(level) + module + "'");
                return;
            }
            base = resolved.get();
        }

        String list = names.strip();
        if (list.startsWith("(")) {
            list = list.endsWith(")") ? list.substring(1, list.length() - 1) : list.substring(1);
        }
        if (list.isBlank()) {
            warn(warnings, artifact, line, "From-import without imported names");
            return;
        }
        if (list.strip().equals("*")) {
            if (base.isEmpty()) {
                warn(warnings, artifact, line, "Wildcard import needs a module path");
                return;
            }
            add(references, artifact, base, ReferenceKind.WILDCARD, line, base);
            return;
        }

        for (String item : list.split(",")) {
            if (item.isBlank()) {
                continue; // trailing comma
            }
            String name = stripAlias(item);
            if (name == null || !DOTTED_NAME.matcher(name).matches() || name.contains(".")) {
                warn(warnings, artifact, line, "Invalid imported name: '" + item.strip() + "'");
                continue;
            }
            if (base.isEmpty()) {
                add(references, artifact, name, ReferenceKind.DIRECT, line, name);
            } else {
                add(references, artifact, base + "." + name, ReferenceKind.DIRECT, line, base);
            }
        }
    }

    /**
     * Anchor a relative import at the importing module's package.
     * One dot is the package itself, each further dot climbs one level.
     */
    private Optional<String> resolveRelative(SourceArtifact artifact, int level, String module) {
        String pkg = artifact.aggregate() ? artifact.id().value() : artifact.id().parent();
        List<String> parts = new ArrayList<>(pkg.isEmpty() ? List.of() : Arrays.asList(pkg.split("\\.")));
        int climb = level - 1;
        if (climb > parts.size() || (climb == parts.size() && climb > 0)) {
            return Optional.empty();
        }
        parts = parts.subList(0, parts.size() - climb);
        if (!module.isEmpty()) {
            parts = new ArrayList<>(parts);
            parts.add(module);
        }
        return Optional.of(String.join(".", parts));
    }

    /**
     * Drop leading {@code keyword ...:} headers, so {@code if TYPE_CHECKING: from app import models}
     * is parsed as the import it guards.
     */
    private static String stripCompoundHeaders(String statement) {
        String body = statement;
        while (COMPOUND_HEADER.matcher(body).matches()) {
            int colon = headerColon(body);
            if (colon < 0) {
                return body;
            }
            body = body.substring(colon + 1).strip();
        }
        return body;
    }

    /**
     * First colon outside brackets that is not part of {@code :=}.
     */
    private static int headerColon(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth--;
            } else if (c == ':' && depth == 0 && (i + 1 >= text.length() || text.charAt(i + 1) != '=')) {
                return i;
            }
        }
        return -1;
    }

    private static String stripAlias(String item) {
        Matcher m = ALIAS.matcher(item.strip());
        return m.matches() ? m.group(1) : null;
    }

    private static void add(Map<String, Reference> references, SourceArtifact artifact,
                            String specifier, ReferenceKind kind, int line, String externalSpecifier) {
        references.putIfAbsent(kind + ":" + specifier,
                new Reference(artifact.id(), specifier, kind, artifact.fileLine(line), externalSpecifier));
    }

    private static void warn(List<AnalysisWarning> warnings, SourceArtifact artifact, int line, String message) {
        warnings.add(AnalysisWarning.extraction(artifact.location(line), artifact.id(), message));
    }
}
