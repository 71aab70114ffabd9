package com.vidnyan.depscope.adapter.out.extractor.terraform;

import com.vidnyan.depscope.application.port.out.ReferenceExtractor;
import com.vidnyan.depscope.domain.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resource-style extractor for Terraform configuration.
 * <p>
 * A file declares one artifact per addressable top-level block:
 * <ul>
 *   <li>{@code resource "T" "N"} → {@code T.N}</li>
 *   <li>{@code data "T" "N"} → {@code data.T.N}</li>
 *   <li>{@code module "N"} → {@code module.N}</li>
 *   <li>{@code variable "N"} → {@code var.N}</li>
 *   <li>{@code output "N"} → {@code output.N}</li>
 *   <li>each attribute of a {@code locals} block → {@code local.NAME}</li>
 * </ul>
 * References are found in the masked block text, so literal strings and comments never match.
 * Indexed and splat references are normalised to the bare address and marked conditional.
 */
@Slf4j
@Component
public class TerraformResourceExtractor implements ReferenceExtractor {

    private static final Pattern REFERENCE = Pattern.compile(
            "(?<![\\w.\\-])([A-Za-z_][\\w-]*)\\.([A-Za-z_][\\w-]*)(?:\\.([A-Za-z_][\\w-]*))?");
    private static final Pattern ATTRIBUTE = Pattern.compile("([A-Za-z_][\\w-]*)[ \\t]*=(?!=)");
    private static final Set<String> IGNORED_ROOTS = Set.of("count", "each", "self", "path", "terraform");

    @Override
    public ArtifactFamily family() {
        return ArtifactFamily.TERRAFORM;
    }

    @Override
    public Declaration declare(SourceFile file) {
        String text = file.text();
        HclMasker.Masked masked = HclMasker.mask(text);
        String code = masked.text();
        List<AnalysisWarning> warnings = new ArrayList<>();
        for (HclMasker.Problem problem : masked.problems()) {
            warnings.add(AnalysisWarning.extraction(
                    Location.at(file.relativePath(), masked.lineAt(problem.offset())), null, problem.message()));
        }

        Map<ArtifactId, SourceArtifact> artifacts = new LinkedHashMap<>();
        BlockCollector collector = new BlockCollector(file, text, code, masked, artifacts, warnings);
        int i = 0;
        while (i < code.length()) {
            i = collector.next(i);
        }

        log.debug("{}: {} blocks, {} warnings", file.relativePath(), artifacts.size(), warnings.size());
        return new Declaration(List.copyOf(artifacts.values()), warnings);
    }

    @Override
    public ExtractionOutcome extract(SourceArtifact artifact) {
        HclMasker.Masked masked = HclMasker.mask(artifact.text());
        String code = masked.text();

        Map<String, Reference> references = new LinkedHashMap<>();
        List<AnalysisWarning> warnings = new ArrayList<>();
        Matcher matcher = REFERENCE.matcher(code);
        while (matcher.find()) {
            String root = matcher.group(1);
            String first = matcher.group(2);
            String second = matcher.group(3);
            int line = masked.lineAt(matcher.start());

            String address;
            int end;
            if (root.equals("data")) {
                if (second == null) {
                    warnings.add(AnalysisWarning.extraction(artifact.location(line), artifact.id(),
                            "Incomplete data source reference: 'data." + first + "'"));
                    continue;
                }
                address = "data." + first + "." + second;
                end = matcher.end(3);
            } else if (root.equals("var") || root.equals("local") || root.equals("module")) {
                address = root + "." + first;
                end = matcher.end(2);
            } else if (IGNORED_ROOTS.contains(root) || !root.contains("_")) {
                continue;
            } else {
                address = root + "." + first;
                end = matcher.end(2);
            }

            ReferenceKind kind = isIndexed(code, end) ? ReferenceKind.CONDITIONAL : ReferenceKind.DIRECT;
            references.putIfAbsent(kind + ":" + address,
                    new Reference(artifact.id(), address, kind, artifact.fileLine(line)));
        }

        log.debug("{}: {} references", artifact.id(), references.size());
        return new ExtractionOutcome(List.copyOf(references.values()), warnings);
    }

    /**
     * {@code addr[...]} or the legacy splat {@code addr.*}.
     */
    private static boolean isIndexed(String code, int end) {
        int i = end;
        while (i < code.length() && (code.charAt(i) == ' ' || code.charAt(i) == '\t')) {
            i++;
        }
        if (i >= code.length()) {
            return false;
        }
        return code.charAt(i) == '[' || code.startsWith(".*", i);
    }

    /**
     * Walks the top level of one masked file and declares its blocks.
     */
    private final class BlockCollector {

        private final SourceFile file;
        private final String text;
        private final String code;
        private final HclMasker.Masked masked;
        private final Map<ArtifactId, SourceArtifact> artifacts;
        private final List<AnalysisWarning> warnings;

        BlockCollector(SourceFile file, String text, String code, HclMasker.Masked masked,
                       Map<ArtifactId, SourceArtifact> artifacts, List<AnalysisWarning> warnings) {
            this.file = file;
            this.text = text;
            this.code = code;
            this.masked = masked;
            this.artifacts = artifacts;
            this.warnings = warnings;
        }

        /**
         * Consume one top-level construct starting at or after {@code i}; return the next offset.
         */
        int next(int i) {
            while (i < code.length() && Character.isWhitespace(code.charAt(i))) {
                i++;
            }
            if (i >= code.length()) {
                return i;
            }
            if (!isIdentifierStart(code.charAt(i))) {
                return skipStatement(i, code.length());
            }

            int start = i;
            int wordEnd = identifierEnd(i);
            String keyword = code.substring(start, wordEnd);
            List<String> labels = new ArrayList<>();
            int j = wordEnd;
            while (true) {
                j = skipBlanks(j);
                if (j >= code.length()) {
                    break;
                }
                char c = code.charAt(j);
                if (c == '"') {
                    int close = code.indexOf('"', j + 1);
                    if (close < 0) {
                        break;
                    }
                    labels.add(text.substring(j + 1, close));
                    j = close + 1;
                } else if (isIdentifierStart(c)) {
                    int end = identifierEnd(j);
                    labels.add(code.substring(j, end));
                    j = end;
                } else {
                    break;
                }
            }

            if (j >= code.length() || code.charAt(j) != '{') {
                return skipStatement(start, code.length());
            }

            int close = matchingBrace(j);
            if (close < 0) {
                warn(start, "Unterminated " + keyword + " block");
                close = code.length() - 1;
            }
            declareBlock(keyword, labels, start, j, close);
            return close + 1;
        }

        private void declareBlock(String keyword, List<String> labels, int start, int open, int close) {
            switch (keyword) {
                case "resource" -> declareLabelled(keyword, labels, 2, start, close, labels.size() == 2
                        ? labels.get(0) + "." + labels.get(1) : null);
                case "data" -> declareLabelled(keyword, labels, 2, start, close, labels.size() == 2
                        ? "data." + labels.get(0) + "." + labels.get(1) : null);
                case "module" -> declareLabelled(keyword, labels, 1, start, close, labels.size() == 1
                        ? "module." + labels.get(0) : null);
                case "variable" -> declareLabelled(keyword, labels, 1, start, close, labels.size() == 1
                        ? "var." + labels.get(0) : null);
                case "output" -> declareLabelled(keyword, labels, 1, start, close, labels.size() == 1
                        ? "output." + labels.get(0) : null);
                case "locals" -> declareLocals(open, close);
                default -> log.trace("{}: skipping '{}' block", file.relativePath(), keyword);
            }
        }

        private void declareLabelled(String keyword, List<String> labels, int expected,
                                     int start, int close, String address) {
            if (address == null) {
                warn(start, "Malformed " + keyword + " block: expected " + expected
                        + " label(s), found " + labels.size());
                return;
            }
            declare(address, start, Math.min(close + 1, text.length()));
        }

        private void declareLocals(int open, int close) {
            int k = open + 1;
            while (k < close) {
                while (k < close && Character.isWhitespace(code.charAt(k))) {
                    k++;
                }
                if (k >= close) {
                    break;
                }
                Matcher attribute = ATTRIBUTE.matcher(code).region(k, close);
                int end = skipStatement(k, close);
                if (attribute.lookingAt()) {
                    declare("local." + attribute.group(1), k, end);
                }
                k = end;
            }
        }

        private void declare(String address, int start, int end) {
            ArtifactId id = ArtifactId.of(address);
            if (artifacts.containsKey(id)) {
                warn(start, "Duplicate block address '" + address + "'");
                return;
            }
            artifacts.put(id, new SourceArtifact(id, ArtifactFamily.TERRAFORM, file.relativePath(),
                    text.substring(start, end), masked.lineAt(start), false));
        }

        /**
         * Skip to the end of the line, carrying over bracketed multi-line values.
         */
        private int skipStatement(int i, int limit) {
            int depth = 0;
            while (i < limit) {
                char c = code.charAt(i);
                if (c == '{' || c == '[' || c == '(') {
                    depth++;
                } else if (c == '}' || c == ']' || c == ')') {
                    depth--;
                } else if (c == '\n' && depth <= 0) {
                    return i + 1;
                }
                i++;
            }
            return limit;
        }

        private int matchingBrace(int open) {
            int depth = 0;
            for (int i = open; i < code.length(); i++) {
                char c = code.charAt(i);
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
            return -1;
        }

        private int skipBlanks(int i) {
            while (i < code.length() && (code.charAt(i) == ' ' || code.charAt(i) == '\t')) {
                i++;
            }
            return i;
        }

        private int identifierEnd(int i) {
            while (i < code.length() && (Character.isLetterOrDigit(code.charAt(i))
                    || code.charAt(i) == '_' || code.charAt(i) == '-')) {
                i++;
            }
            return i;
        }

        private void warn(int offset, String message) {
            warnings.add(AnalysisWarning.extraction(
                    Location.at(file.relativePath(), masked.lineAt(offset)), null, message));
        }
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }
}
