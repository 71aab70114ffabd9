package com.vidnyan.depscope.adapter.out.extractor.terraform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Blanks out everything in HCL text that cannot hold a reference.
 * <p>
 * Comments and literal string content become spaces; the expressions inside
 * {@code ${...}} and {@code %{...}} template sequences are kept verbatim, and
 * heredocs are treated as templates. Quote characters and newlines are preserved,
 * so offsets and line numbers of the masked text match the original.
 */
final class HclMasker {

    private static final Pattern HEREDOC = Pattern.compile("<<-?([A-Za-z_][A-Za-z0-9_]*)[ \\t]*\\r?\\n");

    private final String src;
    private final char[] out;
    private final int n;
    private final List<Problem> problems = new ArrayList<>();

    private HclMasker(String src) {
        this.src = src;
        this.out = src.toCharArray();
        this.n = src.length();
    }

    record Problem(int offset, String message) {}

    /**
     * Masked text plus any unterminated constructs found on the way.
     */
    record Masked(String text, List<Problem> problems, int[] lineStarts) {

        /**
         * 1-based line of an offset.
         */
        int lineAt(int offset) {
            int found = Arrays.binarySearch(lineStarts, offset);
            return found >= 0 ? found + 1 : -found - 1;
        }
    }

    static Masked mask(String source) {
        HclMasker masker = new HclMasker(source);
        masker.scanCode(0, false);
        return new Masked(new String(masker.out), List.copyOf(masker.problems), lineStarts(source));
    }

    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Scan expression code. Inside a template sequence, stops at the closing
     * brace and returns its index; otherwise runs to the end.
     */
    private int scanCode(int i, boolean inTemplate) {
        int depth = 0;
        while (i < n) {
            char c = src.charAt(i);
            if (c == '#' || (c == '/' && peek(i + 1) == '/')) {
                int eol = src.indexOf('\n', i);
                int end = eol < 0 ? n : eol;
                blank(i, end);
                i = end;
                continue;
            }
            if (c == '/' && peek(i + 1) == '*') {
                int close = src.indexOf("*/", i + 2);
                if (close < 0) {
                    problems.add(new Problem(i, "Unterminated block comment"));
                    blank(i, n);
                    return n;
                }
                blank(i, close + 2);
                i = close + 2;
                continue;
            }
            if (c == '"') {
                i = scanQuoted(i + 1);
                continue;
            }
            if (c == '<' && peek(i + 1) == '<') {
                Matcher heredoc = HEREDOC.matcher(src).region(i, n);
                if (heredoc.lookingAt()) {
                    i = scanHeredoc(i, heredoc);
                    continue;
                }
            }
            if (inTemplate) {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    if (depth == 0) {
                        return i;
                    }
                    depth--;
                }
            }
            i++;
        }
        return n;
    }

    /**
     * Scan a quoted string starting just after its opening quote.
     * Returns the index after the closing quote.
     */
    private int scanQuoted(int i) {
        int opened = i - 1;
        while (i < n) {
            char c = src.charAt(i);
            if (c == '\\') {
                blank(i, Math.min(i + 2, n));
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            if (c == '\n') {
                problems.add(new Problem(opened, "Unterminated string literal"));
                return i;
            }
            if (isEscapedTemplate(i)) {
                blank(i, i + 3);
                i += 3;
                continue;
            }
            if (isTemplateStart(i)) {
                i = scanTemplateSequence(i);
                continue;
            }
            out[i] = ' ';
            i++;
        }
        problems.add(new Problem(opened, "Unterminated string literal"));
        return n;
    }

    private int scanHeredoc(int start, Matcher header) {
        String marker = header.group(1);
        int bodyStart = header.end();
        blank(start, bodyStart);

        int lineStart = bodyStart;
        int terminator = -1;
        while (lineStart < n) {
            int eol = src.indexOf('\n', lineStart);
            int lineEnd = eol < 0 ? n : eol;
            if (src.substring(lineStart, lineEnd).strip().equals(marker)) {
                terminator = lineStart;
                break;
            }
            lineStart = lineEnd + 1;
        }

        int bodyEnd = terminator < 0 ? n : terminator;
        int i = bodyStart;
        while (i < bodyEnd) {
            if (isEscapedTemplate(i)) {
                blank(i, i + 3);
                i += 3;
            } else if (isTemplateStart(i)) {
                i = scanTemplateSequence(i);
            } else {
                blank(i, i + 1);
                i++;
            }
        }

        if (terminator < 0) {
            problems.add(new Problem(start, "Unterminated heredoc '" + marker + "'"));
            return n;
        }
        int eol = src.indexOf('\n', Math.max(i, terminator));
        int end = eol < 0 ? n : eol;
        blank(Math.max(i, terminator), end);
        return end;
    }

    /**
     * Blank the delimiters of a template sequence and keep its expression.
     */
    private int scanTemplateSequence(int i) {
        blank(i, i + 2);
        int close = scanCode(i + 2, true);
        if (close >= n) {
            problems.add(new Problem(i, "Unterminated template interpolation"));
            return n;
        }
        blank(close, close + 1);
        return close + 1;
    }

    private boolean isTemplateStart(int i) {
        char c = src.charAt(i);
        return (c == '$' || c == '%') && peek(i + 1) == '{';
    }

    private boolean isEscapedTemplate(int i) {
        char c = src.charAt(i);
        return (c == '$' || c == '%') && peek(i + 1) == c && peek(i + 2) == '{';
    }

    private char peek(int i) {
        return i < n ? src.charAt(i) : '\0';
    }

    private void blank(int from, int to) {
        for (int k = from; k < Math.min(to, n); k++) {
            if (out[k] != '\n') {
                out[k] = ' ';
            }
        }
    }
}
