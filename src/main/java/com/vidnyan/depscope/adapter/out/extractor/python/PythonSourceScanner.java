package com.vidnyan.depscope.adapter.out.extractor.python;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Python source into logical lines with comments removed and
 * string literals collapsed to empty quotes. Bracketed expressions and
 * backslash continuations are joined onto one logical line.
 */
final class PythonSourceScanner {

    private PythonSourceScanner() {
    }

    record LogicalLine(String text, int line) {}

    record Problem(int line, String message) {}

    record ScanResult(List<LogicalLine> lines, List<Problem> problems) {}

    static ScanResult scan(String source) {
        List<LogicalLine> lines = new ArrayList<>();
        List<Problem> problems = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int line = 1;
        int startLine = 1;
        int depth = 0;
        boolean started = false;
        int i = 0;
        int n = source.length();

        while (i < n) {
            char c = source.charAt(i);

            if (c == '#') {
                while (i < n && source.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }

            if (c == '"' || c == '\'') {
                if (!started) {
                    startLine = line;
                    started = true;
                }
                boolean triple = i + 2 < n && source.charAt(i + 1) == c && source.charAt(i + 2) == c;
                int openedAt = line;
                int j = triple ? i + 3 : i + 1;
                boolean closed = false;
                while (j < n) {
                    char s = source.charAt(j);
                    if (s == '\\' && j + 1 < n) {
                        if (source.charAt(j + 1) == '\n') {
                            line++;
                        }
                        j += 2;
                        continue;
                    }
                    if (s == '\n') {
                        if (!triple) {
                            break;
                        }
                        line++;
                    }
                    if (s == c && (!triple || (j + 2 < n && source.charAt(j + 1) == c && source.charAt(j + 2) == c))) {
                        j += triple ? 3 : 1;
                        closed = true;
                        break;
                    }
                    j++;
                }
                if (!closed) {
                    problems.add(new Problem(openedAt, triple
                            ? "Unterminated triple-quoted string"
                            : "Unterminated string literal"));
                }
                current.append(c).append(c);
                i = j;
                continue;
            }

            if (c == '\\' && i + 1 < n && source.charAt(i + 1) == '\n') {
                current.append(' ');
                line++;
                i += 2;
                continue;
            }

            if (c == '\n') {
                line++;
                if (depth > 0) {
                    current.append(' ');
                } else {
                    flush(current, startLine, lines);
                    started = false;
                }
                i++;
                continue;
            }

            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
                depth--;
            }

            if (!started && !Character.isWhitespace(c)) {
                startLine = line;
                started = true;
            }
            current.append(c);
            i++;
        }
        flush(current, startLine, lines);
        return new ScanResult(lines, problems);
    }

    private static void flush(StringBuilder current, int startLine, List<LogicalLine> lines) {
        String text = current.toString().strip();
        if (!text.isEmpty()) {
            lines.add(new LogicalLine(text, startLine));
        }
        current.setLength(0);
    }
}
