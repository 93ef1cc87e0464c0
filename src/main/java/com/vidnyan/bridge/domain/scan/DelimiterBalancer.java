package com.vidnyan.bridge.domain.scan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Depth-counting delimiter scanner that ignores delimiters inside string literals,
 * char literals and comments.
 */
public final class DelimiterBalancer {

    private DelimiterBalancer() {
    }

    /**
     * Content between an opening delimiter and its matching closer.
     * {@code start} is just past the opener, {@code end} is the closer's offset.
     */
    public record Span(int start, int end) {

        public String content(String text) {
            return text.substring(start, end);
        }

        /**
         * Offset just past the closing delimiter.
         */
        public int after() {
            return end + 1;
        }
    }

    /**
     * Find the span enclosed by the delimiter at {@code openIndex}.
     * Returns empty ("no match") when {@code openIndex} does not hold {@code open}
     * or the text ends before depth returns to zero.
     */
    public static Optional<Span> extract(String text, int openIndex, char open, char close) {
        return extract(text, openIndex, text.length(), open, close);
    }

    public static Optional<Span> extract(String text, int openIndex, int end, char open, char close) {
        if (openIndex < 0 || openIndex >= end || text.charAt(openIndex) != open) {
            return Optional.empty();
        }
        int depth = 0;
        int i = openIndex;
        while (i < end) {
            int skipped = Lexical.skipLiteralOrComment(text, i, end);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = text.charAt(i);
            if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) {
                    return Optional.of(new Span(openIndex + 1, i));
                }
            }
            i++;
        }
        return Optional.empty();
    }

    public static Optional<Span> braces(String text, int openIndex, int end) {
        return extract(text, openIndex, end, '{', '}');
    }

    /**
     * First offset of {@code target} in {@code [from, end)} at bracket depth zero and
     * outside literals, or -1. The search stops at a closer with no matching opener,
     * which marks the end of the enclosing scope.
     */
    public static int indexOfTopLevel(String text, int from, int end, char target) {
        int depth = 0;
        int i = from;
        while (i < end) {
            int skipped = Lexical.skipLiteralOrComment(text, i, end);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = text.charAt(i);
            if (depth == 0 && c == target) {
                return i;
            }
            if (c == '{' || c == '(' || c == '[') {
                depth++;
            } else if (c == '}' || c == ')' || c == ']') {
                if (depth == 0) {
                    return -1;
                }
                depth--;
            }
            i++;
        }
        return -1;
    }

    /**
     * Split a type or field list in {@code [from, end)} at top-level occurrences of
     * {@code separator}. Angle brackets count as nesting here, so generic arguments
     * stay together. Parts are trimmed and empty parts dropped.
     */
    public static List<String> splitTopLevel(String text, int from, int end, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int partStart = from;
        int i = from;
        while (i < end) {
            int skipped = Lexical.skipLiteralOrComment(text, i, end);
            if (skipped != i) {
                i = skipped;
                continue;
            }
            char c = text.charAt(i);
            if (c == '{' || c == '(' || c == '[' || c == '<') {
                depth++;
            } else if (c == '}' || c == ')' || c == ']' || (c == '>' && (i == 0 || text.charAt(i - 1) != '-'))) {
                depth = Math.max(0, depth - 1);
            } else if (c == separator && depth == 0) {
                addPart(parts, text.substring(partStart, i));
                partStart = i + 1;
            }
            i++;
        }
        addPart(parts, text.substring(partStart, end));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }
}
