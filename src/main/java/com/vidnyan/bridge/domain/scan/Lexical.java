package com.vidnyan.bridge.domain.scan;

/**
 * Character-level helpers shared by the scanners: trivia skipping, keyword tests
 * and literal/comment skipping. All positions are offsets into the full source
 * text and every method stays within {@code [from, end)}.
 */
public final class Lexical {

    private static final int MAX_CHAR_LITERAL = 12;

    private Lexical() {
    }

    public static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Skip whitespace and comments starting at {@code from}.
     */
    public static int skipTrivia(String text, int from, int end) {
        int i = from;
        while (i < end) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (startsComment(text, i, end)) {
                i = skipComment(text, i, end);
            } else {
                break;
            }
        }
        return i;
    }

    /**
     * True when {@code keyword} starts at {@code at} and is not the prefix of a longer identifier.
     */
    public static boolean atKeyword(String text, int at, int end, String keyword) {
        int after = at + keyword.length();
        if (after > end || !text.startsWith(keyword, at)) {
            return false;
        }
        if (at > 0 && isIdentifierPart(text.charAt(at - 1))) {
            return false;
        }
        return after == end || !isIdentifierPart(text.charAt(after));
    }

    /**
     * If a string literal, char literal or comment starts at {@code at}, return the
     * offset just past it; otherwise return {@code at}. Unterminated literals run to {@code end}.
     */
    public static int skipLiteralOrComment(String text, int at, int end) {
        char c = text.charAt(at);
        if (c == '"') {
            return skipString(text, at + 1, end);
        }
        if (c == '\'') {
            return skipCharLiteral(text, at, end);
        }
        if (c == 'r' && (at == 0 || !isIdentifierPart(text.charAt(at - 1)))) {
            int raw = skipRawString(text, at, end);
            if (raw != at) {
                return raw;
            }
        }
        if (startsComment(text, at, end)) {
            return skipComment(text, at, end);
        }
        return at;
    }

    static boolean startsComment(String text, int at, int end) {
        return at + 1 < end && text.charAt(at) == '/'
                && (text.charAt(at + 1) == '/' || text.charAt(at + 1) == '*');
    }

    static int skipComment(String text, int at, int end) {
        if (text.charAt(at + 1) == '/') {
            int newline = text.indexOf('\n', at);
            return newline == -1 || newline >= end ? end : newline + 1;
        }
        int close = text.indexOf("*/", at + 2);
        return close == -1 || close + 2 > end ? end : close + 2;
    }

    // The quote toggle is suspended while an escape sequence is in progress.
    private static int skipString(String text, int from, int end) {
        boolean escaped = false;
        for (int i = from; i < end; i++) {
            char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '"') {
                return i + 1;
            }
        }
        return end;
    }

    // 'x' and '\n' are literals; 'a in lifetimes and labels is not.
    private static int skipCharLiteral(String text, int at, int end) {
        if (at + 1 < end && text.charAt(at + 1) == '\\') {
            boolean escaped = true;
            int limit = Math.min(end, at + MAX_CHAR_LITERAL);
            for (int i = at + 2; i < limit; i++) {
                char c = text.charAt(i);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '\'') {
                    return i + 1;
                }
            }
            return at;
        }
        if (at + 2 < end && text.charAt(at + 2) == '\'' && text.charAt(at + 1) != '\'') {
            return at + 3;
        }
        return at;
    }

    private static int skipRawString(String text, int at, int end) {
        int hashes = 0;
        int i = at + 1;
        while (i < end && text.charAt(i) == '#') {
            hashes++;
            i++;
        }
        if (i >= end || text.charAt(i) != '"') {
            return at;
        }
        String terminator = "\"" + "#".repeat(hashes);
        int close = text.indexOf(terminator, i + 1);
        return close == -1 || close + terminator.length() > end ? end : close + terminator.length();
    }
}
