package com.vidnyan.bridge.domain.scan;

import com.vidnyan.bridge.domain.model.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Splits a statement body into nodes with a left-to-right cursor.
 *
 * <p>At each cursor the matchers are tried in their fixed order; the first one that
 * recognizes its keyword wins. When none does, the text up to the next top-level
 * semicolon becomes an expression statement. Text left over without a terminating
 * semicolon is the body's final value and becomes an implicit return.
 */
@Slf4j
public class StatementDecomposer {

    // Tokens that continue an expression after a block, e.g. `if a { 1 } else { 2 }`.
    private static final Set<String> BLOCK_CONTINUATIONS = Set.of("else", "as");

    private final List<ConstructMatcher> matchers;
    private final BiFunction<ScanContext, String, Node> expressionStatement;
    private final BiFunction<ScanContext, String, Node> implicitReturn;

    public StatementDecomposer(
            List<ConstructMatcher> matchers,
            BiFunction<ScanContext, String, Node> expressionStatement,
            BiFunction<ScanContext, String, Node> implicitReturn
    ) {
        this.matchers = List.copyOf(matchers);
        this.expressionStatement = expressionStatement;
        this.implicitReturn = implicitReturn;
    }

    /**
     * Decompose {@code [start, end)} of the context's text into statement nodes.
     */
    public List<Node> decompose(ScanContext context, int start, int end) {
        String text = context.text();
        if (context.tooDeep()) {
            String body = text.substring(start, end).trim();
            if (body.isEmpty()) {
                return List.of();
            }
            context.report("Nesting deeper than " + context.maxNestingDepth()
                    + " levels kept as text", start);
            return List.of(expressionStatement.apply(context, body));
        }

        List<Node> statements = new ArrayList<>();
        context.enter();
        try {
            int cursor = start;
            while (true) {
                cursor = Lexical.skipTrivia(text, cursor, end);
                if (cursor >= end) {
                    break;
                }
                if (text.charAt(cursor) == ';') {
                    cursor++;
                    continue;
                }

                Optional<ScanMatch> matched = tryMatchers(context, cursor, end);
                if (matched.isPresent()) {
                    ScanMatch match = matched.get();
                    if (match.isMalformed()) {
                        context.report(match.problem(), cursor);
                        cursor = recover(text, cursor, end);
                    } else {
                        statements.add(match.node());
                        cursor = Math.max(match.end(), cursor + 1);
                    }
                    continue;
                }

                int statementEnd = expressionEnd(text, cursor, end);
                if (statementEnd == -1) {
                    String remaining = text.substring(cursor, end).trim();
                    if (!remaining.isEmpty() && !remaining.startsWith("}")) {
                        statements.add(implicitReturn.apply(context, remaining));
                    }
                    break;
                }
                String expression = text.substring(cursor, statementEnd).trim();
                if (!expression.isEmpty()) {
                    statements.add(expressionStatement.apply(context, expression));
                }
                cursor = statementEnd < end && text.charAt(statementEnd) == ';'
                        ? statementEnd + 1
                        : Math.max(statementEnd, cursor + 1);
            }
        } finally {
            context.exit();
        }
        return statements;
    }

    private Optional<ScanMatch> tryMatchers(ScanContext context, int cursor, int end) {
        for (ConstructMatcher matcher : matchers) {
            Optional<ScanMatch> result = matcher.match(context, cursor, end);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * End of an expression statement starting at {@code cursor}: the next top-level
     * semicolon, or the close of a block expression that is followed by a new
     * statement. -1 when the body ends first.
     */
    static int expressionEnd(String text, int cursor, int end) {
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, cursor, end, ';');
        int brace = DelimiterBalancer.indexOfTopLevel(text, cursor, end, '{');
        while (brace != -1 && (semicolon == -1 || brace < semicolon)) {
            Optional<DelimiterBalancer.Span> block = DelimiterBalancer.braces(text, brace, end);
            if (block.isEmpty()) {
                break;
            }
            int next = Lexical.skipTrivia(text, block.get().after(), end);
            if (next < end && startsNewStatement(text, next, end)) {
                return block.get().after();
            }
            brace = DelimiterBalancer.indexOfTopLevel(text, block.get().after(), end, '{');
        }
        return semicolon;
    }

    private static boolean startsNewStatement(String text, int at, int end) {
        char c = text.charAt(at);
        if (!Character.isLetter(c) && c != '_') {
            return false;
        }
        int wordEnd = at;
        while (wordEnd < end && Lexical.isIdentifierPart(text.charAt(wordEnd))) {
            wordEnd++;
        }
        return !BLOCK_CONTINUATIONS.contains(text.substring(at, wordEnd));
    }

    /**
     * Forward progress after a malformed construct: past the next top-level semicolon,
     * else past the next balanced block, else to the end of the body.
     */
    static int recover(String text, int cursor, int end) {
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, cursor, end, ';');
        int brace = DelimiterBalancer.indexOfTopLevel(text, cursor, end, '{');
        if (semicolon != -1 && (brace == -1 || semicolon < brace)) {
            return semicolon + 1;
        }
        if (brace != -1) {
            return DelimiterBalancer.braces(text, brace, end)
                    .map(DelimiterBalancer.Span::after)
                    .orElse(end);
        }
        log.debug("No recovery point after offset {}, skipping rest of body", cursor);
        return end;
    }
}
