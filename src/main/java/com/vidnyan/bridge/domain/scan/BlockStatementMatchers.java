package com.vidnyan.bridge.domain.scan;

import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Statement matchers whose shape is shared by the brace-bodied dialects:
 * conditionals, pre-condition loops, unconditional loops and returns.
 */
public final class BlockStatementMatchers {

    private BlockStatementMatchers() {
    }

    /**
     * {@code if <condition> { ... } [else if ... | else { ... }]} into CONDITION, THEN and ELSE.
     */
    public static ConstructMatcher conditional(NodeType type) {
        return new ConstructMatcher() {
            @Override
            public Optional<ScanMatch> match(ScanContext context, int cursor, int end) {
                if (!Lexical.atKeyword(context.text(), cursor, end, "if")) {
                    return Optional.empty();
                }
                return Optional.of(matchIf(context, cursor, end));
            }

            /**
             * Walks an {@code else if} chain iteratively and links the branches from the last one back.
             */
            private ScanMatch matchIf(ScanContext context, int cursor, int end) {
                String text = context.text();
                List<Node.Builder> chain = new ArrayList<>();
                List<Node> otherwise = null;
                int at = cursor;
                int after;
                while (true) {
                    Optional<Header> header = header(context, at + 2, end);
                    if (header.isEmpty()) {
                        return ScanMatch.malformed("Malformed if statement: expected a condition followed by '{ ... }'");
                    }
                    DelimiterBalancer.Span then = header.get().body();
                    chain.add(context.node(type)
                            .value("CONDITION", context.textNode(header.get().condition()))
                            .statements("THEN", context.decompose(then.start(), then.end())));

                    after = then.after();
                    int next = Lexical.skipTrivia(text, after, end);
                    if (!Lexical.atKeyword(text, next, end, "else")) {
                        break;
                    }
                    int branch = Lexical.skipTrivia(text, next + 4, end);
                    if (Lexical.atKeyword(text, branch, end, "if")) {
                        at = branch;
                        continue;
                    }
                    Optional<DelimiterBalancer.Span> block = DelimiterBalancer.braces(text, branch, end);
                    if (block.isEmpty()) {
                        return ScanMatch.malformed("Malformed else branch: expected '{ ... }'");
                    }
                    otherwise = context.decompose(block.get().start(), block.get().end());
                    after = block.get().after();
                    break;
                }

                Node built = null;
                for (int i = chain.size() - 1; i >= 0; i--) {
                    Node.Builder branch = chain.get(i);
                    if (built != null) {
                        branch.statements("ELSE", List.of(built));
                    } else if (otherwise != null) {
                        branch.statements("ELSE", otherwise);
                    }
                    built = branch.build();
                }
                return ScanMatch.of(after, built);
            }
        };
    }

    /**
     * {@code <keyword> <condition> { ... }} into CONDITION and BODY.
     */
    public static ConstructMatcher conditionLoop(NodeType type, String keyword) {
        return (context, cursor, end) -> {
            if (!Lexical.atKeyword(context.text(), cursor, end, keyword)) {
                return Optional.empty();
            }
            Optional<Header> header = header(context, cursor + keyword.length(), end);
            if (header.isEmpty()) {
                return Optional.of(ScanMatch.malformed(
                        "Malformed " + keyword + " loop: expected a condition followed by '{ ... }'"));
            }
            DelimiterBalancer.Span body = header.get().body();
            Node node = context.node(type)
                    .value("CONDITION", context.textNode(header.get().condition()))
                    .statements("BODY", context.decompose(body.start(), body.end()))
                    .build();
            return Optional.of(ScanMatch.of(body.after(), node));
        };
    }

    /**
     * {@code loop { ... }} into BODY.
     */
    public static ConstructMatcher unconditionalLoop(NodeType type) {
        return (context, cursor, end) -> {
            String text = context.text();
            if (!Lexical.atKeyword(text, cursor, end, "loop")) {
                return Optional.empty();
            }
            int open = Lexical.skipTrivia(text, cursor + 4, end);
            Optional<DelimiterBalancer.Span> body = DelimiterBalancer.braces(text, open, end);
            if (body.isEmpty()) {
                return Optional.of(ScanMatch.malformed("Malformed loop: expected '{ ... }'"));
            }
            Node node = context.node(type)
                    .statements("BODY", context.decompose(body.get().start(), body.get().end()))
                    .build();
            return Optional.of(ScanMatch.of(body.get().after(), node));
        };
    }

    /**
     * {@code return [value];} into VALUE. A return without a semicolon takes the rest of the body.
     */
    public static ConstructMatcher returnStatement(NodeType type) {
        return (context, cursor, end) -> {
            String text = context.text();
            if (!Lexical.atKeyword(text, cursor, end, "return")) {
                return Optional.empty();
            }
            int semicolon = DelimiterBalancer.indexOfTopLevel(text, cursor, end, ';');
            int stop = semicolon == -1 ? end : semicolon;
            String value = text.substring(cursor + "return".length(), stop).trim();
            Node node = context.node(type)
                    .value("VALUE", value.isEmpty() ? null : context.textNode(value))
                    .build();
            return Optional.of(ScanMatch.of(semicolon == -1 ? end : semicolon + 1, node));
        };
    }

    /**
     * Text between a keyword and the body's opening brace, plus the body span.
     */
    record Header(String condition, DelimiterBalancer.Span body) {
    }

    static Optional<Header> header(ScanContext context, int from, int end) {
        String text = context.text();
        int brace = DelimiterBalancer.indexOfTopLevel(text, from, end, '{');
        if (brace == -1) {
            return Optional.empty();
        }
        String condition = text.substring(from, brace).trim();
        if (condition.isEmpty()) {
            return Optional.empty();
        }
        return DelimiterBalancer.braces(text, brace, end)
                .map(body -> new Header(condition, body));
    }
}
