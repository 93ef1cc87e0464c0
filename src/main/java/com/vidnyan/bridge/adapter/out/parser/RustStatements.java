package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.scan.BlockStatementMatchers;
import com.vidnyan.bridge.domain.scan.ConstructMatcher;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer.Span;
import com.vidnyan.bridge.domain.scan.Lexical;
import com.vidnyan.bridge.domain.scan.ScanContext;
import com.vidnyan.bridge.domain.scan.ScanMatch;
import com.vidnyan.bridge.domain.scan.StatementDecomposer;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statement matchers of Rust function bodies, also used by the Bevy and
 * Biospheres parsers with their own extensions around them.
 */
final class RustStatements {

    private static final Pattern PRINTLN = Pattern.compile("println!\\s*\\((.*)\\)", Pattern.DOTALL);
    private static final Pattern ASSIGN = Pattern.compile("([A-Za-z_][\\w.]*)\\s*=\\s*(.+)", Pattern.DOTALL);
    private static final Pattern FOR_HEADER = Pattern.compile("\\s*(.+?)\\s+in\\s+(.+)", Pattern.DOTALL);
    private static final Pattern BINDING_NAME = Pattern.compile("(mut\\s+)?(.+)", Pattern.DOTALL);

    private RustStatements() {
    }

    /**
     * Decomposer for Rust bodies: {@code leading} matchers first, then the core
     * statements, then {@code trailing} matchers before the expression fallback.
     */
    static StatementDecomposer decomposer(List<ConstructMatcher> leading, List<ConstructMatcher> trailing) {
        List<ConstructMatcher> matchers = new ArrayList<>(leading);
        matchers.add(BlockStatementMatchers.conditional(NodeType.RUST_IF));
        matchers.add(BlockStatementMatchers.conditionLoop(NodeType.RUST_WHILE, "while"));
        matchers.add(RustStatements::forLoop);
        matchers.add(BlockStatementMatchers.unconditionalLoop(NodeType.RUST_LOOP));
        matchers.add(RustStatements::letBinding);
        matchers.add(BlockStatementMatchers.returnStatement(NodeType.RUST_RETURN));
        matchers.addAll(trailing);
        return new StatementDecomposer(matchers, RustStatements::expressionStatement, RustStatements::implicitReturn);
    }

    static StatementDecomposer decomposer() {
        return decomposer(List.of(), List.of());
    }

    /**
     * {@code for <pattern> in <iterator> { ... }}.
     */
    static Optional<ScanMatch> forLoop(ScanContext context, int cursor, int end) {
        String text = context.text();
        if (!Lexical.atKeyword(text, cursor, end, "for")) {
            return Optional.empty();
        }
        int brace = DelimiterBalancer.indexOfTopLevel(text, cursor + 3, end, '{');
        Matcher header = brace == -1 ? null
                : FOR_HEADER.matcher(text.substring(cursor + 3, brace));
        Optional<Span> body = brace == -1 ? Optional.empty() : DelimiterBalancer.braces(text, brace, end);
        if (header == null || !header.matches() || body.isEmpty()) {
            return Optional.of(ScanMatch.malformed(
                    "Malformed for loop: expected 'for <pattern> in <iterator> { ... }'"));
        }
        Node node = context.node(NodeType.RUST_FOR)
                .field("VAR", header.group(1).trim())
                .value("ITERATOR", context.textNode(header.group(2).trim()))
                .statements("BODY", context.decompose(body.get().start(), body.get().end()))
                .build();
        return Optional.of(ScanMatch.of(body.get().after(), node));
    }

    /**
     * {@code let [mut] name[: type] [= value];}
     */
    static Optional<ScanMatch> letBinding(ScanContext context, int cursor, int end) {
        String text = context.text();
        if (!Lexical.atKeyword(text, cursor, end, "let")) {
            return Optional.empty();
        }
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, cursor + 3, end, ';');
        if (semicolon == -1) {
            return Optional.of(ScanMatch.malformed("Malformed let binding: missing ';'"));
        }
        int equals = assignmentOperator(text, cursor + 3, semicolon);
        int targetEnd = equals == -1 ? semicolon : equals;
        int colon = DelimiterBalancer.indexOfTopLevel(text, cursor + 3, targetEnd, ':');
        String target = text.substring(cursor + 3, colon == -1 ? targetEnd : colon).trim();
        Matcher name = BINDING_NAME.matcher(target);
        if (target.isEmpty() || !name.matches()) {
            return Optional.of(ScanMatch.malformed("Malformed let binding: expected a name"));
        }

        String type = colon == -1 ? "" : text.substring(colon + 1, targetEnd).trim();
        String value = equals == -1 ? "" : text.substring(equals + 1, semicolon).trim();
        Node node = context.node(NodeType.RUST_LET_BINDING)
                .field("MUTABLE", name.group(1) != null ? "TRUE" : "FALSE")
                .field("NAME", name.group(2).trim())
                .value("TYPE", type.isEmpty() ? null : context.textNode(": " + type))
                .value("VALUE", value.isEmpty() ? null : context.textNode(value))
                .build();
        return Optional.of(ScanMatch.of(semicolon + 1, node));
    }

    /**
     * Offset of the top-level {@code =} of an assignment in {@code [from, end)}, skipping
     * {@code ==}, {@code !=}, {@code <=}, {@code >=} and {@code =>}; -1 when there is none.
     */
    static int assignmentOperator(String text, int from, int end) {
        int at = DelimiterBalancer.indexOfTopLevel(text, from, end, '=');
        while (at != -1) {
            char before = at > from ? text.charAt(at - 1) : ' ';
            char after = at + 1 < end ? text.charAt(at + 1) : ' ';
            if (after != '=' && after != '>' && before != '=' && before != '!'
                    && before != '<' && before != '>') {
                return at;
            }
            at = DelimiterBalancer.indexOfTopLevel(text, at + 2, end, '=');
        }
        return -1;
    }

    static Node expressionStatement(ScanContext context, String expression) {
        Matcher println = PRINTLN.matcher(expression);
        if (println.matches()) {
            return context.node(NodeType.RUST_PRINTLN)
                    .value("MESSAGE", context.textNode(println.group(1).trim()))
                    .build();
        }
        if (isPlainAssignment(expression)) {
            Matcher assign = ASSIGN.matcher(expression);
            if (assign.matches()) {
                return context.node(NodeType.RUST_ASSIGN)
                        .field("VAR", assign.group(1))
                        .value("VALUE", context.textNode(assign.group(2).trim()))
                        .build();
            }
        }
        return context.node(NodeType.RUST_EXPR_STMT)
                .value("EXPR", context.textNode(expression))
                .build();
    }

    private static boolean isPlainAssignment(String expression) {
        return expression.contains("=") && !expression.contains("==") && !expression.contains("!=")
                && !expression.contains("<=") && !expression.contains(">=") && !expression.contains("=>");
    }

    static Node implicitReturn(ScanContext context, String expression) {
        return context.node(NodeType.RUST_RETURN)
                .value("VALUE", context.textNode(expression))
                .build();
    }
}
