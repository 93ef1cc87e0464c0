package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.scan.BlockStatementMatchers;
import com.vidnyan.bridge.domain.scan.ConstructMatcher;
import com.vidnyan.bridge.domain.scan.DeclarationScanner;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer.Span;
import com.vidnyan.bridge.domain.scan.Lexical;
import com.vidnyan.bridge.domain.scan.ScanContext;
import com.vidnyan.bridge.domain.scan.ScanMatch;
import com.vidnyan.bridge.domain.scan.StatementDecomposer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for WGSL shader modules: structs, entry points, helper functions and
 * resource bindings.
 */
@Component
public class WgslDialectParser extends AbstractDialectParser {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");
    private static final Pattern STRUCT = Pattern.compile("struct\\s+([A-Za-z_]\\w*)\\s*");
    private static final Pattern FUNCTION = Pattern.compile("fn\\s+([A-Za-z_]\\w*)\\s*");
    private static final Pattern LOCAL = Pattern.compile("(let|var|const)\\b\\s*");

    private static final List<ConstructMatcher> DECLARATIONS = List.of(
            WgslDialectParser::struct,
            WgslDialectParser::attributedItem);

    private static final StatementDecomposer STATEMENTS = new StatementDecomposer(
            List.of(
                    BlockStatementMatchers.conditional(NodeType.WGSL_IF),
                    BlockStatementMatchers.conditionLoop(NodeType.WGSL_WHILE, "while"),
                    WgslDialectParser::forLoop,
                    BlockStatementMatchers.unconditionalLoop(NodeType.WGSL_LOOP),
                    WgslDialectParser::localDeclaration,
                    BlockStatementMatchers.returnStatement(NodeType.WGSL_RETURN)),
            WgslDialectParser::expressionStatement,
            WgslDialectParser::implicitReturn);

    public WgslDialectParser(ParserProperties properties) {
        super(properties, new DeclarationScanner(DECLARATIONS), STATEMENTS);
    }

    @Override
    public Dialect dialect() {
        return Dialect.WGSL;
    }

    static Optional<ScanMatch> struct(ScanContext context, int cursor, int end) {
        String text = context.text();
        Matcher m = STRUCT.matcher(text).region(cursor, end);
        if (!Lexical.atKeyword(text, cursor, end, "struct") || !m.lookingAt()) {
            return Optional.empty();
        }
        Optional<Span> body = DelimiterBalancer.braces(text, m.end(), end);
        if (body.isEmpty()) {
            return Optional.of(ScanMatch.malformed("Malformed struct '" + m.group(1) + "': expected '{ ... }'"));
        }
        String fields = body.get().content(text).trim();
        Node node = context.node(NodeType.WGSL_STRUCT)
                .field("NAME", m.group(1))
                .value("FIELDS", fields.isEmpty() ? null : context.textNode(fields))
                .build();
        int after = Lexical.skipTrivia(text, body.get().after(), end);
        return Optional.of(ScanMatch.of(after < end && text.charAt(after) == ';' ? after + 1 : body.get().after(), node));
    }

    /**
     * Functions and module-scope variables, with any {@code @attribute(..)} list before them.
     */
    static Optional<ScanMatch> attributedItem(ScanContext context, int cursor, int end) {
        String text = context.text();
        Map<String, String> attributes = new LinkedHashMap<>();
        int at = readAttributes(text, cursor, end, attributes);
        if (at == -1) {
            return Optional.of(ScanMatch.malformed("Malformed attribute: unbalanced arguments"));
        }
        if (Lexical.atKeyword(text, at, end, "fn")) {
            return Optional.of(function(context, at, end, attributes));
        }
        if (Lexical.atKeyword(text, at, end, "var")) {
            return variable(context, at, end, attributes);
        }
        return Optional.empty();
    }

    /**
     * Read {@code @name[(args)]} attributes into {@code attributes}; returns the offset
     * of the first non-attribute token, or -1 when an argument list is unbalanced.
     */
    private static int readAttributes(String text, int from, int end, Map<String, String> attributes) {
        int at = from;
        while (at < end && text.charAt(at) == '@') {
            Matcher name = IDENTIFIER.matcher(text).region(at + 1, end);
            if (!name.lookingAt()) {
                return at;
            }
            int next = Lexical.skipTrivia(text, name.end(), end);
            String args = "";
            if (next < end && text.charAt(next) == '(') {
                Optional<Span> span = DelimiterBalancer.extract(text, next, end, '(', ')');
                if (span.isEmpty()) {
                    return -1;
                }
                args = span.get().content(text).trim();
                next = span.get().after();
            }
            attributes.put(name.group(), args);
            at = Lexical.skipTrivia(text, next, end);
        }
        return at;
    }

    private static ScanMatch function(ScanContext context, int at, int end, Map<String, String> attributes) {
        String text = context.text();
        Matcher m = FUNCTION.matcher(text).region(at, end);
        if (!m.lookingAt()) {
            return ScanMatch.malformed("Malformed function: expected a name");
        }
        String name = m.group(1);
        Optional<Span> params = DelimiterBalancer.extract(text, m.end(), end, '(', ')');
        if (params.isEmpty()) {
            return ScanMatch.malformed("Malformed function '" + name + "': expected a parameter list");
        }
        int brace = DelimiterBalancer.indexOfTopLevel(text, params.get().after(), end, '{');
        Optional<Span> body = brace == -1 ? Optional.empty() : DelimiterBalancer.braces(text, brace, end);
        if (body.isEmpty()) {
            return ScanMatch.malformed("Malformed function '" + name + "': missing or unbalanced body");
        }

        String returnType = text.substring(params.get().after(), brace).trim();
        if (returnType.startsWith("->")) {
            returnType = returnType.substring(2).trim();
        }
        String paramText = params.get().content(text).trim();
        NodeType type = stage(attributes);
        Node.Builder node = context.node(type).field("NAME", name);
        if (type != NodeType.WGSL_FUNCTION) {
            node.field("WORKGROUP_SIZE", attributes.getOrDefault("workgroup_size", ""));
        }
        node.value("PARAMS", paramText.isEmpty() ? null : context.textNode(paramText))
                .value("RETURN_TYPE", returnType.isEmpty() ? null : context.textNode(returnType))
                .statements("BODY", context.decompose(body.get().start(), body.get().end()));
        return ScanMatch.of(body.get().after(), node.build());
    }

    private static NodeType stage(Map<String, String> attributes) {
        if (attributes.containsKey("compute")) {
            return NodeType.WGSL_COMPUTE_SHADER;
        }
        if (attributes.containsKey("vertex")) {
            return NodeType.WGSL_VERTEX_SHADER;
        }
        if (attributes.containsKey("fragment")) {
            return NodeType.WGSL_FRAGMENT_SHADER;
        }
        return NodeType.WGSL_FUNCTION;
    }

    /**
     * {@code var<class[, access]> [@group(n) @binding(n)] name : type;}
     */
    private static Optional<ScanMatch> variable(ScanContext context, int at, int end, Map<String, String> attributes) {
        String text = context.text();
        int open = Lexical.skipTrivia(text, at + 3, end);
        Optional<Span> qualifier = DelimiterBalancer.extract(text, open, end, '<', '>');
        if (qualifier.isEmpty()) {
            return Optional.empty();
        }
        List<String> parts = DelimiterBalancer.splitTopLevel(
                text, qualifier.get().start(), qualifier.get().end(), ',');
        int next = readAttributes(text, Lexical.skipTrivia(text, qualifier.get().after(), end), end, attributes);
        int semicolon = next == -1 ? -1 : DelimiterBalancer.indexOfTopLevel(text, next, end, ';');
        if (parts.isEmpty() || semicolon == -1) {
            return Optional.of(ScanMatch.malformed("Malformed var binding: expected 'var<class> name: type;'"));
        }
        String declaration = text.substring(next, semicolon).trim();
        int initializer = RustStatements.assignmentOperator(declaration, 0, declaration.length());
        if (initializer != -1) {
            declaration = declaration.substring(0, initializer).trim();
        }
        int colon = declaration.indexOf(':');
        if (colon == -1) {
            return Optional.of(ScanMatch.malformed("Malformed var binding: missing type"));
        }
        Node node = context.node(NodeType.WGSL_VAR)
                .field("STORAGE_CLASS", parts.get(0))
                .field("ACCESS_MODE", parts.size() > 1 ? parts.get(1) : "")
                .field("GROUP", attributes.getOrDefault("group", ""))
                .field("BINDING", attributes.getOrDefault("binding", ""))
                .field("NAME", declaration.substring(0, colon).trim())
                .field("TYPE", declaration.substring(colon + 1).trim())
                .build();
        return Optional.of(ScanMatch.of(semicolon + 1, node));
    }

    /**
     * {@code for (init; condition; update) { ... }}; each header part may be empty.
     */
    static Optional<ScanMatch> forLoop(ScanContext context, int cursor, int end) {
        String text = context.text();
        if (!Lexical.atKeyword(text, cursor, end, "for")) {
            return Optional.empty();
        }
        int open = Lexical.skipTrivia(text, cursor + 3, end);
        Optional<Span> header = DelimiterBalancer.extract(text, open, end, '(', ')');
        int first = header.map(h -> DelimiterBalancer.indexOfTopLevel(text, h.start(), h.end(), ';')).orElse(-1);
        int second = first == -1 ? -1 : DelimiterBalancer.indexOfTopLevel(text, first + 1, header.get().end(), ';');
        Optional<Span> body = header.isEmpty() ? Optional.empty()
                : DelimiterBalancer.braces(text, Lexical.skipTrivia(text, header.get().after(), end), end);
        if (second == -1 || body.isEmpty()) {
            return Optional.of(ScanMatch.malformed(
                    "Malformed for loop: expected 'for (init; condition; update) { ... }'"));
        }
        Node node = context.node(NodeType.WGSL_FOR)
                .value("INIT", optionalText(context, text.substring(header.get().start(), first)))
                .value("CONDITION", optionalText(context, text.substring(first + 1, second)))
                .value("UPDATE", optionalText(context, text.substring(second + 1, header.get().end())))
                .statements("BODY", context.decompose(body.get().start(), body.get().end()))
                .build();
        return Optional.of(ScanMatch.of(body.get().after(), node));
    }

    /**
     * {@code let|var|const name[: type] [= value];}
     */
    static Optional<ScanMatch> localDeclaration(ScanContext context, int cursor, int end) {
        String text = context.text();
        Matcher kind = LOCAL.matcher(text).region(cursor, end);
        if (!kind.lookingAt() || !Lexical.atKeyword(text, cursor, end, kind.group(1))) {
            return Optional.empty();
        }
        int at = kind.end();
        if (at < end && text.charAt(at) == '<') {
            at = DelimiterBalancer.extract(text, at, end, '<', '>').map(Span::after).orElse(at);
        }
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, at, end, ';');
        if (semicolon == -1) {
            return Optional.of(ScanMatch.malformed("Malformed " + kind.group(1) + " declaration: missing ';'"));
        }
        int equals = RustStatements.assignmentOperator(text, at, semicolon);
        int targetEnd = equals == -1 ? semicolon : equals;
        int colon = DelimiterBalancer.indexOfTopLevel(text, at, targetEnd, ':');
        String name = text.substring(at, colon == -1 ? targetEnd : colon).trim();
        if (name.isEmpty()) {
            return Optional.of(ScanMatch.malformed("Malformed " + kind.group(1) + " declaration: expected a name"));
        }
        Node node = context.node(NodeType.WGSL_VAR_DECL)
                .field("KIND", kind.group(1))
                .field("NAME", name)
                .field("TYPE", colon == -1 ? "" : text.substring(colon + 1, targetEnd).trim())
                .value("VALUE", equals == -1 ? null : optionalText(context, text.substring(equals + 1, semicolon)))
                .build();
        return Optional.of(ScanMatch.of(semicolon + 1, node));
    }

    static Node expressionStatement(ScanContext context, String expression) {
        return context.node(NodeType.WGSL_EXPR_STMT)
                .value("EXPR", context.textNode(expression))
                .build();
    }

    /**
     * Trailing text without a semicolon.
     */
    static Node implicitReturn(ScanContext context, String expression) {
        return context.node(NodeType.WGSL_RETURN)
                .value("VALUE", context.textNode(expression))
                .build();
    }

    private static Node optionalText(ScanContext context, String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? null : context.textNode(trimmed);
    }
}
