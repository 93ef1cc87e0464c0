package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer.Span;
import com.vidnyan.bridge.domain.scan.Lexical;
import com.vidnyan.bridge.domain.scan.ScanContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Item-level syntax shared by the Rust, Bevy and Biospheres parsers: imports,
 * function heads, structs with their attributes, and field lists.
 */
final class RustSyntax {

    private static final Pattern USE = Pattern.compile("(pub(\\s*\\([^)]*\\))?\\s+)?use\\s+");
    private static final Pattern FUNCTION = Pattern.compile(
            "(pub(\\s*\\([^)]*\\))?\\s+)?((const|async|unsafe)\\s+)*(extern\\s+(\"[^\"]*\"\\s+)?)?fn\\s+([A-Za-z_]\\w*)\\s*");
    private static final Pattern STRUCT = Pattern.compile("(pub(\\s*\\([^)]*\\))?\\s+)?struct\\s+([A-Za-z_]\\w*)\\s*");
    private static final Pattern WHERE = Pattern.compile("\\bwhere\\b");
    private static final Pattern DERIVE = Pattern.compile("derive\\s*\\(");
    private static final Pattern FIELD = Pattern.compile(
            "(pub(\\s*\\([^)]*\\))?\\s+)?([A-Za-z_]\\w*)\\s*:\\s*(.+)", Pattern.DOTALL);
    private static final Pattern FIELD_NOISE = Pattern.compile("//[^\\n]*|/\\*.*?\\*/|#\\[[^\\]]*\\]", Pattern.DOTALL);

    private RustSyntax() {
    }

    /**
     * A {@code use} item: its path and the offset past its semicolon.
     */
    record UseItem(String path, int end) {
    }

    static Optional<UseItem> useItem(ScanContext context, int cursor, int end) {
        String text = context.text();
        Matcher m = USE.matcher(text).region(cursor, end);
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, m.end(), end, ';');
        if (semicolon == -1) {
            return Optional.empty();
        }
        String path = text.substring(m.end(), semicolon).trim();
        if (path.isEmpty() || path.contains("//") || path.contains("/*")) {
            return Optional.empty();
        }
        return Optional.of(new UseItem(path, semicolon + 1));
    }

    /**
     * Head and body of a function item. A malformed head carries only a problem.
     */
    record FunctionHead(
        boolean isPublic,
        String name,
        String params,
        String returnType,
        Span body,
        String problem
    ) {
        static FunctionHead malformed(String problem) {
            return new FunctionHead(false, null, null, null, null, problem);
        }

        boolean isMalformed() {
            return problem != null;
        }

        boolean isMain() {
            return "main".equals(name) && params.isBlank();
        }

        String bodyText(String text) {
            return body.content(text);
        }
    }

    /**
     * Recognize {@code [pub] [const|async|unsafe|extern] fn name[<..>](params) [-> T] [where ..] { body }}.
     * Bodiless signatures (trait items, extern declarations) are not functions here.
     */
    static Optional<FunctionHead> functionHead(ScanContext context, int cursor, int end) {
        String text = context.text();
        Matcher m = FUNCTION.matcher(text).region(cursor, end);
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        String name = m.group(7);
        int at = m.end();
        if (at < end && text.charAt(at) == '<') {
            Optional<Span> generics = DelimiterBalancer.extract(text, at, end, '<', '>');
            if (generics.isEmpty()) {
                return Optional.of(FunctionHead.malformed("Malformed function '" + name + "': unbalanced generics"));
            }
            at = Lexical.skipTrivia(text, generics.get().after(), end);
        }
        Optional<Span> params = DelimiterBalancer.extract(text, at, end, '(', ')');
        if (params.isEmpty()) {
            return Optional.of(FunctionHead.malformed("Malformed function '" + name + "': expected a parameter list"));
        }

        int afterParams = params.get().after();
        int brace = DelimiterBalancer.indexOfTopLevel(text, afterParams, end, '{');
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, afterParams, end, ';');
        if (semicolon != -1 && (brace == -1 || semicolon < brace)) {
            return Optional.empty();
        }
        Optional<Span> body = brace == -1 ? Optional.empty() : DelimiterBalancer.braces(text, brace, end);
        if (body.isEmpty()) {
            return Optional.of(FunctionHead.malformed("Malformed function '" + name + "': missing or unbalanced body"));
        }

        String returnType = text.substring(afterParams, brace).trim();
        Matcher where = WHERE.matcher(returnType);
        if (where.find()) {
            returnType = returnType.substring(0, where.start()).trim();
        }
        if (returnType.startsWith("->")) {
            returnType = returnType.substring(2).trim();
        }
        return Optional.of(new FunctionHead(
                m.group(1) != null,
                name,
                params.get().content(text).trim(),
                returnType,
                body.get(),
                null));
    }

    /**
     * {@code rust_main}, {@code rust_pub_function} or {@code rust_function} for a function head.
     */
    static Node rustFunction(ScanContext context, FunctionHead head) {
        Span body = head.body();
        if (head.isMain()) {
            return context.node(NodeType.RUST_MAIN)
                    .statements("BODY", context.decompose(body.start(), body.end()))
                    .build();
        }
        return context.node(head.isPublic() ? NodeType.RUST_PUB_FUNCTION : NodeType.RUST_FUNCTION)
                .field("NAME", head.name())
                .value("PARAMS_OPTIONAL", parameters(context, head.params()))
                .value("RETURN_TYPE_OPTIONAL", returnType(context, head.returnType()))
                .statements("BODY", context.decompose(body.start(), body.end()))
                .build();
    }

    static Node parameters(ScanContext context, String params) {
        if (params.isBlank()) {
            return null;
        }
        return context.node(NodeType.RUST_PARAMETERS).field("PARAMS", params).build();
    }

    static Node returnType(ScanContext context, String type) {
        if (type.isBlank()) {
            return null;
        }
        return context.node(NodeType.RUST_RETURN_TYPE).field("TYPE", type).build();
    }

    /**
     * A struct item with the attributes written before it.
     * {@code body} is empty for unit and tuple structs.
     */
    record StructItem(String name, String derives, Optional<Span> body, int end) {

        boolean isMalformed() {
            return end == -1;
        }

        boolean derives(String trait) {
            return Pattern.compile("\\b" + trait + "\\b").matcher(derives).find();
        }

        String bodyText(String text) {
            return body.map(span -> span.content(text).trim()).orElse("");
        }
    }

    /**
     * Recognize {@code #[..]* [pub] struct Name[<..>] { .. }} or the unit/tuple forms.
     * Attributes that do not precede a struct are left to the caller.
     */
    static Optional<StructItem> structItem(ScanContext context, int cursor, int end) {
        String text = context.text();
        List<String> derives = new ArrayList<>();
        int at = cursor;
        while (at < end && text.charAt(at) == '#') {
            Optional<Span> attribute = DelimiterBalancer.extract(text, at + 1, end, '[', ']');
            if (attribute.isEmpty()) {
                return Optional.empty();
            }
            collectDerives(attribute.get().content(text), derives);
            at = Lexical.skipTrivia(text, attribute.get().after(), end);
        }
        Matcher m = STRUCT.matcher(text).region(at, end);
        if (!m.lookingAt()) {
            return Optional.empty();
        }

        int brace = DelimiterBalancer.indexOfTopLevel(text, m.end(), end, '{');
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, m.end(), end, ';');
        String joined = String.join(", ", derives);
        if (semicolon != -1 && (brace == -1 || semicolon < brace)) {
            return Optional.of(new StructItem(m.group(3), joined, Optional.empty(), semicolon + 1));
        }
        Optional<Span> body = brace == -1 ? Optional.empty() : DelimiterBalancer.braces(text, brace, end);
        if (body.isEmpty()) {
            return Optional.of(new StructItem(m.group(3), joined, Optional.empty(), -1));
        }
        return Optional.of(new StructItem(m.group(3), joined, body, body.get().after()));
    }

    private static void collectDerives(String attribute, List<String> derives) {
        Matcher derive = DERIVE.matcher(attribute);
        while (derive.find()) {
            DelimiterBalancer.extract(attribute, derive.end() - 1, '(', ')')
                    .map(span -> span.content(attribute).trim())
                    .filter(list -> !list.isEmpty())
                    .ifPresent(derives::add);
        }
    }

    /**
     * One {@code rust_field} per named field of a braced struct body.
     */
    static List<Node> rustFields(ScanContext context, Span body) {
        List<Node> fields = new ArrayList<>();
        for (String part : DelimiterBalancer.splitTopLevel(context.text(), body.start(), body.end(), ',')) {
            String cleaned = FIELD_NOISE.matcher(part).replaceAll("").trim();
            Matcher m = FIELD.matcher(cleaned);
            if (m.matches()) {
                fields.add(context.node(NodeType.RUST_FIELD)
                        .field("NAME", m.group(3))
                        .field("TYPE", m.group(4).trim())
                        .build());
            }
        }
        return fields;
    }
}
