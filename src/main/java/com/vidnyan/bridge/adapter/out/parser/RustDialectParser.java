package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.adapter.out.parser.RustSyntax.FunctionHead;
import com.vidnyan.bridge.adapter.out.parser.RustSyntax.StructItem;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.scan.ConstructMatcher;
import com.vidnyan.bridge.domain.scan.DeclarationScanner;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer;
import com.vidnyan.bridge.domain.scan.DelimiterBalancer.Span;
import com.vidnyan.bridge.domain.scan.Lexical;
import com.vidnyan.bridge.domain.scan.ScanContext;
import com.vidnyan.bridge.domain.scan.ScanMatch;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * General-purpose parser for plain Rust: imports, functions, impl blocks and structs.
 */
@Component
public class RustDialectParser extends AbstractDialectParser {

    private static final Pattern WHERE = Pattern.compile("\\bwhere\\b");

    // Methods of an impl block are nested function items, not top-level declarations.
    private static final DeclarationScanner METHODS = new DeclarationScanner(List.of(RustDialectParser::function));

    private static final List<ConstructMatcher> DECLARATIONS = List.of(
            RustDialectParser::use,
            RustDialectParser::function,
            RustDialectParser::impl,
            RustDialectParser::struct);

    public RustDialectParser(ParserProperties properties) {
        super(properties, new DeclarationScanner(DECLARATIONS), RustStatements.decomposer());
    }

    @Override
    public Dialect dialect() {
        return Dialect.RUST;
    }

    static Optional<ScanMatch> use(ScanContext context, int cursor, int end) {
        return RustSyntax.useItem(context, cursor, end)
                .map(item -> ScanMatch.of(item.end(),
                        context.node(NodeType.RUST_USE).field("PATH", item.path()).build()));
    }

    static Optional<ScanMatch> function(ScanContext context, int cursor, int end) {
        Optional<FunctionHead> head = RustSyntax.functionHead(context, cursor, end);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        if (head.get().isMalformed()) {
            return Optional.of(ScanMatch.malformed(head.get().problem()));
        }
        return Optional.of(ScanMatch.of(head.get().body().after(), RustSyntax.rustFunction(context, head.get())));
    }

    /**
     * {@code [unsafe] impl[<..>] [Trait for] Type [where ..] { methods }}.
     */
    static Optional<ScanMatch> impl(ScanContext context, int cursor, int end) {
        String text = context.text();
        int at = cursor;
        if (Lexical.atKeyword(text, at, end, "unsafe")) {
            at = Lexical.skipTrivia(text, at + "unsafe".length(), end);
        }
        if (!Lexical.atKeyword(text, at, end, "impl")) {
            return Optional.empty();
        }
        at = Lexical.skipTrivia(text, at + 4, end);
        if (at < end && text.charAt(at) == '<') {
            Optional<Span> generics = DelimiterBalancer.extract(text, at, end, '<', '>');
            if (generics.isEmpty()) {
                return Optional.of(ScanMatch.malformed("Malformed impl block: unbalanced generics"));
            }
            at = generics.get().after();
        }
        int brace = DelimiterBalancer.indexOfTopLevel(text, at, end, '{');
        Optional<Span> body = brace == -1 ? Optional.empty() : DelimiterBalancer.braces(text, brace, end);
        if (body.isEmpty()) {
            return Optional.of(ScanMatch.malformed("Malformed impl block: expected '{ ... }'"));
        }
        String type = text.substring(at, brace).trim();
        Matcher where = WHERE.matcher(type);
        if (where.find()) {
            type = type.substring(0, where.start()).trim();
        }
        List<Node> methods = METHODS.scan(context, body.get().start(), body.get().end(), Integer.MAX_VALUE);
        Node node = context.node(NodeType.RUST_IMPL)
                .field("TYPE", type)
                .statements("METHODS", methods)
                .build();
        return Optional.of(ScanMatch.of(body.get().after(), node));
    }

    static Optional<ScanMatch> struct(ScanContext context, int cursor, int end) {
        Optional<StructItem> item = RustSyntax.structItem(context, cursor, end);
        if (item.isEmpty()) {
            return Optional.empty();
        }
        StructItem struct = item.get();
        if (struct.isMalformed()) {
            return Optional.of(ScanMatch.malformed("Malformed struct '" + struct.name() + "': unbalanced body"));
        }
        Node node = context.node(NodeType.RUST_STRUCT)
                .field("NAME", struct.name())
                .field("DERIVES", struct.derives())
                .statements("FIELDS", struct.body()
                        .map(body -> RustSyntax.rustFields(context, body))
                        .orElse(List.of()))
                .build();
        return Optional.of(ScanMatch.of(struct.end(), node));
    }
}
