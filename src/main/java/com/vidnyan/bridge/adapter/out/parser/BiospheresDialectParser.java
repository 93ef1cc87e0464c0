package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.adapter.out.parser.RustSyntax.FunctionHead;
import com.vidnyan.bridge.adapter.out.parser.RustSyntax.StructItem;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.scan.ConstructMatcher;
import com.vidnyan.bridge.domain.scan.DeclarationScanner;
import com.vidnyan.bridge.domain.scan.ScanContext;
import com.vidnyan.bridge.domain.scan.ScanMatch;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parser for Biospheres cell-simulation code. Cell type components become
 * {@code bevy_derive_component} blocks and cell behaviors become {@code bevy_system}
 * blocks; cell operations inside them are ordinary Rust statements.
 */
@Component
public class BiospheresDialectParser extends AbstractDialectParser {

    private static final Pattern CELL_OPERATIONS = Pattern.compile(
            "emit_signal|contract_adhesions|apply_thrust|CellType|Genome|AdhesionZone");

    private static final List<ConstructMatcher> DECLARATIONS = List.of(
            BiospheresDialectParser::use,
            BiospheresDialectParser::cellBehavior,
            BiospheresDialectParser::cellType);

    public BiospheresDialectParser(ParserProperties properties) {
        super(properties, new DeclarationScanner(DECLARATIONS), RustStatements.decomposer());
    }

    @Override
    public Dialect dialect() {
        return Dialect.BIOSPHERES;
    }

    static Optional<ScanMatch> use(ScanContext context, int cursor, int end) {
        return RustSyntax.useItem(context, cursor, end)
                .map(item -> ScanMatch.of(item.end(),
                        context.node(NodeType.RUST_USE).field("PATH", item.path()).build()));
    }

    /**
     * Functions whose body uses cell operations or cell types.
     */
    static Optional<ScanMatch> cellBehavior(ScanContext context, int cursor, int end) {
        Optional<FunctionHead> found = RustSyntax.functionHead(context, cursor, end);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        FunctionHead head = found.get();
        if (head.isMalformed()) {
            return Optional.of(ScanMatch.malformed(head.problem()));
        }
        if (!CELL_OPERATIONS.matcher(head.bodyText(context.text())).find()) {
            return Optional.empty();
        }
        Node node = context.node(NodeType.BEVY_SYSTEM)
                .field("NAME", head.name())
                .value("PARAMS", RustSyntax.parameters(context, head.params()))
                .statements("BODY", context.decompose(head.body().start(), head.body().end()))
                .build();
        return Optional.of(ScanMatch.of(head.body().after(), node));
    }

    /**
     * Component structs that describe a cell: the name mentions Cell or Type, or
     * earlier text mentions cells.
     */
    static Optional<ScanMatch> cellType(ScanContext context, int cursor, int end) {
        Optional<StructItem> item = RustSyntax.structItem(context, cursor, end);
        if (item.isEmpty() || !item.get().derives("Component")) {
            return Optional.empty();
        }
        StructItem struct = item.get();
        boolean cellRelated = struct.name().contains("Cell") || struct.name().contains("Type")
                || context.text().substring(0, cursor).toLowerCase(Locale.ROOT).contains("cell");
        if (!cellRelated) {
            return Optional.empty();
        }
        if (struct.isMalformed()) {
            return Optional.of(ScanMatch.malformed("Malformed cell type '" + struct.name() + "': unbalanced body"));
        }
        String fields = struct.bodyText(context.text());
        Node node = context.node(NodeType.BEVY_DERIVE_COMPONENT)
                .field("NAME", struct.name())
                .value("FIELDS", fields.isEmpty() ? null : context.textNode(fields))
                .build();
        return Optional.of(ScanMatch.of(struct.end(), node));
    }
}
