package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.application.port.out.DialectParser;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.scan.DeclarationScanner;
import com.vidnyan.bridge.domain.scan.ScanContext;
import com.vidnyan.bridge.domain.scan.StatementDecomposer;
import com.vidnyan.bridge.domain.session.ParseSession;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared driver of the dialect parsers: scans declarations with the dialect's
 * matchers, applies the declaration limit, records failures as diagnostics and
 * falls back to a "could not parse" placeholder.
 */
@Slf4j
public abstract class AbstractDialectParser implements DialectParser {

    static final String FALLBACK_PREFIX = "Imported code (could not parse):\n";

    protected final ParserProperties properties;
    private final DeclarationScanner declarations;
    private final StatementDecomposer statements;

    protected AbstractDialectParser(
            ParserProperties properties,
            DeclarationScanner declarations,
            StatementDecomposer statements
    ) {
        this.properties = properties;
        this.declarations = declarations;
        this.statements = statements;
    }

    @Override
    public DialectParseResult parse(String text, ParseSession session) {
        long startTime = System.currentTimeMillis();
        if (text == null || text.isEmpty()) {
            return DialectParseResult.empty(dialect());
        }

        List<Node> nodes = new ArrayList<>();
        ScanContext context = new ScanContext(
                text, session, dialect(), statements, properties.getMaxNestingDepth());
        try {
            declarations.scanInto(context, 0, text.length(), properties.getMaxDeclarations(), nodes);
        } catch (RuntimeException e) {
            log.warn("{} parser failed after {} declarations", dialect().displayName(), nodes.size(), e);
            session.errors().add(dialect().displayName() + " parse error: " + e.getMessage(),
                    0, 0, dialect().suggestion());
        } catch (StackOverflowError e) {
            log.warn("{} parser ran out of stack after {} declarations", dialect().displayName(), nodes.size());
            session.errors().add(dialect().displayName() + " parse error: input is nested too deeply",
                    0, 0, dialect().suggestion());
        }

        if (nodes.isEmpty()) {
            nodes.add(fallback(text, session));
        }

        log.info("{} parser produced {} declarations in {}ms", dialect().displayName(),
                nodes.size(), System.currentTimeMillis() - startTime);
        return new DialectParseResult(dialect(), nodes);
    }

    private Node fallback(String text, ParseSession session) {
        int limit = properties.getFallbackExcerptLength();
        String excerpt = text.length() > limit ? text.substring(0, limit) + "..." : text;
        return Node.builder(NodeType.opaqueFor(dialect()))
                .id(session.nextId())
                .field("TEXT", FALLBACK_PREFIX + excerpt)
                .build();
    }
}
