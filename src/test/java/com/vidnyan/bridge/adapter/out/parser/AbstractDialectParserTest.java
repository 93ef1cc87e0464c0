package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.application.port.out.DialectParser.DialectParseResult;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.model.ParseError;
import com.vidnyan.bridge.domain.scan.ConstructMatcher;
import com.vidnyan.bridge.domain.scan.DeclarationScanner;
import com.vidnyan.bridge.domain.scan.ScanMatch;
import com.vidnyan.bridge.domain.session.ParseSession;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AbstractDialectParserTest {

    private static final ConstructMatcher OK = (context, cursor, end) -> {
        if (!context.text().startsWith("ok", cursor)) {
            return Optional.empty();
        }
        return Optional.of(ScanMatch.of(cursor + 2,
                context.node(NodeType.RUST_USE).field("PATH", "ok").build()));
    };

    private static final ConstructMatcher BOOM = (context, cursor, end) -> {
        if (context.text().startsWith("boom", cursor)) {
            throw new IllegalStateException("boom");
        }
        return Optional.empty();
    };

    private static final ConstructMatcher DEEP = (context, cursor, end) -> {
        if (context.text().startsWith("deep", cursor)) {
            throw new StackOverflowError();
        }
        return Optional.empty();
    };

    @Test
    void parse_ShouldKeepDeclarationsBuiltBeforeAFailure() {
        ParseSession session = new ParseSession();

        DialectParseResult result = new StubParser(new ParserProperties()).parse("ok ok boom ok", session);

        assertEquals(2, result.nodes().size());
        assertEquals(1, session.errors().size());
        ParseError error = session.diagnostics().get(0);
        assertEquals("Rust parse error: boom", error.message());
        assertEquals(0, error.line());
        assertEquals("Check Rust syntax", error.suggestion());
    }

    @Test
    void parse_ShouldFallBackToTruncatedPlaceholderWhenNothingIsRecognized() {
        ParserProperties properties = new ParserProperties();
        properties.setFallbackExcerptLength(10);
        ParseSession session = new ParseSession();

        DialectParseResult result = new StubParser(properties).parse("something unrecognizable", session);

        assertEquals(1, result.nodes().size());
        assertEquals(NodeType.RUST_COMMENT, result.nodes().get(0).type());
        assertEquals(AbstractDialectParser.FALLBACK_PREFIX + "something ...", result.nodes().get(0).field("TEXT"));
        assertFalse(session.errors().hasErrors());
    }

    @Test
    void parse_ShouldKeepWhitespaceOnlyTextAsPlaceholder() {
        ParseSession session = new ParseSession();

        DialectParseResult result = new StubParser(new ParserProperties()).parse("  \n\t", session);

        assertEquals(1, result.nodes().size());
        assertEquals(NodeType.RUST_COMMENT, result.nodes().get(0).type());
        assertEquals(AbstractDialectParser.FALLBACK_PREFIX + "  \n\t", result.nodes().get(0).field("TEXT"));
    }

    @Test
    void parse_ShouldReturnNothingForEmptyText() {
        ParseSession session = new ParseSession();

        assertEquals(List.of(), new StubParser(new ParserProperties()).parse("", session).nodes());
        assertEquals(0, session.idsIssued());
    }

    @Test
    void parse_ShouldRecordStackExhaustionAsDiagnostic() {
        ParseSession session = new ParseSession();

        DialectParseResult result = new StubParser(new ParserProperties()).parse("ok deep", session);

        assertEquals(1, result.nodes().size());
        assertEquals("Rust parse error: input is nested too deeply", session.diagnostics().get(0).message());
    }

    private static class StubParser extends AbstractDialectParser {

        StubParser(ParserProperties properties) {
            super(properties, new DeclarationScanner(List.of(OK, BOOM, DEEP)), RustStatements.decomposer());
        }

        @Override
        public Dialect dialect() {
            return Dialect.RUST;
        }
    }
}
