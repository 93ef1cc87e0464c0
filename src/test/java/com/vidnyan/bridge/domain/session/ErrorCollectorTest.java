package com.vidnyan.bridge.domain.session;

import com.vidnyan.bridge.domain.model.ParseError;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ErrorCollectorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Test
    void addAt_ShouldComputeOneBasedLineAndColumn() {
        ErrorCollector collector = new ErrorCollector(Clock.fixed(NOW, ZoneOffset.UTC));

        collector.addAt("Unexpected token", "ab\ncd", 4, "Check Rust syntax");

        ParseError error = collector.errors().get(0);
        assertEquals(2, error.line());
        assertEquals(2, error.column());
        assertEquals("Check Rust syntax", error.suggestion());
        assertEquals(NOW, error.timestamp());
        assertEquals("2:2 Unexpected token (Check Rust syntax)", error.format());
    }

    @Test
    void add_ShouldNeverThrowOnMissingValues() {
        ErrorCollector collector = new ErrorCollector();

        collector.add(null, -3, -1, null);
        collector.addAt("Out of range", null, 99, null);

        assertEquals(2, collector.size());
        assertEquals("Unknown error", collector.errors().get(0).message());
        assertEquals(0, collector.errors().get(0).line());
        assertFalse(collector.errors().get(0).hasSuggestion());
    }

    @Test
    void errors_ShouldBeAppendOnlySnapshot() {
        ErrorCollector collector = new ErrorCollector();
        collector.add("first");

        var snapshot = collector.errors();
        collector.add("second");

        assertEquals(1, snapshot.size());
        assertEquals(2, collector.size());
        assertTrue(collector.hasErrors());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
    }

    @Test
    void session_ShouldIssueMonotonicIds() {
        ParseSession session = new ParseSession();

        assertEquals("block_0", session.nextId());
        assertEquals("block_1", session.nextId());
        assertEquals(2, session.idsIssued());
        assertEquals("block_0", new ParseSession().nextId());
    }
}
