package com.vidnyan.bridge.domain.session;

import com.vidnyan.bridge.domain.model.ParseError;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only sink for parse diagnostics. Never throws.
 */
@Slf4j
public class ErrorCollector {

    private final List<ParseError> errors = new ArrayList<>();
    private final Clock clock;

    public ErrorCollector() {
        this(Clock.systemUTC());
    }

    public ErrorCollector(Clock clock) {
        this.clock = clock;
    }

    public void add(String message, int line, int column, String suggestion) {
        ParseError error = new ParseError(
                message == null ? "Unknown error" : message,
                Math.max(line, 0),
                Math.max(column, 0),
                suggestion,
                Instant.now(clock));
        errors.add(error);
        log.warn("Parse diagnostic: {}", error.format());
    }

    public void add(String message) {
        add(message, 0, 0, null);
    }

    /**
     * Record a diagnostic at a character offset of {@code source}.
     */
    public void addAt(String message, String source, int offset, String suggestion) {
        int line = 1;
        int column = 1;
        int limit = Math.min(Math.max(offset, 0), source == null ? 0 : source.length());
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        add(message, line, column, suggestion);
    }

    public List<ParseError> errors() {
        return List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int size() {
        return errors.size();
    }
}
