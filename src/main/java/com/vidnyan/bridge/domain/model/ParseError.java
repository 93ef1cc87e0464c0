package com.vidnyan.bridge.domain.model;

import java.time.Instant;

/**
 * A diagnostic recorded while parsing.
 * Line and column are 1-based; 0 means the position is unknown.
 */
public record ParseError(
    String message,
    int line,
    int column,
    String suggestion,
    Instant timestamp
) {

    public boolean hasSuggestion() {
        return suggestion != null && !suggestion.isBlank();
    }

    /**
     * Format as readable string.
     */
    public String format() {
        String position = line > 0 ? line + ":" + column + " " : "";
        return position + message + (hasSuggestion() ? " (" + suggestion + ")" : "");
    }
}
