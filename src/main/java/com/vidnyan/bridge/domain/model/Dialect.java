package com.vidnyan.bridge.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Source dialects the parser understands.
 */
public enum Dialect {
    RUST("rust", "Rust", "Check Rust syntax"),
    WGSL("wgsl", "WGSL", "Check WGSL syntax"),
    BEVY("bevy", "Bevy", "Check Bevy ECS syntax"),
    BIOSPHERES("biospheres", "Biospheres", "Check Biospheres syntax");

    private final String tag;
    private final String displayName;
    private final String suggestion;

    Dialect(String tag, String displayName, String suggestion) {
        this.tag = tag;
        this.displayName = displayName;
        this.suggestion = suggestion;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Hint attached to diagnostics raised by this dialect's parser.
     */
    public String suggestion() {
        return suggestion;
    }

    public static Optional<Dialect> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(d -> d.tag.equals(normalized))
                .findFirst();
    }
}
