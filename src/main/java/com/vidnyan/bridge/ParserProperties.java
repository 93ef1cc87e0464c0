package com.vidnyan.bridge;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the parsers.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "bridge.parser")
public class ParserProperties {

    /**
     * Maximum top-level declarations one dialect parser extracts from one text.
     */
    private int maxDeclarations = 100;

    /**
     * Characters of the original text kept in a "could not parse" placeholder.
     */
    private int fallbackExcerptLength = 500;

    /**
     * Deepest statement nesting decomposed; deeper bodies are kept as text.
     */
    private int maxNestingDepth = 64;

    /**
     * File name written into the file container when the caller gives none.
     */
    private String defaultFilename = "imported.rs";
}
