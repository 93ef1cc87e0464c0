package com.vidnyan.bridge.domain.model;

import java.util.List;

/**
 * Nodes parsed from one file of a batch.
 */
public record FileParseResult(
    String filename,
    Dialect dialect,
    List<Node> nodes
) {

    public FileParseResult {
        nodes = List.copyOf(nodes);
    }
}
