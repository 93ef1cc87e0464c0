package com.vidnyan.bridge.domain.model;

/**
 * Broad category of a node, fixed by its type.
 */
public enum NodeCategory {
    DECLARATION,
    STATEMENT,
    EXPRESSION,
    LITERAL,
    OPAQUE
}
