package com.vidnyan.bridge.domain.model;

/**
 * Dialect-independent kind of construct a node represents.
 * Two node types with the same kind describe the same source construct
 * as seen by different dialects (e.g. {@code rust_use} and {@code bevy_use}).
 */
public enum ConstructKind {
    IMPORT,
    FUNCTION,
    STRUCT,
    IMPL,
    FIELD,
    BINDING,
    SHADER_HANDLE,
    CONDITIONAL,
    LOOP,
    RETURN,
    CALL,
    ASSIGNMENT,
    EXPRESSION_STATEMENT,
    TEXT,
    COMMENT
}
