package com.vidnyan.bridge.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.vidnyan.bridge.domain.model.ConstructKind.*;
import static com.vidnyan.bridge.domain.model.Dialect.*;
import static com.vidnyan.bridge.domain.model.NodeCategory.*;

/**
 * Closed vocabulary of node types.
 * The tag of each constant is the block type understood by the visual editor and
 * the code generator, so tags must never change.
 */
public enum NodeType {

    // Rust
    RUST_USE("rust_use", RUST, DECLARATION, IMPORT, NodeShape.fields("PATH")),
    RUST_MAIN("rust_main", RUST, DECLARATION, FUNCTION, NodeShape.statements("BODY")),
    RUST_FUNCTION("rust_function", RUST, DECLARATION, FUNCTION,
            NodeShape.fields("NAME").withValues("PARAMS_OPTIONAL", "RETURN_TYPE_OPTIONAL").withStatements("BODY")),
    RUST_PUB_FUNCTION("rust_pub_function", RUST, DECLARATION, FUNCTION,
            NodeShape.fields("NAME").withValues("PARAMS_OPTIONAL", "RETURN_TYPE_OPTIONAL").withStatements("BODY")),
    RUST_PARAMETERS("rust_parameters", RUST, EXPRESSION, TEXT, NodeShape.fields("PARAMS")),
    RUST_RETURN_TYPE("rust_return_type", RUST, EXPRESSION, TEXT, NodeShape.fields("TYPE")),
    RUST_IMPL("rust_impl", RUST, DECLARATION, IMPL, NodeShape.fields("TYPE").withStatements("METHODS")),
    RUST_STRUCT("rust_struct", RUST, DECLARATION, STRUCT, NodeShape.fields("NAME", "DERIVES").withStatements("FIELDS")),
    RUST_FIELD("rust_field", RUST, DECLARATION, FIELD, NodeShape.fields("NAME", "TYPE")),
    RUST_IF("rust_if", RUST, STATEMENT, CONDITIONAL, NodeShape.values("CONDITION").withStatements("THEN", "ELSE")),
    RUST_WHILE("rust_while", RUST, STATEMENT, LOOP, NodeShape.values("CONDITION").withStatements("BODY")),
    RUST_FOR("rust_for", RUST, STATEMENT, LOOP, NodeShape.fields("VAR").withValues("ITERATOR").withStatements("BODY")),
    RUST_LOOP("rust_loop", RUST, STATEMENT, LOOP, NodeShape.statements("BODY")),
    RUST_LET_BINDING("rust_let_binding", RUST, STATEMENT, BINDING,
            NodeShape.fields("MUTABLE", "NAME").withValues("TYPE", "VALUE")),
    RUST_RETURN("rust_return", RUST, STATEMENT, RETURN, NodeShape.values("VALUE")),
    RUST_PRINTLN("rust_println", RUST, STATEMENT, CALL, NodeShape.values("MESSAGE")),
    RUST_ASSIGN("rust_assign", RUST, STATEMENT, ASSIGNMENT, NodeShape.fields("VAR").withValues("VALUE")),
    RUST_EXPR_STMT("rust_expr_stmt", RUST, STATEMENT, EXPRESSION_STATEMENT, NodeShape.values("EXPR")),
    RUST_VAR("rust_var", RUST, LITERAL, TEXT, NodeShape.fields("NAME")),
    RUST_COMMENT("rust_comment", RUST, OPAQUE, COMMENT, NodeShape.fields("TEXT")),

    // WGSL
    WGSL_STRUCT("wgsl_struct", WGSL, DECLARATION, STRUCT, NodeShape.fields("NAME").withValues("FIELDS")),
    WGSL_COMPUTE_SHADER("wgsl_compute_shader", WGSL, DECLARATION, FUNCTION,
            NodeShape.fields("NAME", "WORKGROUP_SIZE").withValues("PARAMS", "RETURN_TYPE").withStatements("BODY")),
    WGSL_VERTEX_SHADER("wgsl_vertex_shader", WGSL, DECLARATION, FUNCTION,
            NodeShape.fields("NAME", "WORKGROUP_SIZE").withValues("PARAMS", "RETURN_TYPE").withStatements("BODY")),
    WGSL_FRAGMENT_SHADER("wgsl_fragment_shader", WGSL, DECLARATION, FUNCTION,
            NodeShape.fields("NAME", "WORKGROUP_SIZE").withValues("PARAMS", "RETURN_TYPE").withStatements("BODY")),
    WGSL_FUNCTION("wgsl_function", WGSL, DECLARATION, FUNCTION,
            NodeShape.fields("NAME").withValues("PARAMS", "RETURN_TYPE").withStatements("BODY")),
    WGSL_VAR("wgsl_var", WGSL, DECLARATION, BINDING,
            NodeShape.fields("STORAGE_CLASS", "ACCESS_MODE", "GROUP", "BINDING", "NAME", "TYPE")),
    WGSL_IF("wgsl_if", WGSL, STATEMENT, CONDITIONAL, NodeShape.values("CONDITION").withStatements("THEN", "ELSE")),
    WGSL_WHILE("wgsl_while", WGSL, STATEMENT, LOOP, NodeShape.values("CONDITION").withStatements("BODY")),
    WGSL_FOR("wgsl_for", WGSL, STATEMENT, LOOP,
            NodeShape.values("INIT", "CONDITION", "UPDATE").withStatements("BODY")),
    WGSL_LOOP("wgsl_loop", WGSL, STATEMENT, LOOP, NodeShape.statements("BODY")),
    WGSL_VAR_DECL("wgsl_var_decl", WGSL, STATEMENT, BINDING, NodeShape.fields("KIND", "NAME", "TYPE").withValues("VALUE")),
    WGSL_RETURN("wgsl_return", WGSL, STATEMENT, RETURN, NodeShape.values("VALUE")),
    WGSL_EXPR_STMT("wgsl_expr_stmt", WGSL, STATEMENT, EXPRESSION_STATEMENT, NodeShape.values("EXPR")),
    WGSL_COMMENT("wgsl_comment", WGSL, OPAQUE, COMMENT, NodeShape.fields("TEXT")),

    // Bevy
    BEVY_USE("bevy_use", BEVY, DECLARATION, IMPORT, NodeShape.fields("PATH")),
    BEVY_SYSTEM("bevy_system", BEVY, DECLARATION, FUNCTION,
            NodeShape.fields("NAME").withValues("PARAMS", "RETURN_TYPE").withStatements("BODY")),
    BEVY_COMPONENT("bevy_component", BEVY, DECLARATION, STRUCT, NodeShape.fields("NAME").withValues("FIELDS")),
    BEVY_DERIVE_COMPONENT("bevy_derive_component", BEVY, DECLARATION, STRUCT,
            NodeShape.fields("NAME").withValues("FIELDS")),
    BEVY_RESOURCE("bevy_resource", BEVY, DECLARATION, STRUCT, NodeShape.fields("NAME").withValues("FIELDS")),
    BEVY_PLUGIN_IMPL("bevy_plugin_impl", BEVY, DECLARATION, IMPL, NodeShape.fields("NAME").withStatements("BODY")),
    BEVY_ADD_SYSTEMS("bevy_add_systems", BEVY, STATEMENT, CALL, NodeShape.fields("SCHEDULE").withValues("SYSTEMS")),
    BEVY_SHADER_HANDLE("bevy_shader_handle", BEVY, STATEMENT, SHADER_HANDLE, NodeShape.fields("NAME", "SHADER_PATH")),
    BEVY_COMMENT("bevy_comment", BEVY, OPAQUE, COMMENT, NodeShape.fields("TEXT"));

    private static final Map<String, NodeType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeType::tag, Function.identity()));

    private final String tag;
    private final Dialect dialect;
    private final NodeCategory category;
    private final ConstructKind kind;
    private final NodeShape shape;

    NodeType(String tag, Dialect dialect, NodeCategory category, ConstructKind kind, NodeShape shape) {
        this.tag = tag;
        this.dialect = dialect;
        this.category = category;
        this.kind = kind;
        this.shape = shape;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public Dialect dialect() {
        return dialect;
    }

    public NodeCategory category() {
        return category;
    }

    public ConstructKind kind() {
        return kind;
    }

    public NodeShape shape() {
        return shape;
    }

    public static Optional<NodeType> fromTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }

    /**
     * Opaque node type used when a dialect cannot recognize anything in its input.
     */
    public static NodeType opaqueFor(Dialect dialect) {
        return switch (dialect) {
            case WGSL -> WGSL_COMMENT;
            case BEVY -> BEVY_COMMENT;
            case RUST, BIOSPHERES -> RUST_COMMENT;
        };
    }
}
