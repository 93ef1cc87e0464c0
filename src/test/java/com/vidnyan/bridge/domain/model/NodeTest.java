package com.vidnyan.bridge.domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest {

    @Test
    void builder_ShouldRejectSlotsOutsideTheShape() {
        Node.Builder builder = Node.builder(NodeType.RUST_USE).id("block_0");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> builder.field("NAME", "x"));
        assertTrue(error.getMessage().contains("rust_use"));
        assertThrows(IllegalArgumentException.class,
                () -> Node.builder(NodeType.RUST_IF).statements("BODY", List.of()));
    }

    @Test
    void primaryName_ShouldPreferNameThenPathThenType() {
        Node function = Node.builder(NodeType.RUST_FUNCTION).id("a").field("NAME", "run").build();
        Node use = Node.builder(NodeType.RUST_USE).id("b").field("PATH", "std::io").build();
        Node impl = Node.builder(NodeType.RUST_IMPL).id("c").field("TYPE", "Point").build();
        Node loop = Node.builder(NodeType.RUST_LOOP).id("d").build();

        assertEquals("run", function.primaryName());
        assertEquals("std::io", use.primaryName());
        assertEquals("Point", impl.primaryName());
        assertEquals("", loop.primaryName());
    }

    @Test
    void sameStructure_ShouldIgnoreIdsAndEmptyStatementSlots() {
        Node left = Node.builder(NodeType.RUST_LOOP).id("block_1")
                .statements("BODY", List.of(text("x", "block_2")))
                .build();
        Node right = Node.builder(NodeType.RUST_LOOP).id("block_7")
                .statements("BODY", List.of(text("x", "block_9")))
                .build();
        Node empty = Node.builder(NodeType.RUST_LOOP).id("block_3").statements("BODY", List.of()).build();

        assertTrue(left.sameStructure(right));
        assertFalse(left.sameStructure(empty));
        assertTrue(empty.statements().isEmpty());
        assertEquals(List.of(), empty.statements("BODY"));
    }

    @Test
    void node_ShouldBeImmutable() {
        List<Node> body = new ArrayList<>(List.of(text("a", "block_1")));
        Node loop = Node.builder(NodeType.RUST_LOOP).id("block_0").statements("BODY", body).build();

        body.add(text("b", "block_2"));

        assertEquals(1, loop.statements("BODY").size());
        assertThrows(UnsupportedOperationException.class, () -> loop.fields().put("X", "y"));
    }

    @Test
    void walk_ShouldVisitValuesBeforeStatements() {
        Node node = Node.builder(NodeType.RUST_IF).id("if")
                .value("CONDITION", text("cond", "c"))
                .statements("THEN", List.of(text("then", "t")))
                .statements("ELSE", List.of(text("else", "e")))
                .build();
        List<String> visited = new ArrayList<>();

        node.walk(n -> visited.add(n.id()));

        assertEquals(List.of("if", "c", "t", "e"), visited);
    }

    @Test
    void fromTag_ShouldResolveEveryVocabularyTag() {
        for (NodeType type : NodeType.values()) {
            assertEquals(type, NodeType.fromTag(type.tag()).orElseThrow());
        }
        assertTrue(NodeType.fromTag("function").isEmpty());
        assertEquals(NodeType.WGSL_COMMENT, NodeType.opaqueFor(Dialect.WGSL));
        assertEquals(NodeType.RUST_COMMENT, NodeType.opaqueFor(Dialect.BIOSPHERES));
        assertEquals(NodeCategory.OPAQUE, NodeType.opaqueFor(Dialect.BIOSPHERES).category());
    }

    private static Node text(String value, String id) {
        return Node.builder(NodeType.RUST_VAR).id(id).field("NAME", value).build();
    }
}
