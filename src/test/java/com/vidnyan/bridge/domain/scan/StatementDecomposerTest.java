package com.vidnyan.bridge.domain.scan;

import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.session.ParseSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatementDecomposerTest {

    private final StatementDecomposer decomposer = new StatementDecomposer(
            List.of(
                    BlockStatementMatchers.conditional(NodeType.RUST_IF),
                    BlockStatementMatchers.conditionLoop(NodeType.RUST_WHILE, "while"),
                    BlockStatementMatchers.unconditionalLoop(NodeType.RUST_LOOP),
                    BlockStatementMatchers.returnStatement(NodeType.RUST_RETURN)),
            (context, expression) -> context.node(NodeType.RUST_EXPR_STMT)
                    .value("EXPR", context.textNode(expression)).build(),
            (context, expression) -> context.node(NodeType.RUST_RETURN)
                    .value("VALUE", context.textNode(expression)).build());

    private ParseSession session;

    @BeforeEach
    void setUp() {
        session = new ParseSession();
    }

    @Test
    void decompose_ShouldSplitStatementsAndWrapTrailingExpressionAsReturn() {
        List<Node> statements = decompose("foo(); bar(1, 2); x + 1", 64);

        assertEquals(3, statements.size());
        assertEquals(NodeType.RUST_EXPR_STMT, statements.get(0).type());
        assertEquals("foo()", statements.get(0).value("EXPR").field("NAME"));
        assertEquals("bar(1, 2)", statements.get(1).value("EXPR").field("NAME"));
        assertEquals(NodeType.RUST_RETURN, statements.get(2).type());
        assertEquals("x + 1", statements.get(2).value("VALUE").field("NAME"));
    }

    @Test
    void decompose_ShouldNestElseIfChains() {
        List<Node> statements = decompose("if a { b(); } else if c { d(); } else { e(); }", 64);

        assertEquals(1, statements.size());
        Node outer = statements.get(0);
        assertEquals("a", outer.value("CONDITION").field("NAME"));
        assertEquals(1, outer.statements("THEN").size());
        Node inner = outer.statements("ELSE").get(0);
        assertEquals(NodeType.RUST_IF, inner.type());
        assertEquals("c", inner.value("CONDITION").field("NAME"));
        assertEquals("e()", inner.statements("ELSE").get(0).value("EXPR").field("NAME"));
    }

    @Test
    void decompose_ShouldHandleLongElseIfChainsWithoutRecursion() {
        StringBuilder chain = new StringBuilder("if a { x(); }");
        for (int i = 0; i < 3000; i++) {
            chain.append(" else if b").append(i).append(" { y(); }");
        }
        chain.append(" else { z(); }");

        List<Node> statements = decompose(chain.toString(), 64);

        assertEquals(1, statements.size());
        assertFalse(session.errors().hasErrors());
        Node branch = statements.get(0);
        for (int i = 0; i < 3000; i++) {
            branch = branch.statements("ELSE").get(0);
            assertEquals("b" + i, branch.value("CONDITION").field("NAME"));
        }
        assertEquals("z()", branch.statements("ELSE").get(0).value("EXPR").field("NAME"));
    }

    @Test
    void decompose_ShouldEndExpressionAtBlockFollowedByNewStatement() {
        List<Node> statements = decompose("match x { _ => 1 } y();", 64);

        assertEquals(2, statements.size());
        assertEquals("match x { _ => 1 }", statements.get(0).value("EXPR").field("NAME"));
        assertEquals("y()", statements.get(1).value("EXPR").field("NAME"));
    }

    @Test
    void decompose_ShouldReportMalformedConstructAndContinue() {
        List<Node> statements = decompose("if { } ; next();", 64);

        assertEquals(1, statements.size());
        assertEquals("next()", statements.get(0).value("EXPR").field("NAME"));
        assertEquals(1, session.errors().size());
        assertTrue(session.diagnostics().get(0).message().startsWith("Malformed if statement"));
        assertEquals(1, session.diagnostics().get(0).line());
    }

    @Test
    void decompose_ShouldKeepBodiesBeyondNestingLimitAsText() {
        List<Node> statements = decompose("loop { loop { loop { x(); } } }", 2);

        Node inner = statements.get(0).statements("BODY").get(0);
        assertEquals(NodeType.RUST_LOOP, inner.type());
        Node kept = inner.statements("BODY").get(0);
        assertEquals(NodeType.RUST_EXPR_STMT, kept.type());
        assertEquals("loop { x(); }", kept.value("EXPR").field("NAME"));
        assertTrue(session.diagnostics().get(0).message().contains("Nesting deeper than 2"));
    }

    @Test
    void decompose_ShouldTerminateOnUnbalancedInput() {
        assertEquals(List.of(), decompose("}}}", 64));
        assertEquals(List.of(), decompose("   ", 64));

        List<Node> statements = decompose("while x { y(); ", 64);
        assertEquals(List.of(), statements);
        assertEquals(1, session.errors().size());
    }

    private List<Node> decompose(String text, int maxDepth) {
        ScanContext context = new ScanContext(text, session, Dialect.RUST, decomposer, maxDepth);
        return context.decompose(0, text.length());
    }
}
