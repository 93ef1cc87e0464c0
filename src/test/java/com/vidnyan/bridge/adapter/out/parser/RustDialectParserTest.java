package com.vidnyan.bridge.adapter.out.parser;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.session.ParseSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RustDialectParserTest {

    private RustDialectParser parser;
    private ParseSession session;

    @BeforeEach
    void setUp() {
        parser = new RustDialectParser(new ParserProperties());
        session = new ParseSession();
    }

    @Test
    void parse_ShouldBuildFunctionWithParametersReturnTypeAndImplicitReturn() {
        List<Node> nodes = parse("fn add(a: i32, b: i32) -> i32 { a + b }");

        assertEquals(1, nodes.size());
        Node function = nodes.get(0);
        assertEquals(NodeType.RUST_FUNCTION, function.type());
        assertEquals("add", function.field("NAME"));
        assertEquals("a: i32, b: i32", function.value("PARAMS_OPTIONAL").field("PARAMS"));
        assertEquals("i32", function.value("RETURN_TYPE_OPTIONAL").field("TYPE"));
        Node ret = function.statements("BODY").get(0);
        assertEquals(NodeType.RUST_RETURN, ret.type());
        assertEquals("a + b", ret.value("VALUE").field("NAME"));
        assertFalse(session.errors().hasErrors());
    }

    @Test
    void parse_ShouldRecognizeMainAndItsStatements() {
        List<Node> nodes = parse("fn main() {\n"
                + "    let mut x: i32 = 5;\n"
                + "    x = x + 1;\n"
                + "    println!(\"{}\", x);\n"
                + "}");

        Node main = nodes.get(0);
        assertEquals(NodeType.RUST_MAIN, main.type());
        List<Node> body = main.statements("BODY");
        assertEquals(3, body.size());

        Node let = body.get(0);
        assertEquals(NodeType.RUST_LET_BINDING, let.type());
        assertEquals("TRUE", let.field("MUTABLE"));
        assertEquals("x", let.field("NAME"));
        assertEquals(": i32", let.value("TYPE").field("NAME"));
        assertEquals("5", let.value("VALUE").field("NAME"));

        assertEquals(NodeType.RUST_ASSIGN, body.get(1).type());
        assertEquals("x", body.get(1).field("VAR"));
        assertEquals("x + 1", body.get(1).value("VALUE").field("NAME"));

        assertEquals(NodeType.RUST_PRINTLN, body.get(2).type());
        assertEquals("\"{}\", x", body.get(2).value("MESSAGE").field("NAME"));
    }

    @Test
    void parse_ShouldDistinguishPublicFunctionsAndStripWhereClauses() {
        List<Node> nodes = parse("pub fn first<T>(items: &[T]) -> Option<&T> where T: Clone { items.first() }\n"
                + "pub(crate) async fn fetch() {}");

        assertEquals(NodeType.RUST_PUB_FUNCTION, nodes.get(0).type());
        assertEquals("Option<&T>", nodes.get(0).value("RETURN_TYPE_OPTIONAL").field("TYPE"));
        assertEquals(NodeType.RUST_PUB_FUNCTION, nodes.get(1).type());
        assertEquals("fetch", nodes.get(1).field("NAME"));
        assertNull(nodes.get(1).value("PARAMS_OPTIONAL"));
        assertTrue(nodes.get(1).statements().isEmpty());
    }

    @Test
    void parse_ShouldCollectImplMethodsAndStructFields() {
        List<Node> nodes = parse("use std::collections::HashMap;\n"
                + "#[derive(Debug, Clone)]\n"
                + "pub struct Point { pub x: f64, // horizontal\n y: f64 }\n"
                + "struct Meters(f64);\n"
                + "impl<T: Clone> Stack<T> where T: Debug {\n"
                + "    pub fn push(&mut self, v: T) { self.items.push(v); }\n"
                + "    fn len(&self) -> usize { self.items.len() }\n"
                + "}");

        assertEquals(List.of(NodeType.RUST_USE, NodeType.RUST_STRUCT, NodeType.RUST_STRUCT, NodeType.RUST_IMPL),
                nodes.stream().map(Node::type).toList());
        assertEquals("std::collections::HashMap", nodes.get(0).field("PATH"));

        Node point = nodes.get(1);
        assertEquals("Debug, Clone", point.field("DERIVES"));
        List<Node> fields = point.statements("FIELDS");
        assertEquals(2, fields.size());
        assertEquals("x", fields.get(0).field("NAME"));
        assertEquals("f64", fields.get(0).field("TYPE"));
        assertEquals("y", fields.get(1).field("NAME"));

        assertEquals("", nodes.get(2).field("DERIVES"));
        assertEquals(List.of(), nodes.get(2).statements("FIELDS"));

        Node impl = nodes.get(3);
        assertEquals("Stack<T>", impl.field("TYPE"));
        List<Node> methods = impl.statements("METHODS");
        assertEquals(NodeType.RUST_PUB_FUNCTION, methods.get(0).type());
        assertEquals(NodeType.RUST_EXPR_STMT, methods.get(0).statements("BODY").get(0).type());
        assertEquals("len", methods.get(1).field("NAME"));
        assertEquals("self.items.len()", methods.get(1).statements("BODY").get(0).value("VALUE").field("NAME"));
    }

    @Test
    void parse_ShouldNotEndBodiesAtBracesInsideLiterals() {
        List<Node> nodes = parse("fn f() { let s = \"}\"; let c = '{'; }\nfn g() {}");

        assertEquals(2, nodes.size());
        assertEquals(2, nodes.get(0).statements("BODY").size());
        assertEquals("g", nodes.get(1).field("NAME"));
    }

    @Test
    void parse_ShouldFallBackToCommentForUnrecognizedText() {
        String text = "trait Shape { fn area(&self) -> f64; }";

        List<Node> nodes = parse(text);

        assertEquals(1, nodes.size());
        assertEquals(NodeType.RUST_COMMENT, nodes.get(0).type());
        assertEquals(AbstractDialectParser.FALLBACK_PREFIX + text, nodes.get(0).field("TEXT"));
        assertFalse(session.errors().hasErrors());
    }

    @Test
    void parse_ShouldStopAtDeclarationLimit() {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 150; i++) {
            text.append("fn f").append(i).append("() {}\n");
        }

        List<Node> nodes = parse(text.toString());

        assertEquals(100, nodes.size());
        assertEquals("f99", nodes.get(99).field("NAME"));
        assertEquals(1, session.errors().size());
        assertEquals("Declaration limit of 100 reached; remaining input ignored",
                session.diagnostics().get(0).message());
        assertEquals(101, session.diagnostics().get(0).line());
    }

    @Test
    void parse_ShouldReportMalformedStatementsAndKeepTheFunction() {
        List<Node> nodes = parse("fn f() { let x = 1 }");

        assertEquals(1, nodes.size());
        assertEquals("f", nodes.get(0).field("NAME"));
        assertEquals(1, session.errors().size());
        assertEquals("Malformed let binding: missing ';'", session.diagnostics().get(0).message());
    }

    @Test
    void parse_ShouldReportUnbalancedBodyWithPosition() {
        List<Node> nodes = parse("\n\nfn broken() { if x {");

        assertEquals(NodeType.RUST_COMMENT, nodes.get(0).type());
        assertEquals(1, session.errors().size());
        assertEquals("3:1 Malformed function 'broken': missing or unbalanced body (Check Rust syntax)",
                session.diagnostics().get(0).format());
    }

    private List<Node> parse(String text) {
        return parser.parse(text, session).nodes();
    }
}
