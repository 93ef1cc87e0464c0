package com.vidnyan.bridge.domain.scan;

import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;
import com.vidnyan.bridge.domain.session.ParseSession;

import java.util.List;

/**
 * Per-parse view of the source handed to matchers: the full text, the session,
 * the statement decomposer of the dialect and the current nesting depth.
 */
public final class ScanContext {

    private final String text;
    private final ParseSession session;
    private final Dialect dialect;
    private final StatementDecomposer decomposer;
    private final int maxNestingDepth;
    private int depth;

    public ScanContext(String text, ParseSession session, Dialect dialect,
                       StatementDecomposer decomposer, int maxNestingDepth) {
        this.text = text;
        this.session = session;
        this.dialect = dialect;
        this.decomposer = decomposer;
        this.maxNestingDepth = maxNestingDepth;
    }

    public String text() {
        return text;
    }

    public ParseSession session() {
        return session;
    }

    public Dialect dialect() {
        return dialect;
    }

    public String slice(int start, int end) {
        return text.substring(start, end);
    }

    public String nextId() {
        return session.nextId();
    }

    public Node.Builder node(NodeType type) {
        return Node.builder(type).id(session.nextId());
    }

    /**
     * Literal text node, used for expressions kept as source text.
     */
    public Node textNode(String value) {
        return node(NodeType.RUST_VAR).field("NAME", value).build();
    }

    /**
     * Decompose the statements of a nested body.
     */
    public List<Node> decompose(int start, int end) {
        return decomposer.decompose(this, start, end);
    }

    public void report(String message, int offset) {
        session.errors().addAt(message, text, offset, dialect.suggestion());
    }

    boolean tooDeep() {
        return depth >= maxNestingDepth;
    }

    int maxNestingDepth() {
        return maxNestingDepth;
    }

    void enter() {
        depth++;
    }

    void exit() {
        depth--;
    }
}
