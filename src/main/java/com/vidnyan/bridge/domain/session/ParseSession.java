package com.vidnyan.bridge.domain.session;

import com.vidnyan.bridge.domain.model.ParseError;

import java.util.List;

/**
 * State of one top-level parse call: the node id counter and the diagnostics.
 * A session is created per call (a single parse or a whole batch) and is never
 * shared between calls.
 */
public final class ParseSession {

    private final ErrorCollector errors;
    private int nextId;

    public ParseSession() {
        this(new ErrorCollector());
    }

    public ParseSession(ErrorCollector errors) {
        this.errors = errors;
    }

    /**
     * Next node id; monotonically increasing and never reused within this session.
     */
    public String nextId() {
        return "block_" + nextId++;
    }

    public int idsIssued() {
        return nextId;
    }

    public ErrorCollector errors() {
        return errors;
    }

    public List<ParseError> diagnostics() {
        return errors.errors();
    }
}
