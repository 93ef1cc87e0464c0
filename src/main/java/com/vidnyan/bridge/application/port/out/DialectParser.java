package com.vidnyan.bridge.application.port.out;

import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.session.ParseSession;

import java.util.List;

/**
 * Port for turning source text of one dialect into nodes.
 * Implemented once per dialect by the parser adapters.
 */
public interface DialectParser {

    /**
     * The dialect this parser handles.
     */
    Dialect dialect();

    /**
     * Parse text into ordered top-level declarations.
     * Never throws: failures are recorded in the session's diagnostics and
     * whatever was built before the failure is returned.
     * @param text Source text
     * @param session Session owning ids and diagnostics for this call
     * @return Declarations found, in source order
     */
    DialectParseResult parse(String text, ParseSession session);

    /**
     * Nodes produced by one dialect parser for one text.
     */
    record DialectParseResult(
        Dialect dialect,
        List<Node> nodes
    ) {
        public DialectParseResult {
            nodes = List.copyOf(nodes);
        }

        public static DialectParseResult empty(Dialect dialect) {
            return new DialectParseResult(dialect, List.of());
        }
    }
}
