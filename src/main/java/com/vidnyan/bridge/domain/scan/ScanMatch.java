package com.vidnyan.bridge.domain.scan;

import com.vidnyan.bridge.domain.model.Node;

/**
 * Outcome of a matcher that recognized its keyword at the cursor: either a node and
 * the offset just past the construct, or a problem describing why the expected
 * shape was not found.
 */
public record ScanMatch(int end, Node node, String problem) {

    public static ScanMatch of(int end, Node node) {
        return new ScanMatch(end, node, null);
    }

    public static ScanMatch malformed(String problem) {
        return new ScanMatch(-1, null, problem);
    }

    public boolean isMalformed() {
        return problem != null;
    }
}
