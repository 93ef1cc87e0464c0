package com.vidnyan.bridge.application.port.out;

import com.vidnyan.bridge.domain.model.Node;

import java.util.List;

/**
 * Port for the portable interchange format exchanged with the visual editor.
 */
public interface NodeSerializer {

    /**
     * Render nodes as the top-level contents of a file container.
     * Pure: holds no state between calls.
     */
    String serialize(List<Node> nodes, String filename);

    /**
     * Load a document produced by {@link #serialize} (or edited by the editor) back into nodes.
     * @throws InterchangeFormatException if the document is not valid
     */
    InterchangeDocument deserialize(String document);

    /**
     * Contents of one file container.
     */
    record InterchangeDocument(
        String filename,
        List<Node> nodes
    ) {
        public InterchangeDocument {
            nodes = List.copyOf(nodes);
        }
    }
}
