package com.vidnyan.bridge.application.port.in;

import com.vidnyan.bridge.domain.model.CrossFileReference;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.FileParseResult;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.ParseError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Primary use case: turn source text into editor blocks.
 * This is the main entry point to the application. No method throws for bad
 * input; problems come back as diagnostics next to a best-effort result.
 */
public interface ParseCodeUseCase {

    /**
     * Parse one text.
     * @param request Text plus a dialect tag, "auto" or "mixed"
     * @return Nodes, the dialects used and all diagnostics
     */
    ParseResponse parse(ParseRequest request);

    /**
     * Parse a batch of files with one shared session and extract cross-file references.
     */
    BatchParseResponse parseFiles(BatchParseRequest request);

    /**
     * Render nodes in the editor's interchange format.
     */
    String toInterchange(List<Node> nodes, String filename);

    /**
     * Load an interchange document back into nodes.
     */
    InterchangeResponse fromInterchange(String document);

    record ParseRequest(
        String code,
        String mode
    ) {
        public static final String AUTO = "auto";
        public static final String MIXED = "mixed";

        public ParseRequest {
            code = code == null ? "" : code;
            mode = mode == null || mode.isBlank() ? AUTO : mode.trim();
        }

        public static ParseRequest auto(String code) {
            return new ParseRequest(code, AUTO);
        }
    }

    record ParseResponse(
        List<Node> nodes,
        Set<Dialect> dialects,
        List<ParseError> errors
    ) {
        public boolean hasErrors() {
            return !errors.isEmpty();
        }
    }

    /**
     * Files in the order they should be processed.
     */
    record BatchParseRequest(
        Map<String, String> files
    ) {
        public BatchParseRequest {
            files = files == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(files));
        }
    }

    record BatchParseResponse(
        Map<String, FileParseResult> results,
        List<CrossFileReference> references,
        List<ParseError> errors
    ) {
        public int nodeCount() {
            return results.values().stream().mapToInt(r -> r.nodes().size()).sum();
        }
    }

    record InterchangeResponse(
        String filename,
        List<Node> nodes,
        List<ParseError> errors
    ) {
        public boolean isValid() {
            return errors.isEmpty();
        }
    }
}
