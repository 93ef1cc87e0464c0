package com.vidnyan.bridge.application.service;

import com.vidnyan.bridge.application.port.out.DialectParser;
import com.vidnyan.bridge.application.port.out.DialectParser.DialectParseResult;
import com.vidnyan.bridge.domain.graph.ReferenceGraph;
import com.vidnyan.bridge.domain.mode.ModeDetector;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.FileParseResult;
import com.vidnyan.bridge.domain.session.ParseSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a batch of files in caller order, choosing each file's dialect from its
 * name, then extracts the references between files.
 */
@Slf4j
@Component
public class MultiFileOrchestrator {

    private final Map<Dialect, DialectParser> parsers = new EnumMap<>(Dialect.class);
    private final ModeDetector modeDetector;

    public MultiFileOrchestrator(List<DialectParser> dialectParsers, ModeDetector modeDetector) {
        dialectParsers.forEach(p -> parsers.put(p.dialect(), p));
        this.modeDetector = modeDetector;
    }

    /**
     * Per-file results in batch order, and the reference graph over them.
     */
    public record BatchResult(
        Map<String, FileParseResult> results,
        ReferenceGraph references
    ) {}

    /**
     * Parse every file with one session, so node ids are unique across the batch.
     */
    public BatchResult parseFiles(Map<String, String> files, ParseSession session) {
        long startTime = System.currentTimeMillis();
        log.info("Parsing batch of {} files", files.size());

        Map<String, FileParseResult> results = new LinkedHashMap<>();
        files.forEach((filename, text) -> results.put(filename, parseFile(filename, text, session)));

        ReferenceGraph graph = ReferenceGraph.build(results);
        log.info("Batch parsed: {} files, {} cross-file references, {} diagnostics in {}ms",
                results.size(), graph.size(), session.errors().size(),
                System.currentTimeMillis() - startTime);
        return new BatchResult(results, graph);
    }

    private FileParseResult parseFile(String filename, String text, ParseSession session) {
        Dialect dialect = modeDetector.detectFromFilename(filename);
        DialectParser parser = parsers.get(dialect);
        if (parser == null) {
            session.errors().add("No parser registered for " + dialect.displayName() + " (" + filename + ")");
            return new FileParseResult(filename, dialect, List.of());
        }
        log.debug("Parsing {} as {}", filename, dialect.displayName());
        DialectParseResult result = parser.parse(text == null ? "" : text, session);
        return new FileParseResult(filename, dialect, result.nodes());
    }
}
