package com.vidnyan.bridge.application.service;

import com.vidnyan.bridge.ParserProperties;
import com.vidnyan.bridge.application.port.in.ParseCodeUseCase;
import com.vidnyan.bridge.application.port.out.DialectParser;
import com.vidnyan.bridge.application.port.out.InterchangeFormatException;
import com.vidnyan.bridge.application.port.out.NodeSerializer;
import com.vidnyan.bridge.domain.mode.ModeDetector;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.session.ParseSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Main application service: picks the parsers for a request, runs them with a
 * fresh session and returns nodes together with every diagnostic.
 * Implements the primary use case.
 */
@Slf4j
@Service
public class CodeParsingApplicationService implements ParseCodeUseCase {

    static final String VALID_MODES = ParseRequest.AUTO + ", " + ParseRequest.MIXED + ", "
            + Arrays.stream(Dialect.values()).map(Dialect::tag).collect(Collectors.joining(", "));

    private final Map<Dialect, DialectParser> parsers = new EnumMap<>(Dialect.class);
    private final ModeDetector modeDetector;
    private final MixedModeMerger mixedModeMerger;
    private final MultiFileOrchestrator orchestrator;
    private final NodeSerializer nodeSerializer;
    private final ParserProperties properties;

    public CodeParsingApplicationService(
            List<DialectParser> dialectParsers,
            ModeDetector modeDetector,
            MixedModeMerger mixedModeMerger,
            MultiFileOrchestrator orchestrator,
            NodeSerializer nodeSerializer,
            ParserProperties properties
    ) {
        dialectParsers.forEach(p -> parsers.put(p.dialect(), p));
        this.modeDetector = modeDetector;
        this.mixedModeMerger = mixedModeMerger;
        this.orchestrator = orchestrator;
        this.nodeSerializer = nodeSerializer;
        this.properties = properties;
    }

    @Override
    public ParseResponse parse(ParseRequest request) {
        long startTime = System.currentTimeMillis();
        ParseSession session = new ParseSession();
        String code = request.code();
        log.info("Parsing {} characters, mode: {}", code.length(), request.mode());

        Set<Dialect> dialects = Set.of();
        List<Node> nodes = List.of();
        try {
            String mode = request.mode();
            if (ParseRequest.AUTO.equalsIgnoreCase(mode) || ParseRequest.MIXED.equalsIgnoreCase(mode)) {
                dialects = modeDetector.detect(code);
                boolean mixed = ParseRequest.MIXED.equalsIgnoreCase(mode) || dialects.size() > 1;
                log.info("Detected dialects: {}{}", dialects, mixed ? " (mixed)" : "");
                nodes = mixed
                        ? mixedModeMerger.parseMixed(code, dialects, session)
                        : parseSingle(dialects.iterator().next(), code, session);
            } else {
                Optional<Dialect> dialect = Dialect.fromTag(mode);
                if (dialect.isEmpty()) {
                    session.errors().add("Unknown mode: " + mode, 0, 0, "Use one of: " + VALID_MODES);
                } else {
                    dialects = EnumSet.of(dialect.get());
                    nodes = parseSingle(dialect.get(), code, session);
                }
            }
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Unexpected failure while parsing", e);
            session.errors().add("Parse error: " + e.getMessage());
        }

        log.info("Parse complete: {} nodes, {} diagnostics in {}ms",
                nodes.size(), session.errors().size(), System.currentTimeMillis() - startTime);
        return new ParseResponse(nodes, Collections.unmodifiableSet(dialects), session.diagnostics());
    }

    private List<Node> parseSingle(Dialect dialect, String code, ParseSession session) {
        DialectParser parser = parsers.get(dialect);
        if (parser == null) {
            session.errors().add("No parser registered for " + dialect.displayName());
            return List.of();
        }
        return parser.parse(code, session).nodes();
    }

    @Override
    public BatchParseResponse parseFiles(BatchParseRequest request) {
        ParseSession session = new ParseSession();
        try {
            MultiFileOrchestrator.BatchResult batch = orchestrator.parseFiles(request.files(), session);
            return new BatchParseResponse(
                    batch.results(), batch.references().getReferences(), session.diagnostics());
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Unexpected failure while parsing batch", e);
            session.errors().add("Batch parse error: " + e.getMessage());
            return new BatchParseResponse(Map.of(), List.of(), session.diagnostics());
        }
    }

    @Override
    public String toInterchange(List<Node> nodes, String filename) {
        String name = filename == null || filename.isBlank() ? properties.getDefaultFilename() : filename;
        return nodeSerializer.serialize(nodes == null ? List.of() : nodes, name);
    }

    @Override
    public InterchangeResponse fromInterchange(String document) {
        ParseSession session = new ParseSession();
        try {
            NodeSerializer.InterchangeDocument loaded = nodeSerializer.deserialize(document);
            log.info("Loaded {} nodes from interchange document '{}'", loaded.nodes().size(), loaded.filename());
            return new InterchangeResponse(loaded.filename(), loaded.nodes(), List.of());
        } catch (InterchangeFormatException e) {
            session.errors().add("Invalid interchange document: " + e.getMessage(), 0, 0,
                    "Export the workspace again from the block editor");
            return new InterchangeResponse(null, List.of(), session.diagnostics());
        }
    }
}
