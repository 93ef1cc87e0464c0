package com.vidnyan.bridge.application.service;

import com.vidnyan.bridge.application.port.out.DialectParser;
import com.vidnyan.bridge.application.port.out.DialectParser.DialectParseResult;
import com.vidnyan.bridge.domain.model.Dialect;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeCategory;
import com.vidnyan.bridge.domain.session.ParseSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses a text that mixes dialects with every relevant parser and merges the
 * results, most specific dialect first.
 */
@Slf4j
@Component
public class MixedModeMerger {

    /**
     * Specificity-descending order in which parsers run and win duplicates.
     */
    public static final List<Dialect> PRIORITY = List.of(
            Dialect.BIOSPHERES, Dialect.BEVY, Dialect.WGSL, Dialect.RUST);

    private final Map<Dialect, DialectParser> parsers = new EnumMap<>(Dialect.class);

    public MixedModeMerger(List<DialectParser> dialectParsers) {
        dialectParsers.forEach(p -> parsers.put(p.dialect(), p));
    }

    /**
     * Run the parsers of the detected dialects, plus the general-purpose one, in
     * priority order and merge their declarations.
     */
    public List<Node> parseMixed(String text, Set<Dialect> detected, ParseSession session) {
        List<DialectParseResult> results = new ArrayList<>();
        for (Dialect dialect : PRIORITY) {
            if (dialect != Dialect.RUST && !detected.contains(dialect)) {
                continue;
            }
            DialectParser parser = parsers.get(dialect);
            if (parser == null) {
                log.warn("No parser registered for {}", dialect.displayName());
                continue;
            }
            DialectParseResult result = parser.parse(text, session);
            log.info("Mixed parse: {} produced {} declarations", dialect.displayName(), result.nodes().size());
            results.add(result);
        }
        return merge(results);
    }

    /**
     * Merge per-parser results: ordered by parser priority, then by discovery order.
     * A node is dropped when a higher-priority parser already produced one with the
     * same signature. Nodes from the same parser are never dropped. Opaque
     * placeholders are kept only when no parser recognized anything.
     * Pure and deterministic.
     */
    public static List<Node> merge(List<DialectParseResult> results) {
        List<DialectParseResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparingInt(r -> priorityOf(r.dialect())));

        boolean recognizedAnything = ordered.stream()
                .flatMap(r -> r.nodes().stream())
                .anyMatch(n -> n.category() != NodeCategory.OPAQUE);

        List<Node> merged = new ArrayList<>();
        Set<String> claimed = new HashSet<>();
        for (DialectParseResult result : ordered) {
            Set<String> produced = new HashSet<>();
            for (Node node : result.nodes()) {
                // placeholders survive only when nothing was recognized
                if (recognizedAnything && node.category() == NodeCategory.OPAQUE) {
                    continue;
                }
                String signature = signature(node);
                if (claimed.contains(signature)) {
                    log.debug("Dropping duplicate {} '{}' from {}", node.type().tag(),
                            node.primaryName(), result.dialect().displayName());
                    continue;
                }
                produced.add(signature);
                merged.add(node);
            }
            claimed.addAll(produced);
        }
        return merged;
    }

    /**
     * Construct kind plus the name identifying the construct, so the same construct
     * seen by two dialects (e.g. {@code bevy_use} and {@code rust_use}) collides.
     */
    public static String signature(Node node) {
        return node.type().kind() + "_" + identity(node);
    }

    /**
     * {@code rust_main} carries no NAME and {@code rust_impl} keeps the whole
     * {@code Trait for Type} header; both are reduced to the name other dialects use.
     */
    static String identity(Node node) {
        return switch (node.type()) {
            case RUST_MAIN -> "main";
            case RUST_IMPL -> implementedType(node.primaryName());
            default -> node.primaryName();
        };
    }

    private static String implementedType(String header) {
        int index = header.lastIndexOf(" for ");
        return index == -1 ? header.trim() : header.substring(index + " for ".length()).trim();
    }

    private static int priorityOf(Dialect dialect) {
        int index = PRIORITY.indexOf(dialect);
        return index == -1 ? PRIORITY.size() : index;
    }
}
