package com.vidnyan.bridge.domain.graph;

import com.vidnyan.bridge.domain.model.CrossFileReference;
import com.vidnyan.bridge.domain.model.CrossFileReference.ReferenceKind;
import com.vidnyan.bridge.domain.model.FileParseResult;
import com.vidnyan.bridge.domain.model.Node;
import com.vidnyan.bridge.domain.model.NodeType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Cross-file references of one batch.
 * Bidirectional index: source file → references, target path → references.
 * Built by a read-only walk of the parsed trees; immutable.
 */
public final class ReferenceGraph {

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("::|/|\\\\");

    private final List<CrossFileReference> references;
    private final Map<String, List<CrossFileReference>> bySource;
    private final Map<String, List<CrossFileReference>> byTarget;

    private ReferenceGraph(
            List<CrossFileReference> references,
            Map<String, List<CrossFileReference>> bySource,
            Map<String, List<CrossFileReference>> byTarget
    ) {
        this.references = List.copyOf(references);
        this.bySource = Collections.unmodifiableMap(bySource);
        this.byTarget = Collections.unmodifiableMap(byTarget);
    }

    /**
     * Build the graph from the per-file results of a batch, in batch order.
     */
    public static ReferenceGraph build(Map<String, FileParseResult> results) {
        Map<String, String> filesByStem = new LinkedHashMap<>();
        results.keySet().forEach(file -> filesByStem.putIfAbsent(stem(file), file));

        List<CrossFileReference> references = new ArrayList<>();
        results.forEach((file, result) -> result.nodes().forEach(root -> root.walk(node ->
                referenceOf(file, node)
                        .map(ref -> resolve(ref, filesByStem))
                        .ifPresent(references::add))));

        Map<String, List<CrossFileReference>> bySource = new HashMap<>();
        Map<String, List<CrossFileReference>> byTarget = new HashMap<>();
        for (CrossFileReference ref : references) {
            bySource.computeIfAbsent(ref.sourceFile(), k -> new ArrayList<>()).add(ref);
            byTarget.computeIfAbsent(ref.targetPath(), k -> new ArrayList<>()).add(ref);
        }
        return new ReferenceGraph(references, bySource, byTarget);
    }

    /**
     * Imports with a module path, and shader handles with an asset path, are references.
     */
    static Optional<CrossFileReference> referenceOf(String file, Node node) {
        if (node.type() == NodeType.RUST_USE || node.type() == NodeType.BEVY_USE) {
            String path = node.field("PATH");
            if (path != null && path.contains("::")) {
                return Optional.of(CrossFileReference.of(file, path, ReferenceKind.IMPORT));
            }
        } else if (node.type() == NodeType.BEVY_SHADER_HANDLE) {
            String path = node.field("SHADER_PATH");
            if (path != null && !path.isBlank()) {
                return Optional.of(CrossFileReference.of(file, path, ReferenceKind.SHADER_HANDLE));
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve to the first batch file, other than the source, whose stem equals a
     * path segment. For imports, {@code crate::physics::Body} resolves to {@code physics.rs};
     * for shaders, {@code shaders/blur.wgsl} resolves to {@code blur.wgsl}.
     */
    private static CrossFileReference resolve(CrossFileReference ref, Map<String, String> filesByStem) {
        for (String segment : SEGMENT_SEPARATOR.split(ref.targetPath())) {
            String file = filesByStem.get(stem(segment.trim()));
            if (file != null && !file.equals(ref.sourceFile())) {
                return ref.resolvedTo(file);
            }
        }
        return ref;
    }

    static String stem(String filename) {
        String name = filename;
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        if (slash != -1) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * All references in batch order, then discovery order within a file.
     */
    public List<CrossFileReference> getReferences() {
        return references;
    }

    public List<CrossFileReference> getReferencesFrom(String sourceFile) {
        return bySource.getOrDefault(sourceFile, List.of());
    }

    public List<CrossFileReference> getReferencesTo(String targetPath) {
        return byTarget.getOrDefault(targetPath, List.of());
    }

    /**
     * Batch files that {@code sourceFile} depends on through resolved references.
     */
    public List<String> getDependencies(String sourceFile) {
        return getReferencesFrom(sourceFile).stream()
                .filter(CrossFileReference::isResolved)
                .map(CrossFileReference::resolvedFile)
                .distinct()
                .toList();
    }

    public int size() {
        return references.size();
    }
}
