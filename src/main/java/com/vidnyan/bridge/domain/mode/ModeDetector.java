package com.vidnyan.bridge.domain.mode;

import com.vidnyan.bridge.domain.model.Dialect;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Detects which dialects a text contains from lexical fingerprints.
 * Pure and order-independent; falls back to Rust when nothing matches.
 */
@Component
public class ModeDetector {

    private static final Map<Dialect, List<String>> FINGERPRINTS = Map.of(
            Dialect.WGSL, List.of("@compute", "@vertex", "@fragment", "var<storage", "var<uniform"),
            Dialect.BEVY, List.of("use bevy::", "Query<", "Commands", "Res<", "ResMut<"),
            Dialect.BIOSPHERES, List.of("CellType", "Genome", "AdhesionZone", "SignalChannel",
                    "emit_signal", "contract_adhesions")
    );

    /**
     * All dialects whose fingerprints occur in the text; never empty.
     */
    public Set<Dialect> detect(String text) {
        EnumSet<Dialect> found = EnumSet.noneOf(Dialect.class);
        if (text != null) {
            FINGERPRINTS.forEach((dialect, markers) -> {
                if (markers.stream().anyMatch(text::contains)) {
                    found.add(dialect);
                }
            });
        }
        if (found.isEmpty()) {
            found.add(Dialect.RUST);
        }
        return Collections.unmodifiableSet(found);
    }

    /**
     * True when more than one dialect was detected.
     */
    public boolean isMixed(String text) {
        return detect(text).size() > 1;
    }

    /**
     * Dialect for a file in a batch, from its name alone: extension first,
     * then substring hints.
     */
    public Dialect detectFromFilename(String filename) {
        String name = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (name.endsWith(".wgsl")) return Dialect.WGSL;
        if (name.contains("system") || name.contains("bevy")) return Dialect.BEVY;
        if (name.contains("cell") || name.contains("genome") || name.contains("bio")) return Dialect.BIOSPHERES;
        return Dialect.RUST;
    }
}
