package com.vidnyan.bridge.domain.scan;

import java.util.Optional;

/**
 * Recognizes one construct starting exactly at {@code cursor}.
 * Returns empty when the construct does not start there.
 */
@FunctionalInterface
public interface ConstructMatcher {

    Optional<ScanMatch> match(ScanContext context, int cursor, int end);
}
