package com.vidnyan.bridge.domain.scan;

import com.vidnyan.bridge.domain.model.Node;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks item boundaries of a scope and collects the declarations the matchers
 * recognize, in source order. Items no matcher recognizes are skipped.
 */
@Slf4j
public class DeclarationScanner {

    private final List<ConstructMatcher> matchers;

    public DeclarationScanner(List<ConstructMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    /**
     * Scan the whole text of the context.
     */
    public List<Node> scan(ScanContext context, int maxDeclarations) {
        return scan(context, 0, context.text().length(), maxDeclarations);
    }

    /**
     * Scan {@code [start, end)}, keeping at most {@code maxDeclarations} declarations.
     * Reaching the limit stops the scan and records one diagnostic.
     */
    public List<Node> scan(ScanContext context, int start, int end, int maxDeclarations) {
        List<Node> declarations = new ArrayList<>();
        scanInto(context, start, end, maxDeclarations, declarations);
        return declarations;
    }

    /**
     * Like {@link #scan(ScanContext, int, int, int)}, appending to {@code declarations}
     * as each one is found so a caller keeps what was built if scanning fails midway.
     */
    public void scanInto(ScanContext context, int start, int end, int maxDeclarations, List<Node> declarations) {
        String text = context.text();
        int found = 0;
        int cursor = start;
        while (true) {
            cursor = Lexical.skipTrivia(text, cursor, end);
            if (cursor >= end) {
                break;
            }
            Optional<ScanMatch> matched = tryMatchers(context, cursor, end);
            if (matched.isEmpty()) {
                cursor = skipItem(text, cursor, end);
                continue;
            }
            ScanMatch match = matched.get();
            if (match.isMalformed()) {
                context.report(match.problem(), cursor);
                cursor = skipItem(text, cursor, end);
                continue;
            }
            if (found >= maxDeclarations) {
                context.report("Declaration limit of " + maxDeclarations
                        + " reached; remaining input ignored", cursor);
                break;
            }
            declarations.add(match.node());
            found++;
            log.debug("{}: found {} '{}'", context.dialect().displayName(),
                    match.node().type().tag(), match.node().primaryName());
            cursor = Math.max(match.end(), cursor + 1);
        }
    }

    private Optional<ScanMatch> tryMatchers(ScanContext context, int cursor, int end) {
        for (ConstructMatcher matcher : matchers) {
            Optional<ScanMatch> result = matcher.match(context, cursor, end);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * Offset just past the item starting at {@code cursor}: an attribute, a
     * semicolon-terminated item or a braced item. Unbalanced input skips one line.
     */
    static int skipItem(String text, int cursor, int end) {
        if (text.charAt(cursor) == '#') {
            int bracket = cursor + 1 < end && text.charAt(cursor + 1) == '!' ? cursor + 2 : cursor + 1;
            Optional<DelimiterBalancer.Span> attribute = DelimiterBalancer.extract(text, bracket, end, '[', ']');
            if (attribute.isPresent()) {
                return attribute.get().after();
            }
        }
        int semicolon = DelimiterBalancer.indexOfTopLevel(text, cursor, end, ';');
        int brace = DelimiterBalancer.indexOfTopLevel(text, cursor, end, '{');
        if (brace != -1 && (semicolon == -1 || brace < semicolon)) {
            Optional<DelimiterBalancer.Span> block = DelimiterBalancer.braces(text, brace, end);
            if (block.isPresent()) {
                return block.get().after();
            }
        } else if (semicolon != -1) {
            return semicolon + 1;
        }
        int newline = text.indexOf('\n', cursor);
        return newline == -1 || newline >= end ? end : newline + 1;
    }
}
