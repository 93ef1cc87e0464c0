package com.vidnyan.bridge.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names of the fields, value slots and statement slots a node type may carry.
 */
public record NodeShape(
    Set<String> fields,
    Set<String> values,
    Set<String> statements
) {

    public static final NodeShape EMPTY = new NodeShape(Set.of(), Set.of(), Set.of());

    public static NodeShape fields(String... names) {
        return EMPTY.withFields(names);
    }

    public static NodeShape values(String... names) {
        return EMPTY.withValues(names);
    }

    public static NodeShape statements(String... names) {
        return EMPTY.withStatements(names);
    }

    public NodeShape withFields(String... names) {
        return new NodeShape(ordered(names), values, statements);
    }

    public NodeShape withValues(String... names) {
        return new NodeShape(fields, ordered(names), statements);
    }

    public NodeShape withStatements(String... names) {
        return new NodeShape(fields, values, ordered(names));
    }

    public boolean allowsField(String name) {
        return fields.contains(name);
    }

    public boolean allowsValue(String name) {
        return values.contains(name);
    }

    public boolean allowsStatement(String name) {
        return statements.contains(name);
    }

    private static Set<String> ordered(String... names) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(names)));
    }
}
