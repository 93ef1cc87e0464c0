package com.vidnyan.bridge.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A parsed structural unit, exchanged with the visual editor as one block.
 * Immutable; every child is owned by exactly one slot of its parent.
 * Sibling order lives only in statement slot lists.
 */
public record Node(
    String id,
    NodeType type,
    Map<String, String> fields,
    Map<String, Node> values,
    Map<String, List<Node>> statements
) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        Map<String, List<Node>> copied = new LinkedHashMap<>();
        statements.forEach((name, list) -> {
            if (!list.isEmpty()) {
                copied.put(name, List.copyOf(list));
            }
        });
        statements = Collections.unmodifiableMap(copied);
    }

    public Dialect dialect() {
        return type.dialect();
    }

    public NodeCategory category() {
        return type.category();
    }

    public String field(String name) {
        return fields.get(name);
    }

    public Node value(String name) {
        return values.get(name);
    }

    public List<Node> statements(String name) {
        return statements.getOrDefault(name, List.of());
    }

    /**
     * The field that identifies the construct: NAME, else PATH, else TYPE.
     */
    public String primaryName() {
        if (fields.containsKey("NAME")) return fields.get("NAME");
        if (fields.containsKey("PATH")) return fields.get("PATH");
        return fields.getOrDefault("TYPE", "");
    }

    /**
     * Compare type, fields and slot structure recursively, ignoring ids.
     */
    public boolean sameStructure(Node other) {
        if (other == null || type != other.type || !fields.equals(other.fields)) {
            return false;
        }
        if (!values.keySet().equals(other.values.keySet())
                || !statements.keySet().equals(other.statements.keySet())) {
            return false;
        }
        for (Map.Entry<String, Node> entry : values.entrySet()) {
            if (!entry.getValue().sameStructure(other.values.get(entry.getKey()))) {
                return false;
            }
        }
        for (Map.Entry<String, List<Node>> entry : statements.entrySet()) {
            if (!sameStructure(entry.getValue(), other.statements.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    public static boolean sameStructure(List<Node> left, List<Node> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!left.get(i).sameStructure(right.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Depth-first visit of this node and every descendant, values before statements.
     */
    public void walk(Consumer<Node> visitor) {
        visitor.accept(this);
        values.values().forEach(child -> child.walk(visitor));
        statements.values().forEach(list -> list.forEach(child -> child.walk(visitor)));
    }

    public static Builder builder(NodeType type) {
        return new Builder(type);
    }

    /**
     * Builder validating slot names against the type's shape.
     */
    public static class Builder {
        private final NodeType type;
        private String id;
        private final Map<String, String> fields = new LinkedHashMap<>();
        private final Map<String, Node> values = new LinkedHashMap<>();
        private final Map<String, List<Node>> statements = new LinkedHashMap<>();

        private Builder(NodeType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder id(String id) { this.id = id; return this; }

        public Builder field(String name, String value) {
            requireSlot(type.shape().allowsField(name), "field", name);
            fields.put(name, value == null ? "" : value);
            return this;
        }

        /**
         * Attach a value child; a null child leaves the slot empty.
         */
        public Builder value(String name, Node child) {
            requireSlot(type.shape().allowsValue(name), "value", name);
            if (child != null) {
                values.put(name, child);
            }
            return this;
        }

        public Builder statements(String name, List<Node> children) {
            requireSlot(type.shape().allowsStatement(name), "statement", name);
            statements.put(name, new ArrayList<>(children));
            return this;
        }

        public Node build() {
            return new Node(id, type, fields, values, statements);
        }

        private void requireSlot(boolean allowed, String slotKind, String name) {
            if (!allowed) {
                throw new IllegalArgumentException(
                        type.tag() + " has no " + slotKind + " named " + name);
            }
        }
    }
}
