package com.metadata.disambiguation.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An entity extracted from a harvested document, pending resolution against persisted records.
 * Nodes are created by the upstream parser and owned by a {@link NodeGraph}.
 */
public class Node {

    /** Prefix of locally scoped, temporary node ids. */
    public static final String LOCAL_ID_PREFIX = "_:";

    private final String id;
    private final String type;
    private Map<String, Object> attrs;
    private final Map<String, Node> related = new LinkedHashMap<>();
    private final Map<String, List<Node>> relatedMany = new LinkedHashMap<>();

    private Node(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.attrs = new LinkedHashMap<>(builder.attrs);
    }

    public String getId() {
        return id;
    }

    /**
     * The declared concrete type, lower case (e.g. {@code article}, {@code creator}).
     */
    public String getType() {
        return type;
    }

    /**
     * Returns true if the id is a temporary id scoped to the document being resolved.
     */
    public boolean isLocal() {
        return id.startsWith(LOCAL_ID_PREFIX);
    }

    public Object attr(String name) {
        return attrs.get(name);
    }

    /**
     * Returns the attribute as a string, or null if absent.
     */
    public String attrString(String name) {
        Object value = attrs.get(name);
        return value != null ? value.toString() : null;
    }

    public Map<String, Object> getAttrs() {
        return Collections.unmodifiableMap(attrs);
    }

    /**
     * Replaces every attribute of this node.
     */
    public void setAttrs(Map<String, Object> attrs) {
        this.attrs = new LinkedHashMap<>(attrs);
    }

    public void setAttr(String name, Object value) {
        attrs.put(name, value);
    }

    /**
     * Returns the node referenced by a to-one relation, or null.
     */
    public Node related(String relation) {
        return related.get(relation);
    }

    /**
     * Returns the nodes of a to-many relation, in insertion order.
     */
    public List<Node> relatedMany(String relation) {
        List<Node> nodes = relatedMany.get(relation);
        return nodes != null ? Collections.unmodifiableList(nodes) : List.of();
    }

    void setRelated(String relation, Node node) {
        if (node == null) {
            related.remove(relation);
        } else {
            related.put(relation, node);
        }
    }

    void addRelatedMany(String relation, Node node) {
        relatedMany.computeIfAbsent(relation, k -> new ArrayList<>()).add(node);
    }

    void detach(Node node) {
        related.values().removeIf(n -> n.equals(node));
        for (List<Node> nodes : relatedMany.values()) {
            nodes.removeIf(n -> n.equals(node));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node node = (Node) o;
        return Objects.equals(id, node.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Node{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", attrs=" + attrs +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String type;
        private final Map<String, Object> attrs = new LinkedHashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder attr(String name, Object value) {
            this.attrs.put(name, value);
            return this;
        }

        public Builder attrs(Map<String, Object> attrs) {
            this.attrs.putAll(attrs);
            return this;
        }

        public Node build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(type, "type is required");
            return new Node(this);
        }
    }
}
