package com.example.polyglot.reachability;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ReachabilitySource} backed by a fixed map of loaded unit names to attribute trees.
 * <p>
 * Built programmatically through {@link #builder()} or from a module manifest exported by the
 * host application:
 * <pre>{@code
 * {
 *   "lino.modules.contacts": {"models": {"Partner": {}}},
 *   "lino.core.actions": ["ShowTable", "SubmitDetail"]
 * }
 * }</pre>
 * Object values nest attributes; array values list leaf attributes; any other value means the
 * unit is loaded but exposes no attributes.
 */
public final class StaticReachabilitySource implements ReachabilitySource {

    private final Map<String, Node> units;

    private StaticReachabilitySource(Map<String, Node> units) {
        this.units = Collections.unmodifiableMap(new LinkedHashMap<>(units));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static StaticReachabilitySource fromManifest(JsonNode manifest) {
        Builder builder = builder();
        if (manifest != null && manifest.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = manifest.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.unit(field.getKey(), Node.fromJson(field.getValue()));
            }
        }
        return builder.build();
    }

    @Override
    public Optional<ReachableHandle> lookup(String dottedName) {
        return Optional.ofNullable(units.get(dottedName));
    }

    public Set<String> unitNames() {
        return units.keySet();
    }

    /**
     * Attribute tree node. A node with no children is a leaf attribute.
     */
    public static final class Node implements ReachableHandle {

        private final Map<String, Node> children = new LinkedHashMap<>();

        public static Node leaf() {
            return new Node();
        }

        /** Node exposing the given leaf attributes. */
        public static Node of(String... attributes) {
            Node node = new Node();
            for (String attribute : attributes) {
                node.children.put(attribute, leaf());
            }
            return node;
        }

        public Node with(String attribute, Node child) {
            children.put(attribute, child);
            return this;
        }

        static Node fromJson(JsonNode json) {
            Node node = new Node();
            if (json == null) {
                return node;
            }
            if (json.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    node.children.put(field.getKey(), fromJson(field.getValue()));
                }
            } else if (json.isArray()) {
                for (JsonNode element : json) {
                    if (element.isTextual()) {
                        node.children.put(element.asText(), leaf());
                    }
                }
            }
            return node;
        }

        @Override
        public Optional<ReachableHandle> attribute(String name) {
            return Optional.ofNullable(children.get(name));
        }
    }

    public static final class Builder {

        private final Map<String, Node> units = new LinkedHashMap<>();

        public Builder unit(String dottedName) {
            return unit(dottedName, Node.leaf());
        }

        public Builder unit(String dottedName, Node attributes) {
            units.put(dottedName, attributes);
            return this;
        }

        public StaticReachabilitySource build() {
            return new StaticReachabilitySource(units);
        }
    }
}
