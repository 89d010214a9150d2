package ai.imagegraph.workflow.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Graph in execution representation: node id to node, in source order.
 * Instances are immutable; the {@code with*} methods return modified copies.
 */
public record GraphTemplate(Map<String, NodeSpec> nodes) {

    public GraphTemplate {
        if (nodes == null) {
            throw new IllegalArgumentException("Nodes map cannot be null");
        }
        for (Map.Entry<String, NodeSpec> entry : nodes.entrySet()) {
            if (entry.getValue() == null || !entry.getKey().equals(entry.getValue().id())) {
                throw new IllegalArgumentException("Node key '" + entry.getKey() + "' does not match its node id");
            }
        }
        nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    }

    public static GraphTemplate of(Collection<NodeSpec> nodes) {
        Map<String, NodeSpec> byId = new LinkedHashMap<>();
        for (NodeSpec node : nodes) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id '" + node.id() + "'");
            }
        }
        return new GraphTemplate(byId);
    }

    public static GraphTemplate empty() {
        return new GraphTemplate(Map.of());
    }

    public Optional<NodeSpec> findNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    public Collection<NodeSpec> allNodes() {
        return nodes.values();
    }

    public GraphTemplate withNode(NodeSpec node) {
        if (!nodes.containsKey(node.id())) {
            throw new IllegalArgumentException("Node '" + node.id() + "' is not part of this template");
        }
        Map<String, NodeSpec> updated = new LinkedHashMap<>(nodes);
        updated.put(node.id(), node);
        return new GraphTemplate(updated);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int linkCount() {
        int count = 0;
        for (NodeSpec node : nodes.values()) {
            count += node.linkCount();
        }
        return count;
    }
}
