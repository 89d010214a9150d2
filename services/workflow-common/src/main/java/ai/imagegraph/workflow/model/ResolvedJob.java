package ai.imagegraph.workflow.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Execution-ready graph with its role bindings. Built once per invocation and never modified.
 *
 * @param graph graph with prompt inputs already written
 * @param bindings node id bound to each resolved role
 */
public record ResolvedJob(GraphTemplate graph, Map<NodeRole, String> bindings) {

    public ResolvedJob {
        if (graph == null) {
            throw new IllegalArgumentException("Resolved job graph cannot be null");
        }
        if (bindings == null) {
            throw new IllegalArgumentException("Resolved job bindings cannot be null");
        }
        for (NodeRole role : NodeRole.values()) {
            if (role.isRequired() && !bindings.containsKey(role)) {
                throw new IllegalArgumentException("Required role " + role + " is not bound");
            }
        }
        for (Map.Entry<NodeRole, String> binding : bindings.entrySet()) {
            if (!graph.containsNode(binding.getValue())) {
                throw new IllegalArgumentException(
                        "Role " + binding.getKey() + " is bound to unknown node '" + binding.getValue() + "'");
            }
        }
        EnumMap<NodeRole, String> copy = new EnumMap<>(NodeRole.class);
        copy.putAll(bindings);
        bindings = Collections.unmodifiableMap(copy);
    }

    public Optional<String> nodeIdFor(NodeRole role) {
        return Optional.ofNullable(bindings.get(role));
    }

    public String outputNodeId() {
        return bindings.get(NodeRole.OUTPUT);
    }
}
