package ai.imagegraph.workflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One node of an execution-representation graph.
 *
 * @param id node identifier, unique within its template
 * @param type backend node class, e.g. {@code CLIPTextEncode}
 * @param title optional display title, may be null
 * @param inputs input values by name; a value is either a literal or a {@link NodeLink}
 */
public record NodeSpec(
        String id,
        String type,
        String title,
        Map<String, Object> inputs
) {

    public NodeSpec {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be null or empty");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Node type cannot be null or empty for node " + id);
        }
        inputs = inputs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public static NodeSpec of(String id, String type, String title, Map<String, Object> inputs) {
        return new NodeSpec(id, type, title, inputs);
    }

    public boolean hasInput(String name) {
        return inputs.containsKey(name);
    }

    public Object input(String name) {
        return inputs.get(name);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    /**
     * Returns a copy of this node with one input replaced.
     */
    public NodeSpec withInput(String name, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(inputs);
        updated.put(name, value);
        return new NodeSpec(id, type, title, updated);
    }

    public int linkCount() {
        int count = 0;
        for (Object value : inputs.values()) {
            if (value instanceof NodeLink) {
                count++;
            }
        }
        return count;
    }
}
