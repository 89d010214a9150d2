package ai.imagegraph.workflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Template file in editor representation.
 *
 * @param nodes nodes in file order
 * @param links link table referenced by node inputs
 */
public record EditorWorkflow(List<Node> nodes, List<Link> links) implements WorkflowDocument {

    public EditorWorkflow {
        if (nodes == null) {
            throw new IllegalArgumentException("Editor nodes cannot be null");
        }
        nodes = List.copyOf(nodes);
        links = links == null ? List.of() : List.copyOf(links);
    }

    @Override
    public Representation representation() {
        return Representation.EDITOR;
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    public int linkCount() {
        return links.size();
    }

    /**
     * Editor node. Widget values are positional unless the node stores them by name.
     *
     * @param id node id
     * @param type node class
     * @param title user-assigned title, may be null
     * @param inputs declared input slots
     * @param widgetValues positional widget values
     * @param namedWidgetValues widget values keyed by input name
     */
    public record Node(
            String id,
            String type,
            String title,
            List<Input> inputs,
            List<Object> widgetValues,
            Map<String, Object> namedWidgetValues
    ) {
        public Node {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Editor node id cannot be null or empty");
            }
            inputs = inputs == null ? List.of() : List.copyOf(inputs);
            widgetValues = widgetValues == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<>(widgetValues));
            namedWidgetValues = namedWidgetValues == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(namedWidgetValues));
        }
    }

    /**
     * Input slot of an editor node.
     *
     * @param name input name
     * @param widget true when the slot is backed by a widget value
     * @param linkId id of the incoming link, null when unconnected
     */
    public record Input(String name, boolean widget, Long linkId) {
    }

    /**
     * Row of the editor link table.
     */
    public record Link(long id, String originId, int originSlot, String targetId, int targetSlot) {
    }
}
