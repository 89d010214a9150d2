package ai.imagegraph.workflow.parser;

import ai.imagegraph.workflow.exception.TemplateException;
import ai.imagegraph.workflow.model.EditorWorkflow;
import ai.imagegraph.workflow.model.ExecutionWorkflow;
import ai.imagegraph.workflow.model.GraphTemplate;
import ai.imagegraph.workflow.model.NodeLink;
import ai.imagegraph.workflow.model.NodeSpec;
import ai.imagegraph.workflow.model.WorkflowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts editor-representation workflows into the execution representation.
 * <p>
 * Node count is preserved and every connected input becomes a {@link NodeLink}
 * into the converted mapping.
 */
public final class WorkflowConverter {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowConverter.class);

    // Editor-only companion value stored after seed widgets; it has no input of its own.
    private static final Set<String> SEED_CONTROL_VALUES = Set.of("fixed", "increment", "decrement", "randomize");

    private WorkflowConverter() {
    }

    public static GraphTemplate toExecution(WorkflowDocument document) {
        if (document instanceof ExecutionWorkflow execution) {
            return execution.template();
        }
        if (document instanceof EditorWorkflow editor) {
            return convert(editor);
        }
        throw new IllegalArgumentException("Unsupported workflow document: " + document);
    }

    public static GraphTemplate convert(EditorWorkflow editor) {
        Set<String> nodeIds = new HashSet<>();
        for (EditorWorkflow.Node node : editor.nodes()) {
            if (!nodeIds.add(node.id())) {
                throw TemplateException.malformed("Editor workflow declares node '" + node.id() + "' twice");
            }
        }

        Map<Long, EditorWorkflow.Link> linksById = new LinkedHashMap<>();
        for (EditorWorkflow.Link link : editor.links()) {
            if (linksById.putIfAbsent(link.id(), link) != null) {
                throw TemplateException.malformed("Editor workflow declares link " + link.id() + " twice");
            }
        }

        Set<Long> consumedLinks = new HashSet<>();
        List<NodeSpec> converted = new ArrayList<>(editor.nodes().size());
        for (EditorWorkflow.Node node : editor.nodes()) {
            converted.add(convertNode(node, linksById, nodeIds, consumedLinks));
        }

        if (consumedLinks.size() != linksById.size()) {
            logger.warn(
                    "Editor workflow has {} link(s) not referenced by any node input",
                    linksById.size() - consumedLinks.size());
        }
        return GraphTemplate.of(converted);
    }

    private static NodeSpec convertNode(
            EditorWorkflow.Node node,
            Map<Long, EditorWorkflow.Link> linksById,
            Set<String> nodeIds,
            Set<Long> consumedLinks) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        int widgetIndex = 0;

        for (EditorWorkflow.Input input : node.inputs()) {
            if (input.widget()) {
                if (node.namedWidgetValues().containsKey(input.name())) {
                    inputs.put(input.name(), node.namedWidgetValues().get(input.name()));
                } else if (widgetIndex < node.widgetValues().size()) {
                    Object value = node.widgetValues().get(widgetIndex);
                    inputs.put(input.name(), value);
                    widgetIndex++;
                    if (value instanceof Number && isSeedControl(node.widgetValues(), widgetIndex)) {
                        widgetIndex++;
                    }
                }
            }

            if (input.linkId() != null) {
                EditorWorkflow.Link link = linksById.get(input.linkId());
                if (link == null) {
                    throw TemplateException.malformed(
                            "Node '" + node.id() + "' input '" + input.name() + "' references unknown link " + input.linkId());
                }
                if (!nodeIds.contains(link.originId())) {
                    throw TemplateException.malformed(
                            "Link " + link.id() + " starts at unknown node '" + link.originId() + "'");
                }
                inputs.put(input.name(), new NodeLink(link.originId(), link.originSlot()));
                consumedLinks.add(link.id());
            }
        }

        for (Map.Entry<String, Object> named : node.namedWidgetValues().entrySet()) {
            inputs.putIfAbsent(named.getKey(), named.getValue());
        }

        return NodeSpec.of(node.id(), node.type(), node.title(), inputs);
    }

    private static boolean isSeedControl(List<Object> widgetValues, int index) {
        return index < widgetValues.size()
                && widgetValues.get(index) instanceof String value
                && SEED_CONTROL_VALUES.contains(value);
    }
}
