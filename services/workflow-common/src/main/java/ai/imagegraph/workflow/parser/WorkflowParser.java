package ai.imagegraph.workflow.parser;

import ai.imagegraph.workflow.exception.TemplateException;
import ai.imagegraph.workflow.model.EditorWorkflow;
import ai.imagegraph.workflow.model.ExecutionWorkflow;
import ai.imagegraph.workflow.model.GraphTemplate;
import ai.imagegraph.workflow.model.NodeLink;
import ai.imagegraph.workflow.model.NodeSpec;
import ai.imagegraph.workflow.model.WorkflowDocument;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses workflow template JSON and detects its representation from the document shape.
 * <p>
 * A top-level {@code nodes} array marks the editor representation. An object whose every
 * member is a node object carrying {@code class_type} marks the execution representation.
 * Anything else is rejected as malformed.
 */
public class WorkflowParser {

    private final ObjectMapper objectMapper;

    public WorkflowParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public WorkflowDocument parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readerFor(JsonNode.class)
                    .with(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
                    .readValue(json);
        } catch (JsonProcessingException e) {
            throw TemplateException.malformed("Workflow template is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return parse(root);
    }

    public WorkflowDocument parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw TemplateException.malformed("Workflow template must be a JSON object");
        }
        JsonNode nodes = root.get("nodes");
        if (nodes != null && nodes.isArray()) {
            return parseEditor(root);
        }
        if (isExecutionShape(root)) {
            return new ExecutionWorkflow(parseExecution(root));
        }
        throw TemplateException.malformed(
                "Workflow template is neither an editor export (nodes + links) nor an execution graph (id -> class_type)");
    }

    private boolean isExecutionShape(JsonNode root) {
        if (root.isEmpty()) {
            return false;
        }
        Iterator<JsonNode> members = root.elements();
        while (members.hasNext()) {
            JsonNode member = members.next();
            if (!member.isObject() || !member.path("class_type").isTextual()) {
                return false;
            }
        }
        return true;
    }

    private GraphTemplate parseExecution(JsonNode root) {
        List<NodeSpec> nodes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String nodeId = field.getKey();
            JsonNode nodeJson = field.getValue();

            Map<String, Object> inputs = new LinkedHashMap<>();
            JsonNode inputsJson = nodeJson.path("inputs");
            if (!inputsJson.isMissingNode() && !inputsJson.isObject()) {
                throw TemplateException.malformed("Node '" + nodeId + "' has non-object inputs");
            }
            Iterator<Map.Entry<String, JsonNode>> inputFields = inputsJson.fields();
            while (inputFields.hasNext()) {
                Map.Entry<String, JsonNode> input = inputFields.next();
                inputs.put(input.getKey(), toInputValue(input.getValue()));
            }

            String title = textOrNull(nodeJson.path("_meta").path("title"));
            nodes.add(buildNode(nodeId, nodeJson.path("class_type").asText(), title, inputs));
        }
        return GraphTemplate.of(nodes);
    }

    private EditorWorkflow parseEditor(JsonNode root) {
        List<EditorWorkflow.Node> nodes = new ArrayList<>();
        for (JsonNode nodeJson : root.get("nodes")) {
            nodes.add(parseEditorNode(nodeJson));
        }

        List<EditorWorkflow.Link> links = new ArrayList<>();
        JsonNode linksJson = root.path("links");
        if (!linksJson.isMissingNode() && !linksJson.isNull()) {
            if (!linksJson.isArray()) {
                throw TemplateException.malformed("Editor workflow 'links' must be an array");
            }
            for (JsonNode linkJson : linksJson) {
                links.add(parseEditorLink(linkJson));
            }
        }
        return new EditorWorkflow(nodes, links);
    }

    private EditorWorkflow.Node parseEditorNode(JsonNode nodeJson) {
        if (!nodeJson.isObject()) {
            throw TemplateException.malformed("Editor workflow node entries must be objects");
        }
        String id = textOrNull(nodeJson.path("id"));
        if (id == null) {
            throw TemplateException.malformed("Editor workflow node is missing its id");
        }
        String type = textOrNull(nodeJson.path("type"));
        if (type == null) {
            throw TemplateException.malformed("Editor workflow node '" + id + "' is missing its type");
        }

        List<EditorWorkflow.Input> inputs = new ArrayList<>();
        for (JsonNode inputJson : nodeJson.path("inputs")) {
            String name = textOrNull(inputJson.path("name"));
            if (name == null) {
                throw TemplateException.malformed("Editor workflow node '" + id + "' has an unnamed input");
            }
            JsonNode widget = inputJson.get("widget");
            JsonNode link = inputJson.get("link");
            Long linkId = link != null && link.canConvertToLong() && link.isIntegralNumber() ? link.asLong() : null;
            inputs.add(new EditorWorkflow.Input(name, widget != null && !widget.isNull(), linkId));
        }

        List<Object> widgetValues = null;
        Map<String, Object> namedWidgetValues = null;
        JsonNode widgetsJson = nodeJson.path("widgets_values");
        if (widgetsJson.isArray()) {
            widgetValues = new ArrayList<>();
            for (JsonNode value : widgetsJson) {
                widgetValues.add(toLiteral(value));
            }
        } else if (widgetsJson.isObject()) {
            namedWidgetValues = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = widgetsJson.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                namedWidgetValues.put(field.getKey(), toLiteral(field.getValue()));
            }
        }

        return new EditorWorkflow.Node(
                id,
                type,
                textOrNull(nodeJson.path("title")),
                inputs,
                widgetValues,
                namedWidgetValues);
    }

    private EditorWorkflow.Link parseEditorLink(JsonNode linkJson) {
        if (linkJson.isArray() && linkJson.size() >= 5) {
            return new EditorWorkflow.Link(
                    requireLong(linkJson.get(0), "link id"),
                    requireText(linkJson.get(1), "link origin"),
                    requireInt(linkJson.get(2), "link origin slot"),
                    requireText(linkJson.get(3), "link target"),
                    requireInt(linkJson.get(4), "link target slot"));
        }
        if (linkJson.isObject()) {
            return new EditorWorkflow.Link(
                    requireLong(linkJson.get("id"), "link id"),
                    requireText(linkJson.get("origin_id"), "link origin"),
                    requireInt(linkJson.get("origin_slot"), "link origin slot"),
                    requireText(linkJson.get("target_id"), "link target"),
                    requireInt(linkJson.get("target_slot"), "link target slot"));
        }
        throw TemplateException.malformed("Unrecognized editor link entry: " + linkJson);
    }

    private Object toInputValue(JsonNode value) {
        if (value.isArray()
                && value.size() == 2
                && (value.get(0).isTextual() || value.get(0).isIntegralNumber())
                && value.get(1).isIntegralNumber()) {
            return new NodeLink(value.get(0).asText(), value.get(1).asInt());
        }
        return toLiteral(value);
    }

    private Object toLiteral(JsonNode value) {
        return objectMapper.convertValue(value, Object.class);
    }

    private static NodeSpec buildNode(String id, String type, String title, Map<String, Object> inputs) {
        try {
            return NodeSpec.of(id, type, title, inputs);
        } catch (IllegalArgumentException e) {
            throw TemplateException.malformed(e.getMessage(), e);
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static long requireLong(JsonNode node, String field) {
        if (node == null || !node.isIntegralNumber()) {
            throw TemplateException.malformed("Editor link has an invalid " + field + ": " + node);
        }
        return node.asLong();
    }

    private static int requireInt(JsonNode node, String field) {
        if (node == null || !node.isIntegralNumber()) {
            throw TemplateException.malformed("Editor link has an invalid " + field + ": " + node);
        }
        return node.asInt();
    }

    private static String requireText(JsonNode node, String field) {
        String text = textOrNull(node);
        if (text == null) {
            throw TemplateException.malformed("Editor link has an invalid " + field);
        }
        return text;
    }
}
