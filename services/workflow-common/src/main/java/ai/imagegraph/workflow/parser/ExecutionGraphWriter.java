package ai.imagegraph.workflow.parser;

import ai.imagegraph.workflow.model.GraphTemplate;
import ai.imagegraph.workflow.model.NodeSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes a graph in the id-keyed JSON shape accepted by the submission endpoint.
 */
public class ExecutionGraphWriter {

    private final ObjectMapper objectMapper;

    public ExecutionGraphWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode write(GraphTemplate template) {
        ObjectNode graph = objectMapper.createObjectNode();
        for (NodeSpec node : template.allNodes()) {
            ObjectNode nodeJson = graph.putObject(node.id());
            nodeJson.put("class_type", node.type());
            nodeJson.set("inputs", objectMapper.valueToTree(node.inputs()));
            if (node.hasTitle()) {
                nodeJson.putObject("_meta").put("title", node.title());
            }
        }
        return graph;
    }
}
