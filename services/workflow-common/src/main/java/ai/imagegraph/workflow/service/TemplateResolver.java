package ai.imagegraph.workflow.service;

import ai.imagegraph.workflow.exception.TemplateException;
import ai.imagegraph.workflow.model.GraphTemplate;
import ai.imagegraph.workflow.model.NodeRole;
import ai.imagegraph.workflow.model.NodeSpec;
import ai.imagegraph.workflow.model.NodeSummary;
import ai.imagegraph.workflow.model.ResolvedJob;
import ai.imagegraph.workflow.model.WorkflowDocument;
import ai.imagegraph.workflow.parser.WorkflowConverter;
import ai.imagegraph.workflow.parser.WorkflowParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Loads workflow templates, binds roles to nodes and writes caller values into bound inputs.
 * <p>
 * Roles are resolved lazily: loading only checks that the file is a well-formed graph.
 */
public class TemplateResolver {

    private static final Logger logger = LoggerFactory.getLogger(TemplateResolver.class);

    private final WorkflowParser parser;

    public TemplateResolver(WorkflowParser parser) {
        this.parser = parser;
    }

    /**
     * Reads a template file in either representation and returns it in execution representation.
     */
    public GraphTemplate load(Path path) {
        if (path == null) {
            throw TemplateException.notFound("<not configured>");
        }
        if (!Files.isRegularFile(path)) {
            throw TemplateException.notFound(path.toString());
        }

        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw TemplateException.malformed("Workflow template " + path + " is not valid UTF-8", e);
        } catch (IOException e) {
            throw new TemplateException(
                    TemplateException.Reason.NOT_FOUND, "Workflow template " + path + " could not be read", e);
        }

        WorkflowDocument document = parser.parse(json);
        GraphTemplate template = WorkflowConverter.toExecution(document);
        logger.info(
                "Loaded workflow template path={} representation={} nodes={} links={}",
                path,
                document.representation(),
                template.nodeCount(),
                template.linkCount());
        return template;
    }

    /**
     * Resolves a role using the role's default title and discovery types as hints.
     * Each type is tried in turn; a later type is only considered when no node matches an earlier one.
     */
    public String resolveRole(GraphTemplate template, NodeRole role, String explicitId) {
        if (explicitId != null && !explicitId.isBlank()) {
            return resolveRole(template, role, explicitId, role.getDefaultTitle(), role.getDefaultType());
        }
        for (String type : role.getDiscoveryTypes()) {
            Optional<String> nodeId = discover(template, role, role.getDefaultTitle(), type);
            if (nodeId.isPresent()) {
                return nodeId.get();
            }
        }
        throw notDiscovered(role, role.getDefaultTitle(), String.join("' or '", role.getDiscoveryTypes()));
    }

    /**
     * Binds a role to a node id.
     * <p>
     * An explicit id is used as-is and must exist. Without one, nodes matching both
     * {@code titleHint} and {@code typeHint} are preferred, then nodes matching the type alone.
     * Several candidates resolve to the first in template order.
     */
    public String resolveRole(
            GraphTemplate template,
            NodeRole role,
            String explicitId,
            String titleHint,
            String typeHint) {
        if (explicitId != null && !explicitId.isBlank()) {
            String nodeId = explicitId.trim();
            if (!template.containsNode(nodeId)) {
                throw new TemplateException(
                        TemplateException.Reason.NODE_NOT_FOUND,
                        "Node '" + nodeId + "' configured for role " + role + " was not found in the workflow template");
            }
            logger.debug("Resolved role={} to configured node={}", role, nodeId);
            return nodeId;
        }

        return discover(template, role, titleHint, typeHint)
                .orElseThrow(() -> notDiscovered(role, titleHint, typeHint));
    }

    /**
     * Writes prompt text into the designated text input of the node bound to {@code role}.
     */
    public ResolvedJob injectPrompt(ResolvedJob job, NodeRole role, String text) {
        return injectInput(job, role, role.getInputName(), text);
    }

    /**
     * Writes a value into an existing input of the node bound to {@code role}.
     * All other inputs are left as they were.
     */
    public ResolvedJob injectInput(ResolvedJob job, NodeRole role, String inputName, Object value) {
        String nodeId = job.nodeIdFor(role)
                .orElseThrow(() -> new TemplateException(
                        TemplateException.Reason.NODE_NOT_FOUND, "Role " + role + " is not bound to a node"));
        NodeSpec node = job.graph().findNode(nodeId)
                .orElseThrow(() -> new TemplateException(
                        TemplateException.Reason.NODE_NOT_FOUND,
                        "Node '" + nodeId + "' bound to role " + role + " is missing from the graph"));

        if (!node.hasInput(inputName)) {
            throw new TemplateException(
                    TemplateException.Reason.INPUT_NOT_FOUND,
                    "Node '" + nodeId + "' (" + node.type() + ") bound to role " + role
                            + " has no input '" + inputName + "'");
        }

        GraphTemplate updated = job.graph().withNode(node.withInput(inputName, value));
        return new ResolvedJob(updated, job.bindings());
    }

    public List<NodeSummary> describeNodes(GraphTemplate template) {
        List<NodeSummary> summaries = new ArrayList<>(template.nodeCount());
        for (NodeSpec node : template.allNodes()) {
            summaries.add(new NodeSummary(node.id(), node.type(), node.title()));
        }
        return summaries;
    }

    private Optional<String> discover(GraphTemplate template, NodeRole role, String titleHint, String typeHint) {
        if (titleHint != null && !titleHint.isBlank()) {
            List<String> byTitleAndType = findNodes(template,
                    node -> titleMatches(node, titleHint) && (typeHint == null || typeHint.equals(node.type())));
            if (!byTitleAndType.isEmpty()) {
                return Optional.of(pick(role, byTitleAndType, "title and type"));
            }
        }

        if (typeHint != null && !typeHint.isBlank()) {
            List<String> byType = findNodes(template, node -> typeHint.equals(node.type()));
            if (!byType.isEmpty()) {
                return Optional.of(pick(role, byType, "type"));
            }
        }
        return Optional.empty();
    }

    private static TemplateException notDiscovered(NodeRole role, String titleHint, String typeHint) {
        return new TemplateException(
                TemplateException.Reason.NODE_NOT_FOUND,
                "Could not discover a node for role " + role + " (title='" + titleHint + "', type='" + typeHint
                        + "'); configure its node id explicitly");
    }

    private String pick(NodeRole role, List<String> candidates, String matchedBy) {
        String selected = candidates.get(0);
        if (candidates.size() > 1) {
            logger.warn(
                    "Ambiguous node discovery for role={} by {}: candidates={} selected={}; configure the node id to disambiguate",
                    role, matchedBy, candidates, selected);
        } else {
            logger.debug("Discovered role={} by {} node={}", role, matchedBy, selected);
        }
        return selected;
    }

    private static List<String> findNodes(GraphTemplate template, Predicate<NodeSpec> filter) {
        List<String> matches = new ArrayList<>();
        for (NodeSpec node : template.allNodes()) {
            if (filter.test(node)) {
                matches.add(node.id());
            }
        }
        return matches;
    }

    private static boolean titleMatches(NodeSpec node, String titleHint) {
        return node.hasTitle() && node.title().trim().equalsIgnoreCase(titleHint.trim());
    }
}
