package ai.imagegraph.workflow.model;

/**
 * Id, type and title of one template node, as listed for operators picking node ids.
 */
public record NodeSummary(String id, String type, String title) {
}
