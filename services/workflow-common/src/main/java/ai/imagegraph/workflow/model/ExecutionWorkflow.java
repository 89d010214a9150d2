package ai.imagegraph.workflow.model;

/**
 * Template file that was already in execution representation.
 */
public record ExecutionWorkflow(GraphTemplate template) implements WorkflowDocument {

    public ExecutionWorkflow {
        if (template == null) {
            throw new IllegalArgumentException("Execution workflow template cannot be null");
        }
    }

    @Override
    public Representation representation() {
        return Representation.EXECUTION;
    }

    @Override
    public int nodeCount() {
        return template.nodeCount();
    }
}
