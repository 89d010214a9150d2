package ai.imagegraph.workflow.model;

/**
 * A parsed template file in one of its two on-disk representations.
 */
public sealed interface WorkflowDocument permits EditorWorkflow, ExecutionWorkflow {

    Representation representation();

    int nodeCount();

    enum Representation {
        /**
         * Node list plus link list, as exported by the graph editor.
         */
        EDITOR,

        /**
         * Flat id-keyed node mapping accepted by the submission endpoint.
         */
        EXECUTION
    }
}
