package ai.imagegraph.executor.model;

/**
 * Backend job identifier returned by a successful submission.
 *
 * @param promptId opaque id assigned by the backend
 */
public record SubmissionHandle(String promptId) {

    public SubmissionHandle {
        if (promptId == null || promptId.isBlank()) {
            throw new IllegalArgumentException("Prompt id cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return promptId;
    }
}
