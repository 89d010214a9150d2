package ai.imagegraph.executor.exception;

import ai.imagegraph.executor.model.JobStatus;

/**
 * Raised when a submitted job ends without producing an image.
 */
public class JobExecutionException extends RuntimeException {

    public enum Reason {
        FAILED,
        TIMED_OUT
    }

    private final Reason reason;
    private final String promptId;

    public JobExecutionException(Reason reason, String promptId, String message) {
        super(message);
        this.reason = reason;
        this.promptId = promptId;
    }

    public static JobExecutionException fromStatus(JobStatus status, String promptId, String message) {
        if (status == JobStatus.TIMED_OUT) {
            return new JobExecutionException(Reason.TIMED_OUT, promptId, message);
        }
        if (status == JobStatus.FAILED) {
            return new JobExecutionException(Reason.FAILED, promptId, message);
        }
        throw new IllegalArgumentException("Status " + status + " is not a failed outcome");
    }

    public Reason getReason() {
        return reason;
    }

    public String getPromptId() {
        return promptId;
    }
}
