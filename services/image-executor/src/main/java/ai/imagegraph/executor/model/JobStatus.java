package ai.imagegraph.executor.model;

/**
 * Status of a submitted job as observed through the backend history, keyed by prompt id.
 */
public enum JobStatus {
    /**
     * Submitted, but the backend history has no entry for the job yet.
     */
    QUEUED,

    /**
     * History entry exists and the job has not completed.
     */
    RUNNING,

    /**
     * Backend reported completion; outputs are available.
     */
    COMPLETED,

    /**
     * Backend reported an execution error.
     */
    FAILED,

    /**
     * No terminal status was observed within the wait budget. The remote job may still run.
     */
    TIMED_OUT;

    /**
     * Returns true when this status is terminal.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }

    /**
     * Returns true when a job can move from the current status to the target status.
     */
    public boolean canTransitionTo(JobStatus target) {
        if (target == null) {
            return false;
        }
        if (this == target) {
            return !isTerminal();
        }
        return switch (this) {
            // History entries appear late, so QUEUED and RUNNING may alternate.
            case QUEUED, RUNNING -> true;
            case COMPLETED, FAILED, TIMED_OUT -> false;
        };
    }
}
