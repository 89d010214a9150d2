package ai.imagegraph.executor.exception;

/**
 * Raised when the execution backend cannot be reached, or answers unusably, at a stage that is not retried.
 */
public class BackendNetworkException extends RuntimeException {

    public enum Reason {
        SUBMIT_FAILED,
        FETCH_FAILED
    }

    private final Reason reason;

    public BackendNetworkException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public BackendNetworkException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
