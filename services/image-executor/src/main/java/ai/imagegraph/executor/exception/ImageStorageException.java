package ai.imagegraph.executor.exception;

/**
 * Raised when a fetched image cannot be written to local storage.
 */
public class ImageStorageException extends RuntimeException {

    public enum Reason {
        WRITE_FAILED
    }

    private final Reason reason;

    public ImageStorageException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ImageStorageException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
