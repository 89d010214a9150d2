package ai.imagegraph.workflow.exception;

/**
 * Raised when a graph template cannot be loaded or does not contain what a role needs.
 * Template defects are configuration errors and are never retried.
 */
public class TemplateException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        MALFORMED,
        NODE_NOT_FOUND,
        INPUT_NOT_FOUND
    }

    private final Reason reason;

    public TemplateException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TemplateException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public static TemplateException notFound(String path) {
        return new TemplateException(Reason.NOT_FOUND, "Workflow template not found: " + path);
    }

    public static TemplateException malformed(String message) {
        return new TemplateException(Reason.MALFORMED, message);
    }

    public static TemplateException malformed(String message, Throwable cause) {
        return new TemplateException(Reason.MALFORMED, message, cause);
    }
}
