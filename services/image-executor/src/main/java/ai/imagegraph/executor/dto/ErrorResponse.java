package ai.imagegraph.executor.dto;

/**
 * Error body returned by every failed API call.
 *
 * @param error HTTP status name, e.g. {@code BAD_GATEWAY}
 * @param reason domain failure reason such as {@code SUBMIT_FAILED}, or the status name
 * @param message human-readable detail
 */
public record ErrorResponse(String error, String reason, String message) {
}
