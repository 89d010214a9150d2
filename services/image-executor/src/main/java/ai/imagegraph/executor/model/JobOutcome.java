package ai.imagegraph.executor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of polling one job to a terminal state.
 *
 * @param status terminal status
 * @param images output images keyed by node id, empty unless completed
 * @param failureReason backend error or timeout description, null when completed
 * @param polls number of history queries made
 * @param transientErrors number of queries that failed and were retried
 */
public record JobOutcome(
        JobStatus status,
        Map<String, List<ImageReference>> images,
        String failureReason,
        int polls,
        int transientErrors
) {

    public JobOutcome {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Job outcome requires a terminal status, got " + status);
        }
        Map<String, List<ImageReference>> copy = new LinkedHashMap<>();
        if (images != null) {
            images.forEach((nodeId, refs) -> copy.put(nodeId, List.copyOf(refs)));
        }
        images = Collections.unmodifiableMap(copy);
    }

    public static JobOutcome completed(Map<String, List<ImageReference>> images, int polls, int transientErrors) {
        return new JobOutcome(JobStatus.COMPLETED, images, null, polls, transientErrors);
    }

    public static JobOutcome failed(String reason, int polls, int transientErrors) {
        return new JobOutcome(JobStatus.FAILED, Map.of(), reason, polls, transientErrors);
    }

    public static JobOutcome timedOut(String reason, int polls, int transientErrors) {
        return new JobOutcome(JobStatus.TIMED_OUT, Map.of(), reason, polls, transientErrors);
    }

    public boolean isCompleted() {
        return status == JobStatus.COMPLETED;
    }

    /**
     * First image produced by the given node.
     */
    public Optional<ImageReference> firstImage(String nodeId) {
        List<ImageReference> refs = images.get(nodeId);
        if (refs == null || refs.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(refs.get(0));
    }
}
