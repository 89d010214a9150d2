package ai.imagegraph.executor.service;

import ai.imagegraph.executor.model.ImageReference;
import ai.imagegraph.executor.model.JobStatus;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps one {@code GET /history/{promptId}} response onto a job status.
 */
final class HistoryClassifier {

    private HistoryClassifier() {
    }

    static Classification classify(JsonNode history, String promptId) {
        if (history == null || history.isNull() || history.isMissingNode()) {
            return new Classification(JobStatus.QUEUED, Map.of(), null);
        }
        if (!history.isObject()) {
            throw new IllegalStateException("History response for prompt " + promptId + " is not a JSON object");
        }
        JsonNode entry = history.get(promptId);
        if (entry == null || entry.isNull()) {
            return new Classification(JobStatus.QUEUED, Map.of(), null);
        }
        if (!entry.isObject()) {
            throw new IllegalStateException("History entry for prompt " + promptId + " is not a JSON object");
        }

        JsonNode status = entry.path("status");
        if ("error".equals(status.path("status_str").asText(null))) {
            return new Classification(JobStatus.FAILED, Map.of(), failureReason(status.path("messages")));
        }
        if (status.path("completed").asBoolean(false)) {
            return new Classification(JobStatus.COMPLETED, outputImages(entry.path("outputs")), null);
        }
        return new Classification(JobStatus.RUNNING, Map.of(), null);
    }

    private static String failureReason(JsonNode messages) {
        for (JsonNode message : messages) {
            if (!message.isArray() || message.size() < 2) {
                continue;
            }
            String event = message.get(0).asText();
            JsonNode data = message.get(1);
            if ("execution_error".equals(event)) {
                StringBuilder reason = new StringBuilder("Node ")
                        .append(data.path("node_id").asText("?"));
                String nodeType = data.path("node_type").asText("");
                if (!nodeType.isEmpty()) {
                    reason.append(" (").append(nodeType).append(')');
                }
                reason.append(" failed");
                String exceptionType = data.path("exception_type").asText("");
                String exceptionMessage = data.path("exception_message").asText("").trim();
                if (!exceptionType.isEmpty() || !exceptionMessage.isEmpty()) {
                    reason.append(": ");
                    if (!exceptionType.isEmpty()) {
                        reason.append(exceptionType);
                        if (!exceptionMessage.isEmpty()) {
                            reason.append(": ");
                        }
                    }
                    reason.append(exceptionMessage);
                }
                return reason.toString();
            }
            if ("execution_interrupted".equals(event)) {
                return "Execution interrupted at node " + data.path("node_id").asText("?");
            }
        }
        return "Backend reported status 'error' without details";
    }

    private static Map<String, List<ImageReference>> outputImages(JsonNode outputs) {
        Map<String, List<ImageReference>> images = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = outputs.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> output = fields.next();
            List<ImageReference> refs = new ArrayList<>();
            for (JsonNode image : output.getValue().path("images")) {
                String filename = image.path("filename").asText("");
                if (filename.isBlank()) {
                    continue;
                }
                refs.add(new ImageReference(
                        filename,
                        image.path("subfolder").asText(""),
                        image.path("type").asText("output")));
            }
            if (!refs.isEmpty()) {
                images.put(output.getKey(), refs);
            }
        }
        return images;
    }

    record Classification(JobStatus status, Map<String, List<ImageReference>> images, String failureReason) {
    }
}
