package ai.imagegraph.workflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Reference from a node input to another node's output slot.
 * Serialized as the two-element array {@code [sourceNodeId, sourceSlot]} the backend expects.
 */
public record NodeLink(String sourceNodeId, int sourceSlot) {

    public NodeLink {
        if (sourceNodeId == null || sourceNodeId.isBlank()) {
            throw new IllegalArgumentException("Link source node id cannot be null or empty");
        }
        if (sourceSlot < 0) {
            throw new IllegalArgumentException("Link source slot cannot be negative");
        }
    }

    @JsonValue
    public List<Object> toJsonValue() {
        return List.of(sourceNodeId, sourceSlot);
    }
}
