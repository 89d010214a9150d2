package ai.imagegraph.executor.config;

import ai.imagegraph.workflow.model.NodeRole;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Workflow template location and optional explicit node ids per role.
 * A blank node id means the role is discovered from the template.
 */
@Validated
@ConfigurationProperties(prefix = "imagegraph.workflow")
public class WorkflowProperties {

    @NotBlank
    private String templatePath;

    private String positivePromptNodeId;

    /**
     * Older name for the positive prompt node id.
     */
    private String promptNodeId;

    private String negativePromptNodeId;
    private String outputNodeId;
    private String filepathNodeId;
    private String latentImageNodeId;

    public String getTemplatePath() {
        return templatePath;
    }

    public void setTemplatePath(String templatePath) {
        this.templatePath = templatePath;
    }

    public String getPositivePromptNodeId() {
        return positivePromptNodeId;
    }

    public void setPositivePromptNodeId(String positivePromptNodeId) {
        this.positivePromptNodeId = positivePromptNodeId;
    }

    public String getPromptNodeId() {
        return promptNodeId;
    }

    public void setPromptNodeId(String promptNodeId) {
        this.promptNodeId = promptNodeId;
    }

    /**
     * Positive prompt node id, falling back to the legacy prompt node id when only that is set.
     */
    public String getEffectivePositivePromptNodeId() {
        if (hasText(positivePromptNodeId)) {
            return positivePromptNodeId;
        }
        return hasText(promptNodeId) ? promptNodeId : null;
    }

    public String getNegativePromptNodeId() {
        return negativePromptNodeId;
    }

    public void setNegativePromptNodeId(String negativePromptNodeId) {
        this.negativePromptNodeId = negativePromptNodeId;
    }

    public String getOutputNodeId() {
        return outputNodeId;
    }

    public void setOutputNodeId(String outputNodeId) {
        this.outputNodeId = outputNodeId;
    }

    public String getFilepathNodeId() {
        return filepathNodeId;
    }

    public void setFilepathNodeId(String filepathNodeId) {
        this.filepathNodeId = filepathNodeId;
    }

    public String getLatentImageNodeId() {
        return latentImageNodeId;
    }

    public void setLatentImageNodeId(String latentImageNodeId) {
        this.latentImageNodeId = latentImageNodeId;
    }

    /**
     * Explicit node id configured for a role, or null when the role should be discovered.
     */
    public String nodeIdFor(NodeRole role) {
        String nodeId = switch (role) {
            case POSITIVE_TEXT -> getEffectivePositivePromptNodeId();
            case NEGATIVE_TEXT -> negativePromptNodeId;
            case OUTPUT -> outputNodeId;
            case FILE_PATH -> filepathNodeId;
            case LATENT_IMAGE -> latentImageNodeId;
        };
        return hasText(nodeId) ? nodeId : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
