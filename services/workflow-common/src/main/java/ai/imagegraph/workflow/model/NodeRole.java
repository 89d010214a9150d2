package ai.imagegraph.workflow.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Logical purpose a template node serves for a generation run.
 * Each role carries the title and type used for discovery and the input it writes.
 */
public enum NodeRole {

    POSITIVE_TEXT("Positive Prompt", "CLIPTextEncode", "text", true),

    NEGATIVE_TEXT("Negative Prompt", "CLIPTextEncode", "text", false),

    /**
     * Image save node. Path-aware {@code Image Save} nodes are tried after the core {@code SaveImage} type.
     */
    OUTPUT("Save Image", "SaveImage", "filename_prefix", true, "Image Save"),

    /**
     * Text node whose value is the save directory, used by path-aware save nodes.
     */
    FILE_PATH("Save Path", "Text String", "text", false),

    /**
     * Latent image node that controls the output dimensions.
     */
    LATENT_IMAGE("Empty Latent Image", "EmptyLatentImage", "width", false);

    private final String defaultTitle;
    private final String defaultType;
    private final String inputName;
    private final boolean required;
    private final List<String> discoveryTypes;

    NodeRole(String defaultTitle, String defaultType, String inputName, boolean required, String... alternateTypes) {
        this.defaultTitle = defaultTitle;
        this.defaultType = defaultType;
        this.inputName = inputName;
        this.required = required;
        List<String> types = new ArrayList<>();
        types.add(defaultType);
        types.addAll(List.of(alternateTypes));
        this.discoveryTypes = List.copyOf(types);
    }

    public String getDefaultTitle() {
        return defaultTitle;
    }

    public String getDefaultType() {
        return defaultType;
    }

    /**
     * Node types tried by discovery, in order. The default type always comes first.
     */
    public List<String> getDiscoveryTypes() {
        return discoveryTypes;
    }

    public String getInputName() {
        return inputName;
    }

    /**
     * Returns true when a submission cannot proceed without this role.
     */
    public boolean isRequired() {
        return required;
    }
}
