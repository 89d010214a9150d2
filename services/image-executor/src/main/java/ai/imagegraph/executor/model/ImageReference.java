package ai.imagegraph.executor.model;

/**
 * Locator of one output image as reported in the backend history.
 *
 * @param filename file name on the backend
 * @param subfolder subfolder below the backend's output root, may be empty
 * @param type storage area, usually {@code output}
 */
public record ImageReference(String filename, String subfolder, String type) {

    public ImageReference {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Image filename cannot be null or empty");
        }
        subfolder = subfolder == null ? "" : subfolder;
        type = type == null || type.isBlank() ? "output" : type;
    }

    /**
     * Extension of the backend file name including the dot, or {@code .png} when it has none.
     */
    public String extension() {
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return ".png";
        }
        return filename.substring(dot);
    }
}
