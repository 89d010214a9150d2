package ai.imagegraph.executor.model;

/**
 * One image generation call.
 *
 * @param positivePrompt text written into the positive prompt node
 * @param negativePrompt optional text for the negative prompt node
 * @param savePath optional save directory override, may contain time tokens
 * @param width optional latent width
 * @param height optional latent height
 */
public record GenerationRequest(
        String positivePrompt,
        String negativePrompt,
        String savePath,
        Integer width,
        Integer height
) {

    public GenerationRequest {
        if (positivePrompt == null || positivePrompt.isBlank()) {
            throw new IllegalArgumentException("Positive prompt cannot be null or empty");
        }
        if (width != null && width <= 0) {
            throw new IllegalArgumentException("Width must be greater than 0");
        }
        if (height != null && height <= 0) {
            throw new IllegalArgumentException("Height must be greater than 0");
        }
    }

    public static GenerationRequest of(String positivePrompt) {
        return new GenerationRequest(positivePrompt, null, null, null, null);
    }

    public boolean hasNegativePrompt() {
        return negativePrompt != null && !negativePrompt.isBlank();
    }
}
