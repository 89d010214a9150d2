package ai.imagegraph.executor.dto;

import ai.imagegraph.executor.model.SavedImage;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Locale;

/**
 * Result of an image generation call. Exactly one of {@code url} and {@code path} is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GenerateImageResponse {

    private String mode;
    private String url;
    private String path;
    private Long sizeBytes;

    public static GenerateImageResponse from(SavedImage image) {
        GenerateImageResponse response = new GenerateImageResponse();
        response.setMode(image.mode().name().toLowerCase(Locale.ROOT));
        response.setUrl(image.url());
        if (image.path() != null) {
            response.setPath(image.path().toString());
            response.setSizeBytes(image.sizeBytes());
        }
        return response;
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(Long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }
}
