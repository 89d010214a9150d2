package ai.imagegraph.executor.model;

import java.nio.file.Path;

/**
 * Final artifact of a job: a locator in url mode, a written file in file mode.
 */
public record SavedImage(OutputMode mode, String url, Path path, long sizeBytes) {

    public SavedImage {
        if (mode == OutputMode.URL && (url == null || url.isBlank())) {
            throw new IllegalArgumentException("A url-mode image requires a url");
        }
        if (mode == OutputMode.FILE && path == null) {
            throw new IllegalArgumentException("A file-mode image requires a path");
        }
    }

    public static SavedImage ofUrl(String url) {
        return new SavedImage(OutputMode.URL, url, null, 0L);
    }

    public static SavedImage ofFile(Path path, long sizeBytes) {
        return new SavedImage(OutputMode.FILE, null, path, sizeBytes);
    }
}
