package ai.imagegraph.executor.config;

import ai.imagegraph.executor.model.OutputMode;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where and how finished images are handed back.
 */
@Validated
@ConfigurationProperties(prefix = "imagegraph.output")
public class OutputProperties {

    static final String DEFAULT_FILENAME_PATTERN = "{timestamp}";

    @NotNull
    private OutputMode mode = OutputMode.FILE;

    private String workingDir;

    private String filenamePattern = DEFAULT_FILENAME_PATTERN;

    public OutputMode getMode() {
        return mode;
    }

    public void setMode(OutputMode mode) {
        this.mode = mode;
    }

    public String getWorkingDir() {
        return workingDir;
    }

    public void setWorkingDir(String workingDir) {
        this.workingDir = workingDir;
    }

    public String getFilenamePattern() {
        return filenamePattern == null || filenamePattern.isBlank() ? DEFAULT_FILENAME_PATTERN : filenamePattern;
    }

    public void setFilenamePattern(String filenamePattern) {
        this.filenamePattern = filenamePattern;
    }
}
