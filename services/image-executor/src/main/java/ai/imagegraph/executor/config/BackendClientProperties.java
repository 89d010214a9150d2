package ai.imagegraph.executor.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Connection and polling settings for the image generation backend.
 * Bare numbers for the durations are read as seconds. The poll interval must be positive
 * and the maximum wait must not be negative.
 */
@Validated
@ConfigurationProperties(prefix = "imagegraph.backend")
public class BackendClientProperties {

    @NotBlank
    private String baseUrl;

    private String externalUrl;

    @NotNull
    @DurationMin(seconds = 0, inclusive = false)
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration pollInterval = Duration.ofSeconds(5);

    @NotNull
    @DurationMin(seconds = 0)
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration maxWait = Duration.ofMinutes(5);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getExternalUrl() {
        return externalUrl;
    }

    public void setExternalUrl(String externalUrl) {
        this.externalUrl = externalUrl;
    }

    /**
     * URL handed to callers in url mode; the internal base URL unless an external one is configured.
     */
    public String getEffectiveExternalUrl() {
        if (externalUrl == null || externalUrl.isBlank()) {
            return baseUrl;
        }
        return externalUrl;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getMaxWait() {
        return maxWait;
    }

    public void setMaxWait(Duration maxWait) {
        this.maxWait = maxWait;
    }
}
