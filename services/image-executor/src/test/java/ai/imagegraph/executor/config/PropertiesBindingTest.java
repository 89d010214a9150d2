package ai.imagegraph.executor.config;

import ai.imagegraph.executor.model.OutputMode;
import jakarta.validation.Validation;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.context.properties.bind.validation.ValidationBindHandler;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.validation.beanvalidation.SpringValidatorAdapter;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PropertiesBindingTest {

    @Test
    void testBareDurationsAreSeconds() {
        Binder binder = new Binder(new MapConfigurationPropertySource(Map.of(
                "imagegraph.backend.base-url", "http://comfy:8188",
                "imagegraph.backend.poll-interval", "2",
                "imagegraph.backend.max-wait", "90")));

        BackendClientProperties properties =
                binder.bind("imagegraph.backend", BackendClientProperties.class).get();

        assertThat(properties.getPollInterval()).isEqualTo(Duration.ofSeconds(2));
        assertThat(properties.getMaxWait()).isEqualTo(Duration.ofSeconds(90));
        assertThat(properties.getEffectiveExternalUrl()).isEqualTo("http://comfy:8188");
    }

    @Test
    void testDurationsWithUnits() {
        Binder binder = new Binder(new MapConfigurationPropertySource(Map.of(
                "imagegraph.backend.base-url", "http://comfy:8188",
                "imagegraph.backend.external-url", "https://public.example.com",
                "imagegraph.backend.poll-interval", "500ms",
                "imagegraph.backend.max-wait", "10m")));

        BackendClientProperties properties =
                binder.bind("imagegraph.backend", BackendClientProperties.class).get();

        assertThat(properties.getPollInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(properties.getMaxWait()).isEqualTo(Duration.ofMinutes(10));
        assertThat(properties.getEffectiveExternalUrl()).isEqualTo("https://public.example.com");
    }

    @Test
    void testOutputModeIsCaseInsensitiveAndPatternDefaults() {
        Binder binder = new Binder(new MapConfigurationPropertySource(Map.of(
                "imagegraph.output.mode", "url",
                "imagegraph.output.filename-pattern", "")));

        OutputProperties properties = binder.bind("imagegraph.output", OutputProperties.class).get();

        assertThat(properties.getMode()).isEqualTo(OutputMode.URL);
        assertThat(properties.getFilenamePattern()).isEqualTo("{timestamp}");
    }

    @Test
    void testNegativePollIntervalIsRejected() {
        BindException ex = assertThrows(BindException.class, () -> bindBackendValidated(Map.of(
                "imagegraph.backend.base-url", "http://comfy:8188",
                "imagegraph.backend.poll-interval", "-1")));

        assertThat(ex.getCause()).isInstanceOf(BindValidationException.class);
        assertThat(ex.getCause().getMessage()).contains("pollInterval").doesNotContain("maxWait");
    }

    @Test
    void testZeroPollIntervalIsRejected() {
        BindException ex = assertThrows(BindException.class, () -> bindBackendValidated(Map.of(
                "imagegraph.backend.base-url", "http://comfy:8188",
                "imagegraph.backend.poll-interval", "0")));

        assertThat(ex.getCause()).isInstanceOf(BindValidationException.class);
        assertThat(ex.getCause().getMessage()).contains("pollInterval");
    }

    @Test
    void testNegativeMaxWaitIsRejected() {
        BindException ex = assertThrows(BindException.class, () -> bindBackendValidated(Map.of(
                "imagegraph.backend.base-url", "http://comfy:8188",
                "imagegraph.backend.max-wait", "-5s")));

        assertThat(ex.getCause()).isInstanceOf(BindValidationException.class);
        assertThat(ex.getCause().getMessage()).contains("maxWait").doesNotContain("pollInterval");
    }

    @Test
    void testSmallestAcceptedDurationsPassValidation() {
        BackendClientProperties properties = bindBackendValidated(Map.of(
                "imagegraph.backend.base-url", "http://comfy:8188",
                "imagegraph.backend.poll-interval", "1ms",
                "imagegraph.backend.max-wait", "0"));

        assertThat(properties.getPollInterval()).isEqualTo(Duration.ofMillis(1));
        assertThat(properties.getMaxWait()).isEqualTo(Duration.ZERO);
    }

    private static BackendClientProperties bindBackendValidated(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        ValidationBindHandler handler = new ValidationBindHandler(
                new SpringValidatorAdapter(Validation.buildDefaultValidatorFactory().getValidator()));
        return binder.bind("imagegraph.backend", Bindable.of(BackendClientProperties.class), handler).get();
    }
}
