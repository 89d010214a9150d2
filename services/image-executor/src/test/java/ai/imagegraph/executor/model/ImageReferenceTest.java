package ai.imagegraph.executor.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageReferenceTest {

    @Test
    void testExtensionFromFilename() {
        assertThat(new ImageReference("ComfyUI_00001_.png", "", "output").extension()).isEqualTo(".png");
        assertThat(new ImageReference("clip.final.webp", "", "output").extension()).isEqualTo(".webp");
    }

    @Test
    void testExtensionDefaultsToPng() {
        assertThat(new ImageReference("noext", "", "output").extension()).isEqualTo(".png");
        assertThat(new ImageReference(".hidden", "", "output").extension()).isEqualTo(".png");
        assertThat(new ImageReference("trailing.", "", "output").extension()).isEqualTo(".png");
    }

    @Test
    void testDefaultsForMissingLocatorParts() {
        ImageReference reference = new ImageReference("a.png", null, null);

        assertThat(reference.subfolder()).isEmpty();
        assertThat(reference.type()).isEqualTo("output");
    }

    @Test
    void testRejectsBlankFilename() {
        assertThatThrownBy(() -> new ImageReference(" ", "", "output"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
