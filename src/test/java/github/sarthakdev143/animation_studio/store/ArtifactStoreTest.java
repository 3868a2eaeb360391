package github.sarthakdev143.animation_studio.store;

import github.sarthakdev143.animation_studio.config.StudioProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactStoreTest {

    @TempDir
    Path tempDir;

    private StudioProperties properties;
    private ArtifactStore store;

    @BeforeEach
    void setUp() {
        properties = new StudioProperties();
        properties.setOutputDir(tempDir.resolve("outputs").toString());
        properties.setUploadDir(tempDir.resolve("uploads").toString());
        store = new ArtifactStore(properties);
    }

    @Test
    void resolvesPublicUrlsToConfiguredDirectories() {
        assertThat(store.resolveOutput("/outputs/scene-1.mp4"))
                .contains(properties.outputPath().resolve("scene-1.mp4"));
        assertThat(store.resolveUpload("/uploads/voice.mp3"))
                .contains(properties.uploadPath().resolve("voice.mp3"));
    }

    @Test
    void onlyTheLastSegmentOfAUrlIsUsed() {
        assertThat(store.resolveOutput("/outputs/../../etc/passwd"))
                .contains(properties.outputPath().resolve("passwd"));
        assertThat(store.resolveUpload("..\\..\\secret.mp3"))
                .contains(properties.uploadPath().resolve("secret.mp3"));
    }

    @Test
    void rejectsUrlsWithoutAFileName() {
        assertThat(store.resolveOutput(null)).isEmpty();
        assertThat(store.resolveOutput("  ")).isEmpty();
        assertThat(store.resolveOutput("/outputs/")).isEmpty();
        assertThat(store.resolveOutput("/outputs/..")).isEmpty();
    }

    @Test
    void outputFileCreatesTheDirectory() throws IOException {
        Path file = store.outputFile("project-1_final.mp4");

        assertThat(file.getParent()).isDirectory();
        assertThat(store.outputUrl("project-1_final.mp4")).isEqualTo("/outputs/project-1_final.mp4");
        assertThat(store.uploadUrl("voice.mp3")).isEqualTo("/uploads/voice.mp3");
    }
}
