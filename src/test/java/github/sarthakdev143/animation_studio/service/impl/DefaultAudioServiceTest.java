package github.sarthakdev143.animation_studio.service.impl;

import github.sarthakdev143.animation_studio.config.StudioProperties;
import github.sarthakdev143.animation_studio.exception.ResourceNotFoundException;
import github.sarthakdev143.animation_studio.model.AudioTrack;
import github.sarthakdev143.animation_studio.model.Project;
import github.sarthakdev143.animation_studio.store.ArtifactStore;
import github.sarthakdev143.animation_studio.store.StudioStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultAudioServiceTest {

    @TempDir
    Path tempDir;

    private StudioStore store;
    private StudioProperties properties;
    private DefaultAudioService service;

    @BeforeEach
    void setUp() {
        store = new StudioStore();
        properties = new StudioProperties();
        properties.setOutputDir(tempDir.resolve("outputs").toString());
        properties.setUploadDir(tempDir.resolve("uploads").toString());
        service = new DefaultAudioService(store, new ArtifactStore(properties));
        Instant now = Instant.now();
        store.saveProject(new Project("project-1", "Project", null, List.of(), null, now, now));
    }

    @Test
    void uploadAudioStoresFileAndAttachesItToProject() throws IOException {
        MockMultipartFile file = new MockMultipartFile("file", "Narration.WAV", "audio/wav", "RIFF".getBytes());

        AudioTrack track = service.uploadAudio("project-1", file);

        assertThat(track.url()).isEqualTo("/uploads/" + track.id() + ".wav");
        assertThat(track.originalFilename()).isEqualTo("Narration.WAV");
        assertThat(properties.uploadPath().resolve(track.id() + ".wav")).hasContent("RIFF");
        assertThat(store.findProject("project-1").orElseThrow().audioUrl()).isEqualTo(track.url());
    }

    @Test
    void uploadAudioFallsBackToMp3ExtensionForOddNames() throws IOException {
        MockMultipartFile file = new MockMultipartFile("file", "voice.../../x y", "audio/mpeg", "ID3".getBytes());

        AudioTrack track = service.uploadAudio("project-1", file);

        assertThat(track.url()).endsWith(".mp3");
    }

    @Test
    void uploadAudioRejectsUnsupportedOrEmptyFiles() {
        MockMultipartFile video = new MockMultipartFile("file", "clip.mp4", "video/mp4", "x".getBytes());
        MockMultipartFile empty = new MockMultipartFile("file", "voice.mp3", "audio/mpeg", new byte[0]);

        assertThatThrownBy(() -> service.uploadAudio("project-1", video))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid file type. Allowed: MP3, WAV");
        assertThatThrownBy(() -> service.uploadAudio("project-1", empty))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Audio file is required.");
        assertThatThrownBy(() -> service.uploadAudio("missing", video))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void removeAudioDeletesFileAndClearsProject() throws IOException {
        AudioTrack track = service.uploadAudio(
                "project-1",
                new MockMultipartFile("file", "voice.mp3", "audio/mpeg", "ID3".getBytes()));
        Path stored = properties.uploadPath().resolve(track.id() + ".mp3");
        assertThat(stored).exists();

        service.removeAudio("project-1");

        assertThat(Files.exists(stored)).isFalse();
        assertThat(store.findProject("project-1").orElseThrow().audioUrl()).isNull();
    }
}
