package github.sarthakdev143.animation_studio.service.impl;

import github.sarthakdev143.animation_studio.exception.ResourceNotFoundException;
import github.sarthakdev143.animation_studio.model.AudioTrack;
import github.sarthakdev143.animation_studio.model.Project;
import github.sarthakdev143.animation_studio.service.AudioService;
import github.sarthakdev143.animation_studio.store.ArtifactStore;
import github.sarthakdev143.animation_studio.store.StudioStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

@Service
public class DefaultAudioService implements AudioService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAudioService.class);
    private static final Set<String> ALLOWED_AUDIO_TYPES = Set.of("audio/mpeg", "audio/wav", "audio/mp3", "audio/x-wav");
    private static final Pattern EXTENSION_PATTERN = Pattern.compile("^[A-Za-z0-9]{1,8}$");
    private static final String DEFAULT_EXTENSION = ".mp3";

    private final StudioStore store;
    private final ArtifactStore artifactStore;

    public DefaultAudioService(StudioStore store, ArtifactStore artifactStore) {
        this.store = store;
        this.artifactStore = artifactStore;
    }

    @Override
    public AudioTrack uploadAudio(String projectId, MultipartFile file) throws IOException {
        requireProject(projectId);
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Audio file is required.");
        }
        String contentType = file.getContentType();
        if (contentType == null || !ALLOWED_AUDIO_TYPES.contains(contentType.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Invalid file type. Allowed: MP3, WAV");
        }

        String audioId = UUID.randomUUID().toString();
        String fileName = audioId + resolveExtension(file.getOriginalFilename());
        Path target = artifactStore.uploadFile(fileName);
        file.transferTo(target);

        String audioUrl = artifactStore.uploadUrl(fileName);
        store.updateProject(projectId, current -> current.withAudioUrl(audioUrl))
                .orElseThrow(() -> new ResourceNotFoundException("Project not found"));
        logger.info("Stored audio {} for project {}", fileName, projectId);
        return new AudioTrack(audioId, projectId, file.getOriginalFilename(), audioUrl, Instant.now());
    }

    @Override
    public void removeAudio(String projectId) throws IOException {
        Project project = requireProject(projectId);
        Optional<Path> audioFile = artifactStore.resolveUpload(project.audioUrl());
        if (audioFile.isPresent()) {
            Files.deleteIfExists(audioFile.get());
        }
        store.updateProject(projectId, current -> current.withAudioUrl(null));
        logger.info("Removed audio from project {}", projectId);
    }

    private Project requireProject(String projectId) {
        return store.findProject(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("Project not found"));
    }

    private String resolveExtension(String originalFilename) {
        String extension = StringUtils.getFilenameExtension(originalFilename);
        if (extension == null || !EXTENSION_PATTERN.matcher(extension).matches()) {
            return DEFAULT_EXTENSION;
        }
        return "." + extension.toLowerCase(Locale.ROOT);
    }
}
