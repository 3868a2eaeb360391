package github.sarthakdev143.animation_studio.integration.video;

import github.sarthakdev143.animation_studio.config.StudioProperties;
import github.sarthakdev143.animation_studio.exception.VideoCombineException;
import github.sarthakdev143.animation_studio.integration.ScopedWorkspace;
import github.sarthakdev143.animation_studio.integration.process.CommandResult;
import github.sarthakdev143.animation_studio.integration.process.CommandRunner;
import github.sarthakdev143.animation_studio.model.Scene;
import github.sarthakdev143.animation_studio.service.VideoCombiner;
import github.sarthakdev143.animation_studio.store.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Joins rendered scene videos with the ffmpeg concat demuxer (stream copy) and optionally
 * muxes a project audio track onto the result.
 */
@Component
public class FfmpegVideoCombiner implements VideoCombiner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegVideoCombiner.class);
    private static final String MANIFEST_FILE_NAME = "files.txt";
    private static final String COMBINED_FILE_NAME = "combined.mp4";
    private static final String FINAL_SUFFIX = "_final.mp4";

    private final CommandRunner commandRunner;
    private final ArtifactStore artifactStore;
    private final StudioProperties properties;

    public FfmpegVideoCombiner(CommandRunner commandRunner, ArtifactStore artifactStore, StudioProperties properties) {
        this.commandRunner = commandRunner;
        this.artifactStore = artifactStore;
        this.properties = properties;
    }

    @Override
    public String combine(List<Scene> orderedScenes, String projectId, String audioUrl) {
        if (orderedScenes == null || orderedScenes.isEmpty()) {
            throw new VideoCombineException(VideoCombineException.Reason.NO_SCENES, "No scenes to compile");
        }

        List<Path> videoFiles = collectExistingVideos(orderedScenes);
        if (videoFiles.isEmpty()) {
            throw new VideoCombineException(
                    VideoCombineException.Reason.NO_ARTIFACTS,
                    "No rendered video files found to compile");
        }

        try (ScopedWorkspace workspace = ScopedWorkspace.create("compile_" + projectId + "_")) {
            Path manifest = workspace.resolve(MANIFEST_FILE_NAME);
            Files.write(manifest, buildManifestLines(videoFiles), StandardCharsets.UTF_8);

            Path combined = workspace.resolve(COMBINED_FILE_NAME);
            CommandResult concatResult = commandRunner.run(
                    buildConcatCommand(manifest, combined),
                    "concatenate project " + projectId);
            if (!concatResult.isSuccess()) {
                throw new VideoCombineException(
                        VideoCombineException.Reason.CONCAT_FAILED,
                        "Video concatenation failed: " + concatResult.output());
            }

            String finalFileName = projectId + FINAL_SUFFIX;
            Path finalVideo = artifactStore.outputFile(finalFileName);
            Optional<Path> audio = resolveAudio(audioUrl, projectId);
            if (audio.isPresent()) {
                CommandResult muxResult = commandRunner.run(
                        buildAudioMuxCommand(combined, audio.get(), finalVideo),
                        "mux audio for project " + projectId);
                if (!muxResult.isSuccess()) {
                    throw new VideoCombineException(
                            VideoCombineException.Reason.MUX_FAILED,
                            "Audio mux failed: " + muxResult.output());
                }
            } else {
                Files.copy(combined, finalVideo, StandardCopyOption.REPLACE_EXISTING);
            }

            logger.info(
                    "Combined {} of {} scenes for project {} withAudio={}",
                    videoFiles.size(),
                    orderedScenes.size(),
                    projectId,
                    audio.isPresent());
            return artifactStore.outputUrl(finalFileName);
        } catch (IOException e) {
            throw new VideoCombineException(
                    VideoCombineException.Reason.IO_FAILURE,
                    "Combine workspace error: " + e.getMessage(),
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VideoCombineException(
                    VideoCombineException.Reason.CONCAT_FAILED,
                    "Video combine interrupted",
                    e);
        }
    }

    private List<Path> collectExistingVideos(List<Scene> orderedScenes) {
        List<Path> videoFiles = new ArrayList<>();
        for (Scene scene : orderedScenes) {
            Optional<Path> videoFile = artifactStore.resolveOutput(scene.videoUrl());
            if (videoFile.isPresent() && Files.isRegularFile(videoFile.get())) {
                videoFiles.add(videoFile.get().toAbsolutePath());
            } else {
                logger.warn("Skipping scene {} in combine: no video file for {}", scene.id(), scene.videoUrl());
            }
        }
        return videoFiles;
    }

    private Optional<Path> resolveAudio(String audioUrl, String projectId) {
        if (audioUrl == null || audioUrl.isBlank()) {
            return Optional.empty();
        }
        Optional<Path> audio = artifactStore.resolveUpload(audioUrl).filter(Files::isRegularFile);
        if (audio.isEmpty()) {
            logger.warn("Audio {} for project {} is missing; combining without audio", audioUrl, projectId);
        }
        return audio;
    }

    /**
     * One concat-demuxer {@code file} directive per video. Paths are single-quoted, so an
     * embedded quote is closed, escaped and reopened.
     */
    List<String> buildManifestLines(List<Path> videoFiles) {
        return videoFiles.stream()
                .map(path -> "file '" + path.toString().replace("'", "'\\''") + "'")
                .toList();
    }

    List<String> buildConcatCommand(Path manifest, Path combined) {
        return List.of(
                properties.getFfmpegBinary(),
                "-f", "concat",
                "-safe", "0",
                "-i", manifest.toString(),
                "-c", "copy",
                "-y",
                combined.toString());
    }

    List<String> buildAudioMuxCommand(Path combined, Path audio, Path finalVideo) {
        return List.of(
                properties.getFfmpegBinary(),
                "-i", combined.toString(),
                "-i", audio.toString(),
                "-c:v", "copy",
                "-c:a", "aac",
                "-shortest",
                "-y",
                finalVideo.toString());
    }
}
