package github.sarthakdev143.animation_studio.integration.manim;

import github.sarthakdev143.animation_studio.config.StudioProperties;
import github.sarthakdev143.animation_studio.exception.SceneRenderException;
import github.sarthakdev143.animation_studio.integration.ScopedWorkspace;
import github.sarthakdev143.animation_studio.integration.process.CommandResult;
import github.sarthakdev143.animation_studio.integration.process.CommandRunner;
import github.sarthakdev143.animation_studio.integration.video.FfmpegMediaProbe;
import github.sarthakdev143.animation_studio.model.RenderedScene;
import github.sarthakdev143.animation_studio.service.SceneRenderer;
import github.sarthakdev143.animation_studio.store.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Renders scene code with the Manim CLI inside a throwaway workspace and publishes the
 * resulting video as {@code {sceneId}.mp4} in the output directory.
 */
@Component
public class ManimSceneRenderer implements SceneRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ManimSceneRenderer.class);
    private static final String SCRIPT_FILE_NAME = "scene.py";
    private static final String MEDIA_DIR_NAME = "media";
    private static final String VIDEO_EXTENSION = ".mp4";
    private static final String THUMBNAIL_SUFFIX = "_thumb.png";

    private final CommandRunner commandRunner;
    private final FfmpegMediaProbe mediaProbe;
    private final ArtifactStore artifactStore;
    private final StudioProperties properties;

    public ManimSceneRenderer(
            CommandRunner commandRunner,
            FfmpegMediaProbe mediaProbe,
            ArtifactStore artifactStore,
            StudioProperties properties) {
        this.commandRunner = commandRunner;
        this.mediaProbe = mediaProbe;
        this.artifactStore = artifactStore;
        this.properties = properties;
    }

    @Override
    public RenderedScene render(String code, String sceneId) {
        try (ScopedWorkspace workspace = ScopedWorkspace.create("manim_" + sceneId + "_")) {
            Path scriptPath = workspace.resolve(SCRIPT_FILE_NAME);
            Path mediaDir = workspace.resolve(MEDIA_DIR_NAME);
            Files.writeString(scriptPath, code, StandardCharsets.UTF_8);

            CommandResult result = commandRunner.run(
                    buildRenderCommand(sceneId, mediaDir, scriptPath),
                    "render scene " + sceneId);
            if (!result.isSuccess()) {
                throw new SceneRenderException(
                        SceneRenderException.Reason.ENGINE_FAILED,
                        "Manim render failed: " + result.output());
            }

            Path renderedVideo = findFirstVideo(mediaDir)
                    .orElseThrow(() -> new SceneRenderException(
                            SceneRenderException.Reason.NO_ARTIFACT,
                            "No video file generated"));

            String videoFileName = sceneId + VIDEO_EXTENSION;
            Path outputVideo = artifactStore.outputFile(videoFileName);
            Files.copy(renderedVideo, outputVideo, StandardCopyOption.REPLACE_EXISTING);

            String thumbnailFileName = sceneId + THUMBNAIL_SUFFIX;
            Path thumbnail = artifactStore.outputFile(thumbnailFileName);
            String thumbnailUrl = mediaProbe.extractThumbnail(outputVideo, thumbnail)
                    ? artifactStore.outputUrl(thumbnailFileName)
                    : null;
            double durationSeconds = mediaProbe.probeDuration(outputVideo);

            logger.info("Rendered scene {} duration={}s thumbnail={}", sceneId, durationSeconds, thumbnailUrl != null);
            return new RenderedScene(artifactStore.outputUrl(videoFileName), thumbnailUrl, durationSeconds);
        } catch (IOException e) {
            throw new SceneRenderException(
                    SceneRenderException.Reason.IO_FAILURE,
                    "Render workspace error: " + e.getMessage(),
                    e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SceneRenderException(
                    SceneRenderException.Reason.ENGINE_FAILED,
                    "Manim render interrupted",
                    e);
        }
    }

    List<String> buildRenderCommand(String sceneId, Path mediaDir, Path scriptPath) {
        return List.of(
                properties.getManimBinary(),
                "render",
                "-ql",
                "-o", sceneId,
                "--media_dir", mediaDir.toString(),
                scriptPath.toString(),
                properties.getEntryClass());
    }

    private Optional<Path> findFirstVideo(Path mediaDir) throws IOException {
        if (Files.notExists(mediaDir)) {
            return Optional.empty();
        }
        try (Stream<Path> paths = Files.walk(mediaDir)) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(VIDEO_EXTENSION))
                    .findFirst();
        }
    }
}
