package github.sarthakdev143.animation_studio.integration.manim;

import github.sarthakdev143.animation_studio.config.StudioProperties;
import github.sarthakdev143.animation_studio.exception.SceneRenderException;
import github.sarthakdev143.animation_studio.integration.process.CommandResult;
import github.sarthakdev143.animation_studio.integration.process.ScriptedCommandRunner;
import github.sarthakdev143.animation_studio.integration.video.FfmpegMediaProbe;
import github.sarthakdev143.animation_studio.model.RenderedScene;
import github.sarthakdev143.animation_studio.store.ArtifactStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static github.sarthakdev143.animation_studio.integration.process.ScriptedCommandRunner.valueAfter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManimSceneRendererTest {

    private static final String CODE = "from manim import *\n";

    @TempDir
    Path tempDir;

    private StudioProperties properties;
    private ArtifactStore artifactStore;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        properties = new StudioProperties();
        properties.setOutputDir(tempDir.resolve("outputs").toString());
        properties.setUploadDir(tempDir.resolve("uploads").toString());
        artifactStore = new ArtifactStore(properties);
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void buildRenderCommandUsesLowQualityAndEntryClass() {
        ManimSceneRenderer renderer = renderer(new ScriptedCommandRunner());

        List<String> command = renderer.buildRenderCommand(
                "scene-1",
                Path.of("/tmp/work/media"),
                Path.of("/tmp/work/scene.py"));

        assertThat(command).containsExactly(
                "manim",
                "render",
                "-ql",
                "-o", "scene-1",
                "--media_dir", Path.of("/tmp/work/media").toString(),
                Path.of("/tmp/work/scene.py").toString(),
                "GeneratedScene");
    }

    @Test
    void renderPublishesVideoThumbnailAndDuration() throws Exception {
        ScriptedCommandRunner runner = ScriptedCommandRunner.working("12.48");

        RenderedScene rendered = renderer(runner).render(CODE, "scene-1");

        assertThat(rendered.videoUrl()).isEqualTo("/outputs/scene-1.mp4");
        assertThat(rendered.thumbnailUrl()).isEqualTo("/outputs/scene-1_thumb.png");
        assertThat(rendered.durationSeconds()).isEqualTo(12.48);
        assertThat(Files.readString(properties.outputPath().resolve("scene-1.mp4"))).isEqualTo("video:scene-1");
        assertThat(properties.outputPath().resolve("scene-1_thumb.png")).exists();
    }

    @Test
    void renderWritesCodeToScriptAndRemovesWorkspace() {
        ScriptedCommandRunner runner = ScriptedCommandRunner.working("3.0");
        String[] scriptContents = new String[1];
        runner.on("manim", command -> {
            Path script = Path.of(command.get(command.size() - 2));
            scriptContents[0] = Files.readString(script);
            return ScriptedCommandRunner.writeManimVideo(command);
        });

        renderer(runner).render(CODE, "scene-1");

        List<String> manimCommand = runner.commandsFor("manim").get(0);
        Path mediaDir = Path.of(valueAfter(manimCommand, "--media_dir"));
        assertThat(scriptContents[0]).isEqualTo(CODE);
        assertThat(mediaDir.getParent()).doesNotExist();
        assertThat(mediaDir.getParent().getFileName().toString()).startsWith("manim_scene-1_");
    }

    @Test
    void engineFailureCarriesEngineOutputAndCleansUp() {
        ScriptedCommandRunner runner = ScriptedCommandRunner.working("3.0")
                .on("manim", command -> new CommandResult(1, "NameError: name 'Circl' is not defined"));

        assertThatThrownBy(() -> renderer(runner).render(CODE, "scene-1"))
                .isInstanceOf(SceneRenderException.class)
                .hasMessage("Manim render failed: NameError: name 'Circl' is not defined")
                .extracting(e -> ((SceneRenderException) e).reason())
                .isEqualTo(SceneRenderException.Reason.ENGINE_FAILED);

        Path mediaDir = Path.of(valueAfter(runner.commandsFor("manim").get(0), "--media_dir"));
        assertThat(mediaDir.getParent()).doesNotExist();
        assertThat(runner.commandsFor("ffmpeg")).isEmpty();
    }

    @Test
    void missingVideoIsReportedAsNoArtifact() {
        ScriptedCommandRunner runner = ScriptedCommandRunner.working("3.0")
                .on("manim", command -> new CommandResult(0, "nothing rendered"));

        assertThatThrownBy(() -> renderer(runner).render(CODE, "scene-1"))
                .isInstanceOf(SceneRenderException.class)
                .hasMessage("No video file generated")
                .extracting(e -> ((SceneRenderException) e).reason())
                .isEqualTo(SceneRenderException.Reason.NO_ARTIFACT);
    }

    @Test
    void thumbnailFailureLeavesThumbnailEmpty() {
        ScriptedCommandRunner runner = ScriptedCommandRunner.working("4.0")
                .on("ffmpeg", command -> new CommandResult(1, "decode error"));

        RenderedScene rendered = renderer(runner).render(CODE, "scene-1");

        assertThat(rendered.videoUrl()).isEqualTo("/outputs/scene-1.mp4");
        assertThat(rendered.thumbnailUrl()).isNull();
        assertThat(rendered.durationSeconds()).isEqualTo(4.0);
        assertThat(meterRegistry.counter("animation_studio.thumbnail.failures").count()).isEqualTo(1.0);
    }

    private ManimSceneRenderer renderer(ScriptedCommandRunner runner) {
        FfmpegMediaProbe mediaProbe = new FfmpegMediaProbe(runner, properties, meterRegistry);
        return new ManimSceneRenderer(runner, mediaProbe, artifactStore, properties);
    }
}
