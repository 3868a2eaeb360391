package github.sarthakdev143.animation_studio.integration.video;

import github.sarthakdev143.animation_studio.config.StudioProperties;
import github.sarthakdev143.animation_studio.integration.process.CommandResult;
import github.sarthakdev143.animation_studio.integration.process.CommandRunner;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Thumbnail extraction and duration probing. Both are soft: failures fall back to no
 * thumbnail and the configured fallback duration.
 */
@Component
public class FfmpegMediaProbe {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegMediaProbe.class);
    private static final String THUMBNAIL_OFFSET = "00:00:01";

    private final CommandRunner commandRunner;
    private final StudioProperties properties;
    private final Counter thumbnailFailureCounter;
    private final Counter durationFallbackCounter;

    public FfmpegMediaProbe(CommandRunner commandRunner, StudioProperties properties, MeterRegistry meterRegistry) {
        this.commandRunner = commandRunner;
        this.properties = properties;
        this.thumbnailFailureCounter = meterRegistry.counter("animation_studio.thumbnail.failures");
        this.durationFallbackCounter = meterRegistry.counter("animation_studio.duration.fallbacks");
    }

    /**
     * Writes a single frame from one second into the video.
     *
     * @return true when the thumbnail file exists afterwards
     */
    public boolean extractThumbnail(Path videoPath, Path thumbnailPath) {
        try {
            CommandResult result = commandRunner.run(
                    buildThumbnailCommand(videoPath, thumbnailPath),
                    "extract thumbnail");
            if (!result.isSuccess()) {
                logger.warn("Thumbnail extraction for {} exited with code {}", videoPath, result.exitCode());
            }
        } catch (IOException e) {
            logger.warn("Thumbnail extraction for {} could not run", videoPath, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Thumbnail extraction for {} was interrupted", videoPath);
        }

        if (Files.exists(thumbnailPath)) {
            return true;
        }
        thumbnailFailureCounter.increment();
        return false;
    }

    public double probeDuration(Path videoPath) {
        double fallback = properties.getFallbackDurationSeconds();
        try {
            CommandResult result = commandRunner.run(buildDurationCommand(videoPath), "probe duration");
            if (result.isSuccess()) {
                return Double.parseDouble(result.output().trim());
            }
            logger.warn("Duration probe for {} exited with code {}; using {}s", videoPath, result.exitCode(), fallback);
        } catch (NumberFormatException e) {
            logger.warn("Duration probe for {} returned a non-numeric value; using {}s", videoPath, fallback);
        } catch (IOException e) {
            logger.warn("Duration probe for {} could not run; using {}s", videoPath, fallback, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Duration probe for {} was interrupted; using {}s", videoPath, fallback);
        }
        durationFallbackCounter.increment();
        return fallback;
    }

    List<String> buildThumbnailCommand(Path videoPath, Path thumbnailPath) {
        return List.of(
                properties.getFfmpegBinary(),
                "-i", videoPath.toString(),
                "-ss", THUMBNAIL_OFFSET,
                "-vframes", "1",
                "-y",
                thumbnailPath.toString());
    }

    List<String> buildDurationCommand(Path videoPath) {
        return List.of(
                properties.getFfprobeBinary(),
                "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                videoPath.toString());
    }
}
