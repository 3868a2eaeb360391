package github.sarthakdev143.animation_studio.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "animation-studio.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int BINARY_CHECK_TIMEOUT_SECONDS = 10;

    private final StudioProperties properties;

    public StartupPreflightChecks(StudioProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        ensureDirectory(properties.outputPath(), "output");
        ensureDirectory(properties.uploadPath(), "upload");
        checkBinary(properties.getFfmpegBinary(), "-version", "FFmpeg", "FFMPEG_PATH");
        checkBinary(properties.getFfprobeBinary(), "-version", "FFprobe", "FFPROBE_PATH");
        checkBinary(properties.getManimBinary(), "--version", "Manim", "MANIM_PATH");
    }

    private void ensureDirectory(Path directory, String purpose) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Unable to create " + purpose + " directory at " + directory + ".", e);
        }
        if (!Files.isWritable(directory)) {
            throw new IllegalStateException(
                    "The " + purpose + " directory at " + directory + " is not writable.");
        }
        logger.info("Using {} directory {}", purpose, directory);
    }

    private void checkBinary(String binary, String versionFlag, String displayName, String envName) {
        try {
            Process process = new ProcessBuilder(binary, versionFlag)
                    .redirectErrorStream(true)
                    .start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            boolean finished = process.waitFor(BINARY_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                if (!finished) {
                    process.destroyForcibly();
                }
                throw new IllegalStateException(
                        displayName + " is not available at '" + binary + "'. Install it or set " + envName + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    displayName + " is not available at '" + binary + "'. Install it or set " + envName + ".",
                    e);
        }
    }
}
