package github.sarthakdev143.animation_studio.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Validated
@ConfigurationProperties(prefix = "animation-studio")
public class StudioProperties {

    private String outputDir = "./outputs";
    private String uploadDir = "./uploads";
    private String manimBinary = "manim";
    private String ffmpegBinary = "ffmpeg";
    private String ffprobeBinary = "ffprobe";
    private String entryClass = "GeneratedScene";
    @Min(0) @Max(100)
    private int renderProgressBudget = 80;
    @Min(0) @Max(100)
    private int combineProgress = 85;
    private double fallbackDurationSeconds = 5.0;

    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }

    public String getUploadDir() { return uploadDir; }
    public void setUploadDir(String uploadDir) { this.uploadDir = uploadDir; }

    public String getManimBinary() { return manimBinary; }
    public void setManimBinary(String manimBinary) { this.manimBinary = manimBinary; }

    public String getFfmpegBinary() { return ffmpegBinary; }
    public void setFfmpegBinary(String ffmpegBinary) { this.ffmpegBinary = ffmpegBinary; }

    public String getFfprobeBinary() { return ffprobeBinary; }
    public void setFfprobeBinary(String ffprobeBinary) { this.ffprobeBinary = ffprobeBinary; }

    public String getEntryClass() { return entryClass; }
    public void setEntryClass(String entryClass) { this.entryClass = entryClass; }

    public int getRenderProgressBudget() { return renderProgressBudget; }
    public void setRenderProgressBudget(int renderProgressBudget) { this.renderProgressBudget = renderProgressBudget; }

    public int getCombineProgress() { return combineProgress; }
    public void setCombineProgress(int combineProgress) { this.combineProgress = combineProgress; }

    public double getFallbackDurationSeconds() { return fallbackDurationSeconds; }
    public void setFallbackDurationSeconds(double fallbackDurationSeconds) {
        this.fallbackDurationSeconds = fallbackDurationSeconds;
    }

    @AssertTrue(message = "combine-progress must not be below render-progress-budget")
    public boolean isCombineProgressAfterRendering() {
        return combineProgress >= renderProgressBudget;
    }

    public Path outputPath() {
        return Path.of(outputDir).toAbsolutePath().normalize();
    }

    public Path uploadPath() {
        return Path.of(uploadDir).toAbsolutePath().normalize();
    }
}
