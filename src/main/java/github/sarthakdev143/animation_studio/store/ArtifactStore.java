package github.sarthakdev143.animation_studio.store;

import github.sarthakdev143.animation_studio.config.StudioProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Maps between public media URLs ({@code /outputs/{file}}, {@code /uploads/{file}}) and files
 * in the configured directories. Only the last path segment of a URL is used, so a URL
 * never resolves outside its directory.
 */
@Component
public class ArtifactStore {

    public static final String OUTPUTS_PREFIX = "/outputs/";
    public static final String UPLOADS_PREFIX = "/uploads/";

    private final StudioProperties properties;

    public ArtifactStore(StudioProperties properties) {
        this.properties = properties;
    }

    public Path outputDirectory() throws IOException {
        return Files.createDirectories(properties.outputPath());
    }

    public Path uploadDirectory() throws IOException {
        return Files.createDirectories(properties.uploadPath());
    }

    public Path outputFile(String fileName) throws IOException {
        return outputDirectory().resolve(fileName);
    }

    public Path uploadFile(String fileName) throws IOException {
        return uploadDirectory().resolve(fileName);
    }

    public String outputUrl(String fileName) {
        return OUTPUTS_PREFIX + fileName;
    }

    public String uploadUrl(String fileName) {
        return UPLOADS_PREFIX + fileName;
    }

    /**
     * Resolves a scene or combined video URL to its file in the output directory. The file
     * may not exist.
     */
    public Optional<Path> resolveOutput(String url) {
        return fileName(url).map(name -> properties.outputPath().resolve(name));
    }

    /**
     * Resolves an uploaded file URL to its file in the upload directory. The file may not exist.
     */
    public Optional<Path> resolveUpload(String url) {
        return fileName(url).map(name -> properties.uploadPath().resolve(name));
    }

    static Optional<String> fileName(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String name = url.substring(url.lastIndexOf('/') + 1);
        int backslash = name.lastIndexOf('\\');
        if (backslash >= 0) {
            name = name.substring(backslash + 1);
        }
        if (name.isBlank() || name.equals(".") || name.equals("..")) {
            return Optional.empty();
        }
        return Optional.of(name);
    }
}
