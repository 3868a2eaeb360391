package github.sarthakdev143.animation_studio.integration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Private temporary directory for one render or combine call, deleted with its contents on close.
 */
public final class ScopedWorkspace implements AutoCloseable {

    private final Path directory;

    private ScopedWorkspace(Path directory) {
        this.directory = directory;
    }

    public static ScopedWorkspace create(String prefix) throws IOException {
        return new ScopedWorkspace(Files.createTempDirectory(prefix));
    }

    public Path directory() {
        return directory;
    }

    public Path resolve(String name) {
        return directory.resolve(name);
    }

    @Override
    public void close() {
        try {
            if (Files.notExists(directory)) {
                return;
            }

            try (Stream<Path> pathStream = Files.walk(directory)) {
                pathStream
                        .sorted(Comparator.reverseOrder())
                        .forEach(ScopedWorkspace::deleteIfExists);
            }
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }

    private static void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ignored) {
            // Cleanup failures are non-fatal.
        }
    }
}
