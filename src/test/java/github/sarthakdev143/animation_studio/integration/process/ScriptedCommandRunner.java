package github.sarthakdev143.animation_studio.integration.process;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stand-in for manim, ffmpeg and ffprobe. Commands are answered by the handler registered
 * for their binary and recorded in order.
 */
public class ScriptedCommandRunner implements CommandRunner {

    @FunctionalInterface
    public interface Handler {
        CommandResult handle(List<String> command) throws IOException;
    }

    private final Map<String, Handler> handlers = new HashMap<>();
    private final List<List<String>> commands = new CopyOnWriteArrayList<>();

    public ScriptedCommandRunner on(String binary, Handler handler) {
        handlers.put(binary, handler);
        return this;
    }

    /**
     * Answers like working binaries: manim writes a video under its media directory, ffmpeg
     * writes its output file and ffprobe prints the given duration.
     */
    public static ScriptedCommandRunner working(String durationOutput) {
        return new ScriptedCommandRunner()
                .on("manim", ScriptedCommandRunner::writeManimVideo)
                .on("ffmpeg", ScriptedCommandRunner::writeLastArgument)
                .on("ffprobe", command -> new CommandResult(0, durationOutput + "\n"));
    }

    @Override
    public CommandResult run(List<String> command, String stage) throws IOException {
        commands.add(List.copyOf(command));
        Handler handler = handlers.get(command.get(0));
        if (handler == null) {
            return new CommandResult(0, "");
        }
        return handler.handle(command);
    }

    public List<List<String>> commands() {
        return new ArrayList<>(commands);
    }

    public List<List<String>> commandsFor(String binary) {
        return commands.stream()
                .filter(command -> command.get(0).equals(binary))
                .toList();
    }

    public static CommandResult writeManimVideo(List<String> command) throws IOException {
        String outputName = valueAfter(command, "-o");
        Path mediaDir = Path.of(valueAfter(command, "--media_dir"));
        Path videoDir = mediaDir.resolve("videos").resolve("scene").resolve("480p15");
        Files.createDirectories(videoDir);
        Files.writeString(videoDir.resolve(outputName + ".mp4"), "video:" + outputName);
        return new CommandResult(0, "File ready at " + videoDir);
    }

    public static CommandResult writeLastArgument(List<String> command) throws IOException {
        Path output = Path.of(command.get(command.size() - 1));
        Files.createDirectories(output.toAbsolutePath().getParent());
        Files.writeString(output, String.join(" ", command));
        return new CommandResult(0, "");
    }

    public static String valueAfter(List<String> command, String flag) {
        int index = command.indexOf(flag);
        if (index < 0 || index + 1 >= command.size()) {
            throw new IllegalArgumentException("Missing value for " + flag + " in " + command);
        }
        return command.get(index + 1);
    }
}
