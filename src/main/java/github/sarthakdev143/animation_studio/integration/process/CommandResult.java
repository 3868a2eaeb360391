package github.sarthakdev143.animation_studio.integration.process;

/**
 * Exit code and combined stdout/stderr of a finished subprocess.
 */
public record CommandResult(int exitCode, String output) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
