package github.sarthakdev143.animation_studio.integration.process;

import java.io.IOException;
import java.util.List;

public interface CommandRunner {

    /**
     * Runs the command to completion and returns its exit code and combined output. A
     * non-zero exit is reported through the result, not as an exception.
     */
    CommandResult run(List<String> command, String stage) throws IOException, InterruptedException;
}
