package github.sarthakdev143.animation_studio.integration.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Runs external binaries with stderr merged into stdout. Calls block until the process
 * exits; no wall-clock limit is applied.
 */
@Component
public class SystemCommandRunner implements CommandRunner {

    private static final Logger logger = LoggerFactory.getLogger(SystemCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, String stage) throws IOException, InterruptedException {
        logger.info("Running command for stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        }

        if (exitCode != 0) {
            logger.warn("Stage {} exited with code {}", stage, exitCode);
        }
        return new CommandResult(exitCode, output.toString());
    }
}
