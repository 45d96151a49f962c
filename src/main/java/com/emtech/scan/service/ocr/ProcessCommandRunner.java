package com.emtech.scan.service.ocr;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}. Stdout is redirected to a temporary
 * file so the deadline is enforced by {@link Process#waitFor(long, TimeUnit)} rather than by a
 * blocking read.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandOutput run(List<String> command, Duration timeout)
            throws IOException, TimeoutException, InterruptedException {
        Path stdout = Files.createTempFile("ocr-stdout-", ".txt");
        Process process = null;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectOutput(stdout.toFile());
            builder.redirectError(ProcessBuilder.Redirect.DISCARD);
            process = builder.start();
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TimeoutException("Command " + command.get(0) + " exceeded " + timeout);
            }
            String output = Files.readString(stdout, StandardCharsets.UTF_8);
            return new CommandOutput(process.exitValue(), output);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            try {
                Files.deleteIfExists(stdout);
            } catch (IOException ignore) {
                log.debug("Unable to delete temporary command output {}", stdout);
            }
        }
    }
}
