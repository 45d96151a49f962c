package com.emtech.scan.service.ocr;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Launches an external command and waits for it within a deadline.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @throws IOException when the process cannot be started
     * @throws TimeoutException when the process outlives {@code timeout}; it is killed first
     */
    CommandOutput run(List<String> command, Duration timeout)
            throws IOException, TimeoutException, InterruptedException;

    record CommandOutput(int exitCode, String stdout) {
    }
}
