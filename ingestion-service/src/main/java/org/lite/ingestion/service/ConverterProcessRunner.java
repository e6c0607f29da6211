package org.lite.ingestion.service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs the external format converter as a child process.
 */
public interface ConverterProcessRunner {

    /**
     * Blocks until the process exits or the timeout elapses; a timed-out process is killed.
     */
    ProcessOutcome run(List<String> command, Path workDir, Duration timeout) throws IOException, InterruptedException;

    record ProcessOutcome(int exitCode, String output, boolean timedOut) {

        public boolean succeeded() {
            return !timedOut && exitCode == 0;
        }
    }
}
