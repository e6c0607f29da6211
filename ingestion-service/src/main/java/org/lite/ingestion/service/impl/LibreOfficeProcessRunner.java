package org.lite.ingestion.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.service.ConverterProcessRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
@Slf4j
public class LibreOfficeProcessRunner implements ConverterProcessRunner {

    @Override
    public ProcessOutcome run(List<String> command, Path workDir, Duration timeout) throws IOException, InterruptedException {
        log.debug("Executing converter: {}", String.join(" ", command));

        // Combined output is captured in the working directory
        Path outputLog = workDir.resolve("converter.log");
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(outputLog.toFile());
        Process process = pb.start();
        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                log.warn("Converter timed out after {}s", timeout.toSeconds());
                return new ProcessOutcome(-1, readOutput(outputLog), true);
            }
            return new ProcessOutcome(process.exitValue(), readOutput(outputLog), false);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private String readOutput(Path outputLog) {
        try {
            return Files.exists(outputLog) ? Files.readString(outputLog, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            log.warn("Could not read converter output: {}", e.getMessage());
            return "";
        }
    }
}
