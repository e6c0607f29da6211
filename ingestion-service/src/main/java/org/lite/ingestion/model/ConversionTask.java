package org.lite.ingestion.model;

import lombok.Getter;

import java.nio.file.Path;
import java.util.UUID;

/**
 * One isolated conversion: its own working directory and converter profile, so concurrent
 * conversions never share files.
 */
@Getter
public class ConversionTask {

    private final String taskId;
    private final Path workDir;
    private final Path inputDir;
    private final Path outputDir;
    private final Path profileDir;
    private int attempts;
    private ConversionResult result;

    private ConversionTask(String taskId, Path workDir) {
        this.taskId = taskId;
        this.workDir = workDir;
        this.inputDir = workDir.resolve("input");
        this.outputDir = workDir.resolve("output");
        this.profileDir = workDir.resolve("profile");
    }

    public static ConversionTask under(Path root) {
        String id = UUID.randomUUID().toString();
        return new ConversionTask(id, root.resolve("conversion_" + id));
    }

    public int nextAttempt() {
        return ++attempts;
    }

    public ConversionResult complete(ConversionResult result) {
        this.result = result;
        return result;
    }
}
