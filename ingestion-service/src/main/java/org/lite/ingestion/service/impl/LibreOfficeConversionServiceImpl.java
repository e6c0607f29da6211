package org.lite.ingestion.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.concurrency.BackoffPolicy;
import org.lite.ingestion.concurrency.ResourcePool;
import org.lite.ingestion.concurrency.RetryExhaustedException;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.exception.ConversionException;
import org.lite.ingestion.exception.UnsupportedDocumentException;
import org.lite.ingestion.model.ConversionResult;
import org.lite.ingestion.model.ConversionTask;
import org.lite.ingestion.model.SourceDocument;
import org.lite.ingestion.service.ConverterProcessRunner;
import org.lite.ingestion.service.FormatConversionService;
import org.lite.ingestion.util.TextUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Converts office documents to PDF with a headless LibreOffice. Conversions run inside the
 * process-wide converter pool, each in its own working directory with its own profile.
 */
@Service
@Slf4j
public class LibreOfficeConversionServiceImpl implements FormatConversionService {

    private final ResourcePool converterPool;
    private final ConverterProcessRunner processRunner;
    private final IngestionProperties.Converter settings;
    private final BackoffPolicy backoffPolicy;

    public LibreOfficeConversionServiceImpl(@Qualifier("converterPool") ResourcePool converterPool,
                                            ConverterProcessRunner processRunner,
                                            IngestionProperties properties) {
        this.converterPool = converterPool;
        this.processRunner = processRunner;
        this.settings = properties.getConverter();
        this.backoffPolicy = new BackoffPolicy(
                settings.getMaxAttempts(), settings.getInitialBackoff(), settings.getMaxBackoff());
    }

    @Override
    public Mono<ConversionResult> convert(SourceDocument source) {
        if (source.getType() != null && source.getType().isCanonical()) {
            log.debug("{} is already a PDF, skipping conversion", source.getFilename());
            return Mono.just(ConversionResult.passthrough(source.getContent()));
        }
        if (source.getType() == null || !source.getType().isSupported()) {
            return Mono.error(new UnsupportedDocumentException(source.getFilename(),
                    source.getType() != null ? source.getType().getDisplayName() : "unknown"));
        }

        return converterPool.withPermit(() -> Mono.usingWhen(
                        Mono.fromCallable(() -> prepare(source)).subscribeOn(Schedulers.boundedElastic()),
                        task -> runWithRetry(task, source),
                        this::cleanup,
                        (task, error) -> cleanup(task),
                        this::cleanup))
                .onErrorMap(RetryExhaustedException.class, error -> new ConversionException(
                        "Conversion of " + source.getFilename() + " failed after " + error.getAttempts()
                                + " attempts: " + error.getCause().getMessage(), error));
    }

    @Override
    public ResourcePool.PoolSnapshot converterSnapshot() {
        return converterPool.snapshot();
    }

    private Mono<ConversionResult> runWithRetry(ConversionTask task, SourceDocument source) {
        return Mono.fromCallable(() -> runOnce(task, source))
                .subscribeOn(Schedulers.boundedElastic())
                .retryWhen(backoffPolicy.toRetrySpec(this::isTransient)
                        .doBeforeRetry(signal -> log.warn("🔄 Transient converter failure for {} (attempt {}), retrying: {}",
                                source.getFilename(), signal.totalRetries() + 1, signal.failure().getMessage())))
                .map(pdf -> task.complete(ConversionResult.converted(pdf, task.getAttempts())))
                .doOnNext(result -> log.info("📄 Converted {} to PDF ({} bytes, attempt {})",
                        source.getFilename(), result.getPdfContent().length, result.getAttempts()));
    }

    private ConversionTask prepare(SourceDocument source) throws IOException {
        Path root = Paths.get(settings.getWorkDir());
        Files.createDirectories(root);
        ConversionTask task = ConversionTask.under(root);
        Files.createDirectories(task.getInputDir());
        Files.write(task.getInputDir().resolve(inputName(source)), source.getContent());
        log.debug("Prepared conversion task {} for {}", task.getTaskId(), source.getFilename());
        return task;
    }

    private byte[] runOnce(ConversionTask task, SourceDocument source) throws IOException, InterruptedException {
        int attempt = task.nextAttempt();
        // Every attempt starts from an empty output directory and a fresh profile
        resetDirectory(task.getOutputDir());
        resetDirectory(task.getProfileDir());

        String inputName = inputName(source);
        ConverterProcessRunner.ProcessOutcome outcome =
                processRunner.run(buildCommand(task, inputName), task.getWorkDir(), settings.getProcessTimeout());

        if (outcome.timedOut()) {
            throw new ConversionException("Converter timed out after " + settings.getProcessTimeout().toSeconds()
                    + "s on attempt " + attempt, false);
        }
        if (outcome.exitCode() != 0) {
            String output = outcome.output() != null ? outcome.output() : "";
            throw new ConversionException("Converter exited with code " + outcome.exitCode() + ": "
                    + TextUtils.truncate(output.trim(), 500), isTransientOutput(output));
        }

        Path expected = task.getOutputDir().resolve(baseName(inputName) + ".pdf");
        if (!Files.exists(expected)) {
            throw new ConversionException("PDF conversion failed - output file not found: " + expected.getFileName(), false);
        }
        return Files.readAllBytes(expected);
    }

    List<String> buildCommand(ConversionTask task, String inputName) {
        return List.of(
                settings.getExecutable(),
                "--headless",
                "--convert-to", "pdf",
                "--outdir", task.getOutputDir().toAbsolutePath().toString(),
                "-env:UserInstallation=file://" + task.getProfileDir().toAbsolutePath(),
                "--norestore",
                "--invisible",
                task.getInputDir().resolve(inputName).toAbsolutePath().toString());
    }

    private boolean isTransient(Throwable error) {
        return error instanceof ConversionException conversionException && conversionException.isTransientFailure();
    }

    private boolean isTransientOutput(String output) {
        return settings.getTransientMarkers().stream().anyMatch(output::contains);
    }

    private Mono<Void> cleanup(ConversionTask task) {
        return Mono.<Void>fromRunnable(() -> {
                    try {
                        FileSystemUtils.deleteRecursively(task.getWorkDir());
                        log.debug("Removed conversion working directory {}", task.getWorkDir());
                    } catch (IOException e) {
                        log.warn("Failed to remove conversion working directory {}: {}", task.getWorkDir(), e.getMessage());
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private void resetDirectory(Path directory) throws IOException {
        FileSystemUtils.deleteRecursively(directory);
        Files.createDirectories(directory);
    }

    private String inputName(SourceDocument source) {
        String name = source.getFilename() != null ? source.getFilename() : "document";
        name = Paths.get(name).getFileName().toString().replaceAll("[^A-Za-z0-9._-]", "_");
        String extension = source.getType().getExtension();
        if (!extension.isEmpty() && !name.toLowerCase().endsWith(extension)) {
            name = name + extension;
        }
        return name;
    }

    private String baseName(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
