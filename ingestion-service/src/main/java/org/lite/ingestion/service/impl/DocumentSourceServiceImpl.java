package org.lite.ingestion.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.DocumentType;
import org.lite.ingestion.exception.SourceNotFoundException;
import org.lite.ingestion.model.SourceDocument;
import org.lite.ingestion.service.DocumentSourceService;
import org.lite.ingestion.service.DocumentTypeDetector;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

@Service
@Slf4j
public class DocumentSourceServiceImpl implements DocumentSourceService {

    private final WebClient webClient;
    private final DocumentTypeDetector documentTypeDetector;
    private final IngestionProperties.Pipeline settings;

    public DocumentSourceServiceImpl(WebClient.Builder webClientBuilder,
                                     DocumentTypeDetector documentTypeDetector,
                                     IngestionProperties properties) {
        this.webClient = webClientBuilder.build();
        this.documentTypeDetector = documentTypeDetector;
        this.settings = properties.getPipeline();
    }

    @Override
    public Mono<SourceDocument> resolve(QueueEntry entry) {
        return Mono.fromCallable(() -> findLocalFile(entry))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(local -> local
                        .map(path -> readLocal(entry, path))
                        .orElseGet(() -> download(entry)))
                .publishOn(Schedulers.boundedElastic())
                .map(raw -> identify(entry, raw));
    }

    Optional<Path> findLocalFile(QueueEntry entry) throws IOException {
        if (entry.getLocalFilePath() != null && !entry.getLocalFilePath().isBlank()) {
            Path declared = Paths.get(entry.getLocalFilePath());
            if (Files.isRegularFile(declared)) {
                return Optional.of(declared);
            }
            log.warn("📁 Local file {} not found, searching {}", declared, settings.getDownloadDir());
        }

        Path downloadDir = Paths.get(settings.getDownloadDir());
        if (!Files.isDirectory(downloadDir)) {
            return Optional.empty();
        }
        if (entry.getFilename() != null) {
            Path exact = downloadDir.resolve(entry.getFilename());
            if (Files.isRegularFile(exact)) {
                return Optional.of(exact);
            }
        }
        if (entry.getContractNoticeId() == null) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(downloadDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        String name = path.getFileName().toString();
                        String lower = name.toLowerCase(Locale.ROOT);
                        return name.contains(entry.getContractNoticeId())
                                && (lower.endsWith(".pdf") || lower.endsWith(".docx"));
                    })
                    .sorted()
                    .findFirst();
        }
    }

    private Mono<RawSource> readLocal(QueueEntry entry, Path path) {
        return Mono.fromCallable(() -> new RawSource(Files.readAllBytes(path), null, path.toString()))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(raw -> log.info("📁 Using local file {} for {} ({} bytes)", path, entry.getFilename(), raw.content().length))
                .onErrorMap(IOException.class, e -> new SourceNotFoundException("Could not read " + path + ": " + e.getMessage(), e));
    }

    private Mono<RawSource> download(QueueEntry entry) {
        String url = entry.getDocumentUrl();
        if (url == null || url.isBlank()) {
            return Mono.error(new SourceNotFoundException("No local file or URL available for " + entry.getFilename()));
        }
        log.info("📥 Downloading {} from {}", entry.getFilename(), url);

        return webClient.get()
                .uri(url)
                .header(HttpHeaders.USER_AGENT, settings.getUserAgent())
                .exchangeToMono(response -> {
                    if (response.statusCode().isError()) {
                        return response.releaseBody().then(Mono.error(new SourceNotFoundException(
                                "Download of " + url + " failed with HTTP " + response.statusCode().value())));
                    }
                    String contentType = response.headers().contentType()
                            .map(MediaType::toString)
                            .orElse(null);
                    return response.bodyToMono(byte[].class)
                            .switchIfEmpty(Mono.error(new SourceNotFoundException("Download of " + url + " returned no content")))
                            .map(bytes -> new RawSource(bytes, contentType, url));
                })
                .timeout(settings.getDownloadTimeout())
                .onErrorMap(error -> !(error instanceof SourceNotFoundException),
                        error -> new SourceNotFoundException("Download of " + url + " failed: " + error.getMessage(), error))
                .doOnNext(raw -> log.info("📥 Downloaded {} ({} bytes, {})", entry.getFilename(), raw.content().length, raw.contentType()));
    }

    private SourceDocument identify(QueueEntry entry, RawSource raw) {
        DocumentType type = documentTypeDetector.detect(raw.content(), raw.contentType(), entry.getFilename());
        String filename = documentTypeDetector.correctFilename(entry.getFilename(), type);
        return SourceDocument.builder()
                .filename(filename)
                .content(raw.content())
                .type(type)
                .declaredMimeType(raw.contentType())
                .origin(raw.origin())
                .build();
    }

    private record RawSource(byte[] content, String contentType, String origin) {
    }
}
