package org.lite.ingestion.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.enums.DocumentType;
import org.lite.ingestion.enums.ExtractionMethod;
import org.lite.ingestion.exception.ExtractionException;
import org.lite.ingestion.exception.UnsupportedDocumentException;
import org.lite.ingestion.model.ConversionResult;
import org.lite.ingestion.model.ExtractionResult;
import org.lite.ingestion.model.SourceDocument;
import org.lite.ingestion.service.FormatConversionService;
import org.lite.ingestion.service.RecognitionService;
import org.lite.ingestion.service.TextExtractionService;
import org.lite.ingestion.service.TikaDocumentParser;
import org.lite.ingestion.util.TextUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;

@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractionServiceImpl implements TextExtractionService {

    private final FormatConversionService formatConversionService;
    private final RecognitionService recognitionService;
    private final TikaDocumentParser tikaDocumentParser;
    private final IngestionProperties properties;

    @Override
    public Mono<ExtractionResult> extract(SourceDocument source) {
        DocumentType type = source.getType();
        if (type == null || !type.isSupported()) {
            return Mono.error(new UnsupportedDocumentException(source.getFilename(),
                    type != null ? type.getDisplayName() : "unknown"));
        }
        if (source.size() == 0) {
            return Mono.error(new ExtractionException(source.getFilename() + " is empty"));
        }
        if (type.isPlainText()) {
            return decodePlainText(source);
        }
        return formatConversionService.convert(source)
                .flatMap(conversion -> extractFromPdf(source, conversion));
    }

    private Mono<ExtractionResult> decodePlainText(SourceDocument source) {
        String text = new String(source.getContent(), StandardCharsets.UTF_8).trim();
        int words = TextUtils.wordCount(text);
        if (words == 0) {
            return Mono.error(new ExtractionException(source.getFilename() + " contains no text"));
        }
        log.info("📊 {} read as plain text: {} words", source.getFilename(), words);
        return Mono.just(ExtractionResult.builder()
                .text(text)
                .method(ExtractionMethod.PLAIN_TEXT)
                .sourceType(source.getType())
                .filename(source.getFilename())
                .converted(false)
                .wordCount(words)
                .build());
    }

    private Mono<ExtractionResult> extractFromPdf(SourceDocument source, ConversionResult conversion) {
        byte[] pdf = conversion.getPdfContent();
        int minWords = properties.getPipeline().getMinDirectWords();

        return Mono.fromCallable(() -> tikaDocumentParser.parse(pdf, DocumentType.PDF.getMimeType()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(parsed -> {
                    String text = parsed.text() != null ? parsed.text().trim() : "";
                    int words = TextUtils.wordCount(text);
                    if (words >= minWords) {
                        log.info("📊 {} extracted directly: {} words", source.getFilename(), words);
                        return Mono.just(result(source, conversion, text, ExtractionMethod.DIRECT, words, parsed.pageCount()));
                    }
                    log.info("⚠️ Low word count for {} ({} < {}), using OCR", source.getFilename(), words, minWords);
                    return recognitionService.recognize(pdf, source.getFilename())
                            .map(recognition -> result(source, conversion, recognition.getText(), ExtractionMethod.OCR,
                                    TextUtils.wordCount(recognition.getText()), recognition.getTotalPages()));
                })
                .flatMap(result -> result.getWordCount() == 0
                        ? Mono.error(new ExtractionException("No text could be extracted from " + source.getFilename()))
                        : Mono.just(result));
    }

    private ExtractionResult result(SourceDocument source, ConversionResult conversion, String text,
                                    ExtractionMethod method, int words, int pages) {
        return ExtractionResult.builder()
                .text(text)
                .method(method)
                .sourceType(source.getType())
                .filename(source.getFilename())
                .converted(conversion.isConverted())
                .wordCount(words)
                .pageCount(pages)
                .build();
    }
}
