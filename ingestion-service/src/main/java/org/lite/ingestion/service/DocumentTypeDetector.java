package org.lite.ingestion.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.enums.DocumentType;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Works out the format of a downloaded document: the declared content type first, then the
 * bytes themselves, then the filename extension.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DocumentTypeDetector {

    private final TikaDocumentParser tikaDocumentParser;

    public DocumentType detect(byte[] content, String declaredMimeType, String filename) {
        Optional<DocumentType> declared = DocumentType.fromMimeType(declaredMimeType);
        if (declared.isPresent()) {
            return declared.get();
        }
        if (content != null && content.length > 0) {
            String detected = tikaDocumentParser.detectContentType(content, filename);
            Optional<DocumentType> sniffed = DocumentType.fromMimeType(detected);
            if (sniffed.isPresent()) {
                log.debug("Detected {} as {} from content", filename, detected);
                return sniffed.get();
            }
        }
        return DocumentType.fromFilename(filename).orElse(DocumentType.UNKNOWN);
    }

    /**
     * Gives the filename the extension of its detected type, replacing a different one.
     */
    public String correctFilename(String filename, DocumentType type) {
        if (filename == null || type == null || type.getExtension().isEmpty()) {
            return filename;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(type.getExtension())) {
            return filename;
        }
        Optional<DocumentType> current = DocumentType.fromFilename(filename);
        if (current.isPresent() && !current.get().getExtension().isEmpty()) {
            return filename.substring(0, filename.length() - current.get().getExtension().length()) + type.getExtension();
        }
        return filename + type.getExtension();
    }
}
