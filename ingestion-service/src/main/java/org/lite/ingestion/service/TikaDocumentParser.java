package org.lite.ingestion.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.PagedText;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.lite.ingestion.exception.ExtractionException;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Embedded-text extraction and content sniffing for source documents.
 */
@Service
@Slf4j
public class TikaDocumentParser {

    private static final String OCTET_STREAM = "application/octet-stream";
    // Characters kept per document; the summary prompt truncates well below this
    private static final int TEXT_LIMIT = 10 * 1024 * 1024;

    private final Tika detector = new Tika();
    private final AutoDetectParser parser = new AutoDetectParser();

    /**
     * Pulls the embedded text layer out of a document. Scanned PDFs come back with little or no
     * text, which callers use to decide on optical recognition.
     */
    public ParseResult parse(byte[] content, String mimeType) {
        Metadata metadata = new Metadata();
        if (mimeType != null) {
            metadata.set(Metadata.CONTENT_TYPE, mimeType);
        }
        BodyContentHandler handler = new BodyContentHandler(TEXT_LIMIT);

        try (ByteArrayInputStream input = new ByteArrayInputStream(content)) {
            parser.parse(input, handler, metadata, new ParseContext());
        } catch (IOException | SAXException | TikaException e) {
            throw new ExtractionException("Text layer could not be read: " + e.getMessage(), e);
        }

        String text = handler.toString();
        Integer pages = metadata.getInt(PagedText.N_PAGES);
        int pageCount = pages != null ? pages : 0;
        if (pageCount == 0 && mimeType != null && mimeType.endsWith("/pdf")) {
            pageCount = pdfPageCount(content);
        }
        log.debug("Read {} characters of embedded text over {} pages", text.length(), pageCount);
        return new ParseResult(text, pageCount);
    }

    /**
     * Magic-byte detection with the filename as a hint. Unreadable input is reported as a generic
     * binary stream.
     */
    public String detectContentType(byte[] content, String filename) {
        try {
            return detector.detect(content, filename);
        } catch (RuntimeException e) {
            log.warn("Content sniffing failed for {}: {}", filename, e.getMessage());
            return OCTET_STREAM;
        }
    }

    private int pdfPageCount(byte[] pdf) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            return document.getNumberOfPages();
        } catch (IOException e) {
            log.warn("PDF page count unavailable: {}", e.getMessage());
            return 0;
        }
    }

    public record ParseResult(String text, int pageCount) {
    }
}
