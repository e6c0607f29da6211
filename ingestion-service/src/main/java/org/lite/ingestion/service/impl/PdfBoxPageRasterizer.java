package org.lite.ingestion.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.lite.ingestion.service.PageRasterizer;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;

@Component
@Slf4j
public class PdfBoxPageRasterizer implements PageRasterizer {

    @Override
    public RasterizedDocument open(byte[] pdfContent, int dpi) throws IOException {
        PDDocument document = Loader.loadPDF(pdfContent);
        log.debug("🖼️ Opened PDF with {} pages for rendering at {} DPI", document.getNumberOfPages(), dpi);
        return new PdfBoxDocument(document, dpi);
    }

    private static final class PdfBoxDocument implements RasterizedDocument {
        private final PDDocument document;
        private final PDFRenderer renderer;
        private final int dpi;

        private PdfBoxDocument(PDDocument document, int dpi) {
            this.document = document;
            this.renderer = new PDFRenderer(document);
            this.dpi = dpi;
        }

        @Override
        public int pageCount() {
            return document.getNumberOfPages();
        }

        // PDDocument is not thread-safe; renders are serialized, recognition is not
        @Override
        public BufferedImage render(int pageNumber) throws IOException {
            synchronized (document) {
                return renderer.renderImageWithDPI(pageNumber - 1, dpi, ImageType.GRAY);
            }
        }

        @Override
        public void close() throws IOException {
            synchronized (document) {
                document.close();
            }
        }
    }
}
