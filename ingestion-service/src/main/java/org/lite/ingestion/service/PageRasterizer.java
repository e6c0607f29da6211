package org.lite.ingestion.service;

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;

public interface PageRasterizer {

    /**
     * Opens a PDF for rendering. Pages are rendered on demand, so only the pages currently being
     * recognized are held as images.
     */
    RasterizedDocument open(byte[] pdfContent, int dpi) throws IOException;

    interface RasterizedDocument extends Closeable {

        int pageCount();

        /**
         * Renders one page, numbered from 1. Safe to call from several threads.
         */
        BufferedImage render(int pageNumber) throws IOException;
    }
}
