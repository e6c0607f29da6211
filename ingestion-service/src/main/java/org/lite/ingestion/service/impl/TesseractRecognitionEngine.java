package org.lite.ingestion.service.impl;

import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.exception.TransientWorkerException;
import org.lite.ingestion.service.RecognitionEngine;
import org.lite.ingestion.service.RecognitionWorker;

import java.awt.image.BufferedImage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tess4J backed workers. Each worker owns its own {@link Tesseract} instance, which is not thread-safe.
 */
@Slf4j
public class TesseractRecognitionEngine implements RecognitionEngine {

    private final IngestionProperties.Recognition settings;

    public TesseractRecognitionEngine(IngestionProperties.Recognition settings) {
        this.settings = settings;
    }

    @Override
    public RecognitionWorker createWorker() {
        Tesseract tesseract = new Tesseract();
        if (settings.getDataPath() != null && !settings.getDataPath().isBlank()) {
            tesseract.setDatapath(settings.getDataPath());
        }
        tesseract.setLanguage(settings.getLanguage());
        tesseract.setPageSegMode(settings.getPageSegMode());
        tesseract.setOcrEngineMode(settings.getEngineMode());
        return new TesseractWorker(tesseract);
    }

    static final class TesseractWorker implements RecognitionWorker {

        private final AtomicBoolean terminated = new AtomicBoolean();
        private volatile Tesseract tesseract;

        TesseractWorker(Tesseract tesseract) {
            this.tesseract = tesseract;
        }

        @Override
        public String recognize(BufferedImage image) throws TesseractException {
            Tesseract current = tesseract;
            if (current == null || terminated.get()) {
                throw new TransientWorkerException("Recognition worker is not available");
            }
            try {
                return current.doOCR(image);
            } catch (Error e) {
                // JNA reports a lost native handle as an Error
                if (e.getMessage() != null && e.getMessage().contains("Invalid memory access")) {
                    throw new TransientWorkerException("Recognition worker lost its native handle", e);
                }
                throw e;
            }
        }

        @Override
        public void terminate() {
            if (terminated.compareAndSet(false, true)) {
                tesseract = null;
            }
        }
    }
}
