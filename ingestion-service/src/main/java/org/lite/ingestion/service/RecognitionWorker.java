package org.lite.ingestion.service;

import java.awt.image.BufferedImage;

/**
 * One recognition engine instance. Not shared between concurrent jobs.
 */
public interface RecognitionWorker {

    /**
     * @throws org.lite.ingestion.exception.TransientWorkerException when the worker was not
     *         usable for this call but a later attempt may succeed
     */
    String recognize(BufferedImage image) throws Exception;

    void terminate();
}
