package org.lite.ingestion.service;

public interface RecognitionEngine {

    RecognitionWorker createWorker() throws Exception;
}
