package org.lite.ingestion.config;

import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.concurrency.ResourcePool;
import org.lite.ingestion.service.RecognitionEngine;
import org.lite.ingestion.service.impl.TesseractRecognitionEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class PipelineConfig {

    /**
     * Gate shared by every conversion in the process; the converter does not tolerate more
     * parallel instances than this.
     */
    @Bean
    public ResourcePool converterPool(IngestionProperties properties) {
        int maxConcurrent = properties.getConverter().getMaxConcurrent();
        log.info("Converter pool allows {} concurrent conversions", maxConcurrent);
        return new ResourcePool("converter", maxConcurrent);
    }

    @Bean
    public RecognitionEngine recognitionEngine(IngestionProperties properties) {
        return new TesseractRecognitionEngine(properties.getRecognition());
    }
}
