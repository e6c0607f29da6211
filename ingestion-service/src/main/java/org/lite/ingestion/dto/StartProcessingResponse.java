package org.lite.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartProcessingResponse {
    private String jobId;
    private int documentsCount;
    private int batchSize;
    private boolean testMode;
    private String processingMethod;
    private String message;
}
