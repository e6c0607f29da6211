package org.lite.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartProcessingRequest {
    // Restricts the run to one contract's documents
    private String contractId;
    private List<SourceRef> sources;
    private Integer limit;
    private Integer concurrency;
    private Boolean autoQueue;
    private Boolean testMode;
}
