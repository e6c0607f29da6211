package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GateResult {
    String identifier;
    String content;
    // True when the content came from the index and no summarization ran
    boolean cached;
    SummaryResult summary;
}
