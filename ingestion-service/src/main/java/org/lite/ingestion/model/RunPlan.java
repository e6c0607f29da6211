package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one processing run. Test mode and regular mode differ only in these values.
 */
@Value
@Builder
public class RunPlan {
    String contractId;
    boolean testMode;
    boolean clearQueue;
    boolean autoQueue;
    int limit;
    int sourceLimit;
    int maxContracts;
    int batchSize;
    String jobType;
}
