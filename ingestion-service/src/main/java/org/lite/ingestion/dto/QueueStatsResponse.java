package org.lite.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatsResponse {
    private long queued;
    private long processing;
    private long completed;
    private long failed;

    public long getTotal() {
        return queued + processing + completed + failed;
    }
}
