package org.lite.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ingestion.entity.ProcessingJob;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    private String jobId;
    private String jobType;
    private String status;
    private int recordsProcessed;
    private int errorsCount;
    private int skippedCount;
    private int documentsCount;
    private LocalDateTime startDate;
    private LocalDateTime completedAt;

    public static JobStatusResponse from(ProcessingJob job) {
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .jobType(job.getJobType())
                .status(job.getStatus() != null ? job.getStatus().name().toLowerCase() : null)
                .recordsProcessed(job.getRecordsProcessed())
                .errorsCount(job.getErrorsCount())
                .skippedCount(job.getSkippedCount())
                .documentsCount(job.getDocumentsCount())
                .startDate(job.getStartDate())
                .completedAt(job.getCompletedAt())
                .build();
    }
}
