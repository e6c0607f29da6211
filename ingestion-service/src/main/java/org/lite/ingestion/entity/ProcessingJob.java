package org.lite.ingestion.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ingestion.enums.JobStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * Aggregate record of one batch run. Created when the run starts and committed once at the end.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "processing_jobs")
public class ProcessingJob {

    public static final String TYPE_PARALLEL = "parallel_processing";
    public static final String TYPE_TEST_MODE = "test_mode_processing";

    @Id
    private String id;

    private String jobType;
    private JobStatus status;

    private LocalDateTime startDate;
    private LocalDateTime completedAt;

    // Entries that reached COMPLETED, cache hits included
    @Builder.Default
    private int recordsProcessed = 0;

    @Builder.Default
    private int errorsCount = 0;

    // Entries served from the content index without summarization
    @Builder.Default
    private int skippedCount = 0;

    private int documentsCount;
    private int batchSize;
    private boolean testMode;
}
