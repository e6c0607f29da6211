package org.lite.ingestion.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ingestion.enums.QueueEntryStatus;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * One document awaiting or undergoing processing.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "document_processing_queue")
@CompoundIndexes({
    @CompoundIndex(name = "status_queued_idx", def = "{'status': 1, 'queuedAt': 1}"),
    @CompoundIndex(name = "contract_url_idx", def = "{'contractNoticeId': 1, 'documentUrl': 1}")
})
public class QueueEntry {

    @Id
    private String id;

    @Indexed
    private String contractNoticeId;

    private String documentUrl;
    private String localFilePath;
    private String filename;
    private String description;

    private QueueEntryStatus status;

    @Builder.Default
    private int retryCount = 0;

    @Builder.Default
    private int maxRetries = 3;

    // Job that last picked this entry up
    @Indexed
    private String jobId;

    private LocalDateTime queuedAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime failedAt;

    // Opaque JSON result of the summarization stage
    private String processedData;
    private String errorMessage;

    /**
     * The source reference handed to the pipeline: local path when known, otherwise the URL.
     */
    public String getSourceLocation() {
        return localFilePath != null && !localFilePath.isBlank() ? localFilePath : documentUrl;
    }

    public boolean canBeRequeued() {
        return status == QueueEntryStatus.FAILED && retryCount < maxRetries;
    }
}
