package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;
import org.lite.ingestion.entity.QueueEntry;
import org.lite.ingestion.enums.QueueEntryStatus;

/**
 * What happened to one entry during a run.
 */
@Value
@Builder
public class DocumentOutcome {
    String entryId;
    String filename;
    QueueEntryStatus status;
    boolean cached;
    String errorMessage;
    // Taken by another job before this one reached it; not counted
    boolean claimedElsewhere;

    public static DocumentOutcome claimedElsewhere(QueueEntry entry) {
        return DocumentOutcome.builder()
                .entryId(entry.getId())
                .filename(entry.getFilename())
                .status(entry.getStatus())
                .claimedElsewhere(true)
                .build();
    }

    public boolean isCompleted() {
        return !claimedElsewhere && status == QueueEntryStatus.COMPLETED;
    }

    public boolean isFailed() {
        return !claimedElsewhere && status == QueueEntryStatus.FAILED;
    }
}
