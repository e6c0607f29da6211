package org.lite.ingestion.enums;

public enum JobStatus {
    RUNNING,
    COMPLETED
}
