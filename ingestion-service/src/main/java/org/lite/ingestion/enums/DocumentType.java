package org.lite.ingestion.enums;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Document formats recognised by the pipeline. PDF is the canonical format every other
 * supported type is converted to before extraction.
 */
public enum DocumentType {
    PDF("application/pdf", ".pdf", "PDF"),
    DOCX("application/vnd.openxmlformats-officedocument.wordprocessingml.document", ".docx", "Word Document"),
    DOC("application/msword", ".doc", "Word Document (Legacy)"),
    XLSX("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", ".xlsx", "Excel Spreadsheet"),
    XLS("application/vnd.ms-excel", ".xls", "Excel Spreadsheet (Legacy)"),
    PPTX("application/vnd.openxmlformats-officedocument.presentationml.presentation", ".pptx", "PowerPoint Presentation"),
    PPT("application/vnd.ms-powerpoint", ".ppt", "PowerPoint Presentation (Legacy)"),
    TXT("text/plain", ".txt", "Text Document"),
    CSV("text/csv", ".csv", "CSV File"),
    ZIP("application/zip", ".zip", "ZIP Archive"),
    UNKNOWN("application/octet-stream", "", "Unknown");

    private final String mimeType;
    private final String extension;
    private final String displayName;

    DocumentType(String mimeType, String extension, String displayName) {
        this.mimeType = mimeType;
        this.extension = extension;
        this.displayName = displayName;
    }

    public String getMimeType() {
        return mimeType;
    }

    public String getExtension() {
        return extension;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isCanonical() {
        return this == PDF;
    }

    public boolean isSupported() {
        return this != ZIP && this != UNKNOWN;
    }

    public boolean isPlainText() {
        return this == TXT || this == CSV;
    }

    public static Optional<DocumentType> fromMimeType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return Optional.empty();
        }
        String normalized = mimeType.toLowerCase(Locale.ROOT).split(";")[0].trim();
        if (normalized.equals("application/x-zip-compressed") || normalized.equals("application/x-zip")) {
            return Optional.of(ZIP);
        }
        return Arrays.stream(values())
                .filter(type -> type != UNKNOWN)
                .filter(type -> type.mimeType.equals(normalized))
                .findFirst();
    }

    public static Optional<DocumentType> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String ext = lower.substring(dot);
        return Arrays.stream(values())
                .filter(type -> type != UNKNOWN)
                .filter(type -> type.extension.equals(ext))
                .findFirst();
    }
}
