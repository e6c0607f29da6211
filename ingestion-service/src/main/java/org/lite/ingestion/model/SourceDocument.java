package org.lite.ingestion.model;

import lombok.Builder;
import lombok.Value;
import org.lite.ingestion.enums.DocumentType;

/**
 * Bytes of one source document together with what is known about their format.
 */
@Value
@Builder(toBuilder = true)
public class SourceDocument {
    String filename;
    byte[] content;
    DocumentType type;
    // Content type reported by the origin, if any
    String declaredMimeType;
    // URL or path the bytes came from
    String origin;

    public int size() {
        return content != null ? content.length : 0;
    }
}
