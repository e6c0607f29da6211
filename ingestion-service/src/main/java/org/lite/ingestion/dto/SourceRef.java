package org.lite.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An explicit document to queue: a URL or a local path, plus the filename to show.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRef {
    private String url;
    private String localPath;
    private String filename;
    private String description;
}
