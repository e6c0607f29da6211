package org.lite.ingestion.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "indexed_documents")
public class IndexedDocument {

    @Id
    private String id;

    @Indexed(unique = true)
    private String identifier;

    @Indexed
    private String contractNoticeId;

    private String filename;
    private String content;
    private Map<String, Object> metadata;
    private LocalDateTime indexedAt;
}
