package org.lite.ingestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.ingestion.model.GeneratedSection;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalSectionsResponse {
    private List<GeneratedSection> sections;
    private int generated;
    private int failed;
}
