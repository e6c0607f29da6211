package org.lite.ingestion.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Sections of a proposal to draft for one contract, and the bidder they are written for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProposalSectionsRequest {
    private String contractTitle;
    private String agency;
    private String contractSummary;
    private String businessProfile;
    @NotEmpty(message = "At least one section is required")
    private List<@Valid SectionRequest> sections;
}
