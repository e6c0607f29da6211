package org.lite.ingestion.service;

import org.lite.ingestion.dto.ProposalSectionsRequest;
import org.lite.ingestion.dto.ProposalSectionsResponse;
import reactor.core.publisher.Mono;

public interface ProposalSectionService {

    /**
     * Drafts every requested section in request order. A failing section is returned with
     * status {@code error} and never affects the others.
     */
    Mono<ProposalSectionsResponse> generate(ProposalSectionsRequest request);
}
