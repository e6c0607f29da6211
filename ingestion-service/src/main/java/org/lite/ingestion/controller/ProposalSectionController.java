package org.lite.ingestion.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.dto.ProposalSectionsRequest;
import org.lite.ingestion.service.ProposalSectionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/proposals")
@RequiredArgsConstructor
@Tag(name = "Proposal Sections", description = "Draft proposal sections through the completion service")
public class ProposalSectionController {

    private final ProposalSectionService proposalSectionService;

    @PostMapping("/sections")
    @Operation(summary = "Generate proposal sections",
               description = "Drafts every requested section. A section that cannot be generated is returned with status 'error'.")
    public Mono<ResponseEntity<?>> generateSections(@Valid @RequestBody ProposalSectionsRequest request) {
        return proposalSectionService.generate(request)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .onErrorResume(error -> {
                    log.error("Error generating proposal sections: {}", error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.of("error", "Failed to generate proposal sections")));
                });
    }
}
