package org.lite.ingestion.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.dto.ProposalSectionsRequest;
import org.lite.ingestion.dto.ProposalSectionsResponse;
import org.lite.ingestion.dto.SectionRequest;
import org.lite.ingestion.model.CompletionRequest;
import org.lite.ingestion.model.CompletionResult;
import org.lite.ingestion.model.GeneratedSection;
import org.lite.ingestion.service.CompletionClient;
import org.lite.ingestion.service.ProposalSectionService;
import org.lite.ingestion.util.TextUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProposalSectionServiceImpl implements ProposalSectionService {

    static final String FAILED_SECTION_CONTENT = "Error generating content. Please edit manually.";

    private static final String SYSTEM_PROMPT = "You are an experienced government proposal writer. "
            + "Write clear, compliant and persuasive proposal sections in professional prose.";

    private final CompletionClient completionClient;
    private final IngestionProperties properties;

    @Override
    public Mono<ProposalSectionsResponse> generate(ProposalSectionsRequest request) {
        int concurrency = Math.max(properties.getCompletion().getSectionConcurrency(), 1);
        List<SectionRequest> sections = request.getSections() != null ? request.getSections() : List.of();
        log.info("✍️ Generating {} proposal sections for '{}' (concurrency {})",
                sections.size(), request.getContractTitle(), concurrency);

        return Flux.fromIterable(sections)
                .flatMapSequential(section -> generateSection(request, section), concurrency)
                .collectList()
                .map(generated -> ProposalSectionsResponse.builder()
                        .sections(generated)
                        .generated((int) generated.stream()
                                .filter(section -> GeneratedSection.STATUS_GENERATED.equals(section.getStatus()))
                                .count())
                        .failed((int) generated.stream()
                                .filter(section -> GeneratedSection.STATUS_ERROR.equals(section.getStatus()))
                                .count())
                        .build());
    }

    private Mono<GeneratedSection> generateSection(ProposalSectionsRequest request, SectionRequest section) {
        CompletionRequest completionRequest = CompletionRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(buildPrompt(request, section))
                .label("section " + section.getTitle())
                .build();

        return completionClient.complete(completionRequest)
                .map(result -> toSection(section, result))
                .onErrorResume(error -> {
                    log.error("❌ Error generating section {}: {}", section.getTitle(), error.getMessage());
                    return Mono.just(failedSection(section, 0, false));
                });
    }

    private GeneratedSection toSection(SectionRequest section, CompletionResult result) {
        if (!result.isSuccess()) {
            log.warn("⚠️ Section {} could not be generated: {}", section.getTitle(), result.getErrorMessage());
            return failedSection(section, result.getAttempts(), result.isWasRetried());
        }
        return GeneratedSection.builder()
                .title(section.getTitle())
                .content(result.getContent())
                .status(GeneratedSection.STATUS_GENERATED)
                .wordCount(TextUtils.wordCount(result.getContent()))
                .attempts(result.getAttempts())
                .wasRetried(result.isWasRetried())
                .build();
    }

    private GeneratedSection failedSection(SectionRequest section, int attempts, boolean wasRetried) {
        return GeneratedSection.builder()
                .title(section.getTitle())
                .content(FAILED_SECTION_CONTENT)
                .status(GeneratedSection.STATUS_ERROR)
                .wordCount(0)
                .attempts(attempts)
                .wasRetried(wasRetried)
                .build();
    }

    private String buildPrompt(ProposalSectionsRequest request, SectionRequest section) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Write the \"").append(section.getTitle()).append("\" section of a proposal");
        if (request.getContractTitle() != null) {
            prompt.append(" responding to \"").append(request.getContractTitle()).append("\"");
        }
        if (request.getAgency() != null) {
            prompt.append(" issued by ").append(request.getAgency());
        }
        prompt.append(".\n\n");
        if (section.getRequirements() != null && !section.getRequirements().isBlank()) {
            prompt.append("REQUIREMENTS:\n").append(section.getRequirements()).append("\n\n");
        }
        if (request.getContractSummary() != null && !request.getContractSummary().isBlank()) {
            prompt.append("CONTRACT SUMMARY:\n").append(request.getContractSummary()).append("\n\n");
        }
        if (request.getBusinessProfile() != null && !request.getBusinessProfile().isBlank()) {
            prompt.append("BIDDER PROFILE:\n").append(request.getBusinessProfile()).append("\n\n");
        }
        prompt.append("Address every requirement explicitly and keep the tone professional.");
        return prompt.toString();
    }
}
