package service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.dto.ProposalSectionsRequest;
import org.lite.ingestion.dto.SectionRequest;
import org.lite.ingestion.model.CompletionRequest;
import org.lite.ingestion.model.CompletionResult;
import org.lite.ingestion.model.GeneratedSection;
import org.lite.ingestion.service.CompletionClient;
import org.lite.ingestion.service.impl.ProposalSectionServiceImpl;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProposalSectionServiceImplTest {

    @Mock
    private CompletionClient completionClient;

    @Test
    void testGenerate_FailedSectionGetsEditableFallback() {
        // Given
        ProposalSectionServiceImpl service = new ProposalSectionServiceImpl(completionClient, new IngestionProperties());
        when(completionClient.complete(any(CompletionRequest.class))).thenAnswer(invocation -> {
            CompletionRequest request = invocation.getArgument(0);
            if (request.getLabel().contains("Past Performance")) {
                return Mono.just(CompletionResult.placeholder("HTTP 504: Gateway Timeout", 3));
            }
            return Mono.just(CompletionResult.succeeded("Our approach covers every requirement.", 1));
        });

        // When / Then
        StepVerifier.create(service.generate(request("Technical Approach", "Past Performance", "Management Plan")))
                .assertNext(response -> {
                    List<GeneratedSection> sections = response.getSections();
                    assertEquals(List.of("Technical Approach", "Past Performance", "Management Plan"),
                            sections.stream().map(GeneratedSection::getTitle).toList());
                    assertEquals(2, response.getGenerated());
                    assertEquals(1, response.getFailed());

                    GeneratedSection failed = sections.get(1);
                    assertEquals(GeneratedSection.STATUS_ERROR, failed.getStatus());
                    assertEquals("Error generating content. Please edit manually.", failed.getContent());
                    assertEquals(3, failed.getAttempts());
                    assertTrue(failed.isWasRetried());

                    assertEquals(GeneratedSection.STATUS_GENERATED, sections.get(0).getStatus());
                    assertEquals(5, sections.get(0).getWordCount());
                })
                .verifyComplete();
    }

    @Test
    void testGenerate_SectionsRunOneAtATimeByDefault() {
        // Given
        ProposalSectionServiceImpl service = new ProposalSectionServiceImpl(completionClient, new IngestionProperties());
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(completionClient.complete(any(CompletionRequest.class))).thenAnswer(invocation -> Mono.fromCallable(() -> {
                    peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                    return CompletionResult.succeeded("text", 1);
                })
                .delayElement(Duration.ofMillis(10))
                .doOnNext(result -> inFlight.decrementAndGet()));

        // When
        service.generate(request("A", "B", "C", "D")).block();

        // Then
        assertEquals(1, peak.get());
        verify(completionClient, times(4)).complete(any(CompletionRequest.class));
    }

    @Test
    void testGenerate_UnexpectedErrorStillYieldsSection() {
        // Given
        ProposalSectionServiceImpl service = new ProposalSectionServiceImpl(completionClient, new IngestionProperties());
        when(completionClient.complete(any(CompletionRequest.class))).thenReturn(Mono.error(new IllegalStateException("boom")));

        // When / Then
        StepVerifier.create(service.generate(request("Executive Summary")))
                .assertNext(response -> {
                    assertEquals(0, response.getGenerated());
                    assertEquals(1, response.getFailed());
                    assertEquals(GeneratedSection.STATUS_ERROR, response.getSections().get(0).getStatus());
                })
                .verifyComplete();
    }

    private ProposalSectionsRequest request(String... titles) {
        return ProposalSectionsRequest.builder()
                .contractTitle("Facility Maintenance Services")
                .agency("GSA")
                .contractSummary("Maintenance of federal buildings")
                .sections(Arrays.stream(titles)
                        .map(title -> SectionRequest.builder().title(title).requirements("Describe " + title).build())
                        .toList())
                .build();
    }
}
