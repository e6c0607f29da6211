package service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.enums.DocumentType;
import org.lite.ingestion.enums.ExtractionMethod;
import org.lite.ingestion.exception.SummarizationException;
import org.lite.ingestion.model.CompletionRequest;
import org.lite.ingestion.model.CompletionResult;
import org.lite.ingestion.model.ExtractionResult;
import org.lite.ingestion.service.CompletionClient;
import org.lite.ingestion.service.impl.SummarizationServiceImpl;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SummarizationServiceImplTest {

    @Mock
    private CompletionClient completionClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private IngestionProperties properties;
    private SummarizationServiceImpl summarizationService;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        summarizationService = new SummarizationServiceImpl(completionClient, objectMapper, properties);
    }

    @Test
    void testSummarize_FencedJsonWithTrailingCommaIsNormalized() {
        // Given
        String response = "```json\n{\"executive_summary\": \"Janitorial services\", \"scope_of_work\": [\"floors\", \"windows\",],}\n```";
        when(completionClient.complete(any())).thenReturn(Mono.just(CompletionResult.succeeded(response, 2)));

        // When / Then
        StepVerifier.create(summarizationService.summarize(extraction("Statement of work text"), "C1"))
                .assertNext(summary -> {
                    JsonNode json = readJson(summary.getContent());
                    assertEquals("Janitorial services", json.get("executive_summary").asText());
                    assertEquals(2, json.get("scope_of_work").size());
                    assertEquals(ExtractionMethod.DIRECT, summary.getExtractionMethod());
                    assertEquals(2, summary.getCompletionAttempts());
                    assertTrue(summary.isWasRetried());
                })
                .verifyComplete();
    }

    @Test
    void testSummarize_PlainTextResponseIsWrapped() {
        // Given
        when(completionClient.complete(any()))
                .thenReturn(Mono.just(CompletionResult.succeeded("The contract covers grounds maintenance.", 1)));

        // When / Then
        StepVerifier.create(summarizationService.summarize(extraction("Grounds maintenance"), "C1"))
                .assertNext(summary -> assertEquals("The contract covers grounds maintenance.",
                        readJson(summary.getContent()).get("content").asText()))
                .verifyComplete();
    }

    @Test
    void testSummarize_PlaceholderFailsTheDocument() {
        // Given
        when(completionClient.complete(any()))
                .thenReturn(Mono.just(CompletionResult.placeholder("HTTP 504: Gateway Timeout", 3)));

        // When / Then
        StepVerifier.create(summarizationService.summarize(extraction("Statement of work text"), "C1"))
                .expectErrorSatisfies(error -> {
                    assertInstanceOf(SummarizationException.class, error);
                    assertTrue(error.getMessage().contains("3 attempt(s)"));
                })
                .verify();
    }

    @Test
    void testSummarize_LongContentIsTruncated() {
        // Given
        properties.getCompletion().setMaxInputTokens(10);
        String text = "A".repeat(40) + "TAIL_MARKER";
        when(completionClient.complete(any())).thenReturn(Mono.just(CompletionResult.succeeded("{}", 1)));

        // When
        summarizationService.summarize(extraction(text), "C1").block();

        // Then
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionClient).complete(captor.capture());
        CompletionRequest request = captor.getValue();
        assertTrue(request.getUserPrompt().contains("A".repeat(40)));
        assertFalse(request.getUserPrompt().contains("TAIL_MARKER"));
        assertTrue(request.isJsonResponse());
        assertTrue(request.getUserPrompt().contains("CONTRACT: C1"));
    }

    private ExtractionResult extraction(String text) {
        return ExtractionResult.builder()
                .text(text)
                .method(ExtractionMethod.DIRECT)
                .sourceType(DocumentType.PDF)
                .filename("C1_sow.pdf")
                .wordCount(text.split("\\s+").length)
                .build();
    }

    private JsonNode readJson(String content) {
        try {
            return objectMapper.readTree(content);
        } catch (Exception e) {
            throw new AssertionError("Summary is not valid JSON: " + content, e);
        }
    }
}
