package org.lite.ingestion.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.ingestion.config.IngestionProperties;
import org.lite.ingestion.exception.SummarizationException;
import org.lite.ingestion.model.CompletionRequest;
import org.lite.ingestion.model.ExtractionResult;
import org.lite.ingestion.model.SummaryResult;
import org.lite.ingestion.service.CompletionClient;
import org.lite.ingestion.service.SummarizationService;
import org.lite.ingestion.util.TextUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class SummarizationServiceImpl implements SummarizationService {

    static final String SYSTEM_PROMPT = "Expert government contract attachment analyst. Return ONLY valid JSON. "
            + "Follow schema exactly. 10-page depth (~6000 words total).";

    private static final String PROMPT_TEMPLATE = """
            TASK: Analyze government contract document and generate comprehensive RFP response sections.

            CONTRACT: %s
            DOCUMENT: %s

            CONTRACT DOCUMENT:
            \"\"\"
            %s
            \"\"\"

            Generate a comprehensive analysis and RFP response content in JSON format. Include all relevant sections \
            that would be needed for a complete RFP response, such as:

            - Executive summary with overview and key points
            - Technical approach and specifications
            - Management plan and project approach
            - Past performance and relevant experience
            - Scope of work and deliverables
            - Compliance requirements and standards
            - Performance metrics and quality measures
            - Risk analysis and mitigation strategies
            - Implementation guidance and coordination

            Structure the response as a JSON object with descriptive field names. Provide detailed, professional \
            content suitable for government contracting.""";

    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");
    private static final Pattern FIRST_OBJECT = Pattern.compile("\\{[^{}]*(?:\\{[^{}]*}[^{}]*)*}");

    // Rough characters-per-token ratio used to keep prompts within the model window
    private static final int CHARS_PER_TOKEN = 4;

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    private final IngestionProperties properties;

    @Override
    public Mono<SummaryResult> summarize(ExtractionResult extraction, String contractId) {
        String content = limitContent(extraction);
        CompletionRequest request = CompletionRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(String.format(PROMPT_TEMPLATE, contractId, extraction.getFilename(), content))
                .jsonResponse(true)
                .label(extraction.getFilename())
                .build();

        return completionClient.complete(request)
                .flatMap(completion -> {
                    if (!completion.isSuccess()) {
                        return Mono.error(new SummarizationException("Summarization of " + extraction.getFilename()
                                + " failed after " + completion.getAttempts() + " attempt(s): " + completion.getErrorMessage()));
                    }
                    return Mono.just(SummaryResult.builder()
                            .content(toJson(completion.getContent()))
                            .extractionMethod(extraction.getMethod())
                            .wordCount(extraction.getWordCount())
                            .completionAttempts(completion.getAttempts())
                            .wasRetried(completion.isWasRetried())
                            .build());
                });
    }

    /**
     * Normalizes a model response to a JSON object: fences are stripped, trailing commas dropped,
     * and text that still does not parse is wrapped as {@code {"content": ...}}.
     */
    String toJson(String raw) {
        String cleaned = TextUtils.stripCodeFences(raw);
        JsonNode parsed = tryParse(cleaned);
        if (parsed == null) {
            parsed = tryParse(TRAILING_COMMA.matcher(cleaned).replaceAll("$1"));
        }
        if (parsed == null) {
            Matcher matcher = FIRST_OBJECT.matcher(cleaned);
            if (matcher.find()) {
                parsed = tryParse(matcher.group());
                if (parsed != null) {
                    log.warn("⚠️ Only a partial JSON object could be recovered from the summary response");
                }
            }
        }
        if (parsed == null || !parsed.isObject()) {
            log.warn("⚠️ Summary response is not a JSON object, storing it as plain content");
            ObjectNode wrapper = objectMapper.createObjectNode();
            wrapper.put("content", cleaned);
            parsed = wrapper;
        }
        try {
            return objectMapper.writeValueAsString(parsed);
        } catch (JsonProcessingException e) {
            throw new SummarizationException("Could not serialize summary: " + e.getMessage());
        }
    }

    private JsonNode tryParse(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private String limitContent(ExtractionResult extraction) {
        int maxChars = properties.getCompletion().getMaxInputTokens() * CHARS_PER_TOKEN;
        String text = extraction.getText();
        if (text.length() > maxChars) {
            log.warn("✂️ {} has ~{} tokens, truncating to {}", extraction.getFilename(),
                    text.length() / CHARS_PER_TOKEN, properties.getCompletion().getMaxInputTokens());
            return text.substring(0, maxChars);
        }
        return text;
    }
}
