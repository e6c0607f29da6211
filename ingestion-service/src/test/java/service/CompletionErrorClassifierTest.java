package service;

import org.junit.jupiter.api.Test;
import org.lite.ingestion.enums.CompletionErrorKind;
import org.lite.ingestion.exception.CompletionServiceException;
import org.lite.ingestion.service.CompletionErrorClassifier;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class CompletionErrorClassifierTest {

    private final CompletionErrorClassifier classifier = new CompletionErrorClassifier();

    @Test
    void testClassify_GatewayStatusesAreRetryable() {
        for (int status : new int[]{408, 502, 503, 504, 524}) {
            assertEquals(CompletionErrorKind.GATEWAY_STATUS,
                    classifier.classify(new CompletionServiceException(status, "upstream")),
                    "Status " + status + " should be retried");
        }
    }

    @Test
    void testClassify_RateLimitIsNotRetried() {
        WebClientResponseException tooMany = WebClientResponseException.create(429, "Too Many Requests", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);

        assertEquals(CompletionErrorKind.NON_RETRYABLE, classifier.classify(new CompletionServiceException(429, "rate limited")));
        assertEquals(CompletionErrorKind.NON_RETRYABLE, classifier.classify(tooMany));
    }

    @Test
    void testClassify_StatusDecidesOverMessage() {
        // Given - a client error whose body mentions a gateway
        CompletionServiceException error = new CompletionServiceException(400, "Bad gateway configuration in request");

        // When
        CompletionErrorKind kind = classifier.classify(error);

        // Then
        assertEquals(CompletionErrorKind.NON_RETRYABLE, kind);
        assertFalse(classifier.isRetryable(error));
    }

    @Test
    void testClassify_WebClientResponseStatus() {
        WebClientResponseException unavailable = WebClientResponseException.create(503, "Service Unavailable", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);
        WebClientResponseException unauthorized = WebClientResponseException.create(401, "Unauthorized", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);

        assertEquals(CompletionErrorKind.GATEWAY_STATUS, classifier.classify(unavailable));
        assertEquals(CompletionErrorKind.NON_RETRYABLE, classifier.classify(unauthorized));
    }

    @Test
    void testClassify_NetworkFailuresInCauseChain() {
        assertEquals(CompletionErrorKind.NETWORK,
                classifier.classify(new IllegalStateException("request failed", new ConnectException("Connection refused"))));
        assertEquals(CompletionErrorKind.NETWORK,
                classifier.classify(new RuntimeException("read ECONNRESET")));
        assertEquals(CompletionErrorKind.NETWORK,
                classifier.classify(new TimeoutException("Did not observe any item within 120000ms")));
    }

    @Test
    void testClassify_TimeoutKeywords() {
        assertEquals(CompletionErrorKind.TIMEOUT_MESSAGE,
                classifier.classify(new IllegalStateException("Upstream request timed out")));
        assertEquals(CompletionErrorKind.TIMEOUT_MESSAGE,
                classifier.classify(new RuntimeException("Service Unavailable, try later")));
    }

    @Test
    void testClassify_OtherFailuresAreNotRetried() {
        assertEquals(CompletionErrorKind.NON_RETRYABLE, classifier.classify(new IllegalArgumentException("invalid api key")));
        assertEquals(CompletionErrorKind.NON_RETRYABLE, classifier.classify(new NullPointerException()));
        assertEquals(CompletionErrorKind.NON_RETRYABLE, classifier.classify(null));
    }
}
