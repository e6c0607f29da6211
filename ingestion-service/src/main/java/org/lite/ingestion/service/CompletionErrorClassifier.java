package org.lite.ingestion.service;

import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.handler.timeout.WriteTimeoutException;
import org.lite.ingestion.enums.CompletionErrorKind;
import org.lite.ingestion.exception.CompletionServiceException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed completion call is worth repeating. Looks at the HTTP status,
 * then at the exception types in the cause chain, then at the messages.
 */
@Component
public class CompletionErrorClassifier {

    static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(408, 502, 503, 504, 524);

    private static final List<String> NETWORK_CODES = List.of(
            "econnreset", "econnaborted", "etimedout", "connection reset", "connection aborted");

    private static final List<String> TIMEOUT_KEYWORDS = List.of(
            "timeout", "timed out", "gateway", "bad gateway", "service unavailable");

    public CompletionErrorKind classify(Throwable error) {
        if (error == null) {
            return CompletionErrorKind.NON_RETRYABLE;
        }
        Integer status = statusOf(error);
        if (status != null) {
            return RETRYABLE_STATUS_CODES.contains(status)
                    ? CompletionErrorKind.GATEWAY_STATUS
                    : CompletionErrorKind.NON_RETRYABLE;
        }
        for (Throwable current = error; current != null; current = nextCause(current)) {
            if (isNetworkFailure(current)) {
                return CompletionErrorKind.NETWORK;
            }
        }
        for (Throwable current = error; current != null; current = nextCause(current)) {
            String message = lower(current.getMessage());
            if (TIMEOUT_KEYWORDS.stream().anyMatch(message::contains)) {
                return CompletionErrorKind.TIMEOUT_MESSAGE;
            }
        }
        return CompletionErrorKind.NON_RETRYABLE;
    }

    public boolean isRetryable(Throwable error) {
        return classify(error).isRetryable();
    }

    private Integer statusOf(Throwable error) {
        for (Throwable current = error; current != null; current = nextCause(current)) {
            if (current instanceof CompletionServiceException cse) {
                return cse.getStatusCode();
            }
            if (current instanceof WebClientResponseException wcre) {
                return wcre.getStatusCode().value();
            }
        }
        return null;
    }

    private boolean isNetworkFailure(Throwable error) {
        if (error instanceof ConnectException
                || error instanceof SocketTimeoutException
                || error instanceof ReadTimeoutException
                || error instanceof WriteTimeoutException
                || error instanceof TimeoutException) {
            return true;
        }
        String message = lower(error.getMessage());
        return NETWORK_CODES.stream().anyMatch(message::contains);
    }

    private Throwable nextCause(Throwable error) {
        Throwable cause = error.getCause();
        return cause == error ? null : cause;
    }

    private String lower(String message) {
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }
}
