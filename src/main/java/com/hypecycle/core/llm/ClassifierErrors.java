package com.hypecycle.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps exceptions raised by an LLM call onto {@link ClassifierErrorKind}.
 * <p>
 * Spring AI reports 4xx provider errors as {@link NonTransientAiException} whose message
 * starts with the HTTP status; RestClient errors carry the status directly.
 */
public final class ClassifierErrors {

    private static final Pattern LEADING_STATUS = Pattern.compile("^\\s*(\\d{3})\\b");

    private ClassifierErrors() {}

    public static ClassifierErrorKind classify(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof LlmTimeoutException
                    || current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof HttpTimeoutException) {
                return ClassifierErrorKind.TIMED_OUT;
            }
            if (current instanceof LlmParseException
                    || current instanceof LlmEmptyResponseException
                    || current instanceof JsonProcessingException) {
                return ClassifierErrorKind.MALFORMED_RESPONSE;
            }
            if (current instanceof RestClientResponseException response) {
                ClassifierErrorKind byStatus = fromStatus(response.getStatusCode().value());
                if (byStatus != null) {
                    return byStatus;
                }
            }
            if (current instanceof NonTransientAiException && current.getMessage() != null) {
                Matcher matcher = LEADING_STATUS.matcher(current.getMessage());
                if (matcher.find()) {
                    ClassifierErrorKind byStatus = fromStatus(Integer.parseInt(matcher.group(1)));
                    if (byStatus != null) {
                        return byStatus;
                    }
                }
            }
        }
        return ClassifierErrorKind.UPSTREAM_ERROR;
    }

    static ClassifierErrorKind fromStatus(int status) {
        return switch (status) {
            case 429 -> ClassifierErrorKind.RATE_LIMITED;
            case 401, 403 -> ClassifierErrorKind.UNAUTHENTICATED;
            case 408, 504 -> ClassifierErrorKind.TIMED_OUT;
            default -> null;
        };
    }

    /** Short message for logs and error lists. */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
