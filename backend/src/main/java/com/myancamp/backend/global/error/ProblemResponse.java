package com.myancamp.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * Error envelope returned by every endpoint: {@code error} is the stable machine code,
 * {@code message} the human readable explanation.
 */
public record ProblemResponse(String type, String title, int status, String error, String message, String instance) {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:myancamp:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String message, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name().toLowerCase();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        String safeMessage = (message != null && !message.isBlank()) ? message : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                DEFAULT_TYPE_PREFIX + normalized,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeCode,
                safeMessage,
                instance
        );
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return new ProblemResponse(
                ex.getProblemType(),
                status.getReasonPhrase(),
                status.value(),
                ex.getCode(),
                ex.getDetailMessage(),
                instance
        );
    }
}
