package com.matchmate.backend.global.error;

import com.matchmate.backend.global.web.RequestIdFilter;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

/**
 * Error body for every failed request. {@code requestId} repeats the {@code X-Request-Id} of the
 * failing request so a client report can be matched to the server log line.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code,
                              String requestId) {

    private static final String TYPE_PREFIX = "urn:problem:matchmate:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String resolvedCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String resolvedDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                TYPE_PREFIX + typeSuffix(resolvedCode),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                resolvedDetail,
                instance,
                resolvedCode,
                MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)
        );
    }

    private static String typeSuffix(String code) {
        return code.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
    }
}
