package com.seatwise.backend.global.error;

import com.seatwise.backend.global.web.RequestIdFilter;

import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

/**
 * Problem-details body for every failed request. {@code requestId} echoes the {@code X-Request-Id}
 * of the call so a planner's error report can be matched to the server log line.
 */
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        String requestId
) {

    static final String TYPE_PREFIX = "urn:problem:seatwise:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                TYPE_PREFIX + safeCode.toLowerCase().replace('_', '-'),
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode,
                MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)
        );
    }

    public static ProblemResponse from(ProblemException ex, String instance) {
        return of(ex.getStatus(), ex.getCode(), ex.getDetailMessage(), instance);
    }
}
