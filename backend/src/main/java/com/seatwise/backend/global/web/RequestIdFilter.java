package com.seatwise.backend.global.web;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every log line of a request with its request id and, for floor-plan routes, the floor plan
 * being read or edited.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String FLOOR_PLAN_MDC_KEY = "floorPlanId";

    // Client-supplied ids end up in log lines; anything else is replaced.
    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    private static final Pattern FLOOR_PLAN_PATH = Pattern.compile("^/floor-plans/([0-9a-fA-F-]{36})(/.*)?$");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request.getHeader(REQUEST_ID_HEADER));
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        String floorPlanId = floorPlanIdOf(request.getRequestURI());
        if (floorPlanId != null) {
            MDC.put(FLOOR_PLAN_MDC_KEY, floorPlanId);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_MDC_KEY);
            MDC.remove(FLOOR_PLAN_MDC_KEY);
        }
    }

    static String resolveRequestId(String header) {
        if (header != null && SAFE_REQUEST_ID.matcher(header.trim()).matches()) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }

    static String floorPlanIdOf(String requestUri) {
        if (requestUri == null) {
            return null;
        }
        Matcher matcher = FLOOR_PLAN_PATH.matcher(requestUri);
        return matcher.matches() ? matcher.group(1).toLowerCase() : null;
    }
}
