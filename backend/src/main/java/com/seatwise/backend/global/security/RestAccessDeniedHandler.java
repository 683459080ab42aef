package com.seatwise.backend.global.security;

import java.io.IOException;

import com.seatwise.backend.global.error.ProblemResponseWriter;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Planners may read seating; only admins change floor plans, assignments, versions and guest
 * relationships.
 */
@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    static final String FORBIDDEN_CODE = "SEATING_EDIT_FORBIDDEN";

    private final ProblemResponseWriter problemResponseWriter;

    public RestAccessDeniedHandler(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        problemResponseWriter.write(request, response, HttpStatus.FORBIDDEN, FORBIDDEN_CODE,
                request.getMethod() + " " + request.getRequestURI() + " requires the ADMIN role");
    }
}
