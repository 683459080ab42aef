package com.seatwise.backend.global.security;

import java.util.UUID;

import com.seatwise.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED");
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    /**
     * Tenant of the caller. A token without a company claim cannot reach any tenant data.
     */
    public static UUID getCurrentCompanyId() {
        UUID companyId = getCurrentPrincipal().companyId();
        if (companyId == null) {
            throw new ProblemException(HttpStatus.FORBIDDEN, "COMPANY_ID_REQUIRED", "Company ID not found");
        }
        return companyId;
    }

    public static boolean hasRole(String roleCode) {
        return getCurrentPrincipal().roles().contains(roleCode);
    }
}
