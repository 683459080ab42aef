package com.seatwise.backend.global.security;

import java.util.List;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, UUID companyId, List<String> roles) {
}
