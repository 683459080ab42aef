package com.seatwise.backend.modules.version.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SaveVersionRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 1000) String description,
        Boolean autoSave
) {
}
