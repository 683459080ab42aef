package com.seatwise.backend.modules.seating.presentation.dto;

public record BatchAssignResponse(int assigned, int replaced) {
}
