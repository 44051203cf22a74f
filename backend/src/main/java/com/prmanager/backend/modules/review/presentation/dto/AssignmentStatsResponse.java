package com.prmanager.backend.modules.review.presentation.dto;

public record AssignmentStatsResponse(long totalAssignments) {
}
