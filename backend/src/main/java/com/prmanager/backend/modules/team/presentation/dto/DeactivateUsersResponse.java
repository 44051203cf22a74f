package com.prmanager.backend.modules.team.presentation.dto;

public record DeactivateUsersResponse(
        Long teamId,
        int deactivatedCount
) {
}
