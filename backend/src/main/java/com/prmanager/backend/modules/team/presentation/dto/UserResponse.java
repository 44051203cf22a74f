package com.prmanager.backend.modules.team.presentation.dto;

import java.time.OffsetDateTime;

import com.prmanager.backend.modules.team.domain.AppUser;

public record UserResponse(
        Long id,
        Long teamId,
        String name,
        boolean active,
        OffsetDateTime createdAt
) {

    public static UserResponse from(AppUser user) {
        return new UserResponse(user.getId(), user.getTeamId(), user.getName(), user.isActive(), user.getCreatedAt());
    }
}
