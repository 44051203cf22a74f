package com.prmanager.backend.modules.team.presentation.dto;

import java.time.OffsetDateTime;

import com.prmanager.backend.modules.team.domain.Team;

public record TeamResponse(
        Long id,
        String name,
        OffsetDateTime createdAt
) {

    public static TeamResponse from(Team team) {
        return new TeamResponse(team.getId(), team.getName(), team.getCreatedAt());
    }
}
