package com.prmanager.backend.modules.team.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record DeactivateUsersRequest(
        @NotEmpty(message = "userIds must not be empty")
        List<@NotNull @Positive Long> userIds
) {
}
