package com.prmanager.backend.modules.team.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank(message = "name is required")
        @Size(max = 100, message = "name must be at most 100 characters")
        String name,
        Boolean active
) {

    public boolean activeOrDefault() {
        return active == null || active;
    }
}
