package com.prmanager.backend.modules.review.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record CreatePullRequestRequest(
        @NotBlank(message = "title is required")
        @Size(max = 255, message = "title must be at most 255 characters")
        String title,
        @NotNull(message = "authorId is required")
        @Positive(message = "authorId must be positive")
        Long authorId
) {
}
