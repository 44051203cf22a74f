package com.prmanager.backend.modules.review.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ReassignReviewerRequest(
        @NotNull(message = "oldUserId is required")
        @Positive(message = "oldUserId must be positive")
        Long oldUserId
) {
}
