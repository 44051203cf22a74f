package com.prmanager.backend.modules.review.presentation;

import java.util.List;

import com.prmanager.backend.modules.review.application.ReviewQueryService;
import com.prmanager.backend.modules.review.presentation.dto.AssignmentStatsResponse;
import com.prmanager.backend.modules.review.presentation.dto.PullRequestResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.constraints.Positive;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReviewerQueryController {

    private final ReviewQueryService reviewQueryService;

    public ReviewerQueryController(ReviewQueryService reviewQueryService) {
        this.reviewQueryService = reviewQueryService;
    }

    @Operation(summary = "Pull requests the user is reviewing")
    @GetMapping("/users/{userId}/prs")
    public ResponseEntity<List<PullRequestResponse>> listAssigned(@PathVariable("userId") @Positive Long userId) {
        return ResponseEntity.ok(reviewQueryService.listAssignedPullRequests(userId));
    }

    @Operation(summary = "Total number of reviewer assignments")
    @GetMapping("/stats")
    public ResponseEntity<AssignmentStatsResponse> stats() {
        return ResponseEntity.ok(reviewQueryService.assignmentStats());
    }
}
