package com.prmanager.backend.modules.review.presentation;

import com.prmanager.backend.modules.review.application.PullRequestService;
import com.prmanager.backend.modules.review.application.ReviewQueryService;
import com.prmanager.backend.modules.review.presentation.dto.CreatePullRequestRequest;
import com.prmanager.backend.modules.review.presentation.dto.PullRequestResponse;
import com.prmanager.backend.modules.review.presentation.dto.ReassignReviewerRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/prs")
public class PullRequestController {

    private final PullRequestService pullRequestService;
    private final ReviewQueryService reviewQueryService;

    public PullRequestController(PullRequestService pullRequestService, ReviewQueryService reviewQueryService) {
        this.pullRequestService = pullRequestService;
        this.reviewQueryService = reviewQueryService;
    }

    @Operation(
            summary = "Open a pull request",
            description = "Up to two active teammates of the author are picked at random as reviewers."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "created with its reviewers"),
            @ApiResponse(responseCode = "404", description = "author missing or inactive")
    })
    @PostMapping
    public ResponseEntity<PullRequestResponse> createPullRequest(@Valid @RequestBody CreatePullRequestRequest request) {
        PullRequestResponse created = pullRequestService.createPullRequest(request.title(), request.authorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{prId}")
    public ResponseEntity<PullRequestResponse> getPullRequest(@PathVariable("prId") @Positive Long prId) {
        return ResponseEntity.ok(reviewQueryService.getPullRequest(prId));
    }

    @Operation(summary = "Replace one reviewer with another active teammate")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "reviewer replaced"),
            @ApiResponse(responseCode = "404", description = "pull request or user missing"),
            @ApiResponse(responseCode = "409", description = "merged, not assigned, or no candidate left")
    })
    @PostMapping("/{prId}/reassign")
    public ResponseEntity<PullRequestResponse> reassignReviewer(
            @PathVariable("prId") @Positive Long prId,
            @Valid @RequestBody ReassignReviewerRequest request
    ) {
        return ResponseEntity.ok(pullRequestService.reassignReviewer(prId, request.oldUserId()));
    }

    @Operation(summary = "Merge a pull request", description = "Merging an already merged pull request returns it unchanged.")
    @PostMapping("/{prId}/merge")
    public ResponseEntity<PullRequestResponse> mergePullRequest(@PathVariable("prId") @Positive Long prId) {
        return ResponseEntity.ok(pullRequestService.mergePullRequest(prId));
    }
}
