package com.prmanager.backend.modules.team.presentation;

import com.prmanager.backend.modules.team.application.TeamService;
import com.prmanager.backend.modules.team.presentation.dto.CreateTeamRequest;
import com.prmanager.backend.modules.team.presentation.dto.CreateUserRequest;
import com.prmanager.backend.modules.team.presentation.dto.DeactivateUsersRequest;
import com.prmanager.backend.modules.team.presentation.dto.DeactivateUsersResponse;
import com.prmanager.backend.modules.team.presentation.dto.TeamResponse;
import com.prmanager.backend.modules.team.presentation.dto.UserResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;

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
@RequestMapping("/teams")
public class TeamController {

    private final TeamService teamService;

    public TeamController(TeamService teamService) {
        this.teamService = teamService;
    }

    @Operation(summary = "Create a team")
    @PostMapping
    public ResponseEntity<TeamResponse> createTeam(@Valid @RequestBody CreateTeamRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(teamService.createTeam(request.name()));
    }

    @GetMapping("/{teamId}")
    public ResponseEntity<TeamResponse> getTeam(@PathVariable("teamId") @Positive Long teamId) {
        return ResponseEntity.ok(teamService.getTeam(teamId));
    }

    @Operation(summary = "Add a user to a team", description = "active defaults to true when omitted.")
    @PostMapping("/{teamId}/users")
    public ResponseEntity<UserResponse> createUser(
            @Parameter(description = "owning team id") @PathVariable("teamId") @Positive Long teamId,
            @Valid @RequestBody CreateUserRequest request
    ) {
        UserResponse created = teamService.createUser(teamId, request.name(), request.activeOrDefault());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(
            summary = "Deactivate team members",
            description = "Deactivated users are no longer picked as reviewers. Their current assignments stay as they are."
    )
    @PostMapping("/{teamId}/users/deactivate")
    public ResponseEntity<DeactivateUsersResponse> deactivateMembers(
            @PathVariable("teamId") @Positive Long teamId,
            @Valid @RequestBody DeactivateUsersRequest request
    ) {
        return ResponseEntity.ok(teamService.deactivateMembers(teamId, request.userIds()));
    }
}
