package com.prmanager.backend.modules.team.presentation;

import com.prmanager.backend.modules.team.application.TeamService;
import com.prmanager.backend.modules.team.presentation.dto.UserResponse;

import jakarta.validation.constraints.Positive;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private final TeamService teamService;

    public UserController(TeamService teamService) {
        this.teamService = teamService;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserResponse> getUser(@PathVariable("userId") @Positive Long userId) {
        return ResponseEntity.ok(teamService.getUser(userId));
    }
}
