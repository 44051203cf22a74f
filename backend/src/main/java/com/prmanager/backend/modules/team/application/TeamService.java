package com.prmanager.backend.modules.team.application;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.prmanager.backend.global.error.ErrorKind;
import com.prmanager.backend.global.error.ProblemException;
import com.prmanager.backend.modules.team.domain.AppUser;
import com.prmanager.backend.modules.team.domain.Team;
import com.prmanager.backend.modules.team.infrastructure.persistence.AppUserRepository;
import com.prmanager.backend.modules.team.infrastructure.persistence.TeamRepository;
import com.prmanager.backend.modules.team.presentation.dto.DeactivateUsersResponse;
import com.prmanager.backend.modules.team.presentation.dto.TeamResponse;
import com.prmanager.backend.modules.team.presentation.dto.UserResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TeamService {

    private static final Logger log = LoggerFactory.getLogger(TeamService.class);

    private final TeamRepository teamRepository;
    private final AppUserRepository appUserRepository;

    public TeamService(TeamRepository teamRepository, AppUserRepository appUserRepository) {
        this.teamRepository = teamRepository;
        this.appUserRepository = appUserRepository;
    }

    public TeamResponse createTeam(String name) {
        String normalized = name == null ? "" : name.trim();
        if (normalized.isEmpty()) {
            throw new ProblemException(ErrorKind.BAD_REQUEST, "TEAM_NAME_REQUIRED", "team name must not be empty");
        }
        if (teamRepository.existsByName(normalized)) {
            throw new ProblemException(ErrorKind.BAD_REQUEST, "TEAM_ALREADY_EXISTS",
                    "team '%s' already exists".formatted(normalized));
        }

        Team team = teamRepository.save(new Team(normalized));
        log.info("Team created id={} name={}", team.getId(), team.getName());
        return TeamResponse.from(team);
    }

    @Transactional(readOnly = true)
    public TeamResponse getTeam(Long teamId) {
        Team team = teamRepository.findById(teamId)
                .orElseThrow(() -> teamNotFound(ErrorKind.NOT_FOUND, teamId));
        return TeamResponse.from(team);
    }

    public UserResponse createUser(Long teamId, String name, boolean active) {
        String normalized = name == null ? "" : name.trim();
        if (normalized.isEmpty()) {
            throw new ProblemException(ErrorKind.BAD_REQUEST, "USER_NAME_REQUIRED", "user name must not be empty");
        }

        Team team = null;
        if (teamId != null) {
            team = teamRepository.findById(teamId)
                    .orElseThrow(() -> teamNotFound(ErrorKind.BAD_REQUEST, teamId));
        }

        AppUser user = appUserRepository.save(new AppUser(team, normalized, active));
        log.info("User created id={} teamId={} active={}", user.getId(), teamId, active);
        return UserResponse.from(user);
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Long userId) {
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(ErrorKind.NOT_FOUND, "USER_NOT_FOUND",
                        "user %d not found".formatted(userId), Map.of("userId", userId)));
        return UserResponse.from(user);
    }

    /**
     * Marks the given members of a team inactive. Ids outside the team, unknown ids and
     * already inactive members are skipped. Existing reviewer assignments are kept.
     */
    public DeactivateUsersResponse deactivateMembers(Long teamId, List<Long> userIds) {
        if (!teamRepository.existsById(teamId)) {
            throw teamNotFound(ErrorKind.NOT_FOUND, teamId);
        }
        Set<Long> distinctIds = new LinkedHashSet<>(userIds);
        if (distinctIds.isEmpty()) {
            return new DeactivateUsersResponse(teamId, 0);
        }

        int changed = appUserRepository.deactivateInTeam(teamId, distinctIds);
        log.info("Deactivated {} of {} requested users in teamId={}", changed, distinctIds.size(), teamId);
        return new DeactivateUsersResponse(teamId, changed);
    }

    private ProblemException teamNotFound(ErrorKind kind, Long teamId) {
        return new ProblemException(kind, "TEAM_NOT_FOUND",
                "team %d not found".formatted(teamId), Map.of("teamId", teamId));
    }
}
