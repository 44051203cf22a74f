package com.prmanager.backend.modules.team.infrastructure.persistence;

import com.prmanager.backend.modules.team.domain.Team;

import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamRepository extends JpaRepository<Team, Long> {

    boolean existsByName(String name);
}
