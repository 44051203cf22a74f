package com.prmanager.backend.modules.team.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.prmanager.backend.modules.team.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {

    @Query("""
            select u
              from AppUser u
             where u.team.id = :teamId
               and u.active = true
             order by u.id
            """)
    List<AppUser> findActiveByTeamId(@Param("teamId") Long teamId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update AppUser u
               set u.active = false
             where u.team.id = :teamId
               and u.id in :userIds
               and u.active = true
            """)
    int deactivateInTeam(@Param("teamId") Long teamId, @Param("userIds") Collection<Long> userIds);
}
