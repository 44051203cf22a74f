package com.prmanager.backend.modules.team.domain;

import com.prmanager.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * 리뷰 대상자/작성자가 되는 사용자 계정.
 * 팀 소속과 활성 여부는 배정 시점에 매번 다시 읽는다.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "team_id")
    private Team team;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    protected AppUser() {
    }

    public AppUser(Team team, String name, boolean active) {
        this.team = team;
        this.name = name;
        this.active = active;
    }

    public Long getId() {
        return id;
    }

    public Team getTeam() {
        return team;
    }

    public Long getTeamId() {
        return team != null ? team.getId() : null;
    }

    public boolean hasTeam() {
        return team != null;
    }

    public String getName() {
        return name;
    }

    public boolean isActive() {
        return active;
    }
}
