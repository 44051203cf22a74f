package com.prmanager.backend.modules.review.domain;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import com.prmanager.backend.modules.team.domain.AppUser;

/**
 * Narrows a team roster down to the users that may be drawn as reviewers.
 * Results are ordered by user id so a seeded sampler always sees the same pool.
 */
public final class ReviewerEligibility {

    private static final Comparator<AppUser> BY_ID = Comparator.comparing(AppUser::getId);

    private ReviewerEligibility() {
    }

    public static List<AppUser> forCreation(List<AppUser> activeTeammates, Long authorId) {
        return filter(activeTeammates, Set.of(authorId));
    }

    /**
     * The replaced reviewer and every current reviewer stay out of the pool, so the
     * replacement can never be the reviewer it replaces or a duplicate.
     */
    public static List<AppUser> forReassignment(
            List<AppUser> activeTeammates,
            Long authorId,
            Long replacedReviewerId,
            Collection<Long> currentReviewerIds
    ) {
        Set<Long> excluded = new HashSet<>(currentReviewerIds);
        excluded.add(authorId);
        excluded.add(replacedReviewerId);
        return filter(activeTeammates, excluded);
    }

    static List<AppUser> filter(List<AppUser> roster, Set<Long> excludedIds) {
        if (roster == null || roster.isEmpty()) {
            return List.of();
        }
        return roster.stream()
                .filter(Objects::nonNull)
                .filter(AppUser::isActive)
                .filter(user -> !excludedIds.contains(user.getId()))
                .distinct()
                .sorted(BY_ID)
                .toList();
    }
}
