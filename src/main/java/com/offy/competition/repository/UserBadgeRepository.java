package com.offy.competition.repository;

import com.offy.competition.model.UserBadge;

public interface UserBadgeRepository {
    UserBadge save(UserBadge userBadge);
    boolean existsByUserIdAndBadgeName(Long userId, String badgeName);
}
