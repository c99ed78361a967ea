package com.offy.competition.repository.impl;

import com.offy.competition.model.UserBadge;
import com.offy.competition.repository.UserBadgeRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

@Repository
public class JpaUserBadgeRepository implements UserBadgeRepository {

    private final SpringDataUserBadgeRepository jpaRepository;

    @Autowired
    public JpaUserBadgeRepository(SpringDataUserBadgeRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public UserBadge save(UserBadge userBadge) {
        return jpaRepository.save(userBadge);
    }

    @Override
    public boolean existsByUserIdAndBadgeName(Long userId, String badgeName) {
        return jpaRepository.existsByUserIdAndBadgeName(userId, badgeName);
    }
}
