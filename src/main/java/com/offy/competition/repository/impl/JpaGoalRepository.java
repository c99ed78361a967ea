package com.offy.competition.repository.impl;

import com.offy.competition.model.Goal;
import com.offy.competition.model.GoalType;
import com.offy.competition.repository.GoalRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaGoalRepository implements GoalRepository {

    private final SpringDataGoalRepository jpaRepository;

    @Autowired
    public JpaGoalRepository(SpringDataGoalRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Optional<Goal> findByUserIdAndGoalType(Long userId, GoalType goalType) {
        return jpaRepository.findByUserIdAndGoalType(userId, goalType);
    }

    @Override
    public List<Goal> findByGoalTypeAndUserIds(GoalType goalType, Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findByGoalTypeAndUserIdIn(goalType, userIds);
    }
}
