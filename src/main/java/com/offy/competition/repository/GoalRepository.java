package com.offy.competition.repository;

import com.offy.competition.model.Goal;
import com.offy.competition.model.GoalType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface GoalRepository {
    Optional<Goal> findByUserIdAndGoalType(Long userId, GoalType goalType);
    List<Goal> findByGoalTypeAndUserIds(GoalType goalType, Collection<Long> userIds);
}
