package com.offy.competition.repository.impl;

import com.offy.competition.model.Goal;
import com.offy.competition.model.GoalType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SpringDataGoalRepository extends JpaRepository<Goal, Long> {
    Optional<Goal> findByUserIdAndGoalType(Long userId, GoalType goalType);
    List<Goal> findByGoalTypeAndUserIdIn(GoalType goalType, Collection<Long> userIds);
}
