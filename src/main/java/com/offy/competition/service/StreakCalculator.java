package com.offy.competition.service;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Component
public class StreakCalculator {

    /**
     * Longest run of consecutive qualifying days within {@code days}.
     * A day qualifies when it has a positive logged total that does not exceed
     * {@code dailyGoal} (when a goal is set). Missing days and zero-minute days break the run.
     *
     * @param days          window of days, oldest first
     * @param minutesByDay  logged total per day
     * @param dailyGoal     daily goal in minutes, or null when the user has none
     */
    public int longestStreak(List<LocalDate> days, Map<LocalDate, Integer> minutesByDay, Integer dailyGoal) {
        if (days == null || days.isEmpty() || minutesByDay == null) {
            return 0;
        }

        int current = 0;
        int max = 0;
        for (LocalDate day : days) {
            if (qualifies(minutesByDay.get(day), dailyGoal)) {
                current++;
                max = Math.max(max, current);
            } else {
                current = 0;
            }
        }
        return max;
    }

    private boolean qualifies(Integer minutes, Integer dailyGoal) {
        if (minutes == null || minutes <= 0) {
            return false;
        }
        return dailyGoal == null || minutes <= dailyGoal;
    }
}
