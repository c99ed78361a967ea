package com.offy.competition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntry {
    private Long userId;
    private String username;
    private Integer rank;
    private int streak;
    private Double averagePerDay;
    private long totalMinutes;
    private int daysLogged;
}
