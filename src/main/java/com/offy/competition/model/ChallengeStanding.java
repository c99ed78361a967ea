package com.offy.competition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeStanding {
    private Long userId;
    private String username;
    private long totalScreenTimeMinutes;
    private int daysLogged;
    private int daysPassed;
    private int daysFailed;
    private Double averageDailyMinutes;
    private Integer rank;
    private boolean winner;
}
