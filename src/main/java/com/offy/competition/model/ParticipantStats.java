package com.offy.competition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Challenge-scoped aggregates of one participant, derived entirely from the screen time logs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantStats {
    private int daysLogged;
    private long totalScreenTimeMinutes;
    private int daysPassed;
    private int daysFailed;
    private int todayMinutes;
    private Boolean todayPassed;

    public static ParticipantStats empty() {
        return ParticipantStats.builder().build();
    }
}
