package com.offy.competition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of ranking one candidate. {@code rank} and {@code average} are null for a
 * candidate that was left out of the ranking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedEntry {
    private Long id;
    private Double average;
    private Integer rank;
    private boolean winner;

    public boolean isRanked() {
        return rank != null;
    }
}
