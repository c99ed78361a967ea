package com.offy.competition.model;

/**
 * How participants without a single logged day take part in a challenge ranking.
 */
public enum ZeroLogPolicy {
    /**
     * Participants with no logged days are ranked with an average of 0 minutes.
     * Matches full-abstinence (zero target) challenges.
     */
    RANK_AS_ZERO_AVERAGE,

    /**
     * Participants with no logged days are left unranked and can never win.
     */
    EXCLUDE
}
