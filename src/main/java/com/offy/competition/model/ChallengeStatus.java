package com.offy.competition.model;

public enum ChallengeStatus {
    UPCOMING,
    ACTIVE,
    COMPLETED,
    DELETED;

    public boolean isTerminal() {
        return this == COMPLETED || this == DELETED;
    }
}
