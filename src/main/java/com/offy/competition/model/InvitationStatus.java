package com.offy.competition.model;

public enum InvitationStatus {
    PENDING,
    ACCEPTED,
    DECLINED
}
