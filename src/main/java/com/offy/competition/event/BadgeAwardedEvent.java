package com.offy.competition.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Published after a badge is stored. Notification delivery listens for it.
 */
@Getter
@ToString
@AllArgsConstructor
public class BadgeAwardedEvent {
    private final Long userId;
    private final String badgeName;
    private final Instant awardedAt;
}
