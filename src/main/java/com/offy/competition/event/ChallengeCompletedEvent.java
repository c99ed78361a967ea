package com.offy.competition.event;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class ChallengeCompletedEvent {
    private final Long challengeId;
    private final List<Long> winnerUserIds;
    private final Instant completedAt;
}
