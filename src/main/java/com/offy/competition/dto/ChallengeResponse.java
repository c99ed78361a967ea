package com.offy.competition.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.offy.competition.model.Challenge;
import com.offy.competition.model.ChallengeStatus;
import com.offy.competition.model.TargetApp;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A challenge with the caller's own participation, if any. The status is the one in effect
 * on {@code today}, so an upcoming challenge whose start date has arrived reads as active.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeResponse {
    private Long challengeId;
    private String name;
    private String description;
    private Long ownerId;
    private TargetApp targetApp;
    private int targetMinutes;
    private LocalDate startDate;
    private LocalDate endDate;
    private ChallengeStatus status;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant completedAt;

    private ParticipantView participant;

    public static ChallengeResponse from(Challenge challenge, ParticipantView participant, LocalDate today) {
        return ChallengeResponse.builder()
            .challengeId(challenge.getId())
            .name(challenge.getName())
            .description(challenge.getDescription())
            .ownerId(challenge.getOwnerId())
            .targetApp(challenge.getTargetApp())
            .targetMinutes(challenge.getTargetMinutes())
            .startDate(challenge.getStartDate())
            .endDate(challenge.getEndDate())
            .status(challenge.effectiveStatus(today))
            .createdAt(challenge.getCreatedAt())
            .completedAt(challenge.getCompletedAt())
            .participant(participant)
            .build();
    }
}
