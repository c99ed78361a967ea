package com.offy.competition.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.offy.competition.model.ChallengeParticipant;
import com.offy.competition.model.InvitationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantView {
    private Long participantId;
    private Long userId;
    private InvitationStatus invitationStatus;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant joinedAt;

    private int daysLogged;
    private long totalScreenTimeMinutes;
    private int daysPassed;
    private int daysFailed;
    private int todayMinutes;
    private Boolean todayPassed;
    private Integer finalRank;
    private boolean winner;
    private boolean challengeCompleted;

    public static ParticipantView from(ChallengeParticipant participant) {
        return ParticipantView.builder()
            .participantId(participant.getId())
            .userId(participant.getUserId())
            .invitationStatus(participant.getInvitationStatus())
            .joinedAt(participant.getJoinedAt())
            .daysLogged(participant.getDaysLogged())
            .totalScreenTimeMinutes(participant.getTotalScreenTimeMinutes())
            .daysPassed(participant.getDaysPassed())
            .daysFailed(participant.getDaysFailed())
            .todayMinutes(participant.getTodayMinutes())
            .todayPassed(participant.getTodayPassed())
            .finalRank(participant.getFinalRank())
            .winner(participant.isWinner())
            .challengeCompleted(participant.isChallengeCompleted())
            .build();
    }
}
