package com.offy.competition.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "challenge_participants",
    uniqueConstraints = @UniqueConstraint(name = "uq_challenge_participant", columnNames = {"challenge_id", "user_id"}),
    indexes = {
        @Index(name = "idx_participant_user", columnList = "user_id"),
        @Index(name = "idx_participant_challenge_status", columnList = "challenge_id,invitation_status")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeParticipant {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "participant_id")
    private Long id;

    @Column(name = "challenge_id", nullable = false)
    private Long challengeId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "invitation_status", nullable = false, length = 20)
    @Builder.Default
    private InvitationStatus invitationStatus = InvitationStatus.PENDING;

    @Column(name = "joined_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant joinedAt;

    @Column(name = "days_logged", nullable = false)
    @Builder.Default
    private int daysLogged = 0;

    @Column(name = "total_screen_time_minutes", nullable = false)
    @Builder.Default
    private long totalScreenTimeMinutes = 0L;

    @Column(name = "days_passed", nullable = false)
    @Builder.Default
    private int daysPassed = 0;

    @Column(name = "days_failed", nullable = false)
    @Builder.Default
    private int daysFailed = 0;

    @Column(name = "today_minutes", nullable = false)
    @Builder.Default
    private int todayMinutes = 0;

    // null until something is logged for today
    @Column(name = "today_passed")
    private Boolean todayPassed;

    @Column(name = "final_rank")
    private Integer finalRank;

    @Column(name = "is_winner", nullable = false)
    @Builder.Default
    private boolean winner = false;

    @Column(name = "challenge_completed", nullable = false)
    @Builder.Default
    private boolean challengeCompleted = false;

    public boolean isAccepted() {
        return invitationStatus == InvitationStatus.ACCEPTED;
    }

    public void applyStats(ParticipantStats stats) {
        this.daysLogged = stats.getDaysLogged();
        this.totalScreenTimeMinutes = stats.getTotalScreenTimeMinutes();
        this.daysPassed = stats.getDaysPassed();
        this.daysFailed = stats.getDaysFailed();
        this.todayMinutes = stats.getTodayMinutes();
        this.todayPassed = stats.getTodayPassed();
    }

    public ParticipantStats currentStats() {
        return ParticipantStats.builder()
            .daysLogged(daysLogged)
            .totalScreenTimeMinutes(totalScreenTimeMinutes)
            .daysPassed(daysPassed)
            .daysFailed(daysFailed)
            .todayMinutes(todayMinutes)
            .todayPassed(todayPassed)
            .build();
    }
}
