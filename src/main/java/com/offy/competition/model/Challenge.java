package com.offy.competition.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "challenges", indexes = {
    @Index(name = "idx_challenge_owner", columnList = "owner_id"),
    @Index(name = "idx_challenge_status_end", columnList = "status,end_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Challenge {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "challenge_id")
    private Long id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Convert(converter = TargetAppConverter.class)
    @Column(name = "target_app", nullable = false, length = 120)
    private TargetApp targetApp;

    @Column(name = "target_minutes", nullable = false)
    private int targetMinutes;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ChallengeStatus status;

    @Column(name = "created_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "completed_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant completedAt;

    /**
     * The stored status only changes on create, completion and deletion. An upcoming
     * challenge whose start date has arrived reads as active.
     */
    public ChallengeStatus effectiveStatus(LocalDate today) {
        if (status == ChallengeStatus.UPCOMING && !today.isBefore(startDate)) {
            return ChallengeStatus.ACTIVE;
        }
        return status;
    }

    public boolean isActiveOn(LocalDate today) {
        return effectiveStatus(today) == ChallengeStatus.ACTIVE
            && !today.isBefore(startDate)
            && !today.isAfter(endDate);
    }

    public boolean isDueForCompletion(LocalDate today) {
        return effectiveStatus(today) == ChallengeStatus.ACTIVE && today.isAfter(endDate);
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public boolean isOwnedBy(Long userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}
