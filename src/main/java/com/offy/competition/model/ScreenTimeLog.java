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
@Table(name = "screen_time_logs",
    uniqueConstraints = @UniqueConstraint(name = "uq_log_user_app_date", columnNames = {"user_id", "app_name", "log_date"}),
    indexes = {
        @Index(name = "idx_log_user_date", columnList = "user_id,log_date"),
        @Index(name = "idx_log_date", columnList = "log_date")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreenTimeLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "log_id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "app_name", nullable = false, length = 120)
    private String appName;

    @Column(name = "log_date", nullable = false)
    private LocalDate logDate;

    @Column(name = "screen_time_minutes", nullable = false)
    private int minutes;

    @Column(name = "created_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;
}
