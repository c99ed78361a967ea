package com.offy.competition.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.offy.competition.model.ScreenTimeLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScreenTimeLogResponse {
    private Long logId;
    private Long userId;
    private String appName;
    private LocalDate date;
    private int minutes;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant updatedAt;

    public static ScreenTimeLogResponse from(ScreenTimeLog log) {
        return ScreenTimeLogResponse.builder()
            .logId(log.getId())
            .userId(log.getUserId())
            .appName(log.getAppName())
            .date(log.getLogDate())
            .minutes(log.getMinutes())
            .updatedAt(log.getUpdatedAt())
            .build();
    }
}
