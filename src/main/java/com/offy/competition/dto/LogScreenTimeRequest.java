package com.offy.competition.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogScreenTimeRequest {
    /** Blank means the day's total. */
    private String appName;

    /** Defaults to today. */
    private LocalDate date;

    @NotNull(message = "Minutes cannot be null")
    @Min(value = 0, message = "Minutes cannot be negative")
    private Integer minutes;
}
