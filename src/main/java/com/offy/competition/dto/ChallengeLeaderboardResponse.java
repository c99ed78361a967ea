package com.offy.competition.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.offy.competition.model.ChallengeStanding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeLeaderboardResponse {
    private Long challengeId;
    private List<ChallengeStanding> standings;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}
