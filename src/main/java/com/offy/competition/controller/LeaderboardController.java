package com.offy.competition.controller;

import com.offy.competition.dto.GlobalLeaderboardResponse;
import com.offy.competition.model.LeaderboardEntry;
import com.offy.competition.service.LeaderboardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/leaderboard")
public class LeaderboardController {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);

    private final LeaderboardService leaderboardService;
    private final Clock clock;

    @Autowired
    public LeaderboardController(LeaderboardService leaderboardService, Clock clock) {
        this.leaderboardService = leaderboardService;
        this.clock = clock;
    }

    /**
     * Monthly global leaderboard.
     * GET /api/v1/leaderboard?limit=N
     */
    @GetMapping
    public ResponseEntity<GlobalLeaderboardResponse> getLeaderboard(
            @RequestParam(required = false) Integer limit) {

        logger.info("Received GET request for global leaderboard - limit: {}", limit);

        try {
            List<LeaderboardEntry> entries = leaderboardService.globalLeaderboard(limit);
            GlobalLeaderboardResponse response = GlobalLeaderboardResponse.builder()
                .entries(entries)
                .returnedUsers(entries.size())
                .retrievedAt(Instant.now(clock))
                .build();
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving global leaderboard - limit: {}, error: {}", limit, e.getMessage(), e);
            throw e;
        }
    }
}
