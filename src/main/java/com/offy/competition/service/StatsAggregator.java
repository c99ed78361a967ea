package com.offy.competition.service;

import com.offy.competition.model.Challenge;
import com.offy.competition.model.ChallengeParticipant;
import com.offy.competition.model.ParticipantStats;
import com.offy.competition.model.ScreenTimeLog;
import com.offy.competition.repository.ChallengeParticipantRepository;
import com.offy.competition.repository.ChallengeRepository;
import com.offy.competition.repository.ScreenTimeLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds a participant's challenge statistics from the screen time logs.
 */
@Service
public class StatsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(StatsAggregator.class);

    private final ChallengeRepository challengeRepository;
    private final ChallengeParticipantRepository participantRepository;
    private final ScreenTimeLogRepository logRepository;
    private final Clock clock;

    @Autowired
    public StatsAggregator(
            ChallengeRepository challengeRepository,
            ChallengeParticipantRepository participantRepository,
            ScreenTimeLogRepository logRepository,
            Clock clock) {
        this.challengeRepository = challengeRepository;
        this.participantRepository = participantRepository;
        this.logRepository = logRepository;
        this.clock = clock;
    }

    /**
     * Recomputes and persists the statistics of one participant. Does nothing (returns empty)
     * when the user has no accepted participation in the challenge, or the challenge is unknown,
     * completed or deleted.
     * The participant row is locked before the challenge is read. Finalization locks the same rows,
     * so a recompute either commits before the final ranks are computed or sees the challenge
     * completed and leaves the frozen stats alone.
     */
    @Transactional
    public Optional<ParticipantStats> recompute(Long challengeId, Long userId) {
        Optional<ChallengeParticipant> participant =
            participantRepository.findByChallengeIdAndUserIdForUpdate(challengeId, userId);
        if (participant.isEmpty() || !participant.get().isAccepted()) {
            logger.debug("Skipping recompute: user {} is not an accepted participant of challenge {}", userId, challengeId);
            return Optional.empty();
        }

        Optional<Challenge> challenge = challengeRepository.findById(challengeId);
        if (challenge.isEmpty()) {
            logger.debug("Skipping recompute: challenge {} not found", challengeId);
            return Optional.empty();
        }
        if (challenge.get().getStatus().isTerminal()) {
            logger.debug("Skipping recompute: challenge {} is {}", challengeId, challenge.get().getStatus());
            return Optional.empty();
        }

        List<ScreenTimeLog> logs = logRepository.findByUserIdBetween(
            userId, challenge.get().getStartDate(), challenge.get().getEndDate());
        ParticipantStats stats = computeStats(challenge.get(), logs, LocalDate.now(clock));

        ChallengeParticipant row = participant.get();
        row.applyStats(stats);
        participantRepository.save(row);

        logger.debug("Recomputed stats for user {} in challenge {}: {}", userId, challengeId, stats);
        return Optional.of(stats);
    }

    /**
     * Aggregates the logs that fall inside the challenge window and match its target app.
     * Rows are folded per day first, so several app rows on one day count as one logged day.
     * For an ALL target a day's "Total" row stands for the whole day and its app rows are
     * not added on top.
     */
    public static ParticipantStats computeStats(Challenge challenge, List<ScreenTimeLog> logs, LocalDate today) {
        List<ScreenTimeLog> matching = new ArrayList<>();
        for (ScreenTimeLog log : logs) {
            if (challenge.covers(log.getLogDate()) && challenge.getTargetApp().matches(log.getAppName())) {
                matching.add(log);
            }
        }
        Map<LocalDate, Integer> dayTotals = DayTotals.of(matching);

        if (dayTotals.isEmpty()) {
            return ParticipantStats.empty();
        }

        int target = challenge.getTargetMinutes();
        long total = 0L;
        int passed = 0;
        for (int dayTotal : dayTotals.values()) {
            total += dayTotal;
            if (dayTotal <= target) {
                passed++;
            }
        }

        Integer todayTotal = dayTotals.get(today);
        return ParticipantStats.builder()
            .daysLogged(dayTotals.size())
            .totalScreenTimeMinutes(total)
            .daysPassed(passed)
            .daysFailed(dayTotals.size() - passed)
            .todayMinutes(todayTotal == null ? 0 : todayTotal)
            .todayPassed(todayTotal == null ? null : todayTotal <= target)
            .build();
    }
}
