package com.offy.competition.service;

import com.offy.competition.exception.ValidationException;
import com.offy.competition.model.ScreenTimeLog;
import com.offy.competition.repository.ScreenTimeLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Accepts daily screen time entries. The log row is committed first; challenge stats, the
 * cached leaderboard and the user's streak are refreshed afterwards on a best-effort basis.
 */
@Service
public class ScreenTimeLogService {

    private static final Logger logger = LoggerFactory.getLogger(ScreenTimeLogService.class);

    private final ScreenTimeLogRepository logRepository;
    private final ChallengeLifecycleService challengeLifecycleService;
    private final LeaderboardService leaderboardService;
    private final AppCatalog appCatalog;
    private final Clock clock;

    @Autowired
    public ScreenTimeLogService(
            ScreenTimeLogRepository logRepository,
            ChallengeLifecycleService challengeLifecycleService,
            LeaderboardService leaderboardService,
            AppCatalog appCatalog,
            Clock clock) {
        this.logRepository = logRepository;
        this.challengeLifecycleService = challengeLifecycleService;
        this.leaderboardService = leaderboardService;
        this.appCatalog = appCatalog;
        this.clock = clock;
    }

    /**
     * Creates or overwrites the (user, app, date) entry. A missing date means today.
     */
    public ScreenTimeLog logScreenTime(Long userId, String appName, LocalDate date, Integer minutes) {
        if (userId == null) {
            throw new ValidationException("User id is required");
        }
        if (minutes == null) {
            throw new ValidationException("Minutes are required");
        }
        if (minutes < 0) {
            throw new ValidationException("Minutes cannot be negative");
        }

        LocalDate today = LocalDate.now(clock);
        LocalDate logDate = date == null ? today : date;
        if (logDate.isAfter(today)) {
            throw new ValidationException("Cannot log screen time for a future date");
        }
        String app = appCatalog.canonicalize(appName);

        ScreenTimeLog saved;
        try {
            saved = upsert(userId, app, logDate, minutes);
        } catch (DataIntegrityViolationException e) {
            // lost an insert race on the unique key; the row exists now
            logger.debug("Concurrent insert for user {} app {} on {}, retrying as update", userId, app, logDate);
            saved = upsert(userId, app, logDate, minutes);
        }
        logger.info("Logged {} minutes of {} for user {} on {}", minutes, app, userId, logDate);

        refreshDerivedState(saved);
        return saved;
    }

    private ScreenTimeLog upsert(Long userId, String app, LocalDate logDate, int minutes) {
        Instant now = Instant.now(clock);
        ScreenTimeLog log = logRepository.findByUserIdAndAppNameAndLogDate(userId, app, logDate)
            .orElseGet(() -> ScreenTimeLog.builder()
                .userId(userId)
                .appName(app)
                .logDate(logDate)
                .createdAt(now)
                .build());
        log.setMinutes(minutes);
        log.setUpdatedAt(now);
        return logRepository.save(log);
    }

    private void refreshDerivedState(ScreenTimeLog log) {
        try {
            int refreshed = challengeLifecycleService.onLogWritten(log);
            logger.debug("Log {} refreshed {} challenge participations", log.getId(), refreshed);
        } catch (Exception e) {
            logger.error("Challenge refresh failed after log {} of user {}: {}", log.getId(), log.getUserId(), e.getMessage(), e);
        }

        try {
            leaderboardService.evictCurrentBoard();
        } catch (Exception e) {
            logger.warn("Failed to evict cached leaderboard after log {}", log.getId(), e);
        }

        try {
            leaderboardService.refreshUserStreak(log.getUserId());
        } catch (Exception e) {
            logger.warn("Failed to refresh streak of user {}", log.getUserId(), e);
        }
    }
}
