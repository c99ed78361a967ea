package com.offy.competition.service;

import com.offy.competition.exception.ValidationException;
import com.offy.competition.model.AppUser;
import com.offy.competition.model.Goal;
import com.offy.competition.model.GoalType;
import com.offy.competition.model.LeaderboardEntry;
import com.offy.competition.model.ScreenTimeLog;
import com.offy.competition.repository.GoalRepository;
import com.offy.competition.repository.LeaderboardCacheRepository;
import com.offy.competition.repository.ScreenTimeLogRepository;
import com.offy.competition.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Global monthly leaderboard: longest goal-aware streak first, then lowest average daily usage.
 * Only the current calendar month up to today counts, and users without a logged day are left out.
 */
@Service
public class LeaderboardService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);

    static final String CACHE_KEY_PREFIX = "leaderboard:global:";

    static final Comparator<LeaderboardEntry> BOARD_ORDER = Comparator
        .comparingInt(LeaderboardEntry::getStreak).reversed()
        .thenComparing(LeaderboardEntry::getAveragePerDay, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(LeaderboardEntry::getUsername, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(LeaderboardEntry::getUserId);

    private final ScreenTimeLogRepository logRepository;
    private final GoalRepository goalRepository;
    private final UserRepository userRepository;
    private final LeaderboardCacheRepository cacheRepository;
    private final StreakCalculator streakCalculator;
    private final Clock clock;
    private final AtomicLong boardGeneration = new AtomicLong();

    @Value("${competition.leaderboard.default-limit:50}")
    private int defaultLimit = 50;

    @Value("${competition.leaderboard.max-limit:100}")
    private int maxLimit = 100;

    @Value("${competition.leaderboard.cache-ttl-seconds:60}")
    private int cacheTtlSeconds = 60;

    @Autowired
    public LeaderboardService(
            ScreenTimeLogRepository logRepository,
            GoalRepository goalRepository,
            UserRepository userRepository,
            LeaderboardCacheRepository cacheRepository,
            StreakCalculator streakCalculator,
            Clock clock) {
        this.logRepository = logRepository;
        this.goalRepository = goalRepository;
        this.userRepository = userRepository;
        this.cacheRepository = cacheRepository;
        this.streakCalculator = streakCalculator;
        this.clock = clock;
    }

    /**
     * Top {@code limit} users of the current month. A null limit means the configured default;
     * anything outside 1..max is rejected.
     */
    public List<LeaderboardEntry> globalLeaderboard(Integer limit) {
        int effectiveLimit = validateLimit(limit);
        List<LeaderboardEntry> board = rankedBoard();
        return board.size() > effectiveLimit ? new ArrayList<>(board.subList(0, effectiveLimit)) : board;
    }

    private int validateLimit(Integer limit) {
        if (limit == null) {
            return defaultLimit;
        }
        if (limit < 1) {
            throw new ValidationException("Limit must be at least 1");
        }
        if (limit > maxLimit) {
            throw new ValidationException("Limit cannot exceed " + maxLimit);
        }
        return limit;
    }

    /**
     * Cache-first read. A board computed while an eviction happened on this instance is returned
     * but not cached, since it may predate the write that caused the eviction. Evictions from
     * other instances are not seen here; such a board stays stale for at most cache-ttl-seconds.
     */
    private List<LeaderboardEntry> rankedBoard() {
        String cacheKey = currentCacheKey();
        Optional<List<LeaderboardEntry>> cached = cacheRepository.get(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Leaderboard cache hit for {}", cacheKey);
            return cached.get();
        }

        long generation = boardGeneration.get();
        List<LeaderboardEntry> board = computeBoard();
        if (boardGeneration.get() != generation) {
            logger.debug("Leaderboard {} was evicted while computing, not caching it", cacheKey);
            return board;
        }
        try {
            cacheRepository.put(cacheKey, board, cacheTtlSeconds);
        } catch (Exception e) {
            logger.warn("Failed to cache leaderboard under {}", cacheKey, e);
        }
        return board;
    }

    /**
     * Computes the board over all users with logs this month. Every position gets its own rank.
     */
    List<LeaderboardEntry> computeBoard() {
        LocalDate today = LocalDate.now(clock);
        List<LocalDate> days = monthToDate(today);
        List<ScreenTimeLog> logs = logRepository.findAllBetween(days.get(0), today);

        Map<Long, List<ScreenTimeLog>> logsByUser = logs.stream()
            .collect(Collectors.groupingBy(ScreenTimeLog::getUserId));
        Map<Long, Integer> dailyGoals = goalRepository.findByGoalTypeAndUserIds(GoalType.DAILY, logsByUser.keySet())
            .stream()
            .collect(Collectors.toMap(Goal::getUserId, Goal::getTargetMinutes, (a, b) -> a));
        Map<Long, String> usernames = userRepository.findAllById(logsByUser.keySet()).stream()
            .collect(Collectors.toMap(AppUser::getId, AppUser::getUsername));

        List<LeaderboardEntry> entries = new ArrayList<>();
        for (Map.Entry<Long, List<ScreenTimeLog>> userLogs : logsByUser.entrySet()) {
            Long userId = userLogs.getKey();
            monthlyEntry(userId, usernames.get(userId), userLogs.getValue(), days, dailyGoals.get(userId))
                .ifPresent(entries::add);
        }

        entries.sort(BOARD_ORDER);
        List<LeaderboardEntry> ranked = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            ranked.add(entries.get(i).toBuilder().rank(i + 1).build());
        }

        logger.debug("Computed global leaderboard for {} with {} users from {} logs", today, ranked.size(), logs.size());
        return ranked;
    }

    /**
     * Month-to-date statistics of one user, empty when the user has not logged a positive day.
     */
    public Optional<LeaderboardEntry> monthlyStats(Long userId) {
        LocalDate today = LocalDate.now(clock);
        List<LocalDate> days = monthToDate(today);
        List<ScreenTimeLog> logs = logRepository.findByUserIdBetween(userId, days.get(0), today);
        Integer dailyGoal = goalRepository.findByUserIdAndGoalType(userId, GoalType.DAILY)
            .map(Goal::getTargetMinutes)
            .orElse(null);
        String username = userRepository.findById(userId).map(AppUser::getUsername).orElse(null);
        return monthlyEntry(userId, username, logs, days, dailyGoal);
    }

    /**
     * Rewrites the user's cached streak counter from the logs.
     */
    public int refreshUserStreak(Long userId) {
        int streak = monthlyStats(userId).map(LeaderboardEntry::getStreak).orElse(0);
        userRepository.findById(userId).ifPresent(user -> {
            if (user.getStreakCount() != streak) {
                user.setStreakCount(streak);
                userRepository.save(user);
                logger.debug("Refreshed streak of user {} to {}", userId, streak);
            }
        });
        return streak;
    }

    public void evictCurrentBoard() {
        boardGeneration.incrementAndGet();
        cacheRepository.evict(currentCacheKey());
    }

    private Optional<LeaderboardEntry> monthlyEntry(Long userId, String username, List<ScreenTimeLog> logs,
                                                    List<LocalDate> days, Integer dailyGoal) {
        Map<LocalDate, Integer> positiveDays = new TreeMap<>();
        DayTotals.of(logs).forEach((day, minutes) -> {
            if (minutes > 0) {
                positiveDays.put(day, minutes);
            }
        });
        if (positiveDays.isEmpty()) {
            return Optional.empty();
        }

        long totalMinutes = positiveDays.values().stream().mapToLong(Integer::longValue).sum();
        int daysLogged = positiveDays.size();
        double average = BigDecimal.valueOf(totalMinutes)
            .divide(BigDecimal.valueOf(daysLogged), 1, RoundingMode.HALF_UP)
            .doubleValue();

        return Optional.of(LeaderboardEntry.builder()
            .userId(userId)
            .username(username)
            .streak(streakCalculator.longestStreak(days, positiveDays, dailyGoal))
            .averagePerDay(average)
            .totalMinutes(totalMinutes)
            .daysLogged(daysLogged)
            .build());
    }

    static List<LocalDate> monthToDate(LocalDate today) {
        List<LocalDate> days = new ArrayList<>(today.getDayOfMonth());
        for (LocalDate day = today.withDayOfMonth(1); !day.isAfter(today); day = day.plusDays(1)) {
            days.add(day);
        }
        return days;
    }

    private String currentCacheKey() {
        return CACHE_KEY_PREFIX + LocalDate.now(clock);
    }
}
