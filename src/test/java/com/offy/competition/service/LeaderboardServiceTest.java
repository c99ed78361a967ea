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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LeaderboardServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 18);
    private static final LocalDate MONTH_START = LocalDate.of(2026, 10, 1);
    private static final String CACHE_KEY = "leaderboard:global:2026-10-18";

    @Mock
    private ScreenTimeLogRepository logRepository;

    @Mock
    private GoalRepository goalRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private LeaderboardCacheRepository cacheRepository;

    private LeaderboardService leaderboardService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC);
        leaderboardService = new LeaderboardService(logRepository, goalRepository, userRepository, cacheRepository,
            new StreakCalculator(), clock);
    }

    private static ScreenTimeLog log(long userId, String app, LocalDate date, int minutes) {
        return ScreenTimeLog.builder().userId(userId).appName(app).logDate(date).minutes(minutes).build();
    }

    private static AppUser user(long id, String username) {
        return AppUser.builder().id(id).username(username).build();
    }

    private void stubBoard(List<ScreenTimeLog> logs, List<Goal> goals, List<AppUser> users) {
        when(cacheRepository.get(CACHE_KEY)).thenReturn(Optional.empty());
        when(logRepository.findAllBetween(MONTH_START, TODAY)).thenReturn(logs);
        when(goalRepository.findByGoalTypeAndUserIds(eq(GoalType.DAILY), anyCollection())).thenReturn(goals);
        when(userRepository.findAllById(anyCollection())).thenReturn(users);
    }

    @Test
    void testGlobalLeaderboard_OrdersByStreakThenAverage() {
        // Arrange
        List<ScreenTimeLog> logs = new ArrayList<>();
        // alice: three consecutive days at 100, streak 3
        logs.add(log(1L, "Total", TODAY.minusDays(2), 100));
        logs.add(log(1L, "Total", TODAY.minusDays(1), 100));
        logs.add(log(1L, "Total", TODAY, 100));
        // bob: one day at 30, streak 1
        logs.add(log(2L, "Total", TODAY, 30));
        // carol: two days at 50, streak 2
        logs.add(log(3L, "Total", TODAY.minusDays(1), 50));
        logs.add(log(3L, "Total", TODAY, 50));
        // dave: two days at 40, streak 2, lower average than carol
        logs.add(log(4L, "Total", TODAY.minusDays(1), 40));
        logs.add(log(4L, "Total", TODAY, 40));
        stubBoard(logs, List.of(), List.of(user(1L, "alice"), user(2L, "bob"), user(3L, "carol"), user(4L, "dave")));

        // Act
        List<LeaderboardEntry> board = leaderboardService.globalLeaderboard(null);

        // Assert
        assertEquals(4, board.size());
        assertEquals("alice", board.get(0).getUsername());
        assertEquals(3, board.get(0).getStreak());
        assertEquals(1, board.get(0).getRank());
        assertEquals("dave", board.get(1).getUsername());
        assertEquals(2, board.get(1).getRank());
        assertEquals("carol", board.get(2).getUsername());
        assertEquals(3, board.get(2).getRank());
        assertEquals("bob", board.get(3).getUsername());
        assertEquals(4, board.get(3).getRank());
        assertEquals(30.0, board.get(3).getAveragePerDay());
        verify(cacheRepository).put(eq(CACHE_KEY), eq(board), eq(60));
    }

    @Test
    void testGlobalLeaderboard_GoalLimitsStreak() {
        // alice is over her 60 minute goal every day; bob has no goal
        List<ScreenTimeLog> logs = List.of(
            log(1L, "Total", TODAY.minusDays(1), 100),
            log(1L, "Total", TODAY, 100),
            log(2L, "Total", TODAY, 200));
        stubBoard(logs, List.of(Goal.builder().userId(1L).goalType(GoalType.DAILY).targetMinutes(60).build()),
            List.of(user(1L, "alice"), user(2L, "bob")));

        List<LeaderboardEntry> board = leaderboardService.globalLeaderboard(10);

        assertEquals("bob", board.get(0).getUsername());
        assertEquals(1, board.get(0).getStreak());
        assertEquals("alice", board.get(1).getUsername());
        assertEquals(0, board.get(1).getStreak());
    }

    @Test
    void testGlobalLeaderboard_UsersWithoutPositiveDaysExcluded() {
        List<ScreenTimeLog> logs = List.of(
            log(1L, "Total", TODAY, 45),
            log(2L, "Total", TODAY, 0));
        stubBoard(logs, List.of(), List.of(user(1L, "alice"), user(2L, "bob")));

        List<LeaderboardEntry> board = leaderboardService.globalLeaderboard(null);

        assertEquals(1, board.size());
        assertEquals(1L, board.get(0).getUserId());
        assertEquals(1, board.get(0).getDaysLogged());
    }

    @Test
    void testGlobalLeaderboard_AverageRoundedToOneDecimal() {
        List<ScreenTimeLog> logs = List.of(
            log(1L, "Total", TODAY.minusDays(2), 10),
            log(1L, "Total", TODAY.minusDays(1), 10),
            log(1L, "Total", TODAY, 11));
        stubBoard(logs, List.of(), List.of(user(1L, "alice")));

        LeaderboardEntry entry = leaderboardService.globalLeaderboard(null).get(0);

        assertEquals(31L, entry.getTotalMinutes());
        assertEquals(10.3, entry.getAveragePerDay());
    }

    @Test
    void testGlobalLeaderboard_LimitApplied() {
        List<LeaderboardEntry> cached = List.of(
            LeaderboardEntry.builder().userId(1L).rank(1).build(),
            LeaderboardEntry.builder().userId(2L).rank(2).build(),
            LeaderboardEntry.builder().userId(3L).rank(3).build());
        when(cacheRepository.get(CACHE_KEY)).thenReturn(Optional.of(cached));

        List<LeaderboardEntry> board = leaderboardService.globalLeaderboard(2);

        assertEquals(2, board.size());
        assertEquals(2L, board.get(1).getUserId());
        verifyNoInteractions(logRepository);
    }

    @Test
    void testGlobalLeaderboard_InvalidLimitRejected() {
        assertThrows(ValidationException.class, () -> leaderboardService.globalLeaderboard(0));
        assertThrows(ValidationException.class, () -> leaderboardService.globalLeaderboard(101));
        verifyNoInteractions(logRepository, cacheRepository);
    }

    @Test
    void testGlobalLeaderboard_CacheWriteFailureStillReturnsBoard() {
        stubBoard(List.of(log(1L, "Total", TODAY, 45)), List.of(), List.of(user(1L, "alice")));
        doThrow(new IllegalStateException("redis down")).when(cacheRepository).put(anyString(), anyList(), anyInt());

        assertEquals(1, leaderboardService.globalLeaderboard(null).size());
    }

    @Test
    void testGlobalLeaderboard_BoardEvictedDuringComputeIsNotCached() {
        // Arrange: a log write evicts the board while it is being computed
        List<ScreenTimeLog> logs = List.of(log(1L, "Total", TODAY, 45));
        when(cacheRepository.get(CACHE_KEY)).thenReturn(Optional.empty());
        when(logRepository.findAllBetween(MONTH_START, TODAY)).thenAnswer(inv -> {
            leaderboardService.evictCurrentBoard();
            return logs;
        });
        when(goalRepository.findByGoalTypeAndUserIds(eq(GoalType.DAILY), anyCollection())).thenReturn(List.of());
        when(userRepository.findAllById(anyCollection())).thenReturn(List.of(user(1L, "alice")));

        // Act
        List<LeaderboardEntry> board = leaderboardService.globalLeaderboard(null);

        // Assert
        assertEquals(1, board.size());
        verify(cacheRepository).evict(CACHE_KEY);
        verify(cacheRepository, never()).put(anyString(), anyList(), anyInt());
    }

    @Test
    void testGlobalLeaderboard_EvictionBeforeComputeStillCaches() {
        leaderboardService.evictCurrentBoard();
        stubBoard(List.of(log(1L, "Total", TODAY, 45)), List.of(), List.of(user(1L, "alice")));

        List<LeaderboardEntry> board = leaderboardService.globalLeaderboard(null);

        verify(cacheRepository).put(CACHE_KEY, board, 60);
    }

    @Test
    void testRefreshUserStreak_UpdatesStoredCounter() {
        AppUser alice = user(1L, "alice");
        when(logRepository.findByUserIdBetween(1L, MONTH_START, TODAY)).thenReturn(List.of(
            log(1L, "Total", TODAY.minusDays(1), 20),
            log(1L, "Total", TODAY, 20)));
        when(goalRepository.findByUserIdAndGoalType(1L, GoalType.DAILY)).thenReturn(Optional.empty());
        when(userRepository.findById(1L)).thenReturn(Optional.of(alice));

        int streak = leaderboardService.refreshUserStreak(1L);

        assertEquals(2, streak);
        assertEquals(2, alice.getStreakCount());
        verify(userRepository).save(alice);
    }

    @Test
    void testMonthToDate() {
        List<LocalDate> days = LeaderboardService.monthToDate(TODAY);

        assertEquals(18, days.size());
        assertEquals(MONTH_START, days.get(0));
        assertEquals(TODAY, days.get(17));
    }
}
