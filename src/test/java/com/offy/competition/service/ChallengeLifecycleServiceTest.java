package com.offy.competition.service;

import com.offy.competition.event.ChallengeCompletedEvent;
import com.offy.competition.exception.NotFoundException;
import com.offy.competition.exception.ValidationException;
import com.offy.competition.model.AppUser;
import com.offy.competition.model.Challenge;
import com.offy.competition.model.ChallengeParticipant;
import com.offy.competition.model.ChallengeStanding;
import com.offy.competition.model.ChallengeStatus;
import com.offy.competition.model.ChallengeSummary;
import com.offy.competition.model.InvitationStatus;
import com.offy.competition.model.ParticipantStats;
import com.offy.competition.model.ScreenTimeLog;
import com.offy.competition.model.TargetApp;
import com.offy.competition.model.ZeroLogPolicy;
import com.offy.competition.repository.ChallengeParticipantRepository;
import com.offy.competition.repository.ChallengeRepository;
import com.offy.competition.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChallengeLifecycleServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 18);
    private static final Long OWNER_ID = 1L;
    private static final Long FRIEND_ID = 2L;

    @Mock
    private ChallengeRepository challengeRepository;

    @Mock
    private ChallengeParticipantRepository participantRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private StatsAggregator statsAggregator;

    @Mock
    private ChallengeFinalizer challengeFinalizer;

    @Mock
    private BadgeAwardService badgeAwardService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private ChallengeLifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC);
        lifecycleService = new ChallengeLifecycleService(challengeRepository, participantRepository, userRepository,
            statsAggregator, new RankingEngine(), challengeFinalizer, badgeAwardService, new AppCatalog(),
            eventPublisher, transactionManager, clock);
    }

    private static Challenge challenge(Long id, ChallengeStatus status, LocalDate start, LocalDate end, TargetApp target) {
        return Challenge.builder()
            .id(id)
            .name("Challenge " + id)
            .ownerId(OWNER_ID)
            .targetApp(target)
            .targetMinutes(60)
            .startDate(start)
            .endDate(end)
            .status(status)
            .build();
    }

    private static Challenge activeChallenge(Long id) {
        return challenge(id, ChallengeStatus.ACTIVE, TODAY.minusDays(2), TODAY.plusDays(5), TargetApp.all());
    }

    private static ChallengeParticipant participant(Long id, Long challengeId, Long userId, InvitationStatus status) {
        return ChallengeParticipant.builder()
            .id(id)
            .challengeId(challengeId)
            .userId(userId)
            .invitationStatus(status)
            .build();
    }

    @Test
    void testCreateChallenge_StartingTodayIsActiveWithOwnerAccepted() {
        // Arrange
        when(challengeRepository.save(any(Challenge.class))).thenAnswer(inv -> {
            Challenge c = inv.getArgument(0);
            c.setId(10L);
            return c;
        });
        when(participantRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

        // Act
        Challenge created = lifecycleService.createChallenge(OWNER_ID, "  No TikTok  ", null, "tiktok", 30,
            TODAY, TODAY.plusDays(6), null);

        // Assert
        assertEquals(10L, created.getId());
        assertEquals("No TikTok", created.getName());
        assertEquals(ChallengeStatus.ACTIVE, created.getStatus());
        assertEquals(TargetApp.specific("TikTok"), created.getTargetApp());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChallengeParticipant>> participants = ArgumentCaptor.forClass(List.class);
        verify(participantRepository).saveAll(participants.capture());
        assertEquals(1, participants.getValue().size());
        assertEquals(OWNER_ID, participants.getValue().get(0).getUserId());
        assertEquals(InvitationStatus.ACCEPTED, participants.getValue().get(0).getInvitationStatus());
        verify(statsAggregator).recompute(10L, OWNER_ID);
    }

    @Test
    void testCreateChallenge_FutureStartIsUpcomingWithPendingInvitees() {
        when(userRepository.findAllById(anyCollection()))
            .thenReturn(List.of(AppUser.builder().id(FRIEND_ID).username("friend").build()));
        when(challengeRepository.save(any(Challenge.class))).thenAnswer(inv -> {
            Challenge c = inv.getArgument(0);
            c.setId(11L);
            return c;
        });
        when(participantRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));

        Challenge created = lifecycleService.createChallenge(OWNER_ID, "Screen diet", "less phone", "ALL", 120,
            TODAY.plusDays(1), TODAY.plusDays(7), List.of(FRIEND_ID, FRIEND_ID, OWNER_ID));

        assertEquals(ChallengeStatus.UPCOMING, created.getStatus());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChallengeParticipant>> participants = ArgumentCaptor.forClass(List.class);
        verify(participantRepository).saveAll(participants.capture());
        assertEquals(2, participants.getValue().size());
        assertEquals(InvitationStatus.PENDING, participants.getValue().get(1).getInvitationStatus());
        verifyNoInteractions(statsAggregator);
    }

    @Test
    void testCreateChallenge_InvalidScheduleRejected() {
        assertThrows(ValidationException.class, () -> lifecycleService.createChallenge(OWNER_ID, "x", null, "ALL", 60,
            TODAY.minusDays(1), TODAY.plusDays(3), null));
        assertThrows(ValidationException.class, () -> lifecycleService.createChallenge(OWNER_ID, "x", null, "ALL", 60,
            TODAY.plusDays(3), TODAY.plusDays(1), null));
        assertThrows(ValidationException.class, () -> lifecycleService.createChallenge(OWNER_ID, "x", null, "ALL", -1,
            TODAY, TODAY.plusDays(1), null));
        assertThrows(ValidationException.class, () -> lifecycleService.createChallenge(OWNER_ID, " ", null, "ALL", 60,
            TODAY, TODAY.plusDays(1), null));
        assertThrows(ValidationException.class, () -> lifecycleService.createChallenge(OWNER_ID, "x", null, "Snapchat", 60,
            TODAY, TODAY.plusDays(1), null));

        verifyNoInteractions(challengeRepository, participantRepository);
    }

    @Test
    void testCreateChallenge_UnknownInviteeRejected() {
        when(userRepository.findAllById(anyCollection())).thenReturn(List.of());

        ValidationException ex = assertThrows(ValidationException.class, () -> lifecycleService.createChallenge(
            OWNER_ID, "x", null, "ALL", 60, TODAY, TODAY.plusDays(1), List.of(99L)));

        assertTrue(ex.getMessage().contains("99"));
        verifyNoInteractions(challengeRepository);
    }

    @Test
    void testLeaveChallenge_OwnerCannotLeave() {
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));
        when(participantRepository.findByChallengeIdAndUserId(10L, OWNER_ID))
            .thenReturn(Optional.of(participant(100L, 10L, OWNER_ID, InvitationStatus.ACCEPTED)));

        assertThrows(ValidationException.class, () -> lifecycleService.leaveChallenge(10L, OWNER_ID));
        verify(participantRepository, never()).delete(any());
    }

    @Test
    void testLeaveChallenge_MemberLeaves() {
        ChallengeParticipant row = participant(101L, 10L, FRIEND_ID, InvitationStatus.ACCEPTED);
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));
        when(participantRepository.findByChallengeIdAndUserId(10L, FRIEND_ID)).thenReturn(Optional.of(row));

        lifecycleService.leaveChallenge(10L, FRIEND_ID);

        verify(participantRepository).delete(row);
    }

    @Test
    void testRespondToInvitation_UnknownInvitation() {
        when(participantRepository.findById(5L)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> lifecycleService.respondToInvitation(5L, FRIEND_ID, true));
    }

    @Test
    void testRespondToInvitation_OnlyInviteeMayAnswer() {
        when(participantRepository.findById(5L))
            .thenReturn(Optional.of(participant(5L, 10L, FRIEND_ID, InvitationStatus.PENDING)));

        assertThrows(ValidationException.class, () -> lifecycleService.respondToInvitation(5L, 3L, true));
        verify(participantRepository, never()).save(any());
    }

    @Test
    void testRespondToInvitation_AcceptBackfillsStatsAndAwardsBadge() {
        ChallengeParticipant invitation = participant(5L, 10L, FRIEND_ID, InvitationStatus.PENDING);
        when(participantRepository.findById(5L)).thenReturn(Optional.of(invitation));
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));
        when(participantRepository.save(any(ChallengeParticipant.class))).thenAnswer(inv -> inv.getArgument(0));
        when(statsAggregator.recompute(10L, FRIEND_ID)).thenReturn(Optional.of(ParticipantStats.builder()
            .daysLogged(2)
            .totalScreenTimeMinutes(90L)
            .daysPassed(2)
            .build()));

        ChallengeParticipant result = lifecycleService.respondToInvitation(5L, FRIEND_ID, true);

        assertEquals(InvitationStatus.ACCEPTED, result.getInvitationStatus());
        assertNotNull(result.getJoinedAt());
        assertEquals(2, result.getDaysLogged());
        assertEquals(90L, result.getTotalScreenTimeMinutes());
        verify(badgeAwardService).awardQuietly(FRIEND_ID, BadgeAwardService.CHALLENGE_ACCEPTED);
    }

    @Test
    void testRespondToInvitation_DeclineSkipsStatsAndBadge() {
        when(participantRepository.findById(5L))
            .thenReturn(Optional.of(participant(5L, 10L, FRIEND_ID, InvitationStatus.PENDING)));
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));
        when(participantRepository.save(any(ChallengeParticipant.class))).thenAnswer(inv -> inv.getArgument(0));

        ChallengeParticipant result = lifecycleService.respondToInvitation(5L, FRIEND_ID, false);

        assertEquals(InvitationStatus.DECLINED, result.getInvitationStatus());
        verifyNoInteractions(statsAggregator, badgeAwardService);
    }

    @Test
    void testRespondToInvitation_AlreadyAnswered() {
        when(participantRepository.findById(5L))
            .thenReturn(Optional.of(participant(5L, 10L, FRIEND_ID, InvitationStatus.DECLINED)));
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));

        assertThrows(ValidationException.class, () -> lifecycleService.respondToInvitation(5L, FRIEND_ID, true));
    }

    @Test
    void testInviteUsers_CompletedChallengeRejected() {
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(
            challenge(10L, ChallengeStatus.COMPLETED, TODAY.minusDays(9), TODAY.minusDays(2), TargetApp.all())));

        assertThrows(ValidationException.class, () -> lifecycleService.inviteUsers(10L, OWNER_ID, List.of(FRIEND_ID)));
        verify(participantRepository, never()).save(any());
    }

    @Test
    void testInviteUsers_NonOwnerRejected() {
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));

        assertThrows(ValidationException.class, () -> lifecycleService.inviteUsers(10L, FRIEND_ID, List.of(3L)));
    }

    @Test
    void testInviteUsers_SkipsExistingMembers() {
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));
        when(userRepository.findAllById(anyCollection())).thenReturn(List.of(
            AppUser.builder().id(FRIEND_ID).build(),
            AppUser.builder().id(3L).build()));
        when(participantRepository.findByChallengeIdAndUserId(10L, FRIEND_ID))
            .thenReturn(Optional.of(participant(101L, 10L, FRIEND_ID, InvitationStatus.PENDING)));
        when(participantRepository.findByChallengeIdAndUserId(10L, 3L)).thenReturn(Optional.empty());

        int invited = lifecycleService.inviteUsers(10L, OWNER_ID, List.of(FRIEND_ID, 3L));

        assertEquals(1, invited);
        verify(participantRepository).save(argThat(p -> p.getUserId().equals(3L)
            && p.getInvitationStatus() == InvitationStatus.PENDING));
    }

    @Test
    void testDeleteChallenge_CompletedRejected() {
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(
            challenge(10L, ChallengeStatus.COMPLETED, TODAY.minusDays(9), TODAY.minusDays(2), TargetApp.all())));

        assertThrows(ValidationException.class, () -> lifecycleService.deleteChallenge(10L, OWNER_ID));
        verify(challengeRepository, never()).save(any());
    }

    @Test
    void testDeleteChallenge_SoftDeletes() {
        Challenge challenge = activeChallenge(10L);
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(challenge));

        lifecycleService.deleteChallenge(10L, OWNER_ID);

        assertEquals(ChallengeStatus.DELETED, challenge.getStatus());
        verify(challengeRepository).save(challenge);
    }

    @Test
    void testListChallenges_FinalizationFailureDoesNotHideOtherChallenges() {
        // Arrange: challenge 10 ended yesterday and its completion fails, challenge 11 is running
        Challenge expired = challenge(10L, ChallengeStatus.ACTIVE, TODAY.minusDays(7), TODAY.minusDays(1), TargetApp.all());
        Challenge running = activeChallenge(11L);
        when(participantRepository.findByUserId(OWNER_ID)).thenReturn(List.of(
            participant(100L, 10L, OWNER_ID, InvitationStatus.ACCEPTED),
            participant(101L, 11L, OWNER_ID, InvitationStatus.ACCEPTED)));
        when(challengeRepository.findAllById(any())).thenReturn(List.of(expired, running));
        when(challengeFinalizer.finalizeChallenge(10L)).thenThrow(new RuntimeException("deadlock"));

        // Act
        List<ChallengeSummary> summaries = lifecycleService.listChallenges(OWNER_ID);

        // Assert
        assertEquals(2, summaries.size());
        assertEquals(ChallengeStatus.ACTIVE, summaries.get(0).getChallenge().getStatus());
        verify(challengeFinalizer, never()).finalizeChallenge(11L);
        verifyNoInteractions(badgeAwardService, eventPublisher);
    }

    @Test
    void testListChallenges_CompletesExpiredChallengeAndSkipsDeleted() {
        Challenge expired = challenge(10L, ChallengeStatus.ACTIVE, TODAY.minusDays(7), TODAY.minusDays(1), TargetApp.all());
        Challenge deleted = challenge(12L, ChallengeStatus.DELETED, TODAY, TODAY.plusDays(3), TargetApp.all());
        Challenge completed = challenge(10L, ChallengeStatus.COMPLETED, TODAY.minusDays(7), TODAY.minusDays(1), TargetApp.all());

        ChallengeParticipant ranked = participant(100L, 10L, OWNER_ID, InvitationStatus.ACCEPTED);
        ranked.setDaysLogged(3);
        ranked.setFinalRank(1);
        ranked.setWinner(true);
        ranked.setChallengeCompleted(true);

        when(participantRepository.findByUserId(OWNER_ID)).thenReturn(List.of(
            participant(100L, 10L, OWNER_ID, InvitationStatus.ACCEPTED),
            participant(102L, 12L, OWNER_ID, InvitationStatus.ACCEPTED)));
        when(challengeRepository.findAllById(any())).thenReturn(List.of(expired, deleted));
        when(challengeFinalizer.finalizeChallenge(10L)).thenReturn(Optional.of(List.of(ranked)));
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(completed));
        when(participantRepository.findByChallengeIdAndUserId(10L, OWNER_ID)).thenReturn(Optional.of(ranked));

        List<ChallengeSummary> summaries = lifecycleService.listChallenges(OWNER_ID);

        assertEquals(1, summaries.size());
        assertEquals(ChallengeStatus.COMPLETED, summaries.get(0).getChallenge().getStatus());
        assertTrue(summaries.get(0).getParticipant().isWinner());
        verify(badgeAwardService).awardQuietly(OWNER_ID, BadgeAwardService.COMPLETED_CHALLENGE);
        verify(eventPublisher).publishEvent(any(ChallengeCompletedEvent.class));
    }

    @Test
    void testGetChallengeLeaderboard_LiveStandingsRankedByAverage() {
        ChallengeParticipant owner = participant(100L, 10L, OWNER_ID, InvitationStatus.ACCEPTED);
        owner.setDaysLogged(3);
        owner.setTotalScreenTimeMinutes(100L);
        ChallengeParticipant friend = participant(101L, 10L, FRIEND_ID, InvitationStatus.ACCEPTED);
        friend.setDaysLogged(2);
        friend.setTotalScreenTimeMinutes(40L);
        ChallengeParticipant pending = participant(102L, 10L, 3L, InvitationStatus.PENDING);

        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));
        when(participantRepository.findByChallengeIdAndUserId(10L, OWNER_ID)).thenReturn(Optional.of(owner));
        when(participantRepository.findByChallengeId(10L)).thenReturn(List.of(owner, friend, pending));
        when(userRepository.findAllById(anyCollection())).thenReturn(List.of(
            AppUser.builder().id(OWNER_ID).username("owner").build(),
            AppUser.builder().id(FRIEND_ID).username("friend").build()));
        when(challengeFinalizer.getZeroLogPolicy()).thenReturn(ZeroLogPolicy.RANK_AS_ZERO_AVERAGE);

        List<ChallengeStanding> standings = lifecycleService.getChallengeLeaderboard(10L, OWNER_ID);

        assertEquals(2, standings.size());
        assertEquals("friend", standings.get(0).getUsername());
        assertEquals(1, standings.get(0).getRank());
        assertTrue(standings.get(0).isWinner());
        assertEquals(20.0, standings.get(0).getAverageDailyMinutes());
        assertEquals(2, standings.get(1).getRank());
        assertEquals(33.33, standings.get(1).getAverageDailyMinutes());
    }

    @Test
    void testGetChallengeLeaderboard_NonParticipantRejected() {
        when(challengeRepository.findById(10L)).thenReturn(Optional.of(activeChallenge(10L)));
        when(participantRepository.findByChallengeIdAndUserId(10L, 42L)).thenReturn(Optional.empty());

        assertThrows(ValidationException.class, () -> lifecycleService.getChallengeLeaderboard(10L, 42L));
    }

    @Test
    void testOnLogWritten_FailureInOneChallengeDoesNotStopOthers() {
        ScreenTimeLog log = ScreenTimeLog.builder().id(1L).userId(OWNER_ID).appName("TikTok").logDate(TODAY).minutes(30).build();
        Challenge failing = activeChallenge(10L);
        Challenge healthy = activeChallenge(11L);
        Challenge otherApp = challenge(12L, ChallengeStatus.ACTIVE, TODAY.minusDays(1), TODAY.plusDays(1),
            TargetApp.specific("Instagram"));
        when(challengeRepository.findOpenChallengesForAcceptedUser(OWNER_ID, TODAY))
            .thenReturn(List.of(failing, healthy, otherApp));
        when(statsAggregator.recompute(10L, OWNER_ID)).thenThrow(new RuntimeException("lock timeout"));
        when(statsAggregator.recompute(11L, OWNER_ID)).thenReturn(Optional.of(ParticipantStats.empty()));

        int recomputed = lifecycleService.onLogWritten(log);

        assertEquals(1, recomputed);
        verify(statsAggregator, never()).recompute(12L, OWNER_ID);
    }

    @Test
    void testOnLogWritten_UpcomingChallengeNotStartedIsSkipped() {
        ScreenTimeLog log = ScreenTimeLog.builder().id(1L).userId(OWNER_ID).appName("Total").logDate(TODAY).minutes(30).build();
        Challenge upcoming = challenge(10L, ChallengeStatus.UPCOMING, TODAY.plusDays(1), TODAY.plusDays(4), TargetApp.all());
        when(challengeRepository.findOpenChallengesForAcceptedUser(OWNER_ID, TODAY)).thenReturn(List.of(upcoming));

        assertEquals(0, lifecycleService.onLogWritten(log));
        verifyNoInteractions(statsAggregator);
    }
}
