package com.offy.competition.service;

import com.offy.competition.event.ChallengeCompletedEvent;
import com.offy.competition.exception.AggregationFailureException;
import com.offy.competition.exception.FinalizationFailureException;
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
import com.offy.competition.model.RankedEntry;
import com.offy.competition.model.RankingCandidate;
import com.offy.competition.model.ScreenTimeLog;
import com.offy.competition.model.TargetApp;
import com.offy.competition.repository.ChallengeParticipantRepository;
import com.offy.competition.repository.ChallengeRepository;
import com.offy.competition.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives challenges through upcoming, active, completed and deleted.
 * <p>
 * There is no scheduler: an active challenge past its end date is completed by whichever
 * read touches it first. Each completion runs in its own transaction and a failure there is
 * logged without affecting the other challenges of the same request.
 */
@Service
public class ChallengeLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeLifecycleService.class);

    static final int MAX_NAME_LENGTH = 200;

    private final ChallengeRepository challengeRepository;
    private final ChallengeParticipantRepository participantRepository;
    private final UserRepository userRepository;
    private final StatsAggregator statsAggregator;
    private final RankingEngine rankingEngine;
    private final ChallengeFinalizer challengeFinalizer;
    private final BadgeAwardService badgeAwardService;
    private final AppCatalog appCatalog;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Autowired
    public ChallengeLifecycleService(
            ChallengeRepository challengeRepository,
            ChallengeParticipantRepository participantRepository,
            UserRepository userRepository,
            StatsAggregator statsAggregator,
            RankingEngine rankingEngine,
            ChallengeFinalizer challengeFinalizer,
            BadgeAwardService badgeAwardService,
            AppCatalog appCatalog,
            ApplicationEventPublisher eventPublisher,
            PlatformTransactionManager transactionManager,
            Clock clock) {
        this.challengeRepository = challengeRepository;
        this.participantRepository = participantRepository;
        this.userRepository = userRepository;
        this.statsAggregator = statsAggregator;
        this.rankingEngine = rankingEngine;
        this.challengeFinalizer = challengeFinalizer;
        this.badgeAwardService = badgeAwardService;
        this.appCatalog = appCatalog;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Creates a challenge owned by {@code ownerId}. The owner joins as an accepted participant,
     * every invited user as pending.
     */
    public Challenge createChallenge(Long ownerId, String name, String description, String targetApp,
                                     Integer targetMinutes, LocalDate startDate, LocalDate endDate,
                                     List<Long> invitedUserIds) {
        LocalDate today = today();
        String validName = validateName(name);
        TargetApp target = appCatalog.parseTarget(targetApp);
        validateSchedule(targetMinutes, startDate, endDate, today);
        Set<Long> invitees = distinctInvitees(invitedUserIds, ownerId);
        validateUsersExist(invitees);

        ChallengeStatus initialStatus = startDate.isEqual(today) ? ChallengeStatus.ACTIVE : ChallengeStatus.UPCOMING;
        Instant now = Instant.now(clock);

        Challenge created = transactionTemplate.execute(status -> {
            Challenge challenge = challengeRepository.save(Challenge.builder()
                .name(validName)
                .description(description)
                .ownerId(ownerId)
                .targetApp(target)
                .targetMinutes(targetMinutes)
                .startDate(startDate)
                .endDate(endDate)
                .status(initialStatus)
                .createdAt(now)
                .build());

            List<ChallengeParticipant> participants = new ArrayList<>();
            participants.add(ChallengeParticipant.builder()
                .challengeId(challenge.getId())
                .userId(ownerId)
                .invitationStatus(InvitationStatus.ACCEPTED)
                .joinedAt(now)
                .build());
            for (Long inviteeId : invitees) {
                participants.add(newInvitation(challenge.getId(), inviteeId));
            }
            participantRepository.saveAll(participants);
            return challenge;
        });

        logger.info("Created challenge {} '{}' for owner {} (target {}, {} min, {}..{}, status {}, {} invited)",
            created.getId(), validName, ownerId, target, targetMinutes, startDate, endDate, initialStatus, invitees.size());

        if (initialStatus == ChallengeStatus.ACTIVE) {
            // the owner may already have logged time today
            recomputeQuietly(created.getId(), ownerId);
        }
        return created;
    }

    /**
     * Every challenge the user belongs to, excluding deleted ones, with the user's own row.
     */
    public List<ChallengeSummary> listChallenges(Long userId) {
        List<ChallengeParticipant> participations = participantRepository.findByUserId(userId);
        if (participations.isEmpty()) {
            return new ArrayList<>();
        }

        Map<Long, Challenge> challengesById = challengeRepository.findAllById(
                participations.stream().map(ChallengeParticipant::getChallengeId).collect(Collectors.toList()))
            .stream()
            .collect(Collectors.toMap(Challenge::getId, Function.identity()));

        List<ChallengeSummary> summaries = new ArrayList<>();
        for (ChallengeParticipant participation : participations) {
            Challenge challenge = challengesById.get(participation.getChallengeId());
            if (challenge == null) {
                continue;
            }

            Challenge current = finalizeIfExpired(challenge);
            if (current.getStatus() == ChallengeStatus.DELETED) {
                continue;
            }

            ChallengeParticipant row = current == challenge
                ? participation
                : participantRepository.findByChallengeIdAndUserId(current.getId(), userId).orElse(participation);
            summaries.add(ChallengeSummary.builder().challenge(current).participant(row).build());
        }

        logger.debug("Listed {} challenges for user {}", summaries.size(), userId);
        return summaries;
    }

    public ChallengeSummary getChallenge(Long challengeId, Long userId) {
        Challenge challenge = finalizeIfExpired(findChallenge(challengeId));
        ChallengeParticipant participant = findParticipation(challengeId, userId);
        return ChallengeSummary.builder().challenge(challenge).participant(participant).build();
    }

    /**
     * Standings of the accepted participants, best first. A completed challenge reports the
     * ranks frozen at completion; an open one is ranked from the current statistics.
     */
    public List<ChallengeStanding> getChallengeLeaderboard(Long challengeId, Long userId) {
        Challenge challenge = finalizeIfExpired(findChallenge(challengeId));
        findParticipation(challengeId, userId);

        List<ChallengeParticipant> accepted = participantRepository.findByChallengeId(challengeId).stream()
            .filter(ChallengeParticipant::isAccepted)
            .toList();
        Map<Long, String> usernames = userRepository.findAllById(
                accepted.stream().map(ChallengeParticipant::getUserId).collect(Collectors.toList()))
            .stream()
            .collect(Collectors.toMap(AppUser::getId, AppUser::getUsername));

        List<ChallengeStanding> standings = challenge.getStatus() == ChallengeStatus.COMPLETED
            ? frozenStandings(accepted, usernames)
            : liveStandings(accepted, usernames);

        logger.debug("Built leaderboard of challenge {} with {} rows", challengeId, standings.size());
        return standings;
    }

    /**
     * Invites users to a challenge. Users already in the challenge are skipped.
     *
     * @return number of new invitations
     */
    public int inviteUsers(Long challengeId, Long ownerId, List<Long> userIds) {
        Challenge challenge = finalizeIfExpired(findChallenge(challengeId));
        if (!challenge.isOwnedBy(ownerId)) {
            throw new ValidationException("Only the challenge owner can invite members");
        }
        if (challenge.getStatus().isTerminal()) {
            throw new ValidationException("Cannot invite to completed or deleted challenges");
        }
        if (userIds == null || userIds.isEmpty()) {
            throw new ValidationException("At least one user id is required");
        }

        Set<Long> candidates = new LinkedHashSet<>(userIds);
        validateUsersExist(candidates);

        Integer invited = transactionTemplate.execute(status -> {
            int count = 0;
            for (Long userId : candidates) {
                if (participantRepository.findByChallengeIdAndUserId(challengeId, userId).isPresent()) {
                    continue;
                }
                participantRepository.save(newInvitation(challengeId, userId));
                count++;
            }
            return count;
        });

        logger.info("Invited {} of {} users to challenge {}", invited, candidates.size(), challengeId);
        return invited == null ? 0 : invited;
    }

    /**
     * Accepts or declines a pending invitation on behalf of the invited user. Accepting
     * backfills the statistics from existing logs.
     */
    public ChallengeParticipant respondToInvitation(Long participantId, Long userId, boolean accept) {
        ChallengeParticipant participant = participantRepository.findById(participantId)
            .orElseThrow(() -> new NotFoundException("Invitation not found with id: " + participantId));
        if (!participant.getUserId().equals(userId)) {
            throw new ValidationException("You can only respond to your own invitations");
        }

        Challenge challenge = finalizeIfExpired(findChallenge(participant.getChallengeId()));
        if (challenge.getStatus().isTerminal()) {
            throw new ValidationException("Cannot respond to an invitation of a completed or deleted challenge");
        }
        if (participant.getInvitationStatus() != InvitationStatus.PENDING) {
            throw new ValidationException("Invitation has already been " + participant.getInvitationStatus().name().toLowerCase());
        }

        participant.setInvitationStatus(accept ? InvitationStatus.ACCEPTED : InvitationStatus.DECLINED);
        if (accept) {
            participant.setJoinedAt(Instant.now(clock));
        }
        ChallengeParticipant saved = participantRepository.save(participant);
        logger.info("User {} {} invitation to challenge {}", userId, accept ? "accepted" : "declined", challenge.getId());

        if (!accept) {
            return saved;
        }

        recomputeQuietly(challenge.getId(), userId).ifPresent(saved::applyStats);
        badgeAwardService.awardQuietly(userId, BadgeAwardService.CHALLENGE_ACCEPTED);
        return saved;
    }

    public void leaveChallenge(Long challengeId, Long userId) {
        Challenge challenge = findChallenge(challengeId);
        ChallengeParticipant participant = findParticipation(challengeId, userId);
        if (challenge.isOwnedBy(userId)) {
            throw new ValidationException("Challenge owner cannot leave. Delete the challenge instead.");
        }

        participantRepository.delete(participant);
        logger.info("User {} left challenge {}", userId, challengeId);
    }

    /**
     * Soft delete: the challenge and its participants stay stored with status deleted.
     */
    public void deleteChallenge(Long challengeId, Long ownerId) {
        Challenge challenge = finalizeIfExpired(findChallenge(challengeId));
        if (!challenge.isOwnedBy(ownerId)) {
            throw new ValidationException("Only the challenge owner can delete it");
        }
        if (challenge.getStatus() == ChallengeStatus.COMPLETED) {
            throw new ValidationException("Completed challenges cannot be deleted");
        }
        if (challenge.getStatus() == ChallengeStatus.DELETED) {
            throw new ValidationException("Challenge is already deleted");
        }

        challenge.setStatus(ChallengeStatus.DELETED);
        challengeRepository.save(challenge);
        logger.info("Owner {} deleted challenge {}", ownerId, challengeId);
    }

    public Challenge renameChallenge(Long challengeId, Long ownerId, String name, String description) {
        Challenge challenge = finalizeIfExpired(findChallenge(challengeId));
        if (!challenge.isOwnedBy(ownerId)) {
            throw new ValidationException("Only the challenge owner can edit it");
        }
        if (challenge.getStatus().isTerminal()) {
            throw new ValidationException("Cannot edit completed or deleted challenges");
        }

        challenge.setName(validateName(name));
        if (description != null) {
            challenge.setDescription(description);
        }
        Challenge saved = challengeRepository.save(challenge);
        logger.info("Owner {} renamed challenge {} to '{}'", ownerId, challengeId, saved.getName());
        return saved;
    }

    /**
     * Recomputes the writer's statistics in every active challenge the log counts toward.
     * Each challenge is handled on its own; a failure is logged and the rest still run.
     *
     * @return number of challenges successfully recomputed
     */
    public int onLogWritten(ScreenTimeLog log) {
        LocalDate today = today();
        List<Challenge> affected = challengeRepository.findOpenChallengesForAcceptedUser(log.getUserId(), log.getLogDate())
            .stream()
            .filter(c -> c.isActiveOn(today))
            .filter(c -> c.getTargetApp().matches(log.getAppName()))
            .toList();

        int recomputed = 0;
        for (Challenge challenge : affected) {
            if (recomputeQuietly(challenge.getId(), log.getUserId()).isPresent()) {
                recomputed++;
            }
        }

        logger.debug("Log {} of user {} ({} on {}) touched {} challenges, {} recomputed",
            log.getId(), log.getUserId(), log.getAppName(), log.getLogDate(), affected.size(), recomputed);
        return recomputed;
    }

    /**
     * Completes the challenge if it is active and past its end date. Never throws: a failed
     * completion is logged and the challenge is returned as it was.
     *
     * @return the same instance when nothing changed, otherwise the reloaded challenge
     */
    Challenge finalizeIfExpired(Challenge challenge) {
        if (!challenge.isDueForCompletion(today())) {
            return challenge;
        }

        try {
            Optional<List<ChallengeParticipant>> ranked = challengeFinalizer.finalizeChallenge(challenge.getId());
            ranked.ifPresent(participants -> afterCompletion(challenge.getId(), participants));
        } catch (Exception e) {
            FinalizationFailureException failure =
                new FinalizationFailureException("Failed to complete challenge " + challenge.getId(), e);
            logger.error(failure.getMessage(), failure);
            return challenge;
        }

        return challengeRepository.findById(challenge.getId()).orElse(challenge);
    }

    private void afterCompletion(Long challengeId, List<ChallengeParticipant> participants) {
        List<Long> winners = new ArrayList<>();
        for (ChallengeParticipant participant : participants) {
            if (participant.isWinner()) {
                winners.add(participant.getUserId());
            }
            if (participant.getDaysLogged() > 0) {
                badgeAwardService.awardQuietly(participant.getUserId(), BadgeAwardService.COMPLETED_CHALLENGE);
            }
        }

        try {
            eventPublisher.publishEvent(new ChallengeCompletedEvent(challengeId, winners, Instant.now(clock)));
        } catch (Exception e) {
            logger.warn("Failed to publish completion of challenge {}", challengeId, e);
        }
    }

    private Optional<ParticipantStats> recomputeQuietly(Long challengeId, Long userId) {
        try {
            return statsAggregator.recompute(challengeId, userId);
        } catch (Exception e) {
            AggregationFailureException failure = new AggregationFailureException(
                "Failed to recompute stats of user " + userId + " in challenge " + challengeId, e);
            logger.error(failure.getMessage(), failure);
            return Optional.empty();
        }
    }

    private List<ChallengeStanding> liveStandings(List<ChallengeParticipant> accepted, Map<Long, String> usernames) {
        Map<Long, ChallengeParticipant> byId = accepted.stream()
            .collect(Collectors.toMap(ChallengeParticipant::getId, Function.identity()));
        List<RankingCandidate> candidates = accepted.stream()
            .map(p -> RankingCandidate.builder()
                .id(p.getId())
                .totalMinutes(p.getTotalScreenTimeMinutes())
                .daysLogged(p.getDaysLogged())
                .build())
            .toList();

        List<ChallengeStanding> standings = new ArrayList<>();
        for (RankedEntry entry : rankingEngine.rank(candidates, challengeFinalizer.getZeroLogPolicy())) {
            ChallengeParticipant participant = byId.get(entry.getId());
            standings.add(toStanding(participant, usernames, entry.getAverage(), entry.getRank(), entry.isWinner()));
        }
        return standings;
    }

    private List<ChallengeStanding> frozenStandings(List<ChallengeParticipant> accepted, Map<Long, String> usernames) {
        return accepted.stream()
            .sorted(Comparator.comparing(ChallengeParticipant::getFinalRank, Comparator.nullsLast(Comparator.naturalOrder())))
            .map(p -> toStanding(p, usernames, frozenAverage(p), p.getFinalRank(), p.isWinner()))
            .toList();
    }

    private static Double frozenAverage(ChallengeParticipant participant) {
        if (participant.getDaysLogged() > 0) {
            return (double) participant.getTotalScreenTimeMinutes() / participant.getDaysLogged();
        }
        return participant.getFinalRank() != null ? 0.0 : null;
    }

    private static ChallengeStanding toStanding(ChallengeParticipant participant, Map<Long, String> usernames,
                                                Double average, Integer rank, boolean winner) {
        return ChallengeStanding.builder()
            .userId(participant.getUserId())
            .username(usernames.get(participant.getUserId()))
            .totalScreenTimeMinutes(participant.getTotalScreenTimeMinutes())
            .daysLogged(participant.getDaysLogged())
            .daysPassed(participant.getDaysPassed())
            .daysFailed(participant.getDaysFailed())
            .averageDailyMinutes(average == null ? null : BigDecimal.valueOf(average).setScale(2, RoundingMode.HALF_UP).doubleValue())
            .rank(rank)
            .winner(winner)
            .build();
    }

    private Challenge findChallenge(Long challengeId) {
        return challengeRepository.findById(challengeId)
            .orElseThrow(() -> new NotFoundException("Challenge not found with id: " + challengeId));
    }

    private ChallengeParticipant findParticipation(Long challengeId, Long userId) {
        return participantRepository.findByChallengeIdAndUserId(challengeId, userId)
            .orElseThrow(() -> new ValidationException("You are not a participant in this challenge"));
    }

    private ChallengeParticipant newInvitation(Long challengeId, Long userId) {
        return ChallengeParticipant.builder()
            .challengeId(challengeId)
            .userId(userId)
            .invitationStatus(InvitationStatus.PENDING)
            .build();
    }

    private String validateName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Challenge name cannot be empty");
        }
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Challenge name must be " + MAX_NAME_LENGTH + " characters or less");
        }
        return trimmed;
    }

    private void validateSchedule(Integer targetMinutes, LocalDate startDate, LocalDate endDate, LocalDate today) {
        if (targetMinutes == null) {
            throw new ValidationException("Target minutes is required");
        }
        if (targetMinutes < 0) {
            throw new ValidationException("Target minutes cannot be negative");
        }
        if (startDate == null || endDate == null) {
            throw new ValidationException("Start date and end date are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new ValidationException("End date cannot be before start date");
        }
        if (startDate.isBefore(today)) {
            throw new ValidationException("Start date cannot be in the past");
        }
    }

    private Set<Long> distinctInvitees(List<Long> invitedUserIds, Long ownerId) {
        Set<Long> invitees = new LinkedHashSet<>();
        if (invitedUserIds != null) {
            for (Long id : invitedUserIds) {
                if (id != null && !id.equals(ownerId)) {
                    invitees.add(id);
                }
            }
        }
        return invitees;
    }

    private void validateUsersExist(Set<Long> userIds) {
        if (userIds.isEmpty()) {
            return;
        }
        Set<Long> found = userRepository.findAllById(userIds).stream()
            .map(AppUser::getId)
            .collect(Collectors.toSet());
        List<Long> missing = userIds.stream().filter(id -> !found.contains(id)).toList();
        if (!missing.isEmpty()) {
            throw new ValidationException("User IDs not found: " + missing);
        }
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
