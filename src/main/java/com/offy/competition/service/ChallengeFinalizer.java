package com.offy.competition.service;

import com.offy.competition.model.ChallengeParticipant;
import com.offy.competition.model.RankedEntry;
import com.offy.competition.model.RankingCandidate;
import com.offy.competition.model.ZeroLogPolicy;
import com.offy.competition.repository.ChallengeParticipantRepository;
import com.offy.competition.repository.ChallengeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Completes one challenge in its own transaction: the status flip and every participant's
 * final rank commit together or not at all.
 */
@Component
public class ChallengeFinalizer {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeFinalizer.class);

    private final ChallengeRepository challengeRepository;
    private final ChallengeParticipantRepository participantRepository;
    private final RankingEngine rankingEngine;
    private final ZeroLogPolicy zeroLogPolicy;
    private final Clock clock;

    @Autowired
    public ChallengeFinalizer(
            ChallengeRepository challengeRepository,
            ChallengeParticipantRepository participantRepository,
            RankingEngine rankingEngine,
            @Value("${competition.ranking.zero-log-policy:RANK_AS_ZERO_AVERAGE}") ZeroLogPolicy zeroLogPolicy,
            Clock clock) {
        this.challengeRepository = challengeRepository;
        this.participantRepository = participantRepository;
        this.rankingEngine = rankingEngine;
        this.zeroLogPolicy = zeroLogPolicy;
        this.clock = clock;
    }

    public ZeroLogPolicy getZeroLogPolicy() {
        return zeroLogPolicy;
    }

    /**
     * Marks the challenge completed and writes final ranks.
     *
     * @return the ranked accepted participants, or empty when another caller completed the
     *         challenge first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<List<ChallengeParticipant>> finalizeChallenge(Long challengeId) {
        Instant completedAt = Instant.now(clock);
        if (!challengeRepository.markCompleted(challengeId, completedAt)) {
            logger.debug("Challenge {} already closed by another request", challengeId);
            return Optional.empty();
        }

        // waits for in-flight recomputes of these rows, then ranks their committed stats
        List<ChallengeParticipant> accepted = participantRepository.findByChallengeIdForUpdate(challengeId).stream()
            .filter(ChallengeParticipant::isAccepted)
            .toList();

        List<RankingCandidate> candidates = accepted.stream()
            .map(p -> RankingCandidate.builder()
                .id(p.getId())
                .totalMinutes(p.getTotalScreenTimeMinutes())
                .daysLogged(p.getDaysLogged())
                .build())
            .toList();

        Map<Long, RankedEntry> rankedById = rankingEngine.rank(candidates, zeroLogPolicy).stream()
            .collect(Collectors.toMap(RankedEntry::getId, Function.identity()));

        for (ChallengeParticipant participant : accepted) {
            RankedEntry entry = rankedById.get(participant.getId());
            participant.setFinalRank(entry.getRank());
            participant.setWinner(entry.isWinner());
            participant.setChallengeCompleted(true);
        }
        List<ChallengeParticipant> saved = participantRepository.saveAll(accepted);

        logger.info("Completed challenge {} with {} ranked participants (policy {})",
            challengeId, saved.size(), zeroLogPolicy);
        return Optional.of(saved);
    }
}
