package com.offy.competition.repository;

import com.offy.competition.model.Challenge;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ChallengeRepository {
    Challenge save(Challenge challenge);
    Optional<Challenge> findById(Long challengeId);
    List<Challenge> findAllById(Iterable<Long> challengeIds);

    /**
     * Challenges still open (upcoming or active) that the user has accepted and whose
     * date range contains {@code logDate}.
     */
    List<Challenge> findOpenChallengesForAcceptedUser(Long userId, LocalDate logDate);

    /**
     * Flips an open challenge to completed. Returns false when another caller already
     * closed it, so exactly one finalization wins.
     */
    boolean markCompleted(Long challengeId, Instant completedAt);
}
