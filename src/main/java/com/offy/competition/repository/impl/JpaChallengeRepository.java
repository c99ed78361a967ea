package com.offy.competition.repository.impl;

import com.offy.competition.model.Challenge;
import com.offy.competition.model.ChallengeStatus;
import com.offy.competition.model.InvitationStatus;
import com.offy.competition.repository.ChallengeRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Repository
public class JpaChallengeRepository implements ChallengeRepository {

    private static final Set<ChallengeStatus> OPEN_STATUSES = EnumSet.of(ChallengeStatus.UPCOMING, ChallengeStatus.ACTIVE);

    private final SpringDataChallengeRepository jpaRepository;

    @Autowired
    public JpaChallengeRepository(SpringDataChallengeRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public Challenge save(Challenge challenge) {
        return jpaRepository.save(challenge);
    }

    @Override
    public Optional<Challenge> findById(Long challengeId) {
        return jpaRepository.findById(challengeId);
    }

    @Override
    public List<Challenge> findAllById(Iterable<Long> challengeIds) {
        return jpaRepository.findAllById(challengeIds);
    }

    @Override
    public List<Challenge> findOpenChallengesForAcceptedUser(Long userId, LocalDate logDate) {
        return jpaRepository.findForParticipantOnDate(userId, InvitationStatus.ACCEPTED, OPEN_STATUSES, logDate);
    }

    @Override
    public boolean markCompleted(Long challengeId, Instant completedAt) {
        return jpaRepository.compareAndSetCompleted(challengeId, ChallengeStatus.COMPLETED, completedAt, OPEN_STATUSES) == 1;
    }
}
