package com.offy.competition.repository.impl;

import com.offy.competition.model.ChallengeParticipant;
import com.offy.competition.repository.ChallengeParticipantRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JpaChallengeParticipantRepository implements ChallengeParticipantRepository {

    private final SpringDataChallengeParticipantRepository jpaRepository;

    @Autowired
    public JpaChallengeParticipantRepository(SpringDataChallengeParticipantRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public ChallengeParticipant save(ChallengeParticipant participant) {
        return jpaRepository.save(participant);
    }

    @Override
    public List<ChallengeParticipant> saveAll(List<ChallengeParticipant> participants) {
        return jpaRepository.saveAll(participants);
    }

    @Override
    public Optional<ChallengeParticipant> findById(Long participantId) {
        return jpaRepository.findById(participantId);
    }

    @Override
    public Optional<ChallengeParticipant> findByChallengeIdAndUserId(Long challengeId, Long userId) {
        return jpaRepository.findByChallengeIdAndUserId(challengeId, userId);
    }

    @Override
    public Optional<ChallengeParticipant> findByChallengeIdAndUserIdForUpdate(Long challengeId, Long userId) {
        return jpaRepository.lockByChallengeIdAndUserId(challengeId, userId);
    }

    @Override
    public List<ChallengeParticipant> findByChallengeId(Long challengeId) {
        return jpaRepository.findByChallengeIdOrderByIdAsc(challengeId);
    }

    @Override
    public List<ChallengeParticipant> findByChallengeIdForUpdate(Long challengeId) {
        return jpaRepository.lockByChallengeId(challengeId);
    }

    @Override
    public List<ChallengeParticipant> findByUserId(Long userId) {
        return jpaRepository.findByUserIdOrderByIdAsc(userId);
    }

    @Override
    public void delete(ChallengeParticipant participant) {
        jpaRepository.delete(participant);
    }
}
