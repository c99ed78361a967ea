package com.offy.competition.repository;

import com.offy.competition.model.ChallengeParticipant;

import java.util.List;
import java.util.Optional;

public interface ChallengeParticipantRepository {
    ChallengeParticipant save(ChallengeParticipant participant);
    List<ChallengeParticipant> saveAll(List<ChallengeParticipant> participants);
    Optional<ChallengeParticipant> findById(Long participantId);
    Optional<ChallengeParticipant> findByChallengeIdAndUserId(Long challengeId, Long userId);
    Optional<ChallengeParticipant> findByChallengeIdAndUserIdForUpdate(Long challengeId, Long userId);
    List<ChallengeParticipant> findByChallengeId(Long challengeId);
    List<ChallengeParticipant> findByChallengeIdForUpdate(Long challengeId);
    List<ChallengeParticipant> findByUserId(Long userId);
    void delete(ChallengeParticipant participant);
}
