package com.offy.competition.repository.impl;

import com.offy.competition.model.ChallengeParticipant;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SpringDataChallengeParticipantRepository extends JpaRepository<ChallengeParticipant, Long> {
    Optional<ChallengeParticipant> findByChallengeIdAndUserId(Long challengeId, Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from ChallengeParticipant p where p.challengeId = :challengeId and p.userId = :userId")
    Optional<ChallengeParticipant> lockByChallengeIdAndUserId(@Param("challengeId") Long challengeId,
                                                              @Param("userId") Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from ChallengeParticipant p where p.challengeId = :challengeId order by p.id")
    List<ChallengeParticipant> lockByChallengeId(@Param("challengeId") Long challengeId);

    List<ChallengeParticipant> findByChallengeIdOrderByIdAsc(Long challengeId);
    List<ChallengeParticipant> findByUserIdOrderByIdAsc(Long userId);
}
