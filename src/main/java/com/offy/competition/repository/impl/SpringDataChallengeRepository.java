package com.offy.competition.repository.impl;

import com.offy.competition.model.Challenge;
import com.offy.competition.model.ChallengeStatus;
import com.offy.competition.model.InvitationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

@Repository
public interface SpringDataChallengeRepository extends JpaRepository<Challenge, Long> {

    @Query("select c from Challenge c, ChallengeParticipant p "
        + "where p.challengeId = c.id and p.userId = :userId and p.invitationStatus = :invitationStatus "
        + "and c.status in :statuses and c.startDate <= :logDate and c.endDate >= :logDate")
    List<Challenge> findForParticipantOnDate(@Param("userId") Long userId,
                                             @Param("invitationStatus") InvitationStatus invitationStatus,
                                             @Param("statuses") Collection<ChallengeStatus> statuses,
                                             @Param("logDate") LocalDate logDate);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Challenge c set c.status = :completed, c.completedAt = :completedAt "
        + "where c.id = :challengeId and c.status in :openStatuses")
    int compareAndSetCompleted(@Param("challengeId") Long challengeId,
                               @Param("completed") ChallengeStatus completed,
                               @Param("completedAt") Instant completedAt,
                               @Param("openStatuses") Collection<ChallengeStatus> openStatuses);
}
