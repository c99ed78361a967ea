package com.offy.competition.controller;

import com.offy.competition.dto.ChallengeLeaderboardResponse;
import com.offy.competition.dto.ChallengeResponse;
import com.offy.competition.dto.CreateChallengeRequest;
import com.offy.competition.dto.InvitationResponseRequest;
import com.offy.competition.dto.InviteUsersRequest;
import com.offy.competition.dto.InviteUsersResponse;
import com.offy.competition.dto.ParticipantView;
import com.offy.competition.dto.RenameChallengeRequest;
import com.offy.competition.model.Challenge;
import com.offy.competition.model.ChallengeParticipant;
import com.offy.competition.model.ChallengeStanding;
import com.offy.competition.model.ChallengeSummary;
import com.offy.competition.service.ChallengeLifecycleService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/challenges")
public class ChallengeController {

    private static final Logger logger = LoggerFactory.getLogger(ChallengeController.class);

    private static final String USER_HEADER = "X-User-Id";

    private final ChallengeLifecycleService lifecycleService;
    private final Clock clock;

    @Autowired
    public ChallengeController(ChallengeLifecycleService lifecycleService, Clock clock) {
        this.lifecycleService = lifecycleService;
        this.clock = clock;
    }

    /**
     * Create a challenge owned by the caller.
     * POST /api/v1/challenges
     */
    @PostMapping
    public ResponseEntity<ChallengeResponse> createChallenge(
            @RequestHeader(USER_HEADER) Long userId,
            @Valid @RequestBody CreateChallengeRequest request) {

        logger.info("Received POST request to create challenge - owner: {}, name: {}, target: {}",
            userId, request.getName(), request.getTargetApp());

        try {
            Challenge challenge = lifecycleService.createChallenge(userId, request.getName(), request.getDescription(),
                request.getTargetApp(), request.getTargetMinutes(), request.getStartDate(), request.getEndDate(),
                request.getInvitedUserIds());
            ChallengeSummary summary = lifecycleService.getChallenge(challenge.getId(), userId);
            return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(summary));
        } catch (Exception e) {
            logger.error("Error creating challenge - owner: {}, error: {}", userId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * GET /api/v1/challenges
     */
    @GetMapping
    public ResponseEntity<List<ChallengeResponse>> listChallenges(@RequestHeader(USER_HEADER) Long userId) {
        logger.info("Received GET request for challenges of user {}", userId);

        try {
            List<ChallengeResponse> response = lifecycleService.listChallenges(userId).stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error listing challenges - userId: {}, error: {}", userId, e.getMessage(), e);
            throw e;
        }
    }

    @GetMapping("/{challengeId}")
    public ResponseEntity<ChallengeResponse> getChallenge(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long challengeId) {
        logger.info("Received GET request for challenge {} by user {}", challengeId, userId);
        return ResponseEntity.ok(toResponse(lifecycleService.getChallenge(challengeId, userId)));
    }

    @PatchMapping("/{challengeId}")
    public ResponseEntity<ChallengeResponse> renameChallenge(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long challengeId,
            @Valid @RequestBody RenameChallengeRequest request) {

        logger.info("Received PATCH request to rename challenge {} by user {}", challengeId, userId);

        try {
            lifecycleService.renameChallenge(challengeId, userId, request.getName(), request.getDescription());
            return ResponseEntity.ok(toResponse(lifecycleService.getChallenge(challengeId, userId)));
        } catch (Exception e) {
            logger.error("Error renaming challenge {} - userId: {}, error: {}", challengeId, userId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Standings of the accepted participants.
     * GET /api/v1/challenges/{challengeId}/leaderboard
     */
    @GetMapping("/{challengeId}/leaderboard")
    public ResponseEntity<ChallengeLeaderboardResponse> getLeaderboard(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long challengeId) {

        logger.info("Received GET request for leaderboard of challenge {} by user {}", challengeId, userId);

        try {
            List<ChallengeStanding> standings = lifecycleService.getChallengeLeaderboard(challengeId, userId);
            ChallengeLeaderboardResponse response = ChallengeLeaderboardResponse.builder()
                .challengeId(challengeId)
                .standings(standings)
                .retrievedAt(Instant.now(clock))
                .build();
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving leaderboard of challenge {} - error: {}", challengeId, e.getMessage(), e);
            throw e;
        }
    }

    @PostMapping("/{challengeId}/invitations")
    public ResponseEntity<InviteUsersResponse> inviteUsers(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long challengeId,
            @Valid @RequestBody InviteUsersRequest request) {

        logger.info("Received POST request to invite {} users to challenge {} by user {}",
            request.getUserIds().size(), challengeId, userId);

        try {
            int invited = lifecycleService.inviteUsers(challengeId, userId, request.getUserIds());
            return ResponseEntity.ok(InviteUsersResponse.builder()
                .challengeId(challengeId)
                .invitedCount(invited)
                .build());
        } catch (Exception e) {
            logger.error("Error inviting users to challenge {} - error: {}", challengeId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * Accept or decline an invitation.
     * POST /api/v1/challenges/participants/{participantId}/response
     */
    @PostMapping("/participants/{participantId}/response")
    public ResponseEntity<ParticipantView> respondToInvitation(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long participantId,
            @Valid @RequestBody InvitationResponseRequest request) {

        logger.info("Received POST request to answer invitation {} by user {} - accept: {}",
            participantId, userId, request.getAccept());

        try {
            ChallengeParticipant participant =
                lifecycleService.respondToInvitation(participantId, userId, request.getAccept());
            return ResponseEntity.ok(ParticipantView.from(participant));
        } catch (Exception e) {
            logger.error("Error answering invitation {} - userId: {}, error: {}", participantId, userId, e.getMessage(), e);
            throw e;
        }
    }

    @DeleteMapping("/{challengeId}/participants/me")
    public ResponseEntity<Void> leaveChallenge(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long challengeId) {
        logger.info("Received DELETE request to leave challenge {} by user {}", challengeId, userId);
        lifecycleService.leaveChallenge(challengeId, userId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{challengeId}")
    public ResponseEntity<Void> deleteChallenge(
            @RequestHeader(USER_HEADER) Long userId,
            @PathVariable Long challengeId) {
        logger.info("Received DELETE request for challenge {} by user {}", challengeId, userId);
        lifecycleService.deleteChallenge(challengeId, userId);
        return ResponseEntity.noContent().build();
    }

    private ChallengeResponse toResponse(ChallengeSummary summary) {
        ParticipantView participant = summary.getParticipant() == null
            ? null
            : ParticipantView.from(summary.getParticipant());
        return ChallengeResponse.from(summary.getChallenge(), participant, LocalDate.now(clock));
    }
}
