package com.offy.competition.service;

import com.offy.competition.event.BadgeAwardedEvent;
import com.offy.competition.model.UserBadge;
import com.offy.competition.repository.UserBadgeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Awards achievement badges. Callers treat every award as best-effort.
 */
@Service
public class BadgeAwardService {

    public static final String CHALLENGE_ACCEPTED = "Challenge Accepted";
    public static final String COMPLETED_CHALLENGE = "Completed Challenge";

    private static final Logger logger = LoggerFactory.getLogger(BadgeAwardService.class);

    private final UserBadgeRepository userBadgeRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Autowired
    public BadgeAwardService(UserBadgeRepository userBadgeRepository,
                             ApplicationEventPublisher eventPublisher,
                             Clock clock) {
        this.userBadgeRepository = userBadgeRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Stores the badge unless the user already holds it.
     *
     * @return true when the badge was newly awarded
     */
    public boolean award(Long userId, String badgeName) {
        if (userBadgeRepository.existsByUserIdAndBadgeName(userId, badgeName)) {
            return false;
        }

        Instant now = Instant.now(clock);
        userBadgeRepository.save(UserBadge.builder()
            .userId(userId)
            .badgeName(badgeName)
            .earnedAt(now)
            .build());
        logger.info("Awarded badge '{}' to user {}", badgeName, userId);

        eventPublisher.publishEvent(new BadgeAwardedEvent(userId, badgeName, now));
        return true;
    }

    /**
     * Same as {@link #award} but never throws; a failed award or notification is only logged.
     */
    public void awardQuietly(Long userId, String badgeName) {
        try {
            award(userId, badgeName);
        } catch (Exception e) {
            logger.warn("Failed to award badge '{}' to user {}", badgeName, userId, e);
        }
    }
}
