package com.offy.competition.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A challenge as seen by one of its participants.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChallengeSummary {
    private Challenge challenge;
    private ChallengeParticipant participant;
}
