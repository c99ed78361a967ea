package com.offy.competition.exception;

/**
 * Completing an expired challenge failed. Isolated to that one challenge.
 */
public class FinalizationFailureException extends CompetitionException {
    public FinalizationFailureException(String message, Throwable cause) {
        super(message, "FINALIZATION_FAILURE", cause);
    }
}
