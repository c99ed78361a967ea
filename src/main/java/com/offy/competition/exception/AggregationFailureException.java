package com.offy.competition.exception;

/**
 * Recomputing a participant's statistics failed. Never surfaced to the caller of the log write.
 */
public class AggregationFailureException extends CompetitionException {
    public AggregationFailureException(String message, Throwable cause) {
        super(message, "AGGREGATION_FAILURE", cause);
    }
}
