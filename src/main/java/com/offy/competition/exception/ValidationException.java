package com.offy.competition.exception;

public class ValidationException extends CompetitionException {
    public ValidationException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
