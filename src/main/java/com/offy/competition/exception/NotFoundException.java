package com.offy.competition.exception;

public class NotFoundException extends CompetitionException {
    public NotFoundException(String message) {
        super(message, "NOT_FOUND");
    }
}
