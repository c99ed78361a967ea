package com.offy.competition.exception;

public class CompetitionException extends RuntimeException {
    private final String errorCode;

    public CompetitionException(String message) {
        super(message);
        this.errorCode = "COMPETITION_ERROR";
    }

    public CompetitionException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public CompetitionException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
