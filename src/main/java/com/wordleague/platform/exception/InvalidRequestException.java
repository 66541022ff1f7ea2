package com.wordleague.platform.exception;

/**
 * Caller input failed a precondition. Always raised before any store mutation.
 */
public class InvalidRequestException extends WordLeagueException {
    public InvalidRequestException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
