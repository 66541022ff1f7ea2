package com.wordleague.platform.exception;

/**
 * A backing store failed for infrastructure reasons (database, file system, Redis).
 */
public class StoreUnavailableException extends WordLeagueException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, "STORE_UNAVAILABLE", cause);
    }
}
