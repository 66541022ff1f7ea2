package com.wordleague.platform.exception;

public class WordLeagueException extends RuntimeException {
    private final String errorCode;
    
    public WordLeagueException(String message) {
        super(message);
        this.errorCode = "WORD_LEAGUE_ERROR";
    }
    
    public WordLeagueException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public WordLeagueException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public String getErrorCode() {
        return errorCode;
    }
}
