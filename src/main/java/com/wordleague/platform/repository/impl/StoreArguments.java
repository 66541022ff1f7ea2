package com.wordleague.platform.repository.impl;

import com.wordleague.platform.exception.InvalidRequestException;

/**
 * Precondition checks shared by every store backend, so a bad write is rejected before it touches storage.
 */
final class StoreArguments {
    
    private StoreArguments() {
    }
    
    static String requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidRequestException(field + " cannot be null or empty");
        }
        return value;
    }

    static String requireTrimmed(String value, String field) {
        return requireText(value, field).trim();
    }
    
    static void requireMistakes(Integer mistakes) {
        if (mistakes == null) {
            throw new InvalidRequestException("Mistakes cannot be null");
        }
        if (mistakes < 0) {
            throw new InvalidRequestException("Mistakes cannot be negative");
        }
    }
}
