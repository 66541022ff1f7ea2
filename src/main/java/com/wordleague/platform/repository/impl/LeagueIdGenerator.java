package com.wordleague.platform.repository.impl;

import com.wordleague.platform.exception.WordLeagueException;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Random 8-character league ids with a collision check against the store.
 */
@Component
public class LeagueIdGenerator {
    
    static final int ID_LENGTH = 8;
    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int MAX_ATTEMPTS = 10;
    private static final SecureRandom random = new SecureRandom();
    
    private final Supplier<String> candidates;
    
    public LeagueIdGenerator() {
        this(LeagueIdGenerator::randomId);
    }
    
    LeagueIdGenerator(Supplier<String> candidates) {
        this.candidates = candidates;
    }
    
    /**
     * Draws candidates until one is not taken. {@code isTaken} may also claim the id, in which
     * case a failed claim counts as taken and the next candidate is tried.
     */
    public String generate(Predicate<String> isTaken) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = candidates.get();
            if (!isTaken.test(candidate)) {
                return candidate;
            }
        }
        throw new WordLeagueException("Could not generate a unique league id after " + MAX_ATTEMPTS + " attempts",
            "ID_GENERATION_FAILED");
    }
    
    private static String randomId() {
        StringBuilder sb = new StringBuilder(ID_LENGTH);
        for (int i = 0; i < ID_LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
