package com.wordleague.platform.service;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Source of the current puzzle date as {@code YYYY-MM-DD}, which sorts lexicographically.
 */
@Component
public class PuzzleCalendar {
    
    private final Clock clock;
    
    @Autowired
    public PuzzleCalendar(Clock clock) {
        this.clock = clock;
    }
    
    public String today() {
        return LocalDate.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
