package com.wordleague.platform.repository;

import com.wordleague.platform.model.Score;

import java.util.List;

/**
 * Per-player, per-league, per-date score records.
 * Implementations throw {@code StoreUnavailableException} on infrastructure failure.
 */
public interface ScoreRepository {
    /**
     * Inserts or overwrites the score keyed by (uuid, leagueId, date); last write wins.
     *
     * @return true if a new row was created, false if an existing one was overwritten
     */
    boolean upsertScore(String uuid, String leagueId, String date, Integer mistakes);
    List<Score> getScoresForLeagueOnDate(String leagueId, String date);
    long countPlayedOnDate(String leagueId, String date);
}
