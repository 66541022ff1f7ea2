package com.wordleague.platform.repository.impl;

import com.wordleague.platform.exception.StoreUnavailableException;
import com.wordleague.platform.model.Score;
import com.wordleague.platform.model.ScoreId;
import com.wordleague.platform.repository.ScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "wordleague.storage.scores", havingValue = "jpa", matchIfMissing = true)
public class JpaScoreRepository implements ScoreRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(JpaScoreRepository.class);
    
    private final ScoreJpaRepository scoreRepository;
    
    @Autowired
    public JpaScoreRepository(ScoreJpaRepository scoreRepository) {
        this.scoreRepository = scoreRepository;
    }
    
    @Override
    public boolean upsertScore(String uuid, String leagueId, String date, Integer mistakes) {
        StoreArguments.requireText(uuid, "Player UUID");
        StoreArguments.requireText(leagueId, "League id");
        StoreArguments.requireText(date, "Date");
        StoreArguments.requireMistakes(mistakes);
        
        ScoreId id = new ScoreId(uuid, leagueId, date);
        try {
            return writeScore(id, mistakes);
        } catch (DataIntegrityViolationException e) {
            // A concurrent submission inserted the row first; last write wins.
            logger.debug("Score {} was inserted concurrently, overwriting", id);
            return overwriteAfterConflict(id, mistakes);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to upsert score for player " + uuid + " in league " + leagueId, e);
        }
    }
    
    private boolean overwriteAfterConflict(ScoreId id, Integer mistakes) {
        try {
            writeScore(id, mistakes);
            return false;
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to upsert score for player " + id.getPlayerUuid()
                + " in league " + id.getLeagueId(), e);
        }
    }
    
    private boolean writeScore(ScoreId id, Integer mistakes) {
        Optional<Score> existing = scoreRepository.findById(id);
        Score score = existing.orElseGet(() -> Score.builder()
            .playerUuid(id.getPlayerUuid())
            .leagueId(id.getLeagueId())
            .date(id.getDate())
            .build());
        score.setMistakes(mistakes);
        score.setRecordedAt(Instant.now());
        scoreRepository.saveAndFlush(score);
        return existing.isEmpty();
    }
    
    @Override
    public List<Score> getScoresForLeagueOnDate(String leagueId, String date) {
        if (!isValidId(leagueId) || !isValidId(date)) {
            return Collections.emptyList();
        }
        try {
            return scoreRepository.findByLeagueIdAndDate(leagueId, date);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to load scores of league " + leagueId + " on " + date, e);
        }
    }
    
    @Override
    public long countPlayedOnDate(String leagueId, String date) {
        if (!isValidId(leagueId) || !isValidId(date)) {
            return 0L;
        }
        try {
            return scoreRepository.countByLeagueIdAndDate(leagueId, date);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to count scores of league " + leagueId + " on " + date, e);
        }
    }
    
    private boolean isValidId(String id) {
        return id != null && !id.trim().isEmpty();
    }
}
