package com.wordleague.platform.service;

import com.wordleague.platform.exception.InvalidRequestException;
import com.wordleague.platform.model.PlayerLeague;
import com.wordleague.platform.repository.MembershipRepository;
import com.wordleague.platform.repository.ScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ScoreService {
    
    private static final Logger logger = LoggerFactory.getLogger(ScoreService.class);
    
    private final MembershipRepository membershipRepository;
    private final ScoreRepository scoreRepository;
    
    @Autowired
    public ScoreService(MembershipRepository membershipRepository, ScoreRepository scoreRepository) {
        this.membershipRepository = membershipRepository;
        this.scoreRepository = scoreRepository;
    }
    
    /**
     * Records one daily score against every league the player belongs to.
     * Each league is written independently: a failed write is logged and skipped, earlier writes stay.
     *
     * @return number of leagues whose score was written; 0 for a player in no league
     */
    public int submitScore(String uuid, String date, Integer mistakes) {
        validateSubmitScoreRequest(uuid, date, mistakes);
        
        List<PlayerLeague> leagues = membershipRepository.listLeaguesOfPlayer(uuid);
        if (leagues.isEmpty()) {
            logger.info("Player {} belongs to no league, nothing recorded for {}", uuid, date);
            return 0;
        }
        
        int recorded = 0;
        for (PlayerLeague league : leagues) {
            if (recordInLeague(uuid, league.getLeagueId(), date, mistakes)) {
                recorded++;
            }
        }
        logger.info("Recorded score for player {} on {} in {}/{} leagues", uuid, date, recorded, leagues.size());
        return recorded;
    }
    
    private boolean recordInLeague(String uuid, String leagueId, String date, Integer mistakes) {
        try {
            boolean created = scoreRepository.upsertScore(uuid, leagueId, date, mistakes);
            logger.debug("{} score for player {} in league {} on {}", created ? "Created" : "Overwrote",
                uuid, leagueId, date);
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to record score for player {} in league {} on {}, continuing with remaining leagues",
                uuid, leagueId, date, e);
            return false;
        }
    }
    
    private void validateSubmitScoreRequest(String uuid, String date, Integer mistakes) {
        if (uuid == null || uuid.trim().isEmpty()) {
            throw new InvalidRequestException("Player UUID cannot be null or empty");
        }
        if (date == null || date.trim().isEmpty()) {
            throw new InvalidRequestException("Date cannot be null or empty");
        }
        if (mistakes == null) {
            throw new InvalidRequestException("Mistakes cannot be null");
        }
        if (mistakes < 0) {
            throw new InvalidRequestException("Mistakes cannot be negative");
        }
    }
}
