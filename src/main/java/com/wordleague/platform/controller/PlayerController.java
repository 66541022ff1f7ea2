package com.wordleague.platform.controller;

import com.wordleague.platform.dto.UpdatePlayerRequest;
import com.wordleague.platform.model.Player;
import com.wordleague.platform.model.PlayerLeagueSummary;
import com.wordleague.platform.service.LeaderboardService;
import com.wordleague.platform.service.LeagueService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/players")
public class PlayerController {
    
    private static final Logger logger = LoggerFactory.getLogger(PlayerController.class);
    
    private final LeagueService leagueService;
    private final LeaderboardService leaderboardService;
    
    @Autowired
    public PlayerController(LeagueService leagueService, LeaderboardService leaderboardService) {
        this.leagueService = leagueService;
        this.leaderboardService = leaderboardService;
    }
    
    /**
     * PUT /api/players/{uuid}
     */
    @PutMapping("/{uuid}")
    public ResponseEntity<Player> updateDisplayName(
            @PathVariable String uuid,
            @Valid @RequestBody UpdatePlayerRequest request) {
        logger.info("Received PUT request to update player - uuid: {}", uuid);
        
        try {
            Player player = leagueService.updateDisplayName(uuid, request.getDisplayName());
            logger.info("Successfully updated player - uuid: {}, displayName: {}", uuid, player.getDisplayName());
            return ResponseEntity.ok(player);
        } catch (Exception e) {
            logger.error("Error updating player - uuid: {}, error: {}", uuid, e.getMessage(), e);
            throw e;
        }
    }
    
    /**
     * Leagues of a player with today's participation.
     * GET /api/players/{uuid}/leagues
     */
    @GetMapping("/{uuid}/leagues")
    public ResponseEntity<List<PlayerLeagueSummary>> getLeagues(@PathVariable String uuid) {
        logger.info("Received GET request for player leagues - uuid: {}", uuid);
        
        try {
            List<PlayerLeagueSummary> summaries = leaderboardService.getPlayerLeagueSummary(uuid);
            logger.info("Successfully retrieved player leagues - uuid: {}, leagues: {}", uuid, summaries.size());
            return ResponseEntity.ok(summaries);
        } catch (Exception e) {
            logger.error("Error retrieving player leagues - uuid: {}, error: {}", uuid, e.getMessage(), e);
            throw e;
        }
    }
}
