package com.wordleague.platform.controller;

import com.wordleague.platform.dto.CreateLeagueRequest;
import com.wordleague.platform.dto.JoinLeagueRequest;
import com.wordleague.platform.dto.LeaderboardResponse;
import com.wordleague.platform.model.League;
import com.wordleague.platform.model.LeagueDetails;
import com.wordleague.platform.model.LeagueJoin;
import com.wordleague.platform.model.LeagueLeaderboard;
import com.wordleague.platform.service.LeaderboardService;
import com.wordleague.platform.service.LeagueService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/leagues")
public class LeagueController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeagueController.class);
    
    private final LeagueService leagueService;
    private final LeaderboardService leaderboardService;
    
    @Autowired
    public LeagueController(LeagueService leagueService, LeaderboardService leaderboardService) {
        this.leagueService = leagueService;
        this.leaderboardService = leaderboardService;
    }
    
    /**
     * Create a new league.
     * POST /api/leagues
     */
    @PostMapping
    public ResponseEntity<League> createLeague(@Valid @RequestBody CreateLeagueRequest request) {
        logger.info("Received POST request to create league - name: {}", request.getName());
        
        try {
            League league = leagueService.createLeague(request.getName());
            logger.info("Successfully created league - id: {}, name: {}", league.getId(), league.getName());
            return ResponseEntity.status(HttpStatus.CREATED).body(league);
        } catch (Exception e) {
            logger.error("Error creating league - name: {}, error: {}", request.getName(), e.getMessage(), e);
            throw e;
        }
    }
    
    /**
     * GET /api/leagues/{leagueId}
     */
    @GetMapping("/{leagueId}")
    public ResponseEntity<LeagueDetails> getLeague(@PathVariable String leagueId) {
        logger.info("Received GET request for league - id: {}", leagueId);
        
        try {
            LeagueDetails details = leagueService.getLeagueDetails(leagueId);
            logger.info("Successfully retrieved league - id: {}, members: {}", leagueId, details.getMemberCount());
            return ResponseEntity.ok(details);
        } catch (Exception e) {
            logger.error("Error retrieving league - id: {}, error: {}", leagueId, e.getMessage(), e);
            throw e;
        }
    }
    
    /**
     * Join a league, creating the player on first use.
     * POST /api/leagues/{leagueId}/join
     */
    @PostMapping("/{leagueId}/join")
    public ResponseEntity<LeagueJoin> joinLeague(
            @PathVariable String leagueId,
            @Valid @RequestBody JoinLeagueRequest request) {
        
        logger.info("Received POST request to join league - id: {}, uuid: {}", leagueId, request.getUuid());
        
        try {
            LeagueJoin join = leagueService.joinLeague(leagueId, request.getUuid(), request.getDisplayName());
            logger.info("Successfully joined league - id: {}, uuid: {}, alreadyMember: {}",
                leagueId, request.getUuid(), join.isAlreadyMember());
            return ResponseEntity.ok(join);
        } catch (Exception e) {
            logger.error("Error joining league - id: {}, uuid: {}, error: {}",
                leagueId, request.getUuid(), e.getMessage(), e);
            throw e;
        }
    }
    
    /**
     * Ranked standings for one puzzle date.
     * GET /api/leagues/{leagueId}/leaderboard?date=YYYY-MM-DD
     */
    @GetMapping("/{leagueId}/leaderboard")
    public ResponseEntity<LeaderboardResponse> getLeaderboard(
            @PathVariable String leagueId,
            @RequestParam(required = false) String date) {
        
        logger.info("Received GET request for leaderboard - id: {}, date: {}", leagueId, date);
        
        try {
            LeagueLeaderboard leaderboard = leaderboardService.computeLeaderboard(leagueId, date);
            LeaderboardResponse response = LeaderboardResponse.builder()
                .league(leaderboard.getLeague())
                .date(leaderboard.getDate())
                .entries(leaderboard.getEntries())
                .retrievedAt(Instant.now())
                .build();
            
            logger.info("Successfully computed leaderboard - id: {}, date: {}, entries: {}",
                leagueId, leaderboard.getDate(), leaderboard.getEntries().size());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error computing leaderboard - id: {}, date: {}, error: {}",
                leagueId, date, e.getMessage(), e);
            throw e;
        }
    }
}
