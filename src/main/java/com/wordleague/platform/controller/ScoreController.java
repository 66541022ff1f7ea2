package com.wordleague.platform.controller;

import com.wordleague.platform.dto.SubmitScoreRequest;
import com.wordleague.platform.dto.SubmitScoreResponse;
import com.wordleague.platform.service.ScoreService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/scores")
public class ScoreController {
    
    private static final Logger logger = LoggerFactory.getLogger(ScoreController.class);
    
    private final ScoreService scoreService;
    
    @Autowired
    public ScoreController(ScoreService scoreService) {
        this.scoreService = scoreService;
    }
    
    /**
     * Submit a daily score for every league the player belongs to.
     * POST /api/scores
     */
    @PostMapping
    public ResponseEntity<SubmitScoreResponse> submitScore(@Valid @RequestBody SubmitScoreRequest request) {
        logger.info("Received POST request to submit score - uuid: {}, date: {}, mistakes: {}",
            request.getUuid(), request.getDate(), request.getMistakes());
        
        try {
            int recorded = scoreService.submitScore(request.getUuid(), request.getDate(), request.getMistakes());
            SubmitScoreResponse response = SubmitScoreResponse.builder()
                .uuid(request.getUuid())
                .date(request.getDate())
                .recorded(recorded)
                .recordedAt(Instant.now())
                .build();
            
            logger.info("Successfully submitted score - uuid: {}, date: {}, recorded: {}",
                request.getUuid(), request.getDate(), recorded);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error submitting score - uuid: {}, date: {}, error: {}",
                request.getUuid(), request.getDate(), e.getMessage(), e);
            throw e;
        }
    }
}
