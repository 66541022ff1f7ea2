package com.wordleague.platform.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wordleague.platform.exception.InvalidRequestException;
import com.wordleague.platform.exception.StoreUnavailableException;
import com.wordleague.platform.model.Score;
import com.wordleague.platform.model.ScoreId;
import com.wordleague.platform.repository.ScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Flat-file score store: one JSON file per league holding every date's scores for that league.
 */
@Repository
@ConditionalOnProperty(name = "wordleague.storage.scores", havingValue = "json")
public class JsonScoreRepository implements ScoreRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(JsonScoreRepository.class);
    
    private static final String SCORES_SUBDIRECTORY = "scores";
    // League ids double as file names
    private static final Pattern FILE_SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");
    
    private final Path scoresDirectory;
    private final ObjectMapper objectMapper;
    private final Map<String, Map<ScoreId, Score>> cache = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> leagueLocks = new ConcurrentHashMap<>();
    
    public JsonScoreRepository(@Value("${wordleague.storage.directory:./data}") String dataDirectory) {
        this.scoresDirectory = Paths.get(dataDirectory, SCORES_SUBDIRECTORY);
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        initializeDirectory();
        loadAllScores();
    }
    
    private void initializeDirectory() {
        try {
            if (!Files.exists(scoresDirectory)) {
                Files.createDirectories(scoresDirectory);
                logger.info("Created score data directory {}", scoresDirectory.toAbsolutePath());
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to create data directory: " + scoresDirectory, e);
        }
    }
    
    private void loadAllScores() {
        try (Stream<Path> files = Files.list(scoresDirectory)) {
            files.filter(p -> p.toString().endsWith(".json"))
                .forEach(this::loadLeagueFile);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to load scores from " + scoresDirectory, e);
        }
        logger.info("Loaded scores for {} leagues from {}", cache.size(), scoresDirectory);
    }
    
    private void loadLeagueFile(Path filePath) {
        String leagueId = filePath.getFileName().toString().replace(".json", "");
        try {
            List<Score> scores = objectMapper.readValue(filePath.toFile(), new TypeReference<List<Score>>() {});
            Map<ScoreId, Score> scoreMap = new LinkedHashMap<>();
            if (scores != null) {
                scores.forEach(score -> scoreMap.put(idOf(score), score));
            }
            cache.put(leagueId, scoreMap);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read scores file " + filePath, e);
        }
    }
    
    @Override
    public boolean upsertScore(String uuid, String leagueId, String date, Integer mistakes) {
        StoreArguments.requireText(uuid, "Player UUID");
        StoreArguments.requireText(leagueId, "League id");
        StoreArguments.requireText(date, "Date");
        StoreArguments.requireMistakes(mistakes);
        if (!isFileSafe(leagueId)) {
            throw new InvalidRequestException("League id contains unsupported characters: " + leagueId);
        }
        
        ScoreId id = new ScoreId(uuid, leagueId, date);
        ReentrantLock lock = getOrCreateLock(leagueId);
        lock.lock();
        try {
            Map<ScoreId, Score> scoreMap = cache.computeIfAbsent(leagueId, k -> new LinkedHashMap<>());
            Score previous = scoreMap.get(id);
            scoreMap.put(id, Score.builder()
                .playerUuid(uuid)
                .leagueId(leagueId)
                .date(date)
                .mistakes(mistakes)
                .recordedAt(Instant.now())
                .build());
            try {
                persistToFile(leagueId, scoreMap);
            } catch (IOException e) {
                if (previous == null) {
                    scoreMap.remove(id);
                } else {
                    scoreMap.put(id, previous);
                }
                throw new StoreUnavailableException("Failed to save scores of league " + leagueId, e);
            }
            return previous == null;
        } finally {
            lock.unlock();
        }
    }
    
    private void persistToFile(String leagueId, Map<ScoreId, Score> scoreMap) throws IOException {
        File file = scoresDirectory.resolve(leagueId + ".json").toFile();
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, new ArrayList<>(scoreMap.values()));
    }
    
    @Override
    public List<Score> getScoresForLeagueOnDate(String leagueId, String date) {
        if (!isFileSafe(leagueId) || date == null) {
            return Collections.emptyList();
        }
        ReentrantLock lock = getOrCreateLock(leagueId);
        lock.lock();
        try {
            Map<ScoreId, Score> scoreMap = cache.get(leagueId);
            if (scoreMap == null) {
                return Collections.emptyList();
            }
            return scoreMap.values().stream()
                .filter(score -> date.equals(score.getDate()))
                .map(this::copyScore)
                .toList();
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public long countPlayedOnDate(String leagueId, String date) {
        return getScoresForLeagueOnDate(leagueId, date).size();
    }
    
    private ReentrantLock getOrCreateLock(String leagueId) {
        return leagueLocks.computeIfAbsent(leagueId, k -> new ReentrantLock());
    }
    
    private Score copyScore(Score score) {
        return Score.builder()
            .playerUuid(score.getPlayerUuid())
            .leagueId(score.getLeagueId())
            .date(score.getDate())
            .mistakes(score.getMistakes())
            .recordedAt(score.getRecordedAt())
            .build();
    }
    
    private static ScoreId idOf(Score score) {
        return new ScoreId(score.getPlayerUuid(), score.getLeagueId(), score.getDate());
    }
    
    private static boolean isFileSafe(String leagueId) {
        return leagueId != null && FILE_SAFE_ID.matcher(leagueId).matches();
    }
}
