package com.wordleague.platform.repository.impl;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wordleague.platform.exception.StoreUnavailableException;
import com.wordleague.platform.exception.WordLeagueException;
import com.wordleague.platform.model.Score;
import com.wordleague.platform.repository.ScoreRepository;
import jakarta.annotation.PreDestroy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Redis score store. Each (league, date) is a hash at {@code scores:<leagueId>:<date>} whose
 * fields are player uuids and whose values are {@code {mistakes, recordedAt}} as JSON.
 */
@Repository
@ConditionalOnProperty(name = "wordleague.storage.scores", havingValue = "redis")
public class JedisScoreRepository implements ScoreRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(JedisScoreRepository.class);
    
    private static final String SCORES_KEY_PREFIX = "scores:";
    
    private final JedisPool jedisPool;
    private final ObjectMapper objectMapper;
    
    @Autowired
    public JedisScoreRepository(
            @Value("${redis.host:localhost}") String redisHost,
            @Value("${redis.port:6379}") int redisPort,
            @Value("${redis.password:}") String redisPassword,
            @Value("${redis.ssl:false}") boolean redisSsl,
            @Value("${redis.timeout:2000}") int timeout) {
        this(createPool(redisHost, redisPort, redisPassword, redisSsl, timeout));
        checkConnection(redisHost, redisPort, redisSsl);
    }
    
    JedisScoreRepository(JedisPool jedisPool) {
        this.jedisPool = jedisPool;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
    }
    
    private static JedisPool createPool(String host, int port, String password, boolean ssl, int timeout) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(128);
        poolConfig.setMaxIdle(32);
        poolConfig.setMinIdle(8);
        poolConfig.setTestOnBorrow(true);
        
        DefaultJedisClientConfig.Builder clientConfigBuilder = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeout)
            .socketTimeoutMillis(timeout)
            .ssl(ssl);
        if (password != null && !password.isEmpty()) {
            clientConfigBuilder.password(password);
        }
        
        return new JedisPool(poolConfig, new HostAndPort(host, port), clientConfigBuilder.build());
    }
    
    private void checkConnection(String host, int port, boolean ssl) {
        try (Jedis jedis = jedisPool.getResource()) {
            jedis.ping();
            logger.info("Connected to Redis at {}:{}{}", host, port, ssl ? " (SSL enabled)" : "");
        } catch (JedisException e) {
            // Writes will surface StoreUnavailableException until Redis comes back
            logger.warn("Redis at {}:{} is not reachable yet: {}", host, port, e.getMessage());
        }
    }
    
    @PreDestroy
    public void destroy() {
        if (jedisPool != null && !jedisPool.isClosed()) {
            jedisPool.close();
        }
    }
    
    @Override
    public boolean upsertScore(String uuid, String leagueId, String date, Integer mistakes) {
        StoreArguments.requireText(uuid, "Player UUID");
        StoreArguments.requireText(leagueId, "League id");
        StoreArguments.requireText(date, "Date");
        StoreArguments.requireMistakes(mistakes);
        
        String value = encode(new StoredScore(mistakes, Instant.now()));
        try (Jedis jedis = jedisPool.getResource()) {
            // HSET returns the number of fields that were newly added
            return jedis.hset(keyOf(leagueId, date), uuid, value) > 0;
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to upsert score in Redis for league " + leagueId, e);
        }
    }
    
    @Override
    public List<Score> getScoresForLeagueOnDate(String leagueId, String date) {
        if (!isValidId(leagueId) || !isValidId(date)) {
            return Collections.emptyList();
        }
        Map<String, String> fields;
        try (Jedis jedis = jedisPool.getResource()) {
            fields = jedis.hgetAll(keyOf(leagueId, date));
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to load scores from Redis for league " + leagueId, e);
        }
        
        List<Score> scores = new ArrayList<>(fields.size());
        for (Map.Entry<String, String> field : fields.entrySet()) {
            StoredScore stored = decode(field.getValue());
            scores.add(Score.builder()
                .playerUuid(field.getKey())
                .leagueId(leagueId)
                .date(date)
                .mistakes(stored.getMistakes())
                .recordedAt(stored.getRecordedAt())
                .build());
        }
        return scores;
    }
    
    @Override
    public long countPlayedOnDate(String leagueId, String date) {
        if (!isValidId(leagueId) || !isValidId(date)) {
            return 0L;
        }
        try (Jedis jedis = jedisPool.getResource()) {
            return jedis.hlen(keyOf(leagueId, date));
        } catch (JedisException e) {
            throw new StoreUnavailableException("Failed to count scores in Redis for league " + leagueId, e);
        }
    }
    
    static String keyOf(String leagueId, String date) {
        return SCORES_KEY_PREFIX + leagueId + ":" + date;
    }
    
    private String encode(StoredScore score) {
        try {
            return objectMapper.writeValueAsString(score);
        } catch (JsonProcessingException e) {
            throw new WordLeagueException("Failed to encode score", "SERIALIZATION_ERROR", e);
        }
    }
    
    private StoredScore decode(String value) {
        try {
            return objectMapper.readValue(value, StoredScore.class);
        } catch (JsonProcessingException e) {
            throw new StoreUnavailableException("Corrupt score value in Redis: " + value, e);
        }
    }
    
    private boolean isValidId(String id) {
        return id != null && !id.trim().isEmpty();
    }
    
    // League, date and player live in the key and field, so only these two are stored
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class StoredScore {
        private Integer mistakes;
        
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
        private Instant recordedAt;
    }
}
