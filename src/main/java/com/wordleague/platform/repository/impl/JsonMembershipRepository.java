package com.wordleague.platform.repository.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.wordleague.platform.exception.StoreUnavailableException;
import com.wordleague.platform.model.League;
import com.wordleague.platform.model.LeagueMember;
import com.wordleague.platform.model.Membership;
import com.wordleague.platform.model.MembershipId;
import com.wordleague.platform.model.Player;
import com.wordleague.platform.model.PlayerLeague;
import com.wordleague.platform.repository.MembershipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
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
import java.util.concurrent.locks.ReentrantLock;

/**
 * Flat-file membership store. Leagues, players and memberships each live in one JSON file
 * under the data directory; every mutation rewrites the affected file while holding the store lock.
 */
@Repository
@ConditionalOnProperty(name = "wordleague.storage.membership", havingValue = "json")
public class JsonMembershipRepository implements MembershipRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(JsonMembershipRepository.class);
    
    private static final String LEAGUES_FILE = "leagues.json";
    private static final String PLAYERS_FILE = "players.json";
    private static final String MEMBERSHIPS_FILE = "memberships.json";
    
    private final String dataDirectory;
    private final ObjectMapper objectMapper;
    private final LeagueIdGenerator leagueIdGenerator;
    private final Map<String, League> leagues = new LinkedHashMap<>();
    private final Map<String, Player> players = new LinkedHashMap<>();
    private final Map<MembershipId, Membership> memberships = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    
    @Autowired
    public JsonMembershipRepository(
            @Value("${wordleague.storage.directory:./data}") String dataDirectory,
            LeagueIdGenerator leagueIdGenerator) {
        this.dataDirectory = dataDirectory;
        this.leagueIdGenerator = leagueIdGenerator;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        initializeDirectory();
        loadAll();
    }
    
    private void initializeDirectory() {
        try {
            Path path = Paths.get(dataDirectory);
            if (!Files.exists(path)) {
                Files.createDirectories(path);
                logger.info("Created membership data directory {}", path.toAbsolutePath());
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to create data directory: " + dataDirectory, e);
        }
    }
    
    private void loadAll() {
        readList(LEAGUES_FILE, new TypeReference<List<League>>() {})
            .forEach(league -> leagues.put(league.getId(), league));
        readList(PLAYERS_FILE, new TypeReference<List<Player>>() {})
            .forEach(player -> players.put(player.getUuid(), player));
        readList(MEMBERSHIPS_FILE, new TypeReference<List<Membership>>() {})
            .forEach(membership -> memberships.put(idOf(membership), membership));
        logger.info("Loaded {} leagues, {} players and {} memberships from {}",
            leagues.size(), players.size(), memberships.size(), dataDirectory);
    }
    
    private <T> List<T> readList(String fileName, TypeReference<List<T>> type) {
        File file = new File(dataDirectory, fileName);
        if (!file.exists()) {
            return Collections.emptyList();
        }
        try {
            List<T> items = objectMapper.readValue(file, type);
            return items != null ? items : Collections.emptyList();
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to read " + file, e);
        }
    }
    
    private void writeList(String fileName, Collection<?> items) {
        File file = new File(dataDirectory, fileName);
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file, new ArrayList<>(items));
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to write " + file, e);
        }
    }
    
    @Override
    public League createLeague(String name) {
        String trimmedName = StoreArguments.requireTrimmed(name, "League name");
        lock.lock();
        try {
            League league = League.builder()
                .id(leagueIdGenerator.generate(leagues::containsKey))
                .name(trimmedName)
                .createdAt(Instant.now())
                .build();
            leagues.put(league.getId(), league);
            try {
                writeList(LEAGUES_FILE, leagues.values());
            } catch (StoreUnavailableException e) {
                leagues.remove(league.getId());
                throw e;
            }
            return league;
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public Optional<League> getLeague(String leagueId) {
        if (!isValidId(leagueId)) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(leagues.get(leagueId));
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public Player upsertPlayer(String uuid, String displayName) {
        StoreArguments.requireText(uuid, "Player UUID");
        String trimmedName = StoreArguments.requireTrimmed(displayName, "Display name");
        lock.lock();
        try {
            Player previous = players.get(uuid);
            Player player = Player.builder()
                .uuid(uuid)
                .displayName(trimmedName)
                .createdAt(previous != null ? previous.getCreatedAt() : Instant.now())
                .build();
            players.put(uuid, player);
            try {
                writeList(PLAYERS_FILE, players.values());
            } catch (StoreUnavailableException e) {
                restore(players, uuid, previous);
                throw e;
            }
            return player;
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public void addMembership(String uuid, String leagueId) {
        StoreArguments.requireText(uuid, "Player UUID");
        StoreArguments.requireText(leagueId, "League id");
        MembershipId id = new MembershipId(uuid, leagueId);
        lock.lock();
        try {
            if (memberships.containsKey(id)) {
                return;
            }
            memberships.put(id, Membership.builder()
                .playerUuid(uuid)
                .leagueId(leagueId)
                .joinedAt(Instant.now())
                .build());
            try {
                writeList(MEMBERSHIPS_FILE, memberships.values());
            } catch (StoreUnavailableException e) {
                memberships.remove(id);
                throw e;
            }
            logger.info("Added player {} to league {}", uuid, leagueId);
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public boolean hasMembership(String uuid, String leagueId) {
        if (!isValidId(uuid) || !isValidId(leagueId)) {
            return false;
        }
        lock.lock();
        try {
            return memberships.containsKey(new MembershipId(uuid, leagueId));
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public List<LeagueMember> listMembersOfLeague(String leagueId) {
        if (!isValidId(leagueId)) {
            return Collections.emptyList();
        }
        lock.lock();
        try {
            List<LeagueMember> members = new ArrayList<>();
            for (Membership membership : memberships.values()) {
                if (!leagueId.equals(membership.getLeagueId())) {
                    continue;
                }
                Player player = players.get(membership.getPlayerUuid());
                if (player != null) {
                    members.add(new LeagueMember(player.getUuid(), player.getDisplayName()));
                }
            }
            return members;
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public List<PlayerLeague> listLeaguesOfPlayer(String uuid) {
        if (!isValidId(uuid)) {
            return Collections.emptyList();
        }
        lock.lock();
        try {
            List<PlayerLeague> result = new ArrayList<>();
            for (Membership membership : memberships.values()) {
                if (!uuid.equals(membership.getPlayerUuid())) {
                    continue;
                }
                League league = leagues.get(membership.getLeagueId());
                if (league != null) {
                    result.add(new PlayerLeague(league.getId(), league.getName()));
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }
    
    @Override
    public long countMembers(String leagueId) {
        if (!isValidId(leagueId)) {
            return 0L;
        }
        lock.lock();
        try {
            return memberships.keySet().stream()
                .filter(id -> leagueId.equals(id.getLeagueId()))
                .count();
        } finally {
            lock.unlock();
        }
    }
    
    private static MembershipId idOf(Membership membership) {
        return new MembershipId(membership.getPlayerUuid(), membership.getLeagueId());
    }
    
    private static <K, V> void restore(Map<K, V> map, K key, V previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }
    
    private boolean isValidId(String id) {
        return id != null && !id.trim().isEmpty();
    }
}
