package com.wordleague.platform.repository.impl;

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
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "wordleague.storage.membership", havingValue = "jpa", matchIfMissing = true)
public class JpaMembershipRepository implements MembershipRepository {
    
    private static final Logger logger = LoggerFactory.getLogger(JpaMembershipRepository.class);
    
    private final LeagueJpaRepository leagueRepository;
    private final PlayerJpaRepository playerRepository;
    private final MembershipJpaRepository membershipRepository;
    private final LeagueIdGenerator leagueIdGenerator;
    
    @Autowired
    public JpaMembershipRepository(
            LeagueJpaRepository leagueRepository,
            PlayerJpaRepository playerRepository,
            MembershipJpaRepository membershipRepository,
            LeagueIdGenerator leagueIdGenerator) {
        this.leagueRepository = leagueRepository;
        this.playerRepository = playerRepository;
        this.membershipRepository = membershipRepository;
        this.leagueIdGenerator = leagueIdGenerator;
    }
    
    @Override
    public League createLeague(String name) {
        String trimmedName = StoreArguments.requireTrimmed(name, "League name");
        Instant createdAt = Instant.now();
        try {
            String id = leagueIdGenerator.generate(candidate -> !insertLeague(candidate, trimmedName, createdAt));
            logger.info("Created league {} - name: {}", id, trimmedName);
            return League.builder()
                .id(id)
                .name(trimmedName)
                .createdAt(createdAt)
                .build();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to create league", e);
        }
    }
    
    private boolean insertLeague(String id, String name, Instant createdAt) {
        try {
            return leagueRepository.insertLeague(id, name, createdAt) == 1;
        } catch (DataIntegrityViolationException e) {
            logger.debug("League id {} is already taken, drawing another", id);
            return false;
        }
    }
    
    @Override
    public Optional<League> getLeague(String leagueId) {
        if (!isValidId(leagueId)) {
            return Optional.empty();
        }
        try {
            return leagueRepository.findById(leagueId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to load league " + leagueId, e);
        }
    }
    
    @Override
    public Player upsertPlayer(String uuid, String displayName) {
        StoreArguments.requireText(uuid, "Player UUID");
        String trimmedName = StoreArguments.requireTrimmed(displayName, "Display name");
        try {
            return writePlayer(uuid, trimmedName);
        } catch (DataIntegrityViolationException e) {
            logger.debug("Player {} was created concurrently, overwriting display name", uuid);
            return retryPlayerWrite(uuid, trimmedName);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to upsert player " + uuid, e);
        }
    }
    
    private Player retryPlayerWrite(String uuid, String displayName) {
        try {
            return writePlayer(uuid, displayName);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to upsert player " + uuid, e);
        }
    }
    
    private Player writePlayer(String uuid, String displayName) {
        Player player = playerRepository.findById(uuid)
            .orElseGet(() -> Player.builder()
                .uuid(uuid)
                .createdAt(Instant.now())
                .build());
        player.setDisplayName(displayName);
        return playerRepository.saveAndFlush(player);
    }
    
    @Override
    public void addMembership(String uuid, String leagueId) {
        StoreArguments.requireText(uuid, "Player UUID");
        StoreArguments.requireText(leagueId, "League id");
        MembershipId id = new MembershipId(uuid, leagueId);
        try {
            if (membershipRepository.existsById(id)) {
                return;
            }
            membershipRepository.saveAndFlush(Membership.builder()
                .playerUuid(uuid)
                .leagueId(leagueId)
                .joinedAt(Instant.now())
                .build());
            logger.info("Added player {} to league {}", uuid, leagueId);
        } catch (DataIntegrityViolationException e) {
            logger.debug("Membership of player {} in league {} was created concurrently", uuid, leagueId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to add player " + uuid + " to league " + leagueId, e);
        }
    }
    
    @Override
    public boolean hasMembership(String uuid, String leagueId) {
        if (!isValidId(uuid) || !isValidId(leagueId)) {
            return false;
        }
        try {
            return membershipRepository.existsById(new MembershipId(uuid, leagueId));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to check membership of player " + uuid, e);
        }
    }
    
    @Override
    public List<LeagueMember> listMembersOfLeague(String leagueId) {
        if (!isValidId(leagueId)) {
            return Collections.emptyList();
        }
        try {
            return membershipRepository.findMembersOfLeague(leagueId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to list members of league " + leagueId, e);
        }
    }
    
    @Override
    public List<PlayerLeague> listLeaguesOfPlayer(String uuid) {
        if (!isValidId(uuid)) {
            return Collections.emptyList();
        }
        try {
            return membershipRepository.findLeaguesOfPlayer(uuid);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to list leagues of player " + uuid, e);
        }
    }
    
    @Override
    public long countMembers(String leagueId) {
        if (!isValidId(leagueId)) {
            return 0L;
        }
        try {
            return membershipRepository.countByLeagueId(leagueId);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to count members of league " + leagueId, e);
        }
    }
    
    private boolean isValidId(String id) {
        return id != null && !id.trim().isEmpty();
    }
}
