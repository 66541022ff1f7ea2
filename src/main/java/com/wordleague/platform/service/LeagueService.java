package com.wordleague.platform.service;

import com.wordleague.platform.exception.InvalidRequestException;
import com.wordleague.platform.exception.LeagueNotFoundException;
import com.wordleague.platform.model.League;
import com.wordleague.platform.model.LeagueDetails;
import com.wordleague.platform.model.LeagueJoin;
import com.wordleague.platform.model.Player;
import com.wordleague.platform.repository.MembershipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class LeagueService {
    
    private static final Logger logger = LoggerFactory.getLogger(LeagueService.class);
    
    private final MembershipRepository membershipRepository;
    
    @Autowired
    public LeagueService(MembershipRepository membershipRepository) {
        this.membershipRepository = membershipRepository;
    }
    
    public League createLeague(String name) {
        requireText(name, "League name");
        League league = membershipRepository.createLeague(name);
        logger.info("Created league {} - name: {}", league.getId(), league.getName());
        return league;
    }
    
    public LeagueDetails getLeagueDetails(String leagueId) {
        League league = findLeague(leagueId);
        return LeagueDetails.builder()
            .league(league)
            .memberCount(membershipRepository.countMembers(leagueId))
            .build();
    }
    
    /**
     * Adds the player to the league, creating the player or overwriting their display name.
     * Joining a league twice is not an error.
     */
    public LeagueJoin joinLeague(String leagueId, String uuid, String displayName) {
        requireText(uuid, "Player UUID");
        requireText(displayName, "Display name");
        League league = findLeague(leagueId);
        
        Player player = membershipRepository.upsertPlayer(uuid, displayName);
        boolean alreadyMember = membershipRepository.hasMembership(uuid, leagueId);
        membershipRepository.addMembership(uuid, leagueId);
        
        logger.info("Player {} joined league {} (already a member: {})", uuid, leagueId, alreadyMember);
        return LeagueJoin.builder()
            .league(league)
            .player(player)
            .alreadyMember(alreadyMember)
            .build();
    }
    
    public Player updateDisplayName(String uuid, String displayName) {
        requireText(uuid, "Player UUID");
        requireText(displayName, "Display name");
        Player player = membershipRepository.upsertPlayer(uuid, displayName);
        logger.info("Updated display name of player {}", uuid);
        return player;
    }
    
    private League findLeague(String leagueId) {
        requireText(leagueId, "League id");
        return membershipRepository.getLeague(leagueId)
            .orElseThrow(() -> new LeagueNotFoundException(leagueId));
    }
    
    private static void requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new InvalidRequestException(field + " cannot be null or empty");
        }
    }
}
