package com.wordleague.platform.repository;

import com.wordleague.platform.model.League;
import com.wordleague.platform.model.LeagueMember;
import com.wordleague.platform.model.Player;
import com.wordleague.platform.model.PlayerLeague;

import java.util.List;
import java.util.Optional;

/**
 * Durable mapping of players to leagues, plus league and player records.
 * Implementations throw {@code StoreUnavailableException} on infrastructure failure.
 */
public interface MembershipRepository {
    /**
     * Persists a new league under a freshly generated 8-character id.
     * The name is stored trimmed; a blank name is rejected with {@code InvalidRequestException}.
     */
    League createLeague(String name);
    Optional<League> getLeague(String leagueId);
    /**
     * Creates the player if absent, otherwise overwrites the display name only.
     */
    Player upsertPlayer(String uuid, String displayName);
    /**
     * Idempotent, including under concurrent duplicate calls for the same pair.
     */
    void addMembership(String uuid, String leagueId);
    boolean hasMembership(String uuid, String leagueId);
    List<LeagueMember> listMembersOfLeague(String leagueId);
    List<PlayerLeague> listLeaguesOfPlayer(String uuid);
    long countMembers(String leagueId);
}
