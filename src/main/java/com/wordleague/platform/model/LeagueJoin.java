package com.wordleague.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of joining a league. Joining twice is allowed and reported through {@code alreadyMember}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeagueJoin {
    private League league;
    private Player player;
    private boolean alreadyMember;
}
