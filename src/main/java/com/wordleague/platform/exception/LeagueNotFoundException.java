package com.wordleague.platform.exception;

public class LeagueNotFoundException extends WordLeagueException {
    public LeagueNotFoundException(String leagueId) {
        super("League not found with id: " + leagueId, "LEAGUE_NOT_FOUND");
    }
}
