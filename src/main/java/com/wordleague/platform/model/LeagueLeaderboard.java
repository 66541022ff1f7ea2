package com.wordleague.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeagueLeaderboard {
    private League league;
    private String date;
    private List<LeaderboardEntry> entries;
}
