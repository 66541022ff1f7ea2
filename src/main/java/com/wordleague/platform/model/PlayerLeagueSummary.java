package com.wordleague.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerLeagueSummary {
    private String leagueId;
    private String leagueName;
    private long totalMembers;
    private long playedToday;
}
