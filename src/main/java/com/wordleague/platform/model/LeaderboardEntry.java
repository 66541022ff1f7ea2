package com.wordleague.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A league member's line on a daily leaderboard. {@code mistakes}, {@code date} and
 * {@code rank} are null for members who have not played that date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntry {
    private String uuid;
    private String displayName;
    private Integer mistakes;
    private String date;
    private Integer rank;

    public boolean hasPlayed() {
        return mistakes != null;
    }
}
