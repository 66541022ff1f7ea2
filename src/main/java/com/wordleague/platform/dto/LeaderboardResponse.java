package com.wordleague.platform.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.wordleague.platform.model.LeaderboardEntry;
import com.wordleague.platform.model.League;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardResponse {
    private League league;
    private String date;
    private List<LeaderboardEntry> entries;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant retrievedAt;
}
