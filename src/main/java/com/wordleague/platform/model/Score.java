package com.wordleague.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One player's mistake count in one league for one puzzle date ({@code YYYY-MM-DD}).
 * Last write wins: re-submission overwrites {@code mistakes} and {@code recordedAt}.
 */
@Entity
@Table(name = "scores", indexes = {
    @Index(name = "idx_score_league_date", columnList = "league_id,score_date")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(ScoreId.class)
public class Score {
    @Id
    @Column(name = "player_uuid", nullable = false)
    private String playerUuid;
    
    @Id
    @Column(name = "league_id", nullable = false, length = 8)
    private String leagueId;
    
    @Id
    @Column(name = "score_date", nullable = false, length = 10)
    private String date;
    
    @Column(name = "mistakes", nullable = false)
    private Integer mistakes;
    
    @Column(name = "recorded_at", nullable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant recordedAt;
}
