package com.wordleague.platform.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "league_memberships", indexes = {
    @Index(name = "idx_membership_league", columnList = "league_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@IdClass(MembershipId.class)
public class Membership {
    @Id
    @Column(name = "player_uuid", nullable = false)
    private String playerUuid;
    
    @Id
    @Column(name = "league_id", nullable = false, length = 8)
    private String leagueId;
    
    @Column(name = "joined_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant joinedAt;
}
