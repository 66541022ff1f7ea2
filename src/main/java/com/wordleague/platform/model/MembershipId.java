package com.wordleague.platform.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MembershipId implements Serializable {
    private String playerUuid;
    private String leagueId;
}
