package com.wordleague.platform.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JoinLeagueRequest {
    @NotBlank(message = "Player UUID cannot be blank")
    private String uuid;
    
    @NotBlank(message = "Display name cannot be blank")
    private String displayName;
}
