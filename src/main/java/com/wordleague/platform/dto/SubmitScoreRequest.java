package com.wordleague.platform.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitScoreRequest {
    @NotBlank(message = "Player UUID cannot be blank")
    private String uuid;
    
    @NotBlank(message = "Date cannot be blank")
    private String date;
    
    @NotNull(message = "Mistakes cannot be null")
    @Min(value = 0, message = "Mistakes cannot be negative")
    private Integer mistakes;
}
