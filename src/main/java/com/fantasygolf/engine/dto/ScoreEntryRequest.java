package com.fantasygolf.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScoreEntryRequest {
    @NotBlank(message = "Tournament id cannot be empty")
    private String tournamentId;
    
    @NotBlank(message = "Golfer id cannot be empty")
    private String golferId;
    
    @NotNull(message = "Participated cannot be null")
    private Boolean participated;
    
    private Integer position;
    private Double rawScore;
}
