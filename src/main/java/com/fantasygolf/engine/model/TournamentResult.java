package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One golfer's raw outcome in one tournament, together with the tournament metadata
 * needed to score it. {@code position} is only set for a 1st to 3rd place finish.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TournamentResult {
    private String golferId;
    private String tournamentId;
    private boolean participated;
    private Integer position;
    private Double rawPerformanceScore;
    private ScoringFormat scoringFormat;
    private double multiplier;
}
