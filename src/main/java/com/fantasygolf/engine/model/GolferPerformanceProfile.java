package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate of a golfer's scored history. {@code averagePointsPerEvent} is the
 * small-sample adjusted average; {@code rawAveragePointsPerEvent} is the plain mean.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GolferPerformanceProfile {
    private String golferId;
    private double totalPoints;
    private int timesPlayed;
    private int wins;
    private int podiums;
    private int bonusRoundCount;
    private double rawAveragePointsPerEvent;
    private double averagePointsPerEvent;
    private double consistencyRate;
    private double compositeScore;
}
