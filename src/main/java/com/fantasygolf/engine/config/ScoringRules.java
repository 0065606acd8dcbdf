package com.fantasygolf.engine.config;

import com.fantasygolf.engine.exception.ValidationException;
import com.fantasygolf.engine.model.ScoringFormat;
import lombok.Builder;
import lombok.Value;

/**
 * Versioned scoring-system constants. Podium points reward only the top three; the bonus
 * has two tiers per format. Stableford thresholds are lower bounds (higher is better),
 * medal thresholds are upper bounds (lower is better).
 */
@Value
@Builder(toBuilder = true)
public class ScoringRules {
    @Builder.Default int firstPlacePoints = 10;
    @Builder.Default int secondPlacePoints = 7;
    @Builder.Default int thirdPlacePoints = 5;
    @Builder.Default int topBonusPoints = 3;
    @Builder.Default int lowerBonusPoints = 1;
    @Builder.Default double stablefordTopThreshold = 36;
    @Builder.Default double stablefordLowerThreshold = 32;
    @Builder.Default double medalTopThreshold = 72;
    @Builder.Default double medalLowerThreshold = 76;

    public static ScoringRules defaults() {
        return ScoringRules.builder().build();
    }

    /**
     * Smallest raw score that still earns the lower bonus tier in this format.
     */
    public double lowestBonusTierFloor(ScoringFormat format) {
        return format == ScoringFormat.MEDAL ? medalLowerThreshold : stablefordLowerThreshold;
    }

    public double topBonusTierFloor(ScoringFormat format) {
        return format == ScoringFormat.MEDAL ? medalTopThreshold : stablefordTopThreshold;
    }

    public ScoringRules validate() {
        if (stablefordTopThreshold < stablefordLowerThreshold) {
            throw new ValidationException("stablefordTopThreshold", "must not be below the lower stableford threshold");
        }
        if (medalTopThreshold > medalLowerThreshold) {
            throw new ValidationException("medalTopThreshold", "must not be above the lower medal threshold");
        }
        if (topBonusPoints < lowerBonusPoints || lowerBonusPoints < 0) {
            throw new ValidationException("topBonusPoints", "bonus tiers must be non-negative and ordered");
        }
        return this;
    }
}
