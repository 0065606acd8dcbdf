package com.fantasygolf.engine.service;

import com.fantasygolf.engine.config.ScoringRules;
import com.fantasygolf.engine.exception.ValidationException;
import com.fantasygolf.engine.model.PointBreakdown;
import com.fantasygolf.engine.model.ScoringFormat;
import com.fantasygolf.engine.model.TournamentResult;
import org.springframework.stereotype.Component;

/**
 * Converts one tournament result into its point breakdown.
 * Stateless; the only failure is a malformed result, reported as a {@link ValidationException}.
 */
@Component
public class ScoringCalculator {

    private final ScoringRules rules;

    public ScoringCalculator(ScoringRules rules) {
        this.rules = rules;
    }

    public ScoringRules getRules() {
        return rules;
    }

    public PointBreakdown calculate(TournamentResult result) {
        validate(result);
        if (!result.isParticipated()) {
            return PointBreakdown.zero();
        }

        int basePoints = basePoints(result.getPosition());
        int bonusPoints = bonusPoints(result.getRawPerformanceScore(), result.getScoringFormat());
        double multipliedPoints = (basePoints + bonusPoints) * result.getMultiplier();
        return new PointBreakdown(basePoints, bonusPoints, multipliedPoints);
    }

    /**
     * Podium table lookup. Anything but 1, 2 or 3 (including null) scores nothing.
     */
    public int basePoints(Integer position) {
        if (position == null) {
            return 0;
        }
        switch (position) {
            case 1:
                return rules.getFirstPlacePoints();
            case 2:
                return rules.getSecondPlacePoints();
            case 3:
                return rules.getThirdPlacePoints();
            default:
                return 0;
        }
    }

    /**
     * Bonus for the raw performance score. An unknown score earns no bonus.
     */
    public int bonusPoints(Double rawPerformanceScore, ScoringFormat format) {
        if (rawPerformanceScore == null) {
            return 0;
        }
        if (format == null) {
            throw new ValidationException("scoringFormat", "must be set when a raw score is present");
        }

        double raw = rawPerformanceScore;
        if (format == ScoringFormat.STABLEFORD) {
            if (raw >= rules.getStablefordTopThreshold()) {
                return rules.getTopBonusPoints();
            }
            if (raw >= rules.getStablefordLowerThreshold()) {
                return rules.getLowerBonusPoints();
            }
            return 0;
        }

        if (raw <= rules.getMedalTopThreshold()) {
            return rules.getTopBonusPoints();
        }
        if (raw <= rules.getMedalLowerThreshold()) {
            return rules.getLowerBonusPoints();
        }
        return 0;
    }

    /**
     * Scores a result already in storage. Unlike {@link #calculate}, nothing is rejected:
     * positions outside the podium score no base points, and a missing format or a
     * non-finite raw score earns no bonus.
     */
    public PointBreakdown rescore(TournamentResult result) {
        if (result == null || !result.isParticipated()) {
            return PointBreakdown.zero();
        }
        int basePoints = basePoints(result.getPosition());
        int bonusPoints = isBonusRound(result.getRawPerformanceScore(), result.getScoringFormat())
            ? bonusPoints(result.getRawPerformanceScore(), result.getScoringFormat())
            : 0;
        return new PointBreakdown(basePoints, bonusPoints, (basePoints + bonusPoints) * result.getMultiplier());
    }

    /**
     * True when the raw score lands in any bonus tier. A missing format counts as no bonus.
     */
    public boolean isBonusRound(Double rawPerformanceScore, ScoringFormat format) {
        if (format == null || rawPerformanceScore == null || !Double.isFinite(rawPerformanceScore)) {
            return false;
        }
        return bonusPoints(rawPerformanceScore, format) > 0;
    }

    // Position and raw score only matter for golfers who played
    private void validate(TournamentResult result) {
        if (result == null) {
            throw new ValidationException("result", "must not be null");
        }
        if (result.getScoringFormat() == null) {
            throw new ValidationException("scoringFormat", "must be stableford or medal");
        }
        double multiplier = result.getMultiplier();
        if (!(multiplier > 0) || Double.isInfinite(multiplier)) {
            throw new ValidationException("multiplier", "must be a positive number, was " + multiplier);
        }
        if (!result.isParticipated()) {
            return;
        }

        Integer position = result.getPosition();
        if (position != null && (position < 1 || position > 3)) {
            throw new ValidationException("position", "must be 1, 2, 3 or null, was " + position);
        }
        Double raw = result.getRawPerformanceScore();
        if (raw != null && (raw.isNaN() || raw.isInfinite())) {
            throw new ValidationException("rawPerformanceScore", "must be a real number or null");
        }
    }
}
