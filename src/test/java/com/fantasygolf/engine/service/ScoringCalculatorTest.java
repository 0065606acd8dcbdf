package com.fantasygolf.engine.service;

import com.fantasygolf.engine.config.ScoringRules;
import com.fantasygolf.engine.exception.ValidationException;
import com.fantasygolf.engine.model.PointBreakdown;
import com.fantasygolf.engine.model.ScoringFormat;
import com.fantasygolf.engine.model.TournamentResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ScoringCalculatorTest {

    private final ScoringCalculator calculator = new ScoringCalculator(ScoringRules.defaults());

    private TournamentResult.TournamentResultBuilder played() {
        return TournamentResult.builder()
            .golferId("golfer-1")
            .tournamentId("tournament-1")
            .participated(true)
            .scoringFormat(ScoringFormat.STABLEFORD)
            .multiplier(1.0);
    }

    @Test
    void testBasePoints_PodiumTable() {
        assertEquals(10, calculator.basePoints(1));
        assertEquals(7, calculator.basePoints(2));
        assertEquals(5, calculator.basePoints(3));
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 0, 4, 5, 10, 99})
    void testBasePoints_OffPodiumScoresNothing(int position) {
        assertEquals(0, calculator.basePoints(position));
    }

    @Test
    void testBasePoints_NullPosition() {
        assertEquals(0, calculator.basePoints(null));
    }

    @ParameterizedTest
    @EnumSource(ScoringFormat.class)
    void testBonusPoints_UnknownScoreEarnsNothing(ScoringFormat format) {
        assertEquals(0, calculator.bonusPoints(null, format));
    }

    @ParameterizedTest
    @CsvSource({
        "36, 3",
        "40, 3",
        "35.99, 1",
        "32, 1",
        "31.9, 0",
        "0, 0"
    })
    void testBonusPoints_Stableford(double raw, int expected) {
        assertEquals(expected, calculator.bonusPoints(raw, ScoringFormat.STABLEFORD));
    }

    @ParameterizedTest
    @CsvSource({
        "65, 3",
        "72, 3",
        "72.5, 1",
        "76, 1",
        "76.1, 0",
        "90, 0"
    })
    void testBonusPoints_Medal(double raw, int expected) {
        assertEquals(expected, calculator.bonusPoints(raw, ScoringFormat.MEDAL));
    }

    @Test
    void testCalculate_WinnerWithTopBonus() {
        PointBreakdown breakdown = calculator.calculate(played().position(1).rawPerformanceScore(36.0).build());

        assertEquals(10, breakdown.getBasePoints());
        assertEquals(3, breakdown.getBonusPoints());
        assertEquals(13.0, breakdown.getMultipliedPoints());
    }

    @Test
    void testCalculate_MultiplierAppliesToBaseAndBonus() {
        PointBreakdown breakdown = calculator.calculate(played()
            .position(2)
            .rawPerformanceScore(74.0)
            .scoringFormat(ScoringFormat.MEDAL)
            .multiplier(2.0)
            .build());

        assertEquals(7, breakdown.getBasePoints());
        assertEquals(1, breakdown.getBonusPoints());
        assertEquals(16.0, breakdown.getMultipliedPoints());
    }

    @ParameterizedTest
    @CsvSource({
        "1, 36, 1.0",
        "2, 33, 2.0",
        "3, 20, 3.0",
        "2, 31, 1.5",
        "1, 40, 0.5"
    })
    void testCalculate_MultipliedPointsInvariant(int position, double raw, double multiplier) {
        PointBreakdown breakdown = calculator.calculate(played()
            .position(position)
            .rawPerformanceScore(raw)
            .multiplier(multiplier)
            .build());

        assertEquals((breakdown.getBasePoints() + breakdown.getBonusPoints()) * multiplier,
            breakdown.getMultipliedPoints());
    }

    @Test
    void testCalculate_NotParticipatedIsAllZero() {
        PointBreakdown breakdown = calculator.calculate(played()
            .participated(false)
            .position(1)
            .rawPerformanceScore(40.0)
            .multiplier(3.0)
            .build());

        assertEquals(PointBreakdown.zero(), breakdown);
    }

    @Test
    void testCalculate_NotParticipatedIgnoresJunkPosition() {
        PointBreakdown breakdown = calculator.calculate(played().participated(false).position(9).build());

        assertEquals(PointBreakdown.zero(), breakdown);
    }

    @Test
    void testCalculate_ParticipatedOffPodiumStillEarnsBonus() {
        PointBreakdown breakdown = calculator.calculate(played().rawPerformanceScore(33.0).build());

        assertEquals(0, breakdown.getBasePoints());
        assertEquals(1, breakdown.getBonusPoints());
        assertEquals(1.0, breakdown.getMultipliedPoints());
    }

    @Test
    void testCalculate_InvalidPositionNamesField() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> calculator.calculate(played().position(4).build()));

        assertEquals("position", ex.getField());
        assertEquals("VALIDATION_ERROR", ex.getErrorCode());
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    void testCalculate_NonPositiveMultiplierRejected(double multiplier) {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> calculator.calculate(played().multiplier(multiplier).build()));

        assertEquals("multiplier", ex.getField());
    }

    @Test
    void testCalculate_MissingScoringFormatRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> calculator.calculate(played().scoringFormat(null).build()));

        assertEquals("scoringFormat", ex.getField());
    }

    @Test
    void testCalculate_NonFiniteRawScoreRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> calculator.calculate(played().rawPerformanceScore(Double.NaN).build()));

        assertEquals("rawPerformanceScore", ex.getField());
    }

    @Test
    void testScoringFormat_UnknownValueRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> ScoringFormat.fromValue("matchplay"));

        assertEquals("scoringFormat", ex.getField());
        assertEquals(ScoringFormat.MEDAL, ScoringFormat.fromValue(" Medal "));
    }

    @Test
    void testCalculate_AlternateRulesVersion() {
        ScoringRules v1 = ScoringRules.defaults().toBuilder()
            .firstPlacePoints(5)
            .secondPlacePoints(3)
            .thirdPlacePoints(1)
            .build();
        ScoringCalculator legacy = new ScoringCalculator(v1);

        PointBreakdown breakdown = legacy.calculate(played().position(1).rawPerformanceScore(36.0).build());

        assertEquals(5, breakdown.getBasePoints());
        assertEquals(8.0, breakdown.getMultipliedPoints());
    }

    @Test
    void testRescore_StoredPositionOffPodiumScoresNoBase() {
        PointBreakdown breakdown = calculator.rescore(played()
            .position(7)
            .rawPerformanceScore(33.0)
            .multiplier(2.0)
            .build());

        assertEquals(0, breakdown.getBasePoints());
        assertEquals(1, breakdown.getBonusPoints());
        assertEquals(2.0, breakdown.getMultipliedPoints());
    }

    @Test
    void testRescore_MissingFormatOrNullResultDoesNotThrow() {
        PointBreakdown breakdown = calculator.rescore(played()
            .position(1)
            .rawPerformanceScore(40.0)
            .scoringFormat(null)
            .build());

        assertEquals(new PointBreakdown(10, 0, 10.0), breakdown);
        assertEquals(PointBreakdown.zero(), calculator.rescore(null));
        assertFalse(calculator.isBonusRound(Double.NaN, ScoringFormat.STABLEFORD));
    }
}
