package com.fantasygolf.engine.config;

import com.fantasygolf.engine.exception.ValidationException;
import com.fantasygolf.engine.model.NormalizationBasis;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    private final EngineConfig engineConfig = new EngineConfig();

    @Test
    void testPricingConfig_DefaultsMatchProperties() {
        PricingConfig config = engineConfig.pricingConfig(new FantasyGolfProperties());

        assertEquals(PricingConfig.defaults(), config);
        assertEquals(11_000_000L, config.priceRange());
        assertFalse(config.isConcaveCurve());
    }

    @Test
    void testScoringRules_DefaultsMatchProperties() {
        assertEquals(ScoringRules.defaults(), engineConfig.scoringRules(new FantasyGolfProperties()));
    }

    @Test
    void testRecomputeOptions_DefaultsMatchProperties() {
        assertEquals(RecomputeOptions.defaults(), engineConfig.recomputeOptions(new FantasyGolfProperties()));
    }

    @Test
    void testPricingConfig_ConcaveExponentStillAccepted() {
        FantasyGolfProperties properties = new FantasyGolfProperties();
        properties.getPricing().setExponent(0.8);
        properties.getPricing().setBasis(NormalizationBasis.RANK);

        PricingConfig config = engineConfig.pricingConfig(properties);

        assertTrue(config.isConcaveCurve());
        assertEquals(NormalizationBasis.RANK, config.getBasis());
    }

    @Test
    void testPricingConfig_CeilingBelowFloorRejected() {
        FantasyGolfProperties properties = new FantasyGolfProperties();
        properties.getPricing().setCeilingPrice(3_000_000L);

        ValidationException ex = assertThrows(ValidationException.class,
            () -> engineConfig.pricingConfig(properties));
        assertEquals("ceilingPrice", ex.getField());
    }

    @Test
    void testPricingConfig_NonPositiveRoundingRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> PricingConfig.builder().roundTo(0).build().validate());
        assertEquals("roundTo", ex.getField());
    }

    @Test
    void testScoringRules_InvertedThresholdsRejected() {
        FantasyGolfProperties properties = new FantasyGolfProperties();
        properties.getScoring().setMedalTopThreshold(80);

        ValidationException ex = assertThrows(ValidationException.class,
            () -> engineConfig.scoringRules(properties));
        assertEquals("medalTopThreshold", ex.getField());
    }
}
