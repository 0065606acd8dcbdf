package com.fantasygolf.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FantasyGolfProperties.class)
public class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public ScoringRules scoringRules(FantasyGolfProperties properties) {
        FantasyGolfProperties.Scoring scoring = properties.getScoring();
        ScoringRules rules = ScoringRules.builder()
            .firstPlacePoints(scoring.getFirstPlacePoints())
            .secondPlacePoints(scoring.getSecondPlacePoints())
            .thirdPlacePoints(scoring.getThirdPlacePoints())
            .topBonusPoints(scoring.getTopBonusPoints())
            .lowerBonusPoints(scoring.getLowerBonusPoints())
            .stablefordTopThreshold(scoring.getStablefordTopThreshold())
            .stablefordLowerThreshold(scoring.getStablefordLowerThreshold())
            .medalTopThreshold(scoring.getMedalTopThreshold())
            .medalLowerThreshold(scoring.getMedalLowerThreshold())
            .build()
            .validate();
        logger.info("Scoring rules: podium {}/{}/{}, stableford {}+/{}+, medal <={}/<={}",
            rules.getFirstPlacePoints(), rules.getSecondPlacePoints(), rules.getThirdPlacePoints(),
            rules.getStablefordTopThreshold(), rules.getStablefordLowerThreshold(),
            rules.getMedalTopThreshold(), rules.getMedalLowerThreshold());
        return rules;
    }

    @Bean
    public PricingConfig pricingConfig(FantasyGolfProperties properties) {
        FantasyGolfProperties.Pricing pricing = properties.getPricing();
        PricingConfig config = PricingConfig.builder()
            .floorPrice(pricing.getFloorPrice())
            .ceilingPrice(pricing.getCeilingPrice())
            .exponent(pricing.getExponent())
            .roundTo(pricing.getRoundTo())
            .baselineAverage(pricing.getBaselineAverage())
            .minSampleSize(pricing.getMinSampleSize())
            .consistencyMinEvents(pricing.getConsistencyMinEvents())
            .totalPointsWeight(pricing.getTotalPointsWeight())
            .averageWeight(pricing.getAverageWeight())
            .winsWeight(pricing.getWinsWeight())
            .podiumsWeight(pricing.getPodiumsWeight())
            .consistencyWeight(pricing.getConsistencyWeight())
            .basis(pricing.getBasis())
            .salaryCap(pricing.getSalaryCap())
            .rosterSize(pricing.getRosterSize())
            .build()
            .validate();
        
        if (config.isConcaveCurve()) {
            logger.warn("Pricing exponent {} is below 1: the curve compresses top prices together. " +
                "Keep it only for backward numeric compatibility with legacy prices.", config.getExponent());
        }
        logger.info("Pricing: floor {} ceiling {} exponent {} basis {} cap {}",
            config.getFloorPrice(), config.getCeilingPrice(), config.getExponent(),
            config.getBasis(), config.getSalaryCap());
        return config;
    }

    @Bean
    public RecomputeOptions recomputeOptions(FantasyGolfProperties properties) {
        return RecomputeOptions.builder()
            .legacyFlagMapping(properties.getRecompute().getLegacyFlagMapping())
            .absentFlagPolicy(properties.getRecompute().getAbsentFlagPolicy())
            .build();
    }
}
