package com.fantasygolf.engine.config;

import com.fantasygolf.engine.model.NormalizationBasis;
import com.fantasygolf.engine.model.RunMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised engine settings. Defaults mirror {@link ScoringRules#defaults()},
 * {@link PricingConfig#defaults()} and {@link RecomputeOptions#defaults()}.
 */
@Data
@ConfigurationProperties(prefix = "fantasy")
public class FantasyGolfProperties {

    private Scoring scoring = new Scoring();
    private Pricing pricing = new Pricing();
    private Recompute recompute = new Recompute();

    @Data
    public static class Scoring {
        private int firstPlacePoints = 10;
        private int secondPlacePoints = 7;
        private int thirdPlacePoints = 5;
        private int topBonusPoints = 3;
        private int lowerBonusPoints = 1;
        private double stablefordTopThreshold = 36;
        private double stablefordLowerThreshold = 32;
        private double medalTopThreshold = 72;
        private double medalLowerThreshold = 76;
    }

    @Data
    public static class Pricing {
        private long floorPrice = 3_500_000L;
        private long ceilingPrice = 14_500_000L;
        private double exponent = 1.3;
        private long roundTo = 100_000L;
        private double baselineAverage = 3.0;
        private int minSampleSize = 5;
        private int consistencyMinEvents = 3;
        private double totalPointsWeight = 1.0;
        private double averageWeight = 5.0;
        private double winsWeight = 8.0;
        private double podiumsWeight = 3.0;
        private double consistencyWeight = 20.0;
        private NormalizationBasis basis = NormalizationBasis.COMPOSITE;
        private long salaryCap = 50_000_000L;
        private int rosterSize = 6;
        private String backupDirectory = "./data/price-backups";
        private RunMode scheduledMode = RunMode.PREVIEW;
    }

    @Data
    public static class Recompute {
        private RecomputeOptions.LegacyFlagMapping legacyFlagMapping = RecomputeOptions.LegacyFlagMapping.LOWEST_BONUS_TIER;
        private RecomputeOptions.AbsentFlagPolicy absentFlagPolicy = RecomputeOptions.AbsentFlagPolicy.NO_BONUS;
    }
}
