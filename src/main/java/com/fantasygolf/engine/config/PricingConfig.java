package com.fantasygolf.engine.config;

import com.fantasygolf.engine.exception.ValidationException;
import com.fantasygolf.engine.model.NormalizationBasis;
import lombok.Builder;
import lombok.Value;

/**
 * Price curve, composite weights and audit limits for a pricing run.
 * Money amounts are whole minor units.
 */
@Value
@Builder(toBuilder = true)
public class PricingConfig {
    @Builder.Default long floorPrice = 3_500_000L;
    @Builder.Default long ceilingPrice = 14_500_000L;
    @Builder.Default double exponent = 1.3;
    @Builder.Default long roundTo = 100_000L;
    @Builder.Default double baselineAverage = 3.0;
    @Builder.Default int minSampleSize = 5;
    @Builder.Default int consistencyMinEvents = 3;
    @Builder.Default double totalPointsWeight = 1.0;
    @Builder.Default double averageWeight = 5.0;
    @Builder.Default double winsWeight = 8.0;
    @Builder.Default double podiumsWeight = 3.0;
    @Builder.Default double consistencyWeight = 20.0;
    @Builder.Default NormalizationBasis basis = NormalizationBasis.COMPOSITE;
    @Builder.Default long salaryCap = 50_000_000L;
    @Builder.Default int rosterSize = 6;

    public static PricingConfig defaults() {
        return PricingConfig.builder().build();
    }

    public long priceRange() {
        return ceilingPrice - floorPrice;
    }

    /**
     * True when the curve compresses the top of the market instead of separating it.
     */
    public boolean isConcaveCurve() {
        return exponent < 1.0;
    }

    public PricingConfig validate() {
        if (floorPrice < 0) {
            throw new ValidationException("floorPrice", "must not be negative");
        }
        if (ceilingPrice < floorPrice) {
            throw new ValidationException("ceilingPrice", "must not be below floorPrice");
        }
        if (!(exponent > 0) || Double.isInfinite(exponent)) {
            throw new ValidationException("exponent", "must be a positive finite number");
        }
        if (roundTo <= 0) {
            throw new ValidationException("roundTo", "must be positive");
        }
        if (minSampleSize < 1) {
            throw new ValidationException("minSampleSize", "must be at least 1");
        }
        if (consistencyMinEvents < 1) {
            throw new ValidationException("consistencyMinEvents", "must be at least 1");
        }
        if (rosterSize < 1) {
            throw new ValidationException("rosterSize", "must be at least 1");
        }
        if (basis == null) {
            throw new ValidationException("basis", "must be set");
        }
        return this;
    }
}
