package com.fantasygolf.engine.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class RecomputeOptions {

    public enum LegacyFlagMapping {
        /** A true flag becomes the floor of the lowest bonus tier. */
        LOWEST_BONUS_TIER,
        /** A true flag becomes the floor of the top tier, the threshold the flag originally recorded. */
        LEGACY_THRESHOLD
    }

    public enum AbsentFlagPolicy {
        /** Never-recorded flags score like false: unknown, no bonus. */
        NO_BONUS,
        /** Never-recorded flags leave the record untouched and are counted as excluded. */
        EXCLUDE
    }

    @Builder.Default LegacyFlagMapping legacyFlagMapping = LegacyFlagMapping.LOWEST_BONUS_TIER;
    @Builder.Default AbsentFlagPolicy absentFlagPolicy = AbsentFlagPolicy.NO_BONUS;

    public static RecomputeOptions defaults() {
        return RecomputeOptions.builder().build();
    }
}
