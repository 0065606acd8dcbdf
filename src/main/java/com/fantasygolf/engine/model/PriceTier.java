package com.fantasygolf.engine.model;

public enum PriceTier {
    ELITE(12_000_000L),
    STAR(9_000_000L),
    STRONG(6_000_000L),
    AVERAGE(4_500_000L),
    DEVELOPING(0L);

    private final long lowerBound;

    PriceTier(long lowerBound) {
        this.lowerBound = lowerBound;
    }

    public long getLowerBound() {
        return lowerBound;
    }

    public static PriceTier forPrice(long price) {
        for (PriceTier tier : values()) {
            if (price >= tier.lowerBound) {
                return tier;
            }
        }
        return DEVELOPING;
    }
}
