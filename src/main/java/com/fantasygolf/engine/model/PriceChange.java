package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * New price for one golfer. Ranks are 1-based competition ranks, so golfers with equal
 * prices share a rank.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceChange {
    private String golferId;
    private String displayName;
    private long oldPrice;
    private long newPrice;
    private int oldRank;
    private int newRank;
    private double normalizedScore;
    private PriceTier tier;
    private GolferPerformanceProfile profile;

    public int getDirection() {
        return Long.compare(newPrice, oldPrice);
    }
}
