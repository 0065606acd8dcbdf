package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingReport {
    @Builder.Default
    private List<RankInversion> rankInversions = new ArrayList<>();
    
    @Builder.Default
    private List<OverBudgetRoster> overBudgetRosters = new ArrayList<>();
    
    /** Stored multipliedPoints subtracted from the current formula's points for the same results. */
    private double pointDriftTotal;
    
    private boolean rankingPreserved;
    private int rostersAudited;
    private long topRosterCost;
    private boolean capForcesTradeOffs;
    
    @Builder.Default
    private Map<PriceTier, Integer> tierDistribution = new EnumMap<>(PriceTier.class);

    public static PricingReport empty() {
        return PricingReport.builder()
            .rankingPreserved(true)
            .build();
    }
}
