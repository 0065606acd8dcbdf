package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one pricing run, ordered by new price descending.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingResult {
    private NormalizationBasis basis;
    
    @Builder.Default
    private List<PriceChange> prices = new ArrayList<>();
    
    private PricingReport report;

    public static PricingResult empty(NormalizationBasis basis) {
        return PricingResult.builder()
            .basis(basis)
            .report(PricingReport.empty())
            .build();
    }
}
