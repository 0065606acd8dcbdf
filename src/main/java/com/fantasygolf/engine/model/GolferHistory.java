package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of everything the pricing run knows about one golfer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GolferHistory {
    private String golferId;
    private String displayName;
    private long currentPrice;
    
    @Builder.Default
    private List<ScoredResult> results = new ArrayList<>();
}
