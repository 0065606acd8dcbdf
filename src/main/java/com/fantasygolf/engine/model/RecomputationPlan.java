package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Computed outcome of a recomputation, shared verbatim by preview and apply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecomputationPlan {
    @Builder.Default
    private List<RecomputedScore> scores = new ArrayList<>();
    
    private RecomputationSummary summary;
}
