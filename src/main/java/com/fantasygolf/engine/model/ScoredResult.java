package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A tournament result paired with the breakdown stored for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredResult {
    private TournamentResult result;
    private PointBreakdown breakdown;
}
