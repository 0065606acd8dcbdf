package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Objects;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecomputedScore {
    private String scoreId;
    private String tournamentId;
    private String golferId;
    private RawScoreSource source;
    private Double previousRawScore;
    private Double rawScore;
    
    /** Set when a matched real value supersedes the legacy flag. */
    private boolean legacyFlagCleared;
    
    private PointBreakdown before;
    private PointBreakdown after;

    public boolean isChanged() {
        return !Objects.equals(before, after);
    }

    public boolean needsWrite() {
        if (source == RawScoreSource.EXCLUDED) {
            return false;
        }
        return isChanged() || legacyFlagCleared || !Objects.equals(previousRawScore, rawScore);
    }
}
