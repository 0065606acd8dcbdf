package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecomputationSummary {
    private RunMode mode;
    private int tournaments;
    private int recordsRecalculated;
    private int recordsChanged;
    private int recordsExcluded;
    private int recordsWritten;
    private int matchedRows;
    private int unmatchedRows;
    private int fallbackRows;
    private int fallbackFlagTrueRows;
    private int fallbackNoBonusRows;
    private int retainedRows;
    private int duplicateSourceRows;
    private int orphanedRecords;
    private double pointsBefore;
    private double pointsAfter;

    public double getPointDrift() {
        return pointsAfter - pointsBefore;
    }
}
