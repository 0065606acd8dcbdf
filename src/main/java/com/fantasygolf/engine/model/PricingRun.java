package com.fantasygolf.engine.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A pricing result plus what the run did with it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingRun {
    private RunMode mode;
    private PricingResult result;
    private int pricesWritten;
    private String backupFile;
    private boolean priceBoardRefreshed;
    private int skippedScores;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant completedAt;
}
