package com.fantasygolf.engine.controller;

import com.fantasygolf.engine.dto.ScoreEntryRequest;
import com.fantasygolf.engine.model.PointBreakdown;
import com.fantasygolf.engine.model.RecomputationSummary;
import com.fantasygolf.engine.model.RunMode;
import com.fantasygolf.engine.model.SourceResultRow;
import com.fantasygolf.engine.service.ScoreRecomputationService;
import com.fantasygolf.engine.service.ScoringService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/scoring")
public class ScoringController {
    
    private static final Logger logger = LoggerFactory.getLogger(ScoringController.class);
    
    private final ScoringService scoringService;
    private final ScoreRecomputationService recomputationService;
    
    @Autowired
    public ScoringController(ScoringService scoringService, ScoreRecomputationService recomputationService) {
        this.scoringService = scoringService;
        this.recomputationService = recomputationService;
    }
    
    /**
     * Score one result without storing it.
     * POST /api/v1/scoring/breakdown
     */
    @PostMapping("/breakdown")
    public ResponseEntity<PointBreakdown> breakdown(@Valid @RequestBody ScoreEntryRequest request) {
        logger.debug("Received breakdown request - tournamentId: {}, golferId: {}",
            request.getTournamentId(), request.getGolferId());
        return ResponseEntity.ok(scoringService.breakdownFor(request));
    }
    
    /**
     * Recompute every stored breakdown.
     * POST /api/v1/scoring/recompute?mode=preview|apply
     */
    @PostMapping("/recompute")
    public ResponseEntity<RecomputationSummary> recompute(
            @RequestParam(defaultValue = "preview") String mode,
            @RequestBody(required = false) List<SourceResultRow> sourceRows) {
        
        RunMode runMode = RunMode.fromValue(mode);
        logger.info("Received recompute request - mode: {}, source rows: {}",
            runMode, sourceRows != null ? sourceRows.size() : 0);
        
        try {
            return ResponseEntity.ok(recomputationService.recompute(runMode, sourceRows != null ? sourceRows : List.of()));
        } catch (Exception e) {
            logger.error("Error recomputing scores - mode: {}, error: {}", runMode, e.getMessage(), e);
            throw e;
        }
    }
}
