package com.fantasygolf.engine.controller;

import com.fantasygolf.engine.dto.PricingRunResponse;
import com.fantasygolf.engine.dto.TopPricedResponse;
import com.fantasygolf.engine.model.GolferPerformanceProfile;
import com.fantasygolf.engine.model.PricingRun;
import com.fantasygolf.engine.model.RunMode;
import com.fantasygolf.engine.service.PricingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/v1/pricing")
public class PricingController {
    
    private static final Logger logger = LoggerFactory.getLogger(PricingController.class);
    
    private final PricingService pricingService;
    
    @Autowired
    public PricingController(PricingService pricingService) {
        this.pricingService = pricingService;
    }
    
    /**
     * Run the pricing engine.
     * POST /api/v1/pricing/runs?mode=preview|apply&backup=true|false
     */
    @PostMapping("/runs")
    public ResponseEntity<PricingRunResponse> run(
            @RequestParam(defaultValue = "preview") String mode,
            @RequestParam(defaultValue = "false") boolean backup) {
        
        RunMode runMode = RunMode.fromValue(mode);
        logger.info("Received pricing run request - mode: {}, backup: {}", runMode, backup);
        
        try {
            PricingRun run = pricingService.run(runMode, backup);
            logger.info("Pricing run complete - mode: {}, golfers: {}, written: {}",
                runMode, run.getResult().getPrices().size(), run.getPricesWritten());
            return ResponseEntity.ok(PricingRunResponse.from(run));
        } catch (Exception e) {
            logger.error("Error running pricing - mode: {}, error: {}", runMode, e.getMessage(), e);
            throw e;
        }
    }
    
    /**
     * GET /api/v1/pricing/top?limit=N
     */
    @GetMapping("/top")
    public ResponseEntity<TopPricedResponse> top(@RequestParam(defaultValue = "10") int limit) {
        TopPricedResponse response = TopPricedResponse.builder()
            .golfers(pricingService.getTopPriced(limit))
            .retrievedAt(Instant.now())
            .build();
        return ResponseEntity.ok(response);
    }
    
    /**
     * GET /api/v1/pricing/golfers/{golferId}/profile
     */
    @GetMapping("/golfers/{golferId}/profile")
    public ResponseEntity<GolferPerformanceProfile> profile(@PathVariable String golferId) {
        return ResponseEntity.ok(pricingService.getProfile(golferId));
    }
}
