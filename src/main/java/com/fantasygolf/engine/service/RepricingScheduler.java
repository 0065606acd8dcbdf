package com.fantasygolf.engine.service;

import com.fantasygolf.engine.config.FantasyGolfProperties;
import com.fantasygolf.engine.model.PricingRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class RepricingScheduler {
    
    private static final Logger logger = LoggerFactory.getLogger(RepricingScheduler.class);
    
    private final PricingService pricingService;
    private final FantasyGolfProperties properties;
    
    @Autowired
    public RepricingScheduler(PricingService pricingService, FantasyGolfProperties properties) {
        this.pricingService = pricingService;
        this.properties = properties;
    }
    
    /**
     * Scheduled repricing. Disabled unless {@code fantasy.pricing.schedule} holds a cron expression.
     */
    @Scheduled(cron = "${fantasy.pricing.schedule:-}")
    public void reprice() {
        try {
            PricingRun run = pricingService.run(properties.getPricing().getScheduledMode(), false);
            logger.info("Scheduled repricing finished - mode: {}, prices written: {}",
                run.getMode(), run.getPricesWritten());
        } catch (Exception e) {
            logger.error("Scheduled repricing failed", e);
        }
    }
}
