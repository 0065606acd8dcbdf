package com.fantasygolf.engine.dto;

import com.fantasygolf.engine.model.NormalizationBasis;
import com.fantasygolf.engine.model.PriceChange;
import com.fantasygolf.engine.model.PricingReport;
import com.fantasygolf.engine.model.PricingRun;
import com.fantasygolf.engine.model.RunMode;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingRunResponse {
    private RunMode mode;
    private NormalizationBasis basis;
    private List<PriceChange> prices;
    private PricingReport report;
    private int pricesWritten;
    private String backupFile;
    private boolean priceBoardRefreshed;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant completedAt;

    public static PricingRunResponse from(PricingRun run) {
        return PricingRunResponse.builder()
            .mode(run.getMode())
            .basis(run.getResult().getBasis())
            .prices(run.getResult().getPrices())
            .report(run.getResult().getReport())
            .pricesWritten(run.getPricesWritten())
            .backupFile(run.getBackupFile())
            .priceBoardRefreshed(run.isPriceBoardRefreshed())
            .completedAt(run.getCompletedAt())
            .build();
    }
}
