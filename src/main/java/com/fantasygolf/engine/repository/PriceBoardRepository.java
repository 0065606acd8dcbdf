package com.fantasygolf.engine.repository;

import com.fantasygolf.engine.model.RankedGolfer;

import java.util.List;
import java.util.Map;

/**
 * Read-optimised cache of golfer prices, ordered by price.
 */
public interface PriceBoardRepository {
    void replacePrices(Map<String, Long> pricesByGolferId);
    List<RankedGolfer> getTopN(int limit);
    boolean isAvailable();
}
