package com.fantasygolf.engine.model;

public enum NormalizationBasis {
    /** Composite score divided by the population's maximum composite score. */
    COMPOSITE,
    /** Linear position of the current price within the observed price range. */
    RANK
}
