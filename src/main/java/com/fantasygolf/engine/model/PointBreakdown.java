package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointBreakdown {
    private int basePoints;
    private int bonusPoints;
    private double multipliedPoints;

    public static PointBreakdown zero() {
        return new PointBreakdown(0, 0, 0.0);
    }
}
