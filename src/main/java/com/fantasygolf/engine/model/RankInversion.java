package com.fantasygolf.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A pair of golfers whose relative order flipped: {@code formerlyHigherGolferId} was
 * strictly dearer before the run and is strictly cheaper after it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankInversion {
    private String formerlyHigherGolferId;
    private String formerlyLowerGolferId;
    private long formerlyHigherOldPrice;
    private long formerlyLowerOldPrice;
    private long formerlyHigherNewPrice;
    private long formerlyLowerNewPrice;
}
